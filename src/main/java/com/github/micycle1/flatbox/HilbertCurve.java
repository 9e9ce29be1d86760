package com.github.micycle1.flatbox;

/**
 * Maps 2D grid cells to their rank along a Hilbert space-filling curve.
 * <p>
 * The transform is a branch-free prefix scan over the bits of both coordinates
 * (after http://threadlocalmutex.com/, public domain). At the maximum order of 16
 * each axis spans {@code [0, 65535]} and ranks span the full unsigned 32-bit
 * range, so ranks are returned as non-negative {@code long}s.
 */
public final class HilbertCurve {

	/** Maximum supported curve order. */
	public static final int MAX_ORDER = 16;

	/** Largest coordinate on either axis at {@link #MAX_ORDER}. */
	public static final int MAX_COORDINATE = (1 << MAX_ORDER) - 1;

	private static final int MASK = 0xFFFF;

	private HilbertCurve() {
	}

	/**
	 * Computes the rank of {@code (x, y)} on the 16th-order curve.
	 *
	 * @param x the x cell, in {@code [0, 65535]}
	 * @param y the y cell, in {@code [0, 65535]}
	 * @return the rank, in {@code [0, 2^32)}
	 */
	public static long index(int x, int y) {
		return encode(x & MASK, y & MASK);
	}

	/**
	 * Computes the rank of {@code (x, y)} on a curve of the given order.
	 *
	 * @param order the curve order, in {@code [1, 16]}
	 * @param x     the x cell, in {@code [0, 2^order)}
	 * @param y     the y cell, in {@code [0, 2^order)}
	 * @return the rank, in {@code [0, 4^order)}
	 * @throws IllegalArgumentException if {@code order} is out of range
	 */
	public static long index(int order, int x, int y) {
		if (order < 1 || order > MAX_ORDER) {
			throw new IllegalArgumentException("Hilbert order must be in [1, " + MAX_ORDER + "]: " + order);
		}
		int shift = MAX_ORDER - order;
		return encode((x << shift) & MASK, (y << shift) & MASK) >>> (32 - 2 * order);
	}

	private static long encode(int x, int y) {
		// initial prefix scan round, primed with x and y
		int a = x ^ y;
		int b = MASK ^ a;
		int c = MASK ^ (x | y);
		int d = x & (y ^ MASK);

		int A = a | (b >>> 1);
		int B = (a >>> 1) ^ a;
		int C = ((c >>> 1) ^ (b & (d >>> 1))) ^ c;
		int D = ((a & (c >>> 1)) ^ (d >>> 1)) ^ d;

		a = A;
		b = B;
		c = C;
		d = D;
		A = (a & (a >>> 2)) ^ (b & (b >>> 2));
		B = (a & (b >>> 2)) ^ (b & ((a ^ b) >>> 2));
		C ^= (a & (c >>> 2)) ^ (b & (d >>> 2));
		D ^= (b & (c >>> 2)) ^ ((a ^ b) & (d >>> 2));

		a = A;
		b = B;
		c = C;
		d = D;
		A = (a & (a >>> 4)) ^ (b & (b >>> 4));
		B = (a & (b >>> 4)) ^ (b & ((a ^ b) >>> 4));
		C ^= (a & (c >>> 4)) ^ (b & (d >>> 4));
		D ^= (b & (c >>> 4)) ^ ((a ^ b) & (d >>> 4));

		// final round
		a = A;
		b = B;
		c = C;
		d = D;
		C ^= (a & (c >>> 8)) ^ (b & (d >>> 8));
		D ^= (b & (c >>> 8)) ^ ((a ^ b) & (d >>> 8));

		// undo the prefix scan
		a = C ^ (C >>> 1);
		b = D ^ (D >>> 1);

		int i0 = x ^ y;
		int i1 = b | (MASK ^ (i0 | a));

		return (((long) interleave(i1) << 1) | interleave(i0)) & 0xFFFFFFFFL;
	}

	/**
	 * Spreads the low 16 bits of {@code x} onto the even bit positions.
	 */
	private static int interleave(int x) {
		x = (x | (x << 8)) & 0x00FF00FF;
		x = (x | (x << 4)) & 0x0F0F0F0F;
		x = (x | (x << 2)) & 0x33333333;
		x = (x | (x << 1)) & 0x55555555;
		return x;
	}
}
