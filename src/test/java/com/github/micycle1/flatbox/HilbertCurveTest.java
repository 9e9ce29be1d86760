package com.github.micycle1.flatbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Checks the Hilbert transform by its defining properties: at every low order it
 * is a bijection between grid cells and ranks, and consecutive ranks are
 * 4-connected grid neighbours.
 */
public class HilbertCurveTest {

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 3, 4, 5, 6 })
	public void testBijectionAndAdjacency(int order) {
		int side = 1 << order;
		int cells = side * side;
		int[] xs = new int[cells];
		int[] ys = new int[cells];
		boolean[] seen = new boolean[cells];

		for (int x = 0; x < side; x++) {
			for (int y = 0; y < side; y++) {
				long rank = HilbertCurve.index(order, x, y);
				assertTrue(rank >= 0 && rank < cells, "Rank out of range at (" + x + ", " + y + "): " + rank);
				int r = (int) rank;
				assertTrue(!seen[r], "Rank " + r + " assigned twice at order " + order);
				seen[r] = true;
				xs[r] = x;
				ys[r] = y;
			}
		}

		for (int r = 1; r < cells; r++) {
			int step = Math.abs(xs[r] - xs[r - 1]) + Math.abs(ys[r] - ys[r - 1]);
			assertEquals(1, step, "Ranks " + (r - 1) + " and " + r + " are not grid neighbours at order " + order);
		}
	}

	@Test
	public void testLowOrderMatchesFullOrderPrefix() {
		Random rnd = new Random(7);
		for (int i = 0; i < 1000; i++) {
			int order = 1 + rnd.nextInt(HilbertCurve.MAX_ORDER);
			int x = rnd.nextInt(1 << order);
			int y = rnd.nextInt(1 << order);
			int shift = HilbertCurve.MAX_ORDER - order;
			long full = HilbertCurve.index(x << shift, y << shift);
			assertEquals(full >>> (2 * shift), HilbertCurve.index(order, x, y));
		}
	}

	@Test
	public void testFullOrderRangeAndDistinctness() {
		Random rnd = new Random(42);
		Set<Long> ranks = new HashSet<>();
		Set<Long> cells = new HashSet<>();
		for (int i = 0; i < 20000; i++) {
			int x = rnd.nextInt(HilbertCurve.MAX_COORDINATE + 1);
			int y = rnd.nextInt(HilbertCurve.MAX_COORDINATE + 1);
			long rank = HilbertCurve.index(x, y);
			assertTrue(rank >= 0 && rank <= 0xFFFFFFFFL, "Rank out of unsigned 32-bit range: " + rank);
			if (cells.add(((long) x << 16) | y)) {
				assertTrue(ranks.add(rank), "Distinct cells collided at (" + x + ", " + y + ")");
			}
		}
		// corners of the grid are distinct and deterministic
		assertEquals(HilbertCurve.index(0, 0), HilbertCurve.index(0, 0));
		assertEquals(4, Set.of(HilbertCurve.index(0, 0), HilbertCurve.index(0, 65535), HilbertCurve.index(65535, 0), HilbertCurve.index(65535, 65535)).size());
	}

	@Test
	public void testInvalidOrder() {
		assertThrows(IllegalArgumentException.class, () -> HilbertCurve.index(0, 0, 0));
		assertThrows(IllegalArgumentException.class, () -> HilbertCurve.index(17, 0, 0));
	}
}
