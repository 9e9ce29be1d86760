package com.github.micycle1.flatbox;

import java.util.Objects;

import org.locationtech.jts.geom.Envelope;

/**
 * An immutable axis-aligned 2D box.
 * <p>
 * The box does not check that {@code minX <= maxX} and {@code minY <= maxY}. A
 * malformed box only overlaps query boxes that span the whole gap between its
 * maximum and minimum on each inverted axis.
 *
 * @param <C> the coordinate type
 */
public final class BoundingBox<C extends Number> {

	private final C minX;
	private final C minY;
	private final C maxX;
	private final C maxY;

	public BoundingBox(C minX, C minY, C maxX, C maxY) {
		this.minX = Objects.requireNonNull(minX, "minX");
		this.minY = Objects.requireNonNull(minY, "minY");
		this.maxX = Objects.requireNonNull(maxX, "maxX");
		this.maxY = Objects.requireNonNull(maxY, "maxY");
	}

	/**
	 * Returns the neutral element of box union: minima at the highest value of the
	 * domain and maxima at the lowest. Expanding it by any box yields that box.
	 */
	public static <C extends Number> BoundingBox<C> inverted(CoordinateType<C> type) {
		return new BoundingBox<>(type.highest(), type.highest(), type.lowest(), type.lowest());
	}

	public C getMinX() {
		return minX;
	}

	public C getMinY() {
		return minY;
	}

	public C getMaxX() {
		return maxX;
	}

	public C getMaxY() {
		return maxY;
	}

	/**
	 * Tests whether this box and {@code other} share at least one point (closed
	 * intervals, so touching edges overlap).
	 */
	public boolean intersects(BoundingBox<C> other, CoordinateType<C> type) {
		return !(type.compare(other.maxX, minX) < 0 || type.compare(other.maxY, minY) < 0 || type.compare(other.minX, maxX) > 0
				|| type.compare(other.minY, maxY) > 0);
	}

	/**
	 * @return {@code true} if a minimum exceeds its maximum, as for the inverted box
	 */
	public boolean isInverted(CoordinateType<C> type) {
		return type.compare(minX, maxX) > 0 || type.compare(minY, maxY) > 0;
	}

	/**
	 * Converts this box to a JTS envelope via {@link Number#doubleValue()}.
	 */
	public Envelope toEnvelope() {
		return new Envelope(minX.doubleValue(), maxX.doubleValue(), minY.doubleValue(), maxY.doubleValue());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BoundingBox)) {
			return false;
		}
		BoundingBox<?> other = (BoundingBox<?>) o;
		return minX.equals(other.minX) && minY.equals(other.minY) && maxX.equals(other.maxX) && maxY.equals(other.maxY);
	}

	@Override
	public int hashCode() {
		return Objects.hash(minX, minY, maxX, maxY);
	}

	@Override
	public String toString() {
		return "BoundingBox[" + minX + ", " + minY + " : " + maxX + ", " + maxY + "]";
	}
}
