package com.github.micycle1.flatbox;

/**
 * Encodes box centres as Hilbert ranks, normalizing them against an extent onto
 * the {@link HilbertCurve#MAX_ORDER 16th-order} grid.
 * <p>
 * An axis of zero (or non-finite) width cannot be normalized; all centres on
 * such an axis map to grid coordinate 0, so ordering is driven by the other
 * axis alone.
 */
final class HilbertCenterEncoder<C extends Number> {

	private static final double HILBERT_MAX = HilbertCurve.MAX_COORDINATE;

	private final CoordinateType<C> type;
	private final double minX;
	private final double minY;
	private final double scaleX;
	private final double scaleY;

	HilbertCenterEncoder(CoordinateType<C> type, Node<C> extent) {
		this.type = type;
		this.minX = type.toDouble(extent.minX);
		this.minY = type.toDouble(extent.minY);
		this.scaleX = scale(minX, type.toDouble(extent.maxX));
		this.scaleY = scale(minY, type.toDouble(extent.maxY));
	}

	private static double scale(double min, double max) {
		double width = max - min;
		if (width > 0 && Double.isFinite(width)) {
			return HILBERT_MAX / width;
		}
		return 0;
	}

	long encode(Node<C> node) {
		double centreX = (type.toDouble(node.minX) + type.toDouble(node.maxX)) / 2;
		double centreY = (type.toDouble(node.minY) + type.toDouble(node.maxY)) / 2;
		return HilbertCurve.index(toGrid(centreX, minX, scaleX), toGrid(centreY, minY, scaleY));
	}

	private static int toGrid(double centre, double min, double scale) {
		long cell = Math.round(scale * (centre - min));
		// centres of malformed boxes can fall outside the extent
		if (cell < 0) {
			return 0;
		}
		return (int) Math.min(cell, HilbertCurve.MAX_COORDINATE);
	}
}
