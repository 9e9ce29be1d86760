package com.github.micycle1.flatbox;

/**
 * An entry of the flat node array: either a leaf holding one inserted box or an
 * internal node covering a contiguous run of children one level below.
 * <p>
 * Exactly one of {@link #itemIndex} and {@link #childStart} is meaningful; the
 * other is {@code -1}. Which one applies is decided by the traversal (the array
 * position relative to the leaf count), never by inspecting the node.
 */
final class Node<C extends Number> {

	static final int NONE = -1;

	C minX;
	C minY;
	C maxX;
	C maxY;

	/** Insertion index of the box, for leaves. */
	final int itemIndex;

	/** Array position of the first child, for internal nodes. */
	final int childStart;

	private Node(C minX, C minY, C maxX, C maxY, int itemIndex, int childStart) {
		this.minX = minX;
		this.minY = minY;
		this.maxX = maxX;
		this.maxY = maxY;
		this.itemIndex = itemIndex;
		this.childStart = childStart;
	}

	static <C extends Number> Node<C> leaf(C minX, C minY, C maxX, C maxY, int itemIndex) {
		return new Node<>(minX, minY, maxX, maxY, itemIndex, NONE);
	}

	/**
	 * Creates an internal node with inverted bounds, ready to be expanded by its
	 * children.
	 */
	static <C extends Number> Node<C> parent(int childStart, CoordinateType<C> type) {
		return new Node<>(type.highest(), type.highest(), type.lowest(), type.lowest(), NONE, childStart);
	}

	static <C extends Number> Node<C> inverted(CoordinateType<C> type) {
		return new Node<>(type.highest(), type.highest(), type.lowest(), type.lowest(), NONE, NONE);
	}

	void expandToInclude(C minX, C minY, C maxX, C maxY, CoordinateType<C> type) {
		this.minX = type.min(this.minX, minX);
		this.minY = type.min(this.minY, minY);
		this.maxX = type.max(this.maxX, maxX);
		this.maxY = type.max(this.maxY, maxY);
	}

	void expandToInclude(Node<C> other, CoordinateType<C> type) {
		expandToInclude(other.minX, other.minY, other.maxX, other.maxY, type);
	}

	boolean intersects(C qMinX, C qMinY, C qMaxX, C qMaxY, CoordinateType<C> type) {
		boolean isBeyond = type.compare(qMaxX, minX) < 0 || type.compare(qMaxY, minY) < 0 || type.compare(qMinX, maxX) > 0
				|| type.compare(qMinY, maxY) > 0;
		return !isBeyond;
	}

	BoundingBox<C> toBoundingBox() {
		return new BoundingBox<>(minX, minY, maxX, maxY);
	}
}
