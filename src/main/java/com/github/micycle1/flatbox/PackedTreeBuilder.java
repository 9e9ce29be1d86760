package com.github.micycle1.flatbox;

import java.util.List;

import org.locationtech.jts.util.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk-loads a flat node array: sorts the leaves along the Hilbert curve and
 * packs parent levels on top of them, bottom-up.
 * <p>
 * On return the array holds the leaves (in Hilbert order) followed by every
 * internal level, the root last. Each parent covers a window of at most
 * {@code nodeSize} consecutive nodes of the level below and records the
 * window's first position in {@link Node#childStart}.
 */
final class PackedTreeBuilder {

	private static final Logger LOGGER = LoggerFactory.getLogger(PackedTreeBuilder.class);

	static final int MIN_NODE_SIZE = 2;

	private PackedTreeBuilder() {
	}

	/**
	 * Builds the tree in place.
	 *
	 * @param nodes    the leaves, in insertion order; parents are appended
	 * @param extent   the union of all leaves
	 * @param nodeSize the fan-out, at least {@link #MIN_NODE_SIZE}
	 * @param type     the coordinate type
	 * @return the level bounds (exclusive end offset of each level, leaves first);
	 *         empty when there are no leaves
	 */
	static <C extends Number> int[] build(List<Node<C>> nodes, Node<C> extent, int nodeSize, CoordinateType<C> type) {
		final int numItems = nodes.size();
		if (numItems == 0) {
			return new int[0];
		}
		long start = System.nanoTime();

		int[] levelBounds = computeLevelBounds(numItems, nodeSize);
		long[] hilbertValues = computeHilbertValues(nodes, extent, type);
		DualKeySort.sort(hilbertValues, nodes, 0, numItems - 1);

		for (int level = 0; level < levelBounds.length - 1; level++) {
			int levelStart = level == 0 ? 0 : levelBounds[level - 1];
			packLevel(nodes, levelStart, levelBounds[level], nodeSize, type);
		}

		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Packed {} {} boxes into {} levels ({} nodes, fan-out {}) in {} ms", numItems, type.name(), levelBounds.length, nodes.size(),
					nodeSize, (System.nanoTime() - start) / 1_000_000.0);
		}
		return levelBounds;
	}

	/**
	 * Computes the exclusive end offset of each level. There is always at least
	 * one level above the leaves, so the root is an internal node.
	 */
	static int[] computeLevelBounds(int numItems, int nodeSize) {
		IntArrayList levelBounds = new IntArrayList();
		int levelSize = numItems;
		int numNodes = numItems;
		levelBounds.add(numNodes);
		do {
			levelSize = numNodesToCover(levelSize, nodeSize);
			numNodes += levelSize;
			levelBounds.add(numNodes);
		} while (levelSize > 1);
		return levelBounds.toArray();
	}

	/**
	 * Computes the worst-case size of the node array for {@code numItems} leaves.
	 */
	static int capacityFor(int numItems, int nodeSize) {
		int n = numItems;
		int numNodes = n;
		while (n > 1) {
			n = numNodesToCover(n, nodeSize);
			numNodes += n;
		}
		return numNodes;
	}

	/**
	 * Computes the number of nodes required to cover a given number of children.
	 */
	static int numNodesToCover(int nChild, int nodeSize) {
		int mult = nChild / nodeSize;
		if (mult * nodeSize == nChild)
			return mult;
		return mult + 1;
	}

	/**
	 * Returns {@code min(windowStart + nodeSize, levelEnd)} without overflowing.
	 */
	static int windowEnd(int windowStart, int nodeSize, int levelEnd) {
		return levelEnd - windowStart <= nodeSize ? levelEnd : windowStart + nodeSize;
	}

	private static <C extends Number> long[] computeHilbertValues(List<Node<C>> nodes, Node<C> extent, CoordinateType<C> type) {
		HilbertCenterEncoder<C> encoder = new HilbertCenterEncoder<>(type, extent);
		long[] hilbertValues = new long[nodes.size()];
		for (int i = 0; i < hilbertValues.length; i++) {
			hilbertValues[i] = encoder.encode(nodes.get(i));
		}
		return hilbertValues;
	}

	private static <C extends Number> void packLevel(List<Node<C>> nodes, int levelStart, int levelEnd, int nodeSize, CoordinateType<C> type) {
		int windowEnd;
		for (int windowStart = levelStart; windowStart < levelEnd; windowStart = windowEnd) {
			windowEnd = windowEnd(windowStart, nodeSize, levelEnd);
			Node<C> parent = Node.parent(windowStart, type);
			for (int pos = windowStart; pos < windowEnd; pos++) {
				parent.expandToInclude(nodes.get(pos), type);
			}
			nodes.add(parent);
		}
	}
}
