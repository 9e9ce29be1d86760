package com.github.micycle1.flatbox;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * A static, bulk-loaded spatial index over axis-aligned 2D bounding boxes (a
 * packed Hilbert R-tree).
 * <p>
 * The index has two phases:
 * <ul>
 * <li><em>Building</em>: boxes are {@link #add(Number, Number, Number, Number)
 * added} and receive dense, zero-based insertion indices.</li>
 * <li><em>Finished</em>: after {@link #finish()} the leaves are sorted by the
 * Hilbert rank of their centres and internal levels are packed above them in a
 * single flat array. Queries return the insertion indices of all boxes that
 * overlap a query box.</li>
 * </ul>
 * The transition is one-way. Queries issued before {@code finish()}, or against
 * an index without boxes, return no results rather than failing.
 * <p>
 * Coordinates are generic over any {@link CoordinateType}; overlap tests use
 * the type's exact ordering, so integer coordinates are never rounded.
 * <p>
 * Thread-safety: instances are not synchronized. Once finished, an index is only
 * read, so concurrent queries are safe as long as each thread uses its own
 * result buffer.
 *
 * @param <C> the coordinate type
 */
public class FlatBoxIndex<C extends Number> {

	private static final Logger LOGGER = LoggerFactory.getLogger(FlatBoxIndex.class);

	public static final int DEFAULT_NODE_SIZE = 16;

	private final CoordinateType<C> type;
	private final Node<C> bounds;
	private final ArrayList<Node<C>> nodes = new ArrayList<>();
	private int nodeSize;
	private int numItems = 0;
	private int[] levelBounds;

	/**
	 * Creates an empty index with the {@link #DEFAULT_NODE_SIZE default} fan-out.
	 *
	 * @param type the coordinate type
	 */
	public FlatBoxIndex(CoordinateType<C> type) {
		this(type, DEFAULT_NODE_SIZE);
	}

	/**
	 * Creates an empty index.
	 *
	 * @param type     the coordinate type
	 * @param nodeSize the maximum number of children per internal node; values
	 *                 below 2 are raised to 2 when the index is finished
	 */
	public FlatBoxIndex(CoordinateType<C> type, int nodeSize) {
		this.type = Objects.requireNonNull(type, "type");
		this.nodeSize = nodeSize;
		this.bounds = Node.inverted(type);
	}

	public static FlatBoxIndex<Byte> ofBytes() {
		return new FlatBoxIndex<>(CoordinateType.BYTE);
	}

	public static FlatBoxIndex<Short> ofShorts() {
		return new FlatBoxIndex<>(CoordinateType.SHORT);
	}

	public static FlatBoxIndex<Integer> ofInts() {
		return new FlatBoxIndex<>(CoordinateType.INT);
	}

	public static FlatBoxIndex<Long> ofLongs() {
		return new FlatBoxIndex<>(CoordinateType.LONG);
	}

	public static FlatBoxIndex<Float> ofFloats() {
		return new FlatBoxIndex<>(CoordinateType.FLOAT);
	}

	public static FlatBoxIndex<Double> ofDoubles() {
		return new FlatBoxIndex<>(CoordinateType.DOUBLE);
	}

	public CoordinateType<C> getCoordinateType() {
		return type;
	}

	/**
	 * Returns the fan-out. Before {@link #finish()} this is the configured value;
	 * afterwards it is the value actually used (at least 2).
	 */
	public int getNodeSize() {
		return nodeSize;
	}

	/**
	 * Sets the maximum number of children per internal node. Values below 2 are
	 * raised to 2 when the index is finished.
	 *
	 * @throws IllegalStateException if the index has already been finished
	 */
	public void setNodeSize(int nodeSize) {
		if (isFinished()) {
			throw new IllegalStateException("Cannot change node size after index is finished.");
		}
		this.nodeSize = nodeSize;
	}

	/**
	 * Pre-sizes internal storage for {@code expectedCount} boxes and the internal
	 * nodes they will produce. This is only a capacity hint.
	 */
	public void reserve(int expectedCount) {
		if (expectedCount <= 0) {
			return;
		}
		nodes.ensureCapacity(PackedTreeBuilder.capacityFor(expectedCount, Math.max(nodeSize, PackedTreeBuilder.MIN_NODE_SIZE)));
	}

	/**
	 * Adds a box. The box is not validated; a box whose minimum exceeds its
	 * maximum on some axis only matches queries spanning the gap between them.
	 *
	 * @return the insertion index of the box, equal to the number of boxes added
	 *         before it
	 * @throws IllegalStateException if the index has already been finished
	 */
	public int add(C minX, C minY, C maxX, C maxY) {
		if (isFinished()) {
			throw new IllegalStateException("Cannot add boxes after index is finished.");
		}
		Objects.requireNonNull(minX, "minX");
		Objects.requireNonNull(minY, "minY");
		Objects.requireNonNull(maxX, "maxX");
		Objects.requireNonNull(maxY, "maxY");
		int index = numItems++;
		nodes.add(Node.leaf(minX, minY, maxX, maxY, index));
		bounds.expandToInclude(minX, minY, maxX, maxY, type);
		return index;
	}

	/**
	 * Adds a box.
	 *
	 * @see #add(Number, Number, Number, Number)
	 */
	public int add(BoundingBox<C> box) {
		return add(box.getMinX(), box.getMinY(), box.getMaxX(), box.getMaxY());
	}

	/**
	 * Builds the index from the boxes added so far. Calling this more than once
	 * has no further effect.
	 */
	public void finish() {
		if (isFinished()) {
			return;
		}
		if (nodeSize < PackedTreeBuilder.MIN_NODE_SIZE) {
			LOGGER.warn("Node size {} is below the minimum; using {}", nodeSize, PackedTreeBuilder.MIN_NODE_SIZE);
			nodeSize = PackedTreeBuilder.MIN_NODE_SIZE;
		}
		levelBounds = PackedTreeBuilder.build(nodes, bounds, nodeSize, type);
		nodes.trimToSize();
	}

	public boolean isFinished() {
		return levelBounds != null;
	}

	/**
	 * @return the number of boxes added
	 */
	public int size() {
		return numItems;
	}

	/**
	 * Returns the union of all added boxes, or the {@link BoundingBox#inverted
	 * inverted box} if none were added.
	 */
	public BoundingBox<C> getBounds() {
		return bounds.toBoundingBox();
	}

	/**
	 * Returns the exclusive end offset of each tree level in the node array, from
	 * the leaves up to the root. Empty before {@link #finish()} and for an index
	 * without boxes.
	 */
	public int[] getLevelBounds() {
		return levelBounds == null ? new int[0] : Arrays.copyOf(levelBounds, levelBounds.length);
	}

	/**
	 * Returns the bounds of the internal nodes, in node array order (the root
	 * last). Empty before {@link #finish()}.
	 */
	public List<BoundingBox<C>> getNodeBounds() {
		if (!isFinished()) {
			return new ArrayList<>();
		}
		List<BoundingBox<C>> result = new ArrayList<>(nodes.size() - numItems);
		for (int i = numItems; i < nodes.size(); i++) {
			result.add(nodes.get(i).toBoundingBox());
		}
		return result;
	}

	/**
	 * Returns the extents of the internal nodes as JTS envelopes, in node array
	 * order. Each envelope is a new object and may be modified by the caller.
	 */
	public Envelope[] getNodeEnvelopes() {
		List<BoundingBox<C>> nodeBounds = getNodeBounds();
		Envelope[] envelopes = new Envelope[nodeBounds.size()];
		for (int i = 0; i < envelopes.length; i++) {
			envelopes[i] = nodeBounds.get(i).toEnvelope();
		}
		return envelopes;
	}

	/**
	 * Returns the insertion indices of all boxes overlapping the query box, in
	 * traversal order.
	 *
	 * @return a new list; empty before {@link #finish()}
	 */
	public IntList search(C minX, C minY, C maxX, C maxY) {
		return searchInto(minX, minY, maxX, maxY, new IntArrayList());
	}

	/**
	 * @see #search(Number, Number, Number, Number)
	 */
	public IntList search(BoundingBox<C> query) {
		return search(query.getMinX(), query.getMinY(), query.getMaxX(), query.getMaxY());
	}

	/**
	 * Like {@link #search(Number, Number, Number, Number)}, but writes into a
	 * caller-owned buffer so that repeated queries need not allocate. The buffer
	 * is cleared first.
	 *
	 * @param results the buffer to fill
	 * @return {@code results}
	 */
	public IntList searchInto(C minX, C minY, C maxX, C maxY, IntList results) {
		results.clear();
		visit(minX, minY, maxX, maxY, index -> {
			results.add(index);
			return true;
		});
		return results;
	}

	/**
	 * Visits the insertion index of every box overlapping the query box, in
	 * traversal order, until the visitor asks to stop.
	 * <p>
	 * The traversal keeps a work queue of {@code (position, level)} pairs,
	 * starting at the root. Each pair denotes a window of up to {@code nodeSize}
	 * consecutive nodes at that level; a window starting below the leaf count
	 * holds leaves, otherwise its overlapping nodes push their child windows.
	 */
	public void visit(C minX, C minY, C maxX, C maxY, IndexVisitor visitor) {
		Objects.requireNonNull(visitor, "visitor");
		if (levelBounds == null || levelBounds.length == 0) {
			return;
		}
		IntArrayList queue = new IntArrayList(32);
		queue.push(nodes.size() - 1);
		queue.push(levelBounds.length - 1);

		while (!queue.isEmpty()) {
			int level = queue.popInt();
			int nodeIndex = queue.popInt();
			int end = PackedTreeBuilder.windowEnd(nodeIndex, nodeSize, levelBounds[level]);

			for (int pos = nodeIndex; pos < end; pos++) {
				Node<C> node = nodes.get(pos);
				if (!node.intersects(minX, minY, maxX, maxY, type)) {
					continue;
				}
				if (nodeIndex < numItems) {
					if (!visitor.visit(node.itemIndex)) {
						return;
					}
				} else {
					queue.push(node.childStart);
					queue.push(level - 1);
				}
			}
		}
	}
}
