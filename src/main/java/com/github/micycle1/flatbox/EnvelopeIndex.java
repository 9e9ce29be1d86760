package com.github.micycle1.flatbox;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Envelope;

/**
 * A static spatial index of arbitrary items keyed by JTS {@link Envelope}s,
 * backed by a {@link FlatBoxIndex} over {@code double} coordinates.
 * <p>
 * Items are buffered until the index is built, either explicitly by
 * {@link #build()} or implicitly by the first query. After that the index is
 * read-only and further inserts fail.
 * <p>
 * Thread-safety notes:
 * <ul>
 * <li>{@link #build()} is idempotent and uses internal synchronization so it is
 * safe to call concurrently; the index will be prepared once.</li>
 * <li>After the index is built, queries perform no modifications and may run
 * concurrently.</li>
 * </ul>
 *
 * @param <T> the type of the items stored in the index
 */
public class EnvelopeIndex<T> {

	private final FlatBoxIndex<Double> index;
	private final List<T> items = new ArrayList<>();
	private final Envelope totalExtent = new Envelope();
	private int numNullItems = 0;
	private volatile boolean isBuilt = false;

	/**
	 * Creates a new index using the default node size.
	 */
	public EnvelopeIndex() {
		this(FlatBoxIndex.DEFAULT_NODE_SIZE);
	}

	/**
	 * Creates a new index with the specified node size.
	 *
	 * @param nodeSize the number of children per internal node. Larger values
	 *                 produce shallower trees but increase the per-node scan
	 *                 cost; values below 2 are raised to 2.
	 */
	public EnvelopeIndex(int nodeSize) {
		this.index = new FlatBoxIndex<>(CoordinateType.DOUBLE, nodeSize);
	}

	/**
	 * Returns the number of items that have been inserted.
	 */
	public int size() {
		return items.size() + numNullItems;
	}

	/**
	 * Inserts an item with its bounding envelope.
	 *
	 * @param itemEnv the envelope of the item; a null envelope is never matched
	 *                by queries
	 * @param item    the item to store
	 * @throws IllegalStateException if called after the index has been built
	 */
	public void insert(Envelope itemEnv, T item) {
		if (isBuilt) {
			throw new IllegalStateException("Cannot insert items after tree is built.");
		}
		if (itemEnv.isNull()) {
			// counted, but kept out of the index
			numNullItems++;
			return;
		}
		index.add(itemEnv.getMinX(), itemEnv.getMinY(), itemEnv.getMaxX(), itemEnv.getMaxY());
		totalExtent.expandToInclude(itemEnv);
		items.add(item);
	}

	/**
	 * Builds the index, if not already built.
	 */
	public void build() {
		if (!isBuilt) {
			synchronized (this) {
				if (!isBuilt) {
					index.finish();
					this.isBuilt = true;
				}
			}
		}
	}

	/**
	 * Returns the items whose envelopes intersect the search envelope, in
	 * Hilbert-ordered traversal order.
	 *
	 * @param searchEnv the query envelope
	 * @return a new list of matching items; empty if none intersect
	 */
	public List<T> query(Envelope searchEnv) {
		List<T> result = new ArrayList<>();
		query(searchEnv, item -> {
			result.add(item);
			return true; // keep visiting
		});
		return result;
	}

	/**
	 * Visits the items whose envelopes intersect the search envelope. The visitor
	 * may return {@code false} to stop the traversal.
	 *
	 * @param searchEnv the query envelope
	 * @param visitor   callback invoked for each matching item
	 */
	public void query(Envelope searchEnv, ItemVisitor<T> visitor) {
		build();
		if (searchEnv.isNull() || !totalExtent.intersects(searchEnv))
			return;

		index.visit(searchEnv.getMinX(), searchEnv.getMinY(), searchEnv.getMaxX(), searchEnv.getMaxY(), i -> visitor.visitItem(items.get(i)));
	}

	/**
	 * Returns the extent of all inserted items; a null envelope if there are none.
	 */
	public Envelope getExtent() {
		return new Envelope(totalExtent);
	}

	/**
	 * Returns the extents of the internal index nodes, building the index if
	 * needed. Each envelope is a new object.
	 */
	public Envelope[] getBounds() {
		build();
		return index.getNodeEnvelopes();
	}

	/**
	 * Visitor used by {@link #query(Envelope, ItemVisitor)}.
	 *
	 * @param <T> the type of items visited
	 */
	@FunctionalInterface
	public interface ItemVisitor<T> {
		/**
		 * @param item the item whose envelope intersects the query
		 * @return {@code true} to continue visiting, {@code false} to terminate the
		 *         traversal early
		 */
		boolean visitItem(T item);
	}
}
