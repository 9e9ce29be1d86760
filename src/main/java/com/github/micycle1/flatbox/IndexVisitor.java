package com.github.micycle1.flatbox;

/**
 * Receives the insertion indices of boxes matched by a
 * {@link FlatBoxIndex#visit query}.
 */
@FunctionalInterface
public interface IndexVisitor {

	/**
	 * Invoked for each box overlapping the query box.
	 *
	 * @param index the insertion index of the box
	 * @return {@code true} to continue visiting, {@code false} to terminate the
	 *         traversal early
	 */
	boolean visit(int index);
}
