package com.github.micycle1.flatbox;

import java.util.Comparator;
import java.util.Objects;

/**
 * {@link CoordinateType} backed by a fixed pair of sentinels and a comparator.
 */
final class SimpleCoordinateType<C extends Number> implements CoordinateType<C> {

	/**
	 * Orders floating point values as the primitive operators do, so
	 * {@code -0.0} and {@code 0.0} are equal.
	 */
	static final Comparator<Number> FLOATING_ORDER = (a, b) -> {
		double x = a.doubleValue();
		double y = b.doubleValue();
		return x < y ? -1 : (x > y ? 1 : 0);
	};

	private final String name;
	private final C lowest;
	private final C highest;
	private final Comparator<? super C> order;

	SimpleCoordinateType(String name, C lowest, C highest, Comparator<? super C> order) {
		this.name = Objects.requireNonNull(name, "name");
		this.lowest = Objects.requireNonNull(lowest, "lowest");
		this.highest = Objects.requireNonNull(highest, "highest");
		this.order = Objects.requireNonNull(order, "order");
		if (order.compare(lowest, highest) > 0) {
			throw new IllegalArgumentException("lowest " + lowest + " is greater than highest " + highest);
		}
	}

	@Override
	public int compare(C a, C b) {
		return order.compare(a, b);
	}

	@Override
	public C lowest() {
		return lowest;
	}

	@Override
	public C highest() {
		return highest;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public String toString() {
		return "CoordinateType[" + name + "]";
	}
}
