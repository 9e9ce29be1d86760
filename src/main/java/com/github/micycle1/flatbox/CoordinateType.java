package com.github.micycle1.flatbox;

import java.util.Comparator;

/**
 * A totally ordered numeric domain in which box coordinates are expressed.
 * <p>
 * A coordinate type supplies the ordering used by overlap tests and the two
 * sentinels used to seed the inverted (empty) bounding box: {@link #highest()}
 * for the minimum corner and {@link #lowest()} for the maximum corner. Centre
 * and normalization arithmetic is performed on {@link #toDouble(Number)
 * doubles}, so integer domains never overflow when the index computes box
 * centres.
 * <p>
 * Constants are provided for the Java primitive wrappers. Integer domains use
 * {@code MIN_VALUE}/{@code MAX_VALUE} as sentinels; floating point domains use
 * {@code -MAX_VALUE}/{@code MAX_VALUE} and compare like the primitive
 * operators (so {@code -0.0 == 0.0}).
 *
 * @param <C> the boxed coordinate type
 */
public interface CoordinateType<C extends Number> extends Comparator<C> {

	CoordinateType<Byte> BYTE = of("byte", Byte.MIN_VALUE, Byte.MAX_VALUE);
	CoordinateType<Short> SHORT = of("short", Short.MIN_VALUE, Short.MAX_VALUE);
	CoordinateType<Integer> INT = of("int", Integer.MIN_VALUE, Integer.MAX_VALUE);
	CoordinateType<Long> LONG = of("long", Long.MIN_VALUE, Long.MAX_VALUE);
	CoordinateType<Float> FLOAT = of("float", -Float.MAX_VALUE, Float.MAX_VALUE, SimpleCoordinateType.FLOATING_ORDER);
	CoordinateType<Double> DOUBLE = of("double", -Double.MAX_VALUE, Double.MAX_VALUE, SimpleCoordinateType.FLOATING_ORDER);

	/**
	 * Creates a coordinate type for any naturally ordered number type.
	 *
	 * @param name    a short display name for the domain
	 * @param lowest  the lowest representable value (seeds inverted maxima)
	 * @param highest the highest representable value (seeds inverted minima)
	 * @return a coordinate type ordering values by their natural order
	 */
	static <C extends Number & Comparable<C>> CoordinateType<C> of(String name, C lowest, C highest) {
		return of(name, lowest, highest, Comparator.naturalOrder());
	}

	/**
	 * Creates a coordinate type ordered by the given comparator.
	 *
	 * @param name    a short display name for the domain
	 * @param lowest  the lowest representable value (seeds inverted maxima)
	 * @param highest the highest representable value (seeds inverted minima)
	 * @param order   the ordering of coordinate values
	 * @return a coordinate type
	 */
	static <C extends Number> CoordinateType<C> of(String name, C lowest, C highest, Comparator<? super C> order) {
		return new SimpleCoordinateType<>(name, lowest, highest, order);
	}

	/**
	 * @return the lowest value of the domain
	 */
	C lowest();

	/**
	 * @return the highest value of the domain
	 */
	C highest();

	/**
	 * @return a short display name, e.g. {@code "double"}
	 */
	String name();

	default C min(C a, C b) {
		return compare(a, b) <= 0 ? a : b;
	}

	default C max(C a, C b) {
		return compare(a, b) >= 0 ? a : b;
	}

	/**
	 * Converts a coordinate to a double for centre and normalization arithmetic.
	 * Wide integer values may lose low-order precision; this only affects Hilbert
	 * ordering, never overlap tests.
	 */
	default double toDouble(C value) {
		return value.doubleValue();
	}
}
