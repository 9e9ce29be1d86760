package com.github.micycle1.flatbox;

import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * In-place quicksort of a key array and a co-indexed value list.
 * <p>
 * Each partition step uses the key of the middle element as pivot and a Hoare
 * scan that swaps key/value pairs together. Pending ranges are kept on an
 * explicit stack, so adversarial key distributions cannot exhaust the call
 * stack. The sort is not stable.
 */
final class DualKeySort {

	private DualKeySort() {
	}

	/**
	 * Sorts {@code keys[lo..hi]} ascending, applying every swap to
	 * {@code values} as well.
	 *
	 * @param keys   the sort keys
	 * @param values the payloads, co-indexed with {@code keys}
	 * @param lo     first index to sort (inclusive)
	 * @param hi     last index to sort (inclusive)
	 */
	static <T> void sort(long[] keys, List<T> values, int lo, int hi) {
		IntArrayList ranges = new IntArrayList();
		ranges.push(lo);
		ranges.push(hi);
		while (!ranges.isEmpty()) {
			int right = ranges.popInt();
			int left = ranges.popInt();
			if (left >= right) {
				continue;
			}
			int split = hoarePartition(keys, values, left, right);
			// larger range first, so the stack stays logarithmic
			if (split - left > right - split - 1) {
				ranges.push(left);
				ranges.push(split);
				ranges.push(split + 1);
				ranges.push(right);
			} else {
				ranges.push(split + 1);
				ranges.push(right);
				ranges.push(left);
				ranges.push(split);
			}
		}
	}

	private static <T> int hoarePartition(long[] keys, List<T> values, int lo, int hi) {
		long pivot = keys[(lo + hi) >>> 1];
		int i = lo - 1;
		int j = hi + 1;

		while (true) {
			do
				i++;
			while (keys[i] < pivot);
			do
				j--;
			while (keys[j] > pivot);
			if (i >= j)
				return j;
			swap(keys, values, i, j);
		}
	}

	private static <T> void swap(long[] keys, List<T> values, int i, int j) {
		long tmpKey = keys[i];
		keys[i] = keys[j];
		keys[j] = tmpKey;

		T tmpValue = values.get(i);
		values.set(i, values.get(j));
		values.set(j, tmpValue);
	}
}
