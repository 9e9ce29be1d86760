package com.github.micycle1.flatbox;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineSegment;

/**
 * Compares {@link EnvelopeIndex} queries with a linear scan over
 * {@link Envelope#intersects(Envelope)}, for point items and for short line
 * segments, and covers null envelopes and early termination.
 */
public class EnvelopeIndexTest {

	@Test
	public void testQueryWithCoordinates() {
		final int N_ITEMS = 5000;
		final int N_QUERIES = 500;
		Random rnd = new Random(4242);

		EnvelopeIndex<Coordinate> tree = new EnvelopeIndex<>(16);
		List<Coordinate> items = new ArrayList<>(N_ITEMS);

		for (int i = 0; i < N_ITEMS; i++) {
			double x = rnd.nextDouble() * 1000.0;
			double y = rnd.nextDouble() * 1000.0;
			Coordinate c = new Coordinate(x, y);
			items.add(c);
			tree.insert(new Envelope(x, x, y, y), c);
		}

		tree.build();

		for (int qi = 0; qi < N_QUERIES; qi++) {
			double x = rnd.nextDouble() * 1100.0 - 50.0;
			double y = rnd.nextDouble() * 1100.0 - 50.0;
			Envelope searchEnv = new Envelope(x, x + rnd.nextDouble() * 100.0, y, y + rnd.nextDouble() * 100.0);

			List<Coordinate> expected = new ArrayList<>();
			for (Coordinate it : items) {
				if (searchEnv.intersects(it))
					expected.add(it);
			}

			List<Coordinate> actual = tree.query(searchEnv);

			// Set equality (order-independent)
			assertEquals(expected.size(), actual.size(), "Result size mismatch for query " + qi);
			assertTrue(expected.containsAll(actual) && actual.containsAll(expected), "Set mismatch for query " + qi);
		}

		// whole extent returns every item
		List<Coordinate> all = tree.query(new Envelope(-1, 1001, -1, 1001));
		assertEquals(items.size(), all.size());
	}

	@Test
	public void testQueryWithLineSegments() {
		final int N_ITEMS = 4000;
		final int N_QUERIES = 300;
		Random rnd = new Random(2121);

		EnvelopeIndex<LineSegment> tree = new EnvelopeIndex<>(8);
		List<LineSegment> items = new ArrayList<>(N_ITEMS);

		for (int i = 0; i < N_ITEMS; i++) {
			Coordinate p0 = new Coordinate(rnd.nextDouble() * 1000.0, rnd.nextDouble() * 1000.0);
			Coordinate p1 = new Coordinate(p0.x + rnd.nextDouble() * 40.0 - 20.0, p0.y + rnd.nextDouble() * 40.0 - 20.0);
			LineSegment seg = new LineSegment(p0, p1);
			items.add(seg);
			tree.insert(new Envelope(p0, p1), seg);
		}

		// query builds implicitly
		for (int qi = 0; qi < N_QUERIES; qi++) {
			Coordinate q = new Coordinate(rnd.nextDouble() * 1000.0, rnd.nextDouble() * 1000.0);
			Envelope searchEnv = new Envelope(q);
			searchEnv.expandBy(rnd.nextDouble() * 50.0);

			List<LineSegment> expected = new ArrayList<>();
			for (LineSegment seg : items) {
				if (searchEnv.intersects(new Envelope(seg.p0, seg.p1)))
					expected.add(seg);
			}

			List<LineSegment> actual = tree.query(searchEnv);

			assertEquals(expected.size(), actual.size(), "Result size mismatch for query " + qi);
			assertTrue(expected.containsAll(actual) && actual.containsAll(expected), "Set mismatch for query " + qi);
		}
	}

	@Test
	public void testEarlyExitVisitor() {
		EnvelopeIndex<Integer> tree = new EnvelopeIndex<>();
		for (int i = 0; i < 1000; i++) {
			tree.insert(new Envelope(i, i + 1, 0, 1), i);
		}

		List<Integer> visited = new ArrayList<>();
		tree.query(new Envelope(0, 1000, 0, 1), item -> {
			visited.add(item);
			return visited.size() < 3;
		});
		assertEquals(3, visited.size());
	}

	@Test
	public void testOnlyNullEnvelopes() {
		EnvelopeIndex<String> tree = new EnvelopeIndex<>();
		tree.insert(new Envelope(), "x");
		tree.insert(new Envelope(), "y");
		assertEquals(2, tree.size());
		assertTrue(tree.getExtent().isNull());
		assertTrue(tree.query(new Envelope(-Double.MAX_VALUE, Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE)).isEmpty());
		assertEquals(0, tree.getBounds().length);
	}

	@Test
	public void testEdgeCases() {
		// Empty tree
		EnvelopeIndex<String> empty = new EnvelopeIndex<>();
		assertTrue(empty.query(new Envelope(0, 10, 0, 10)).isEmpty(), "Empty tree should return empty list");
		assertEquals(0, empty.getBounds().length);
		assertTrue(empty.getExtent().isNull());

		EnvelopeIndex<String> tree = new EnvelopeIndex<>(4);
		tree.insert(new Envelope(0, 1, 0, 1), "a");
		tree.insert(new Envelope(), "null-envelope");
		tree.insert(new Envelope(5, 6, 5, 6), "b");
		assertEquals(3, tree.size());
		assertEquals(new Envelope(0, 6, 0, 6), tree.getExtent());

		// a null envelope never matches
		assertEquals(List.of("a"), tree.query(new Envelope(0, 1, 0, 1)));
		List<String> everything = tree.query(new Envelope(-100, 100, -100, 100));
		assertEquals(2, everything.size());
		assertTrue(everything.contains("a") && everything.contains("b"));
		// not even a query over the whole plane reaches it
		Envelope plane = new Envelope(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
		assertFalse(tree.query(plane).contains("null-envelope"));
		assertEquals(2, tree.query(plane).size());
		Envelope widest = new Envelope(-Double.MAX_VALUE, Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE);
		assertFalse(tree.query(widest).contains("null-envelope"));
		assertEquals(2, tree.query(widest).size());

		// null and disjoint search envelopes
		assertTrue(tree.query(new Envelope()).isEmpty());
		assertTrue(tree.query(new Envelope(50, 60, 50, 60)).isEmpty());

		// inserting after the build fails
		assertThrows(IllegalStateException.class, () -> tree.insert(new Envelope(1, 2, 1, 2), "late"));

		// root node covers the extent
		Envelope[] bounds = tree.getBounds();
		assertEquals(tree.getExtent(), bounds[bounds.length - 1]);
	}
}
