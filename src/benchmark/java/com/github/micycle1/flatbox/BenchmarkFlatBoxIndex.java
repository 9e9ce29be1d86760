package com.github.micycle1.flatbox;

import java.util.concurrent.TimeUnit;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.hprtree.HPRtree;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Query throughput over a square grid of boxes, {@code spacing} units apart,
 * with a sliding 4x4-cell query window.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 1, time = 1)
@Measurement(iterations = 2, time = 2)
@Fork(value = 1, jvmArgsAppend = { "-Xms2g", "-Xmx2g", "-XX:+AlwaysPreTouch" })
public class BenchmarkFlatBoxIndex {

	@Param({ "300", "1000" })
	public int dim;

	@Param({ "16" })
	public int nodeSize;

	private static final int spacing = 10;
	private static final int numQueries = 10000;

	private FlatBoxIndex<Integer> intIndex;
	private FlatBoxIndex<Double> doubleIndex;
	private HPRtree jtsTree;
	private int[] queryMinX;
	private int[] queryMinY;
	private IntList buffer;

	@Setup(Level.Trial)
	public void setup() {
		intIndex = new FlatBoxIndex<>(CoordinateType.INT, nodeSize);
		doubleIndex = new FlatBoxIndex<>(CoordinateType.DOUBLE, nodeSize);
		jtsTree = new HPRtree(nodeSize);
		fillSquare(intIndex, doubleIndex, jtsTree, dim);

		queryMinX = new int[numQueries];
		queryMinY = new int[numQueries];
		int sx = 0;
		int sy = 0;
		for (int i = 0; i < numQueries; i++) {
			queryMinX[i] = sx % (dim * spacing);
			queryMinY[i] = sy % (dim * spacing);
			sx += 13;
			sy += 17;
		}
		buffer = new IntArrayList();
	}

	private static void fillSquare(FlatBoxIndex<Integer> ints, FlatBoxIndex<Double> doubles, HPRtree jts, int dim) {
		ints.reserve(dim * dim);
		doubles.reserve(dim * dim);
		for (int x = 0; x < dim; x++) {
			for (int y = 0; y < dim; y++) {
				int xp = x * spacing;
				int yp = y * spacing;
				ints.add(xp + 1, yp + 1, xp + spacing - 1, yp + spacing - 1);
				doubles.add(xp + 1.0, yp + 1.0, xp + spacing - 1.0, yp + spacing - 1.0);
				jts.insert(new Envelope(xp + 1, xp + spacing - 1, yp + 1, yp + spacing - 1), x * dim + y);
			}
		}
		ints.finish();
		doubles.finish();
		jts.build();
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void searchIntIntoBuffer(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			int minX = queryMinX[i];
			int minY = queryMinY[i];
			bh.consume(intIndex.searchInto(minX, minY, minX + 4 * spacing, minY + 4 * spacing, buffer).size());
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void searchDoubleIntoBuffer(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			double minX = queryMinX[i];
			double minY = queryMinY[i];
			bh.consume(doubleIndex.searchInto(minX, minY, minX + 4 * spacing, minY + 4 * spacing, buffer).size());
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void searchDoubleAllocating(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			double minX = queryMinX[i];
			double minY = queryMinY[i];
			bh.consume(doubleIndex.search(minX, minY, minX + 4 * spacing, minY + 4 * spacing));
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void searchJtsHPRtree(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			double minX = queryMinX[i];
			double minY = queryMinY[i];
			bh.consume(jtsTree.query(new Envelope(minX, minX + 4 * spacing, minY, minY + 4 * spacing)));
		}
	}

	@Benchmark
	@BenchmarkMode(Mode.SingleShotTime)
	@OutputTimeUnit(TimeUnit.MILLISECONDS)
	public FlatBoxIndex<Double> insertAndFinish() {
		FlatBoxIndex<Double> index = new FlatBoxIndex<>(CoordinateType.DOUBLE, nodeSize);
		index.reserve(dim * dim);
		for (int x = 0; x < dim; x++) {
			for (int y = 0; y < dim; y++) {
				double xp = x * spacing;
				double yp = y * spacing;
				index.add(xp + 1, yp + 1, xp + spacing - 1, yp + spacing - 1);
			}
		}
		index.finish();
		return index;
	}
}
