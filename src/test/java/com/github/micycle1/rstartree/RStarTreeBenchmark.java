package com.github.micycle1.rstartree;

import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rough timings for insertion and k-NN queries. Not part of the default test
 * run; invoke explicitly.
 */
public class RStarTreeBenchmark {

	private static final Logger log = LoggerFactory.getLogger(RStarTreeBenchmark.class);

	@ParameterizedTest
	@ValueSource(ints = { 10_000, 50_000, 100_000 })
	public void benchmarkPointInsertion(int num) {
		RStarTree<Integer> tree = new RStarTree<>(2);
		Random rnd = new Random();
		long startTime = System.currentTimeMillis();

		for (int i = 0; i < num; i++) {
			tree.insert(new Coordinate(rnd.nextDouble() * 1000, rnd.nextDouble() * 1000), i);
		}

		long duration = System.currentTimeMillis() - startTime;
		log.info("Insertion of {} points took {} ms (height {}).", num, duration, tree.height());
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 10, 100 })
	public void benchmarkKnnQuery(int k) {
		RStarTree<Integer> tree = new RStarTree<>(2);
		Random rnd = new Random();
		for (int i = 0; i < 100_000; i++) {
			tree.insert(new double[] { rnd.nextDouble() * 1000, rnd.nextDouble() * 1000 }, i);
		}

		int queries = 10_000;
		long startTime = System.currentTimeMillis();
		for (int i = 0; i < queries; i++) {
			tree.query(new double[] { rnd.nextDouble() * 1000, rnd.nextDouble() * 1000 }, k);
		}
		long duration = System.currentTimeMillis() - startTime;
		log.info("{} queries of k={} over 100000 points took {} ms.", queries, k, duration);
	}
}
