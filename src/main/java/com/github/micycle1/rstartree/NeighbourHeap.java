package com.github.micycle1.rstartree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Bounded max-heap of the best {@code k} candidates seen during a k-NN search.
 * <p>
 * Candidates are ranked by squared distance and then by insertion sequence, so
 * among equally distant values the earlier-inserted one is kept and listed
 * first.
 *
 * @param <T> the type of stored value
 */
final class NeighbourHeap<T> {

	private static final Comparator<Candidate<?>> ASCENDING = Comparator.<Candidate<?>>comparingDouble(c -> c.distSq)
			.thenComparingLong(c -> c.sequence);

	private static final int MAX_INITIAL_CAPACITY = 16;

	private final int k;
	private final PriorityQueue<Candidate<T>> heap;

	NeighbourHeap(int k) {
		this.k = k;
		this.heap = new PriorityQueue<>(Math.max(1, Math.min(k, MAX_INITIAL_CAPACITY)), Collections.reverseOrder(ASCENDING));
	}

	static final class Candidate<T> {
		final double distSq;
		final long sequence;
		final T value;

		Candidate(double distSq, long sequence, T value) {
			this.distSq = distSq;
			this.sequence = sequence;
			this.value = value;
		}
	}

	boolean isFull() {
		return heap.size() >= k;
	}

	/**
	 * Squared distance of the current k-th best candidate, or +inf while fewer
	 * than {@code k} candidates are held.
	 */
	double worstDistanceSquared() {
		return isFull() && k > 0 ? heap.peek().distSq : Double.POSITIVE_INFINITY;
	}

	/**
	 * Offers a candidate. It is admitted if the heap has room, or if it ranks
	 * strictly better than the current worst, which is then evicted.
	 */
	void offer(double distSq, long sequence, T value) {
		if (k == 0) {
			return;
		}
		if (heap.size() < k) {
			heap.add(new Candidate<>(distSq, sequence, value));
			return;
		}
		Candidate<T> worst = heap.peek();
		if (distSq < worst.distSq || (distSq == worst.distSq && sequence < worst.sequence)) {
			heap.poll();
			heap.add(new Candidate<>(distSq, sequence, value));
		}
	}

	/**
	 * Empties the heap into a list ordered nearest-first.
	 */
	List<T> drainAscending() {
		List<T> result = new ArrayList<>(heap.size());
		while (!heap.isEmpty()) {
			result.add(heap.poll().value);
		}
		Collections.reverse(result);
		return result;
	}
}
