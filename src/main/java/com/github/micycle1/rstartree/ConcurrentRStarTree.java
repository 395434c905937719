package com.github.micycle1.rstartree;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Thread-safe view of an {@link RStarTree}. Queries run concurrently under a
 * shared read lock; inserts take the exclusive write lock, so no query ever
 * observes a node mid-split.
 * <p>
 * The lock is a non-fair {@link ReentrantReadWriteLock}. The wrapped tree must
 * not be used directly once wrapped.
 *
 * @param <T> the type of object stored in the tree.
 */
public class ConcurrentRStarTree<T> {

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(false);
	private final RStarTree<T> tree;

	public ConcurrentRStarTree(RStarTree<T> tree) {
		this.tree = Objects.requireNonNull(tree, "tree");
	}

	public ConcurrentRStarTree(int dimensions, int fanout, int leafFanout) {
		this(new RStarTree<>(dimensions, fanout, leafFanout));
	}

	public void insert(double[] key, T value) {
		write(() -> tree.insert(key, value));
	}

	public void insert(Coordinate key, T value) {
		write(() -> tree.insert(key, value));
	}

	public List<T> query(double[] key) {
		return read(() -> tree.query(key));
	}

	public List<T> query(double[] key, int max) {
		return read(() -> tree.query(key, max));
	}

	public List<T> query(Coordinate key, int max) {
		return read(() -> tree.query(key, max));
	}

	public List<T> queryWithFilter(double[] key, int max, Predicate<? super T> filter) {
		return read(() -> tree.queryWithFilter(key, max, filter));
	}

	public List<T> queryWithFilter(Coordinate key, int max, Predicate<? super T> filter) {
		return read(() -> tree.queryWithFilter(key, max, filter));
	}

	public List<T> search(Region window) {
		return read(() -> tree.search(window));
	}

	public List<T> search(Envelope window) {
		return read(() -> tree.search(window));
	}

	public int size() {
		return read(tree::size);
	}

	public boolean isEmpty() {
		return read(tree::isEmpty);
	}

	public int height() {
		return read(tree::height);
	}

	public Region bounds() {
		return read(tree::bounds);
	}

	private <X> X read(Supplier<X> r) {
		lock.readLock().lock();
		try {
			return r.get();
		} finally {
			lock.readLock().unlock();
		}
	}

	private void write(Runnable w) {
		lock.writeLock().lock();
		try {
			w.run();
		} finally {
			lock.writeLock().unlock();
		}
	}
}
