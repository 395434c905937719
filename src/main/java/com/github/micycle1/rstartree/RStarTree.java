package com.github.micycle1.rstartree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.Predicate;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.rstartree.NodeSplitter.Entry;
import com.github.micycle1.rstartree.NodeSplitter.Partition;

/**
 * In-memory R*-tree mapping D-dimensional point keys to values, with
 * branch-and-bound k-nearest-neighbour search.
 * <p>
 * Dimensionality, internal fanout and leaf fanout are fixed when the tree is
 * constructed. Duplicate keys are permitted and coexist as separate entries.
 * Entries cannot be removed.
 * <p>
 * Not thread-safe: concurrent queries are fine, but no query may run while an
 * insert is in flight. Wrap the tree in a {@link ConcurrentRStarTree} when it
 * is shared between threads.
 *
 * @param <T> the type of object stored in the tree.
 * @author Michael Carleton
 */
public class RStarTree<T> {

	private static final Logger log = LoggerFactory.getLogger(RStarTree.class);

	/** Fanout used when none is given. */
	public static final int DEFAULT_FANOUT = 16;

	/**
	 * Fraction of a node's capacity that the smaller half of a split must hold
	 * (at least one entry).
	 */
	static final double MIN_SPLIT = 0.25;

	final int dimensions;
	final int fanout;
	final int leafFanout;

	Node<T> root;
	private int size;
	private int height;
	private long nextSequence;

	/**
	 * Creates a tree with the default fanout for both internal and leaf nodes.
	 *
	 * @param dimensions number of coordinates in every key
	 */
	public RStarTree(int dimensions) {
		this(dimensions, DEFAULT_FANOUT);
	}

	/**
	 * Creates a tree whose leaves hold as many entries as its internal nodes.
	 */
	public RStarTree(int dimensions, int fanout) {
		this(dimensions, fanout, fanout);
	}

	/**
	 * @param dimensions number of coordinates in every key (at least 1)
	 * @param fanout     maximum children per internal node (at least 2)
	 * @param leafFanout maximum values per leaf node (at least 1)
	 */
	public RStarTree(int dimensions, int fanout, int leafFanout) {
		if (dimensions < 1) {
			throw new IllegalArgumentException("Dimensionality must be at least 1, got " + dimensions);
		}
		if (fanout < 2) {
			throw new IllegalArgumentException("Internal fanout must be at least 2, got " + fanout);
		}
		if (leafFanout < 1) {
			throw new IllegalArgumentException("Leaf fanout must be at least 1, got " + leafFanout);
		}
		this.dimensions = dimensions;
		this.fanout = fanout;
		this.leafFanout = leafFanout;
	}

	/**
	 * Inserts a value at the given point. Always succeeds; an existing entry at
	 * the same coordinates is kept alongside the new one.
	 *
	 * @param key   the point, of length {@link #getDimensions()}
	 * @param value the value to store (may be null)
	 */
	public void insert(double[] key, T value) {
		validateKey(key);
		final double[] point = key.clone();
		final long sequence = nextSequence++;

		if (root == null) {
			LeafNode<T> leaf = new LeafNode<>(dimensions, leafFanout);
			leaf.insert(point, value, sequence);
			root = leaf;
			height = 1;
			size++;
			return;
		}

		SplitResult<T> split = root.insert(point, value, sequence);
		size++;
		if (split == null) {
			return;
		}

		// root split: grow the tree by one level
		InternalNode<T> newRoot = new InternalNode<>(dimensions, fanout);
		newRoot.append(new Entry<>(new Region(root.region), root, 0));
		newRoot.append(new Entry<>(new Region(split.region), split.sibling, 0));
		root = newRoot;
		height++;
		log.debug("Root split after {} entries; tree height is now {}", size, height);
	}

	/**
	 * Inserts a value at a JTS coordinate. Two-dimensional trees use
	 * {@code (x, y)}; three-dimensional trees use {@code (x, y, z)}.
	 */
	public void insert(Coordinate key, T value) {
		insert(toKey(key), value);
	}

	/**
	 * @return the single value nearest to {@code key}, as a list of at most one
	 *         element
	 */
	public List<T> query(double[] key) {
		return query(key, 1);
	}

	/**
	 * Returns up to {@code max} values nearest to {@code key} by Euclidean
	 * distance, nearest first. Equally distant values are listed in insertion
	 * order, and when they compete for the last places the earlier-inserted ones
	 * are kept.
	 */
	public List<T> query(double[] key, int max) {
		return queryWithFilter(key, max, v -> true);
	}

	public List<T> query(Coordinate key, int max) {
		return query(toKey(key), max);
	}

	/**
	 * As {@link #query(double[], int)}, but skips any value for which
	 * {@code filter} returns false. Skipped values do not count against
	 * {@code max}.
	 */
	public List<T> queryWithFilter(double[] key, int max, Predicate<? super T> filter) {
		validateKey(key);
		Objects.requireNonNull(filter, "filter");
		if (max < 0) {
			throw new IllegalArgumentException("max must not be negative, got " + max);
		}
		if (root == null || max == 0) {
			return new ArrayList<>();
		}
		NeighbourHeap<T> heap = new NeighbourHeap<>(max);
		root.nearest(key, heap, filter);
		return heap.drainAscending();
	}

	public List<T> queryWithFilter(Coordinate key, int max, Predicate<? super T> filter) {
		return queryWithFilter(toKey(key), max, filter);
	}

	/**
	 * Region search: every value whose key lies inside {@code window} (boundaries
	 * inclusive), in no particular order.
	 */
	public List<T> search(Region window) {
		Objects.requireNonNull(window, "window");
		if (window.getDimensions() != dimensions) {
			throw new IllegalArgumentException("Expected a " + dimensions + "-dimensional window, got " + window.getDimensions());
		}
		List<T> results = new ArrayList<>();
		if (root != null && !window.isEmpty()) {
			root.search(window, results);
		}
		return results;
	}

	/**
	 * Region search over a JTS envelope; two-dimensional trees only.
	 */
	public List<T> search(Envelope window) {
		return search(Region.of(window));
	}

	/**
	 * @return number of values inserted
	 */
	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return root == null;
	}

	/**
	 * @return number of node levels; 0 for an empty tree, 1 while the root is a
	 *         leaf
	 */
	public int height() {
		return height;
	}

	/**
	 * @return a copy of the region covering every key, or an empty region if the
	 *         tree is empty
	 */
	public Region bounds() {
		return root == null ? new Region(dimensions) : new Region(root.region);
	}

	public int getDimensions() {
		return dimensions;
	}

	public int getFanout() {
		return fanout;
	}

	public int getLeafFanout() {
		return leafFanout;
	}

	private void validateKey(double[] key) {
		Objects.requireNonNull(key, "key");
		if (key.length != dimensions) {
			throw new IllegalArgumentException("Expected a " + dimensions + "-dimensional key, got " + key.length);
		}
		for (int i = 0; i < key.length; i++) {
			if (!Double.isFinite(key[i])) {
				throw new IllegalArgumentException("Key coordinate " + i + " is not finite: " + key[i]);
			}
		}
	}

	private double[] toKey(Coordinate c) {
		Objects.requireNonNull(c, "key");
		switch (dimensions) {
			case 2:
				return new double[] { c.getX(), c.getY() };
			case 3:
				return new double[] { c.getX(), c.getY(), c.getZ() };
			default:
				throw new IllegalArgumentException("Coordinate keys need a 2- or 3-dimensional tree, this tree has " + dimensions);
		}
	}

	/**
	 * Squared Euclidean distance between two points of equal length.
	 */
	static double distanceSquared(double[] a, double[] b) {
		double sum = 0.0;
		for (int i = 0; i < a.length; i++) {
			double d = a[i] - b[i];
			sum += d * d;
		}
		return sum;
	}

	/* ===================== Supporting Classes ==================== */

	/**
	 * Outcome of an insert that overflowed a node: the newly created sibling and
	 * its region, which the parent must adopt.
	 */
	static final class SplitResult<T> {
		final Region region;
		final Node<T> sibling;

		SplitResult(Region region, Node<T> sibling) {
			this.region = region;
			this.sibling = sibling;
		}
	}

	/**
	 * A tree node: either a {@link LeafNode} holding values or an
	 * {@link InternalNode} holding child nodes. No other variants exist.
	 * <p>
	 * Live entries occupy slots {@code [0, size)}; {@code region} is always the
	 * tight union of their regions.
	 *
	 * @param <T> the type of stored value
	 */
	abstract static class Node<T> {
		final int dimensions;
		final int capacity;
		int size;
		Region region;

		private Node(int dimensions, int capacity) {
			this.dimensions = dimensions;
			this.capacity = capacity;
			this.region = new Region(dimensions);
		}

		boolean isFull() {
			return size == capacity;
		}

		abstract boolean isLeaf();

		/**
		 * Region of the live entry in slot {@code i}.
		 */
		abstract Region regionAt(int i);

		/**
		 * Inserts below this node.
		 *
		 * @return null, or the sibling this node was split off into
		 */
		abstract SplitResult<T> insert(double[] key, T value, long sequence);

		/**
		 * Offers every qualifying value below this node to {@code heap}.
		 */
		abstract void nearest(double[] key, NeighbourHeap<T> heap, Predicate<? super T> filter);

		abstract void search(Region window, List<T> results);

		/**
		 * Copies the {@code size} live entries plus {@code overflow} into a fresh
		 * array of {@code size + 1}, ready for splitting.
		 */
		static <P> Entry<P>[] pack(Entry<P>[] entries, int size, Entry<P> overflow) {
			@SuppressWarnings("unchecked")
			Entry<P>[] packed = new Entry[size + 1];
			for (int i = 0; i < size; i++) {
				packed[i] = checkSlot(entries, i);
			}
			packed[size] = overflow;
			return packed;
		}

		static <P> Entry<P> checkSlot(Entry<P>[] entries, int i) {
			Entry<P> e = entries[i];
			if (e == null || e.region == null) {
				throw new CorruptNodeException("Corrupt node: live slot " + i + " has no region");
			}
			return e;
		}
	}

	/**
	 * A leaf: up to {@code capacity} point entries, each carrying a stored value.
	 */
	static final class LeafNode<T> extends Node<T> {
		Entry<T>[] entries;

		@SuppressWarnings("unchecked")
		LeafNode(int dimensions, int capacity) {
			super(dimensions, capacity);
			this.entries = new Entry[capacity];
		}

		@Override
		boolean isLeaf() {
			return true;
		}

		@Override
		Region regionAt(int i) {
			return checkSlot(entries, i).region;
		}

		@Override
		SplitResult<T> insert(double[] key, T value, long sequence) {
			Entry<T> entry = new Entry<>(new Region(key), value, sequence);
			if (!isFull()) {
				entries[size++] = entry;
				region.expand(key);
				return null;
			}

			Partition<T> split = NodeSplitter.split(pack(entries, size, entry), dimensions, "leaf");
			adopt(split.lower, split.lowerRegion);

			LeafNode<T> sibling = new LeafNode<>(dimensions, capacity);
			sibling.adopt(split.upper, split.upperRegion);
			return new SplitResult<>(new Region(split.upperRegion), sibling);
		}

		private void adopt(Entry<T>[] group, Region groupRegion) {
			Arrays.fill(entries, null);
			System.arraycopy(group, 0, entries, 0, group.length);
			size = group.length;
			region = groupRegion;
		}

		@Override
		void nearest(double[] key, NeighbourHeap<T> heap, Predicate<? super T> filter) {
			for (int i = 0; i < size; i++) {
				Entry<T> e = checkSlot(entries, i);
				if (!filter.test(e.payload)) {
					continue;
				}
				// a leaf region is a single point, so min is the stored key
				heap.offer(distanceSquared(key, e.region.min), e.sequence, e.payload);
			}
		}

		@Override
		void search(Region window, List<T> results) {
			for (int i = 0; i < size; i++) {
				Entry<T> e = checkSlot(entries, i);
				if (window.contains(e.region.min)) {
					results.add(e.payload);
				}
			}
		}
	}

	/**
	 * An internal node: up to {@code capacity} child nodes, each with the region
	 * bounding its subtree.
	 */
	static final class InternalNode<T> extends Node<T> {
		Entry<Node<T>>[] entries;

		@SuppressWarnings("unchecked")
		InternalNode(int dimensions, int capacity) {
			super(dimensions, capacity);
			this.entries = new Entry[capacity];
		}

		@Override
		boolean isLeaf() {
			return false;
		}

		@Override
		Region regionAt(int i) {
			return childSlot(i).region;
		}

		Node<T> childAt(int i) {
			return childSlot(i).payload;
		}

		private Entry<Node<T>> childSlot(int i) {
			Entry<Node<T>> e = checkSlot(entries, i);
			if (e.payload == null) {
				throw new CorruptNodeException("Corrupt node: live slot " + i + " has no child");
			}
			return e;
		}

		void append(Entry<Node<T>> entry) {
			entries[size++] = entry;
			region.expand(entry.region);
		}

		@Override
		SplitResult<T> insert(double[] key, T value, long sequence) {
			final int best = chooseSubtree(key);
			final Entry<Node<T>> chosen = childSlot(best);
			final SplitResult<T> childSplit = chosen.payload.insert(key, value, sequence);
			region.expand(key);

			if (childSplit == null) {
				chosen.region.expand(key);
				return null;
			}

			// the split child now covers only its lower half
			entries[best] = new Entry<>(new Region(chosen.payload.region), chosen.payload, 0);
			Entry<Node<T>> adopted = new Entry<>(new Region(childSplit.region), childSplit.sibling, 0);
			if (!isFull()) {
				append(adopted);
				return null;
			}

			Partition<Node<T>> split = NodeSplitter.split(pack(entries, size, adopted), dimensions, "internal");
			adopt(split.lower, split.lowerRegion);

			InternalNode<T> sibling = new InternalNode<>(dimensions, capacity);
			sibling.adopt(split.upper, split.upperRegion);
			return new SplitResult<>(new Region(split.upperRegion), sibling);
		}

		/**
		 * Least-enlargement rule: the child whose region grows least in area to cover
		 * {@code key}; ties go to the smaller region, then the lower slot.
		 */
		int chooseSubtree(double[] key) {
			int bestIndex = -1;
			double bestEnlargement = Double.POSITIVE_INFINITY;
			double bestArea = Double.POSITIVE_INFINITY;

			for (int i = 0; i < size; i++) {
				Region current = regionAt(i);
				double originalArea = current.area();
				Region enlarged = new Region(current);
				enlarged.expand(key);
				double enlargement = enlarged.area() - originalArea;

				if (bestIndex < 0 || enlargement < bestEnlargement || (enlargement == bestEnlargement && originalArea < bestArea)) {
					bestIndex = i;
					bestEnlargement = enlargement;
					bestArea = originalArea;
				}
			}
			if (bestIndex < 0) {
				throw new CorruptNodeException("Corrupt node: internal node has no children");
			}
			return bestIndex;
		}

		private void adopt(Entry<Node<T>>[] group, Region groupRegion) {
			Arrays.fill(entries, null);
			System.arraycopy(group, 0, entries, 0, group.length);
			size = group.length;
			region = groupRegion;
		}

		@Override
		void nearest(double[] key, NeighbourHeap<T> heap, Predicate<? super T> filter) {
			PriorityQueue<SearchItem> queue = new PriorityQueue<>(Math.max(1, size));
			for (int i = 0; i < size; i++) {
				queue.offer(new SearchItem(regionAt(i).distanceSquared(key), i));
			}

			while (!queue.isEmpty()) {
				SearchItem item = queue.poll();
				// everything left in the queue is at least this far away
				if (heap.isFull() && item.distSq > heap.worstDistanceSquared()) {
					break;
				}
				childAt(item.index).nearest(key, heap, filter);
			}
		}

		@Override
		void search(Region window, List<T> results) {
			for (int i = 0; i < size; i++) {
				if (window.overlaps(regionAt(i))) {
					childAt(i).search(window, results);
				}
			}
		}
	}

	/**
	 * A child slot queued during k-NN search, ordered by its box distance.
	 */
	private static final class SearchItem implements Comparable<SearchItem> {
		final double distSq;
		final int index;

		SearchItem(double distSq, int index) {
			this.distSq = distSq;
			this.index = index;
		}

		@Override
		public int compareTo(SearchItem other) {
			int c = Double.compare(distSq, other.distSq);
			return c != 0 ? c : Integer.compare(index, other.index);
		}
	}
}
