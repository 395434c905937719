package com.github.micycle1.rstartree;

import java.util.Arrays;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * R*-style node split, shared by leaf nodes (payload is a stored value) and
 * internal nodes (payload is a child node).
 * <p>
 * Given {@code capacity + 1} entries, every axis is sorted by the minimum
 * coordinate of each entry region and every admissible split index is scored.
 * The winner minimises overlap volume, then margin, then total area.
 *
 * @author Michael Carleton
 */
final class NodeSplitter {

	private static final Logger log = LoggerFactory.getLogger(NodeSplitter.class);

	private NodeSplitter() {
	}

	/**
	 * A region paired with a payload, materialised only while a node is split.
	 *
	 * @param <P> the payload type
	 */
	static final class Entry<P> {
		final Region region;
		final P payload;
		final long sequence; // insertion order for leaf values; unused (0) for children

		Entry(Region region, P payload, long sequence) {
			this.region = region;
			this.payload = payload;
			this.sequence = sequence;
		}
	}

	/**
	 * The best split seen so far: axis and index plus its cost triple.
	 */
	static final class Candidate {
		int axis = -1;
		int index = -1;
		double overlap = Double.POSITIVE_INFINITY;
		double margin = Double.POSITIVE_INFINITY;
		double area = Double.POSITIVE_INFINITY;

		/**
		 * Lexicographic comparison: overlap, then margin, then area. Exact ties keep
		 * the incumbent.
		 */
		boolean isBeatenBy(double overlap, double margin, double area) {
			if (overlap != this.overlap) {
				return overlap < this.overlap;
			}
			if (margin != this.margin) {
				return margin < this.margin;
			}
			return area < this.area;
		}

		void update(int axis, int index, double overlap, double margin, double area) {
			this.axis = axis;
			this.index = index;
			this.overlap = overlap;
			this.margin = margin;
			this.area = area;
		}
	}

	/**
	 * The two groups produced by a split, each with its tight region.
	 */
	static final class Partition<P> {
		final Entry<P>[] lower;
		final Entry<P>[] upper;
		final Region lowerRegion;
		final Region upperRegion;

		Partition(Entry<P>[] lower, Entry<P>[] upper, Region lowerRegion, Region upperRegion) {
			this.lower = lower;
			this.upper = upper;
			this.lowerRegion = lowerRegion;
			this.upperRegion = upperRegion;
		}
	}

	/**
	 * Smallest group size a split may produce for a node of the given capacity.
	 */
	static int minSplitCount(int capacity) {
		return Math.max(1, (int) (RStarTree.MIN_SPLIT * capacity));
	}

	/**
	 * Splits {@code entries} (a node's {@code capacity} entries plus the overflow
	 * entry) into two groups. The array is reordered in place by the winning
	 * axis.
	 */
	static <P> Partition<P> split(Entry<P>[] entries, int dimensions, String kind) {
		Candidate best = findBestSplit(entries, dimensions);
		sortByMin(entries, best.axis);
		Partition<P> partition = partition(entries, best.index, dimensions);
		if (log.isTraceEnabled()) {
			log.trace("Split {} node of {} entries on axis {} at {} (overlap={}, margin={}, area={})", kind, entries.length, best.axis, best.index,
					best.overlap, best.margin, best.area);
		}
		return partition;
	}

	/**
	 * Scores every axis and every admissible split index. Split indices run over
	 * {@code [m, (capacity + 1) - m]} inclusive, where {@code m} is
	 * {@link #minSplitCount(int)}.
	 */
	static <P> Candidate findBestSplit(Entry<P>[] entries, int dimensions) {
		final int total = entries.length;
		final int capacity = total - 1;
		final int m = minSplitCount(capacity);
		final int first = Math.min(m, total - 1);
		final int last = Math.max(first, total - m);

		Candidate best = new Candidate();
		for (int axis = 0; axis < dimensions; axis++) {
			Entry<P>[] sorted = entries.clone();
			sortByMin(sorted, axis);

			// prefix[k] bounds entries [0, k), suffix[k] bounds entries [k, total)
			Region[] prefix = new Region[total + 1];
			Region[] suffix = new Region[total + 1];
			prefix[0] = new Region(dimensions);
			for (int j = 0; j < total; j++) {
				prefix[j + 1] = new Region(prefix[j]);
				prefix[j + 1].expand(sorted[j].region);
			}
			suffix[total] = new Region(dimensions);
			for (int j = total - 1; j >= 0; j--) {
				suffix[j] = new Region(suffix[j + 1]);
				suffix[j].expand(sorted[j].region);
			}

			for (int k = first; k <= last; k++) {
				Region lower = prefix[k];
				Region upper = suffix[k];
				double overlap = Region.intersectionVolume(lower, upper);
				double margin = lower.margin() + upper.margin();
				double area = lower.area() + upper.area();
				if (best.isBeatenBy(overlap, margin, area)) {
					best.update(axis, k, overlap, margin, area);
				}
			}
		}

		if (best.axis < 0) {
			throw new CorruptNodeException("No admissible split found among " + total + " entries");
		}
		return best;
	}

	/**
	 * Divides already-sorted entries at {@code index}, rebuilding both tight
	 * regions.
	 */
	static <P> Partition<P> partition(Entry<P>[] sorted, int index, int dimensions) {
		Entry<P>[] lower = Arrays.copyOfRange(sorted, 0, index);
		Entry<P>[] upper = Arrays.copyOfRange(sorted, index, sorted.length);
		Region lowerRegion = new Region(dimensions);
		Region upperRegion = new Region(dimensions);
		for (Entry<P> e : lower) {
			lowerRegion.expand(e.region);
		}
		for (Entry<P> e : upper) {
			upperRegion.expand(e.region);
		}
		return new Partition<>(lower, upper, lowerRegion, upperRegion);
	}

	private static <P> void sortByMin(Entry<P>[] entries, int axis) {
		// stable, so ties on an axis keep the caller's order
		Arrays.sort(entries, Comparator.comparingDouble((Entry<P> e) -> e.region.min[axis]));
	}
}
