package com.github.micycle1.rstartree;

import java.util.Arrays;
import java.util.Objects;

import org.locationtech.jts.geom.Envelope;

/**
 * An axis-aligned minimum bounding region (MBR) in D-dimensional space.
 * <p>
 * An empty region has {@code min = +inf} and {@code max = -inf} on every axis,
 * so that expanding it by a point or region yields exactly that point or
 * region. The {@code expand} methods mutate the receiver; every other
 * operation is side-effect free.
 *
 * @author Michael Carleton
 */
public final class Region {

	final double[] min;
	final double[] max;

	/**
	 * Creates an empty region of the given dimensionality.
	 */
	public Region(int dimensions) {
		if (dimensions < 1) {
			throw new IllegalArgumentException("Region dimensionality must be at least 1, got " + dimensions);
		}
		this.min = new double[dimensions];
		this.max = new double[dimensions];
		Arrays.fill(min, Double.POSITIVE_INFINITY);
		Arrays.fill(max, Double.NEGATIVE_INFINITY);
	}

	/**
	 * Creates a degenerate region covering exactly one point.
	 */
	public Region(double[] point) {
		Objects.requireNonNull(point, "point");
		if (point.length == 0) {
			throw new IllegalArgumentException("Region dimensionality must be at least 1, got 0");
		}
		this.min = point.clone();
		this.max = point.clone();
	}

	/**
	 * Copy constructor.
	 */
	public Region(Region other) {
		this.min = other.min.clone();
		this.max = other.max.clone();
	}

	/**
	 * Creates the region spanning {@code min..max} on each axis.
	 *
	 * @throws IllegalArgumentException if the corners differ in length or
	 *                                  {@code min[i] > max[i]} on some axis
	 */
	public static Region of(double[] min, double[] max) {
		Objects.requireNonNull(min, "min");
		Objects.requireNonNull(max, "max");
		if (min.length != max.length || min.length == 0) {
			throw new IllegalArgumentException("Region corners must have the same, non-zero length: " + min.length + " vs " + max.length);
		}
		Region r = new Region(min);
		for (int i = 0; i < max.length; i++) {
			if (!(min[i] <= max[i])) {
				throw new IllegalArgumentException("min[" + i + "]=" + min[i] + " exceeds max[" + i + "]=" + max[i]);
			}
			r.max[i] = max[i];
		}
		return r;
	}

	/**
	 * Converts a JTS envelope into a two-dimensional region. A null (empty)
	 * envelope maps to the empty region.
	 */
	public static Region of(Envelope envelope) {
		Objects.requireNonNull(envelope, "envelope");
		if (envelope.isNull()) {
			return new Region(2);
		}
		return of(new double[] { envelope.getMinX(), envelope.getMinY() }, new double[] { envelope.getMaxX(), envelope.getMaxY() });
	}

	/**
	 * Converts this region into a JTS envelope.
	 *
	 * @throws IllegalStateException if this region is not two-dimensional
	 */
	public Envelope toEnvelope() {
		if (getDimensions() != 2) {
			throw new IllegalStateException("Only two-dimensional regions map to an Envelope, this region has " + getDimensions());
		}
		if (isEmpty()) {
			return new Envelope();
		}
		return new Envelope(min[0], max[0], min[1], max[1]);
	}

	public int getDimensions() {
		return min.length;
	}

	public double getMin(int axis) {
		return min[axis];
	}

	public double getMax(int axis) {
		return max[axis];
	}

	/**
	 * @return true if this region has never been expanded
	 */
	public boolean isEmpty() {
		for (int i = 0; i < min.length; i++) {
			if (min[i] > max[i]) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Product of per-axis extents. Not guaranteed positive: a degenerate region
	 * has zero area and an empty one may report a negative or infinite value.
	 */
	public double area() {
		double result = 1.0;
		for (int i = 0; i < min.length; i++) {
			result *= max[i] - min[i];
		}
		return result;
	}

	/**
	 * Sum of per-axis extents (half the perimeter in two dimensions).
	 */
	public double margin() {
		double sum = 0.0;
		for (int i = 0; i < min.length; i++) {
			sum += max[i] - min[i];
		}
		return sum;
	}

	/**
	 * Inclusive containment test for a point.
	 */
	public boolean contains(double[] point) {
		for (int i = 0; i < min.length; i++) {
			if (point[i] < min[i] || point[i] > max[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Separating-axis test. Boxes that only touch on a boundary overlap.
	 */
	public boolean overlaps(Region other) {
		for (int i = 0; i < min.length; i++) {
			if (max[i] < other.min[i] || min[i] > other.max[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Grows this region to include the given point.
	 */
	public void expand(double[] point) {
		for (int i = 0; i < min.length; i++) {
			if (point[i] < min[i]) {
				min[i] = point[i];
			}
			if (point[i] > max[i]) {
				max[i] = point[i];
			}
		}
	}

	/**
	 * Grows this region to include {@code other} (in-place union).
	 */
	public void expand(Region other) {
		for (int i = 0; i < min.length; i++) {
			if (other.min[i] < min[i]) {
				min[i] = other.min[i];
			}
			if (other.max[i] > max[i]) {
				max[i] = other.max[i];
			}
		}
	}

	/**
	 * Squared Euclidean distance from {@code point} to the nearest point of this
	 * region; zero when the point lies inside.
	 */
	public double distanceSquared(double[] point) {
		double sum = 0.0;
		for (int i = 0; i < min.length; i++) {
			double d;
			if (point[i] < min[i]) {
				d = min[i] - point[i];
			} else if (point[i] > max[i]) {
				d = point[i] - max[i];
			} else {
				continue;
			}
			sum += d * d;
		}
		return sum;
	}

	/**
	 * Volume of the intersection of two regions, or zero if they are separated
	 * (or merely touch) on any axis.
	 */
	static double intersectionVolume(Region a, Region b) {
		double volume = 1.0;
		for (int i = 0; i < a.min.length; i++) {
			double extent = Math.min(a.max[i], b.max[i]) - Math.max(a.min[i], b.min[i]);
			if (extent <= 0.0) {
				return 0.0;
			}
			volume *= extent;
		}
		return volume;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Region)) {
			return false;
		}
		Region other = (Region) o;
		return Arrays.equals(min, other.min) && Arrays.equals(max, other.max);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
	}

	@Override
	public String toString() {
		return "Region[" + Arrays.toString(min) + " : " + Arrays.toString(max) + "]";
	}
}
