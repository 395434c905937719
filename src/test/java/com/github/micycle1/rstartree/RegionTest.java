package com.github.micycle1.rstartree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

public class RegionTest {

	private static Region box(double minX, double minY, double maxX, double maxY) {
		return Region.of(new double[] { minX, minY }, new double[] { maxX, maxY });
	}

	@Test
	public void testEmptyRegionExpandsToExactlyThePoint() {
		Region r = new Region(3);
		assertTrue(r.isEmpty());
		r.expand(new double[] { 1, 2, 3 });
		assertFalse(r.isEmpty());
		assertEquals(new Region(new double[] { 1, 2, 3 }), r);
	}

	@Test
	public void testEmptyRegionExpandsToExactlyTheRegion() {
		Region r = new Region(2);
		Region other = box(-1, 0, 4, 2);
		r.expand(other);
		assertEquals(other, r);
	}

	@Test
	public void testAreaAndMargin() {
		Region r = box(0, 0, 4, 2.5);
		assertEquals(10.0, r.area());
		assertEquals(6.5, r.margin());
		assertEquals(0.0, new Region(new double[] { 3, 3 }).area(), "A point has zero area");
	}

	@Test
	public void testContainsIsInclusive() {
		Region r = box(0, 0, 10, 10);
		assertTrue(r.contains(new double[] { 0, 10 }));
		assertTrue(r.contains(new double[] { 5, 5 }));
		assertFalse(r.contains(new double[] { 10.000001, 5 }));
		assertFalse(r.contains(new double[] { 5, -1 }));
	}

	@Test
	public void testOverlaps() {
		Region a = box(0, 0, 5, 5);
		assertTrue(a.overlaps(box(5, 5, 8, 8)), "Touching corners overlap");
		assertTrue(a.overlaps(box(1, 1, 2, 2)));
		assertTrue(a.overlaps(box(-3, 2, 10, 3)));
		assertFalse(a.overlaps(box(6, 0, 8, 5)));
		assertFalse(a.overlaps(box(0, 5.5, 5, 6)));
	}

	@Test
	public void testIntersectionVolume() {
		assertEquals(4.0, Region.intersectionVolume(box(0, 0, 4, 4), box(2, 2, 6, 6)));
		assertEquals(0.0, Region.intersectionVolume(box(0, 0, 4, 4), box(4, 0, 6, 4)), "Touching boxes share no volume");
		assertEquals(0.0, Region.intersectionVolume(box(0, 0, 1, 1), box(3, 3, 4, 4)));
	}

	@Test
	public void testDistanceSquared() {
		Region r = box(0, 0, 2, 2);
		assertEquals(0.0, r.distanceSquared(new double[] { 1, 1 }));
		assertEquals(0.0, r.distanceSquared(new double[] { 2, 0 }));
		assertEquals(9.0, r.distanceSquared(new double[] { 5, 1 }));
		assertEquals(2.0, r.distanceSquared(new double[] { -1, 3 }));
	}

	@Test
	public void testExpandMutatesOnlyReceiver() {
		Region a = box(0, 0, 1, 1);
		Region b = box(2, 2, 3, 3);
		Region copy = new Region(a);
		a.expand(b);
		assertEquals(box(0, 0, 3, 3), a);
		assertEquals(box(2, 2, 3, 3), b);
		assertEquals(box(0, 0, 1, 1), copy);
	}

	@Test
	public void testInvalidCorners() {
		assertThrows(IllegalArgumentException.class, () -> Region.of(new double[] { 1, 0 }, new double[] { 0, 0 }));
		assertThrows(IllegalArgumentException.class, () -> Region.of(new double[] { 1 }, new double[] { 2, 2 }));
		assertThrows(IllegalArgumentException.class, () -> new Region(0));
	}

	@Test
	public void testEnvelopeConversion() {
		Envelope env = new Envelope(1, 4, -2, 3);
		Region r = Region.of(env);
		assertEquals(box(1, -2, 4, 3), r);
		assertEquals(env, r.toEnvelope());

		assertTrue(Region.of(new Envelope()).isEmpty());
		assertTrue(new Region(2).toEnvelope().isNull());
		assertThrows(IllegalStateException.class, () -> new Region(new double[] { 1, 2, 3 }).toEnvelope());
	}

	@Test
	public void testPointConstructorRejectsMissingOrEmptyPoint() {
		assertThrows(NullPointerException.class, () -> new Region((double[]) null));
		assertThrows(IllegalArgumentException.class, () -> new Region(new double[0]));
		assertEquals(1, new Region(new double[] { 5 }).getDimensions());
	}
}
