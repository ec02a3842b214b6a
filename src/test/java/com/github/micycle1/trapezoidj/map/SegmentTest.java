package com.github.micycle1.trapezoidj.map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

class SegmentTest {

	private final Coordinate[] pts = { new Coordinate(0, 0), new Coordinate(4, 8), new Coordinate(6, 8) };

	@Test
	void upperEndpointIsA() {
		Segment s = new Segment(pts, 0, 1);
		assertEquals(1, s.getA());
		assertEquals(0, s.getB());

		Segment reversed = new Segment(pts, 1, 0);
		assertEquals(1, reversed.getA());
		assertEquals(0, reversed.getB());
		assertEquals(0.5, reversed.getSlope());
	}

	@Test
	void getXExtrapolatesSupportingLine() {
		Segment s = new Segment(pts, 0, 1);
		assertEquals(2, s.getX(pts, 4), 1e-12);
		assertEquals(6, s.getX(pts, 12), 1e-12);
		assertEquals(-1, s.getX(pts, -2), 1e-12);
	}

	@Test
	void sideOfPoint() {
		Segment s = new Segment(pts, 0, 1);
		assertTrue(s.isLeft(pts, new Coordinate(0, 4)));
		assertFalse(s.isLeft(pts, new Coordinate(4, 4)));
		assertEquals(Orientation.COLLINEAR, s.orientation(pts, new Coordinate(1, 2)));
		assertFalse(s.isLeft(pts, new Coordinate(1, 2)));
	}

	@Test
	void horizontalSegment() {
		Segment s = new Segment(pts, 1, 2);
		assertTrue(s.isHorizontal());
		assertTrue(Double.isNaN(s.getSlope()));
		assertTrue(s.hasEndpoint(1));
		assertTrue(s.hasEndpoint(2));
		assertFalse(s.hasEndpoint(0));
	}
}
