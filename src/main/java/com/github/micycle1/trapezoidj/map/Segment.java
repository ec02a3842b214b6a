package com.github.micycle1.trapezoidj.map;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

/**
 * A polygon edge, directed from its upper endpoint {@code A} down to its lower
 * endpoint {@code B}. Endpoints are indices into the owning point table.
 * <p>
 * A segment whose endpoints share a Y coordinate is horizontal. It can sit in
 * the table, but has no slope and cannot be inserted into a map.
 */
public class Segment {

	private final int a; // upper point
	private final int b; // lower point
	private final double slope; // dx/dy; NaN when horizontal

	/**
	 * Creates the segment between points {@code p} and {@code q}, ordering the
	 * endpoints so that {@code A} is the upper one.
	 */
	public Segment(Coordinate[] pts, int p, int q) {
		Coordinate cp = pts[p], cq = pts[q];
		if (cp.y < cq.y) {
			this.a = q;
			this.b = p;
		} else {
			this.a = p;
			this.b = q;
		}
		Coordinate ca = pts[a], cb = pts[b];
		this.slope = ca.y == cb.y ? Double.NaN : (ca.x - cb.x) / (ca.y - cb.y);
	}

	public int getA() {
		return a;
	}

	public int getB() {
		return b;
	}

	public double getSlope() {
		return slope;
	}

	public boolean isHorizontal() {
		return Double.isNaN(slope);
	}

	public boolean hasEndpoint(int point) {
		return a == point || b == point;
	}

	/**
	 * X of the supporting line at the given Y. Not clamped to the segment's own
	 * extent.
	 */
	public double getX(Coordinate[] pts, double y) {
		Coordinate cb = pts[b];
		return cb.x + slope * (y - cb.y);
	}

	/**
	 * Orientation of {@code p} relative to the upward line {@code B -> A}: one of
	 * {@link Orientation#LEFT}, {@link Orientation#RIGHT} or
	 * {@link Orientation#COLLINEAR}.
	 */
	public int orientation(Coordinate[] pts, Coordinate p) {
		return Orientation.index(pts[b], pts[a], p);
	}

	/**
	 * Is the given point strictly left of this segment?
	 */
	public boolean isLeft(Coordinate[] pts, Coordinate p) {
		return orientation(pts, p) == Orientation.LEFT;
	}

	@Override
	public String toString() {
		return "Segment " + a + " to " + b;
	}
}
