package com.github.micycle1.trapezoidj.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

import com.github.micycle1.trapezoidj.TrapezoidUtils;

/**
 * An ordered collection of closed point loops: the input of a trapezoidal
 * decomposition. Each loop is implicitly closed (the last point connects back
 * to the first). Usually the first loop is the outer boundary and the rest are
 * holes, though nothing downstream depends on that.
 * <p>
 * Loops are copied and normalised on construction: an explicit closing point
 * (as found in JTS rings) is dropped, and only the x/y ordinates are kept.
 */
public class PolygonLoops {

	private final List<Coordinate[]> loops;
	private final int pointCount;

	public PolygonLoops(List<Coordinate[]> loops) {
		Objects.requireNonNull(loops, "Loops cannot be null");
		if (loops.isEmpty()) {
			throw new IllegalArgumentException("At least one loop is required.");
		}
		List<Coordinate[]> copy = new ArrayList<>(loops.size());
		int count = 0;
		for (int i = 0; i < loops.size(); i++) {
			Coordinate[] loop = normalise(loops.get(i), i);
			copy.add(loop);
			count += loop.length;
		}
		this.loops = Collections.unmodifiableList(copy);
		this.pointCount = count;
	}

	/**
	 * Loops of a polygon: the exterior ring followed by each interior ring.
	 */
	public static PolygonLoops of(Polygon polygon) {
		Objects.requireNonNull(polygon, "Polygon cannot be null");
		List<Coordinate[]> loops = new ArrayList<>();
		addRings(polygon, loops);
		return new PolygonLoops(loops);
	}

	/**
	 * Loops of every polygonal component of a geometry (a Polygon, a
	 * MultiPolygon or a collection of polygons), in component order.
	 */
	public static PolygonLoops of(Geometry geometry) {
		Objects.requireNonNull(geometry, "Geometry cannot be null");
		List<Coordinate[]> loops = new ArrayList<>();
		for (int n = 0; n < geometry.getNumGeometries(); n++) {
			Geometry geom = geometry.getGeometryN(n);
			if (geom instanceof Polygon) {
				addRings((Polygon) geom, loops);
			} else if (!geom.isEmpty()) {
				throw new IllegalArgumentException("Only polygonal geometry is supported, found " + geom.getGeometryType());
			}
		}
		return new PolygonLoops(loops);
	}

	public static PolygonLoops of(Coordinate[]... loops) {
		return new PolygonLoops(List.of(loops));
	}

	private static void addRings(Polygon poly, List<Coordinate[]> loops) {
		LineString exteriorRing = poly.getExteriorRing();
		if (exteriorRing == null || exteriorRing.isEmpty()) {
			return;
		}
		loops.add(exteriorRing.getCoordinates());
		for (int i = 0; i < poly.getNumInteriorRing(); i++) {
			LineString interiorRing = poly.getInteriorRingN(i);
			if (interiorRing != null && !interiorRing.isEmpty()) {
				loops.add(interiorRing.getCoordinates());
			}
		}
	}

	private static Coordinate[] normalise(Coordinate[] loop, int index) {
		if (loop == null) {
			throw new IllegalArgumentException("Loop " + index + " is null.");
		}
		int n = loop.length;
		// JTS rings repeat the first coordinate at the end
		if (n > 1 && loop[0].equals2D(loop[n - 1])) {
			n--;
		}
		if (n < 3) {
			throw new IllegalArgumentException("Loop " + index + " has " + n + " distinct points; at least 3 are required.");
		}
		Coordinate[] out = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			Coordinate c = loop[i];
			if (c == null || !TrapezoidUtils.isFinite(c)) {
				throw new IllegalArgumentException("Loop " + index + " has an invalid coordinate at position " + i + ": " + c);
			}
			out[i] = new Coordinate(c.x, c.y);
		}
		return out;
	}

	public List<Coordinate[]> getLoops() {
		return loops;
	}

	public int getLoopCount() {
		return loops.size();
	}

	/**
	 * Total number of points over all loops; this is also the number of polygon
	 * edges.
	 */
	public int getPointCount() {
		return pointCount;
	}

	public Envelope getEnvelope() {
		Envelope env = new Envelope();
		for (Coordinate[] loop : loops) {
			for (Coordinate c : loop) {
				env.expandToInclude(c);
			}
		}
		return env;
	}
}
