package com.github.micycle1.trapezoidj;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.trapezoidj.map.Trapezoid;
import com.github.micycle1.trapezoidj.map.TrapezoidMap;
import com.github.micycle1.trapezoidj.output.TrapezoidDump;

/**
 * Shared fixtures and structural assertions for map tests.
 */
public final class TestPolygons {

	public static final GeometryFactory GF = new GeometryFactory();
	private static final WKTReader READER = new WKTReader(GF);

	private TestPolygons() {
	}

	public static Polygon read(String wkt) {
		try {
			return (Polygon) READER.read(wkt);
		} catch (ParseException e) {
			throw new IllegalArgumentException(e);
		}
	}

	public static Polygon square() {
		return read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
	}

	public static Polygon triangle() {
		return read("POLYGON ((0 0, 10 2, 4 8, 0 0))");
	}

	/**
	 * Two vertices share a Y coordinate.
	 */
	public static Polygon diamond() {
		return read("POLYGON ((0 5, 5 0, 10 5, 5 10, 0 5))");
	}

	/**
	 * Concave arrow without horizontal edges.
	 */
	public static Polygon arrow() {
		return read("POLYGON ((0 1, 6 2, 5 -3, 12 4.5, 4 11, 6.5 6, 1 7, 2.5 4.2, 0 1))");
	}

	/**
	 * Square with a square hole, rotated so that no edge is horizontal.
	 */
	public static Polygon rotatedSquareWithHole() {
		Polygon p = read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0), (3 3, 7 3, 7 7, 3 7, 3 3))");
		return (Polygon) AffineTransformation.rotationInstance(0.3).transform(p);
	}

	/**
	 * Random star-shaped polygon around the origin: angles strictly increase, so
	 * the ring is simple.
	 */
	public static Coordinate[] star(Random r, int n, double rMin, double rMax) {
		Coordinate[] c = new Coordinate[n + 1];
		for (int i = 0; i < n; i++) {
			double a = 2 * Math.PI * (i + 0.1 + 0.8 * r.nextDouble()) / n;
			double rad = rMin + (rMax - rMin) * r.nextDouble();
			c[i] = new Coordinate(rad * Math.cos(a), rad * Math.sin(a));
		}
		c[n] = c[0].copy();
		return c;
	}

	public static Polygon randomStar(long seed, int n) {
		return GF.createPolygon(star(new Random(seed), n, 40, 100));
	}

	/**
	 * Random star with a random star-shaped hole well inside it.
	 */
	public static Polygon randomStarWithHole(long seed, int n) {
		Random r = new Random(seed);
		LinearRing shell = GF.createLinearRing(star(r, n, 60, 100));
		LinearRing hole = GF.createLinearRing(star(r, Math.max(3, n / 2), 10, 30));
		return GF.createPolygon(shell, new LinearRing[] { hole });
	}

	/**
	 * Sum of trapezoid areas equals the area of the bounding box: the trapezoids
	 * tile it.
	 */
	public static void assertTilesBounds(TrapezoidMap map) {
		double sum = 0;
		for (Trapezoid t : map.getTrapezoids()) {
			double h = t.getYMax() - t.getYMin();
			double wb = map.getX(t.getRight(), t.getYMin()) - map.getX(t.getLeft(), t.getYMin());
			double wt = map.getX(t.getRight(), t.getYMax()) - map.getX(t.getLeft(), t.getYMax());
			sum += h * (wb + wt) / 2;
		}
		Envelope b = map.getBounds();
		assertEquals(b.getArea(), sum, 1e-6 * b.getArea());
	}

	/**
	 * Random queries are located in a trapezoid that really contains them, and
	 * every point of that trapezoid is on the same side of the polygon boundary.
	 */
	public static void assertLocation(TrapezoidMap map, Polygon polygon, long seed, int queries) {
		Random r = new Random(seed);
		Envelope b = map.getBounds();
		TrapezoidDump dump = new TrapezoidDump(map);
		for (int i = 0; i < queries; i++) {
			Coordinate q = new Coordinate(b.getMinX() + b.getWidth() * r.nextDouble(), b.getMinY() + b.getHeight() * r.nextDouble());
			Trapezoid t = map.find(q);
			assertTrue(q.y >= t.getYMin() && q.y <= t.getYMax(), () -> q + " outside Y range of " + t);
			double xl = map.getX(t.getLeft(), q.y);
			double xr = map.getX(t.getRight(), q.y);
			assertTrue(q.x >= xl - 1e-9 && q.x <= xr + 1e-9, () -> q + " outside X range of " + t);

			Polygon outline = dump.getOutline(t, 0);
			if (outline.getArea() > 1e-6) {
				Point inner = outline.getInteriorPoint();
				boolean qInside = polygon.contains(GF.createPoint(q));
				boolean innerInside = polygon.contains(inner);
				assertEquals(innerInside, qInside, () -> t + " straddles the polygon boundary at " + q);
			}
		}
	}

	/**
	 * Full structural check of a finished map.
	 */
	public static void assertWellFormed(TrapezoidMap map, Polygon polygon) {
		map.validate();
		assertEquals(2 * map.getTrapezoidCount() - 1, map.getNodeCount());
		for (int i = 0; i < map.getPolygonPointCount(); i++) {
			assertTrue(map.isSegmentInserted(i));
		}
		assertTilesBounds(map);
		assertLocation(map, polygon, 99, 400);
	}
}
