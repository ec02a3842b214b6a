package com.github.micycle1.trapezoidj.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.trapezoidj.TrapConstants;
import com.github.micycle1.trapezoidj.TrapezoidUtils;
import com.github.micycle1.trapezoidj.map.Node;
import com.github.micycle1.trapezoidj.map.Trapezoid;
import com.github.micycle1.trapezoidj.map.TrapezoidMap;

/**
 * Diagnostic views of a {@link TrapezoidMap}: trapezoid outlines as JTS
 * polygons, and plain-text dumps of the trapezoids and of the search
 * structure. Numbers in the text dumps are rounded, so two equal maps always
 * dump to identical text.
 */
public class TrapezoidDump {

	private static final Logger LOGGER = LoggerFactory.getLogger(TrapezoidDump.class);

	private final TrapezoidMap map;
	private final GeometryFactory geometryFactory;

	public TrapezoidDump(TrapezoidMap map) {
		this(map, new GeometryFactory());
	}

	public TrapezoidDump(TrapezoidMap map, GeometryFactory geometryFactory) {
		this.map = Objects.requireNonNull(map, "Map cannot be null");
		this.geometryFactory = Objects.requireNonNull(geometryFactory, "Geometry factory cannot be null");
	}

	public List<Pair<Integer, Polygon>> getOutlines() {
		return getOutlines(TrapConstants.DEFAULT_OUTLINE_INSET);
	}

	/**
	 * Outline of every trapezoid, in slot order, paired with its slot.
	 *
	 * @param inset distance by which each outline is pulled in from the
	 *              trapezoid's sides (0 for the exact outline)
	 */
	public List<Pair<Integer, Polygon>> getOutlines(double inset) {
		List<Pair<Integer, Polygon>> outlines = new ArrayList<>(map.getTrapezoidCount());
		for (Trapezoid t : map.getTrapezoids()) {
			outlines.add(Pair.of(t.getId(), toPolygon(outline(t, inset))));
		}
		return outlines;
	}

	public Polygon getOutline(Trapezoid t, double inset) {
		return toPolygon(outline(t, inset));
	}

	/**
	 * Corners of a trapezoid's outline, closed: bottom-left, bottom-right,
	 * top-right, top-left, bottom-left.
	 */
	Coordinate[] outline(Trapezoid t, double inset) {
		double y0 = t.getYMin() + inset;
		double y1 = t.getYMax() - inset;
		if (y0 > y1) {
			y0 = y1 = (t.getYMin() + t.getYMax()) / 2;
		}
		Coordinate[] bottom = edge(t, y0, inset);
		Coordinate[] top = edge(t, y1, inset);
		return new Coordinate[] { bottom[0], bottom[1], top[1], top[0], bottom[0].copy() };
	}

	private Coordinate[] edge(Trapezoid t, double y, double inset) {
		double xl = map.getX(t.getLeft(), y) + inset;
		double xr = map.getX(t.getRight(), y) - inset;
		if (xl > xr) {
			xl = xr = (xl + xr) / 2;
		}
		return new Coordinate[] { new Coordinate(xl, y), new Coordinate(xr, y) };
	}

	private Polygon toPolygon(Coordinate[] ring) {
		return geometryFactory.createPolygon(ring);
	}

	/**
	 * One line per trapezoid, in slot order:
	 * {@code T<slot> Y:<yMin> to <yMax> Left:<seg> Right:<seg> POLYGON ((...))}.
	 */
	public String dumpTrapezoids() {
		StringBuilder sb = new StringBuilder();
		for (Trapezoid t : map.getTrapezoids()) {
			sb.append('T').append(t.getId());
			sb.append(" Y:").append(TrapezoidUtils.round(t.getYMin()));
			sb.append(" to ").append(TrapezoidUtils.round(t.getYMax()));
			sb.append(" Left:").append(t.getLeft());
			sb.append(" Right:").append(t.getRight());
			sb.append(' ');
			appendWkt(sb, outline(t, 0));
			sb.append('\n');
		}
		return sb.toString();
	}

	private static void appendWkt(StringBuilder sb, Coordinate[] ring) {
		sb.append("POLYGON ((");
		for (int i = 0; i < ring.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(TrapezoidUtils.round(ring[i].x)).append(' ').append(TrapezoidUtils.round(ring[i].y));
		}
		sb.append("))");
	}

	/**
	 * Depth-first dump of the search structure from the root, three spaces of
	 * indent per level. Each line is {@code #<index> <kind>}; Y nodes add the Y of
	 * their split point.
	 */
	public String dumpTree() {
		StringBuilder sb = new StringBuilder();
		dumpNode(map.getRoot(), 0, sb);
		return sb.toString();
	}

	private void dumpNode(Node node, int level, StringBuilder sb) {
		sb.append(" ".repeat(3 * level));
		sb.append('#').append(node.getIndex()).append(' ').append(node.getKind().label());
		if (node.getKind() == Node.Kind.Y) {
			sb.append(' ').append(TrapezoidUtils.round(map.getPoint(node.getIndex()).y));
		}
		sb.append('\n');
		if (!node.isLeaf()) {
			dumpNode(map.getNode(node.getFirst()), level + 1, sb);
			dumpNode(map.getNode(node.getSecond()), level + 1, sb);
		}
	}

	public void writeTree(Path file) throws IOException {
		write(file, dumpTree());
	}

	public void writeTrapezoids(Path file) throws IOException {
		write(file, dumpTrapezoids());
	}

	private static void write(Path file, String text) throws IOException {
		Files.writeString(file, text, StandardCharsets.UTF_8);
		LOGGER.debug("Wrote {} characters to {}", text.length(), file);
	}
}
