package com.github.micycle1.trapezoidj;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.random.RandomGenerator;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.trapezoidj.input.PolygonLoops;
import com.github.micycle1.trapezoidj.map.Segment;
import com.github.micycle1.trapezoidj.map.Trapezoid;
import com.github.micycle1.trapezoidj.map.TrapezoidMap;

/**
 * Drives the construction of a {@link TrapezoidMap}: segments are inserted one
 * per step, in the map's randomised order. Construction can be run to the end,
 * advanced a segment at a time, or walked through finer steps (start point, end
 * point, slice) with {@link #steps()} for visual debugging.
 */
public class Trapezoidation {

	private static final Logger LOGGER = LoggerFactory.getLogger(Trapezoidation.class);

	private final TrapezoidMap map;
	private final int[] order;
	private int cursor = 0; // next position in the order
	private int phase = 0; // 0: start point, 1: end point, 2: slice

	/**
	 * @throws UnsupportedOperationException if the map has a horizontal polygon
	 *                                       edge; nothing has been inserted
	 */
	public Trapezoidation(TrapezoidMap map) {
		this.map = Objects.requireNonNull(map, "Map cannot be null");
		map.checkSupported();
		this.order = map.getOrder();
	}

	/**
	 * Builds the complete trapezoidal map of the given loops with the default
	 * margin and seed.
	 */
	public static TrapezoidMap build(PolygonLoops loops) {
		return new Trapezoidation(new TrapezoidMap(loops)).run();
	}

	public static TrapezoidMap build(PolygonLoops loops, RandomGenerator random) {
		return new Trapezoidation(new TrapezoidMap(loops, random)).run();
	}

	/**
	 * Builds the complete trapezoidal map of a polygon and its holes.
	 */
	public static TrapezoidMap build(Polygon polygon) {
		return build(PolygonLoops.of(polygon));
	}

	public TrapezoidMap getMap() {
		return map;
	}

	public boolean isComplete() {
		return cursor >= order.length;
	}

	/**
	 * Number of segments fully inserted so far.
	 */
	public int getStepCount() {
		return cursor;
	}

	/**
	 * Inserts the remaining segments and returns the finished map. The map is
	 * validated when verification is enabled on it.
	 */
	public TrapezoidMap run() {
		LOGGER.info("Building trapezoidal map of {} segments", order.length - cursor);
		while (!isComplete()) {
			step();
		}
		if (map.isVerify()) {
			map.validate();
		}
		LOGGER.info("Built trapezoidal map: {} trapezoids, {} nodes", map.getTrapezoidCount(), map.getNodeCount());
		return map;
	}

	/**
	 * Inserts the next segment in the order, finishing it if {@link #steps()} left
	 * it partly processed.
	 *
	 * @return the index of the inserted segment
	 */
	public int step() {
		if (isComplete()) {
			throw new IllegalStateException("All " + order.length + " segments have been inserted");
		}
		int n = order[cursor];
		List<Trapezoid> chain = map.insertSegment(n);
		LOGGER.debug("Step {}: segment {} sliced {} trapezoids", cursor, n, chain.size());
		cursor++;
		phase = 0;
		return n;
	}

	/**
	 * Fine-grained construction: each call to {@code next()} performs one action
	 * (insert a segment's start point, its end point, or slice the trapezoids it
	 * crosses) and describes it.
	 */
	public Iterator<String> steps() {
		return new Iterator<String>() {

			@Override
			public boolean hasNext() {
				return !isComplete();
			}

			@Override
			public String next() {
				if (isComplete()) {
					throw new NoSuchElementException();
				}
				int n = order[cursor];
				Segment seg = map.getSegment(n);
				String message;
				switch (phase) {
					case 0:
						map.insertPoint(seg.getA());
						message = "Added start point " + describe(seg.getA()) + " of segment " + n;
						phase = 1;
						break;
					case 1:
						map.insertPoint(seg.getB());
						message = "Added end point " + describe(seg.getB()) + " of segment " + n;
						phase = 2;
						break;
					default:
						List<Trapezoid> chain = map.insertSegment(n);
						StringBuilder sb = new StringBuilder("Sliced segment ").append(n).append(" through");
						for (Trapezoid t : chain) {
							sb.append(" T").append(t.getId());
						}
						message = sb.toString();
						cursor++;
						phase = 0;
						break;
				}
				LOGGER.debug(message);
				return message;
			}
		};
	}

	private String describe(int point) {
		Coordinate c = map.getPoint(point);
		return point + " (" + TrapezoidUtils.round(c.x) + ", " + TrapezoidUtils.round(c.y) + ")";
	}
}
