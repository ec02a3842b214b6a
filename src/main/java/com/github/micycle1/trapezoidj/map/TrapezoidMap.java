package com.github.micycle1.trapezoidj.map;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.trapezoidj.TrapConstants;
import com.github.micycle1.trapezoidj.TrapezoidUtils;
import com.github.micycle1.trapezoidj.input.PolygonLoops;
import com.github.micycle1.trapezoidj.map.Node.Kind;

/**
 * Trapezoidal map of a set of polygon loops, together with its point-location
 * search structure.
 * <p>
 * Points, segments, trapezoids and nodes live in tables and refer to each other
 * by slot index. The first {@code n} points and segments are the polygon's
 * (loops appended in order); four extra points and two extra segments describe
 * the left and right sides of a bounding box grown by a margin around the
 * input. Trapezoid slot 0 starts out as that whole box.
 * <p>
 * The map is built incrementally with {@link #insertPoint(int)} and
 * {@link #insertSegment(int)}, normally driven in the randomised order of
 * {@link #getOrder()} by {@link com.github.micycle1.trapezoidj.Trapezoidation}.
 * Not thread-safe.
 */
public class TrapezoidMap {

	private static final Logger LOGGER = LoggerFactory.getLogger(TrapezoidMap.class);

	private final int max; // number of polygon points (and segments)
	private final Coordinate[] pts;
	private final boolean[] done;
	private final Segment[] segs;
	private final boolean[] sliced;
	private final int[] order;
	private final Envelope bounds;

	private final List<Trapezoid> traps = new ArrayList<>();
	private final List<Node> nodes = new ArrayList<>();
	private final int root;

	private boolean verify = true;

	public TrapezoidMap(PolygonLoops loops) {
		this(loops, TrapConstants.DEFAULT_MARGIN, new Random(TrapConstants.DEFAULT_SEED));
	}

	public TrapezoidMap(PolygonLoops loops, RandomGenerator random) {
		this(loops, TrapConstants.DEFAULT_MARGIN, random);
	}

	/**
	 * @param loops  the polygon loops
	 * @param margin how far the bounding box extends past the input on each side;
	 *               must be positive
	 * @param random source of the segment insertion order
	 */
	public TrapezoidMap(PolygonLoops loops, double margin, RandomGenerator random) {
		Objects.requireNonNull(loops, "Loops cannot be null");
		Objects.requireNonNull(random, "Random generator cannot be null");
		if (!(margin > 0) || !Double.isFinite(margin)) {
			throw new IllegalArgumentException("Margin must be a positive finite value, was " + margin);
		}

		max = loops.getPointCount();
		pts = new Coordinate[max + 4];
		done = new boolean[max];
		segs = new Segment[max + 2];
		sliced = new boolean[max];
		order = new int[max];

		int n = 0;
		for (Coordinate[] loop : loops.getLoops()) {
			int c = loop.length;
			for (int i = 0; i < c; i++) {
				pts[n + i] = new Coordinate(loop[i].x, loop[i].y);
			}
			for (int i = 0; i < c; i++) {
				segs[n + i] = new Segment(pts, n + i, n + (i + 1) % c);
				order[n + i] = n + i;
			}
			n += c;
		}
		shuffle(order, random);

		Envelope env = loops.getEnvelope();
		env.expandBy(margin);
		bounds = env;
		pts[max] = new Coordinate(env.getMinX(), env.getMinY());
		pts[max + 1] = new Coordinate(env.getMinX(), env.getMaxY());
		pts[max + 2] = new Coordinate(env.getMaxX(), env.getMinY());
		pts[max + 3] = new Coordinate(env.getMaxX(), env.getMaxY());
		segs[max] = new Segment(pts, max, max + 1);
		segs[max + 1] = new Segment(pts, max + 2, max + 3);

		root = newNode(Kind.LEAF, 0);
		traps.add(new Trapezoid(0, env.getMinY(), env.getMaxY(), max, max + 1, root));

		LOGGER.debug("Created map for {} loops, {} points; bounds {}", loops.getLoopCount(), max, env);
	}

	/**
	 * In-place Fisher-Yates shuffle.
	 */
	static void shuffle(int[] a, RandomGenerator random) {
		for (int i = a.length - 1; i > 0; i--) {
			int j = random.nextInt(i + 1);
			int t = a[i];
			a[i] = a[j];
			a[j] = t;
		}
	}

	// --- Point location ---

	/**
	 * Finds the trapezoid containing the query point. Points sharing a Y with a
	 * vertex are ordered against it by X, as if the plane were sheared by an
	 * infinitesimal amount.
	 */
	public Trapezoid find(Coordinate q) {
		Objects.requireNonNull(q, "Query point cannot be null");
		Node node = nodes.get(root);
		while (!node.isLeaf()) {
			int next;
			if (node.getKind() == Kind.Y) {
				next = TrapezoidUtils.isBelow(q, pts[node.getIndex()]) ? node.getFirst() : node.getSecond();
			} else {
				next = segs[node.getIndex()].isLeft(pts, q) ? node.getFirst() : node.getSecond();
			}
			node = nodes.get(next);
		}
		return traps.get(node.getIndex());
	}

	/**
	 * Finds the trapezoid containing the query point, sending a query that lies
	 * exactly on a split line below it when {@code preferBelow} is set, and
	 * above it otherwise.
	 */
	public Trapezoid findSlice(Coordinate q, boolean preferBelow) {
		Objects.requireNonNull(q, "Query point cannot be null");
		Node node = nodes.get(root);
		while (!node.isLeaf()) {
			int next;
			if (node.getKind() == Kind.Y) {
				double y = pts[node.getIndex()].y;
				boolean below = q.y == y ? preferBelow : q.y < y;
				next = below ? node.getFirst() : node.getSecond();
			} else {
				next = segs[node.getIndex()].isLeft(pts, q) ? node.getFirst() : node.getSecond();
			}
			node = nodes.get(next);
		}
		return traps.get(node.getIndex());
	}

	/**
	 * Locates the trapezoid a segment enters just below its upper endpoint
	 * ({@code top}) or leaves just above its lower endpoint. The probe sits on
	 * the segment, infinitesimally close to the endpoint, and is never exactly
	 * on a split line or on another segment.
	 */
	private Trapezoid locateEnd(Segment seg, boolean top) {
		int end = top ? seg.getA() : seg.getB();
		Coordinate p = pts[end];
		Coordinate other = pts[top ? seg.getB() : seg.getA()];

		Node node = nodes.get(root);
		while (!node.isLeaf()) {
			int k = node.getIndex();
			boolean first;
			if (node.getKind() == Kind.Y) {
				if (k == end || pts[k].equals2D(p)) {
					first = top;
				} else {
					first = TrapezoidUtils.isBelow(p, pts[k]);
				}
			} else {
				Segment s = segs[k];
				int side = s.orientation(pts, p);
				if (side == Orientation.COLLINEAR) {
					side = s.orientation(pts, other);
				}
				first = side == Orientation.LEFT;
			}
			node = nodes.get(first ? node.getFirst() : node.getSecond());
		}
		return traps.get(node.getIndex());
	}

	// --- Construction ---

	/**
	 * Splits the trapezoid containing point {@code n} with a horizontal line
	 * through it. The located trapezoid keeps its slot as the lower half.
	 *
	 * @return the new upper trapezoid, or {@code null} if the point was already
	 *         inserted
	 */
	public Trapezoid insertPoint(int n) {
		checkPointIndex(n);
		if (done[n]) {
			return null;
		}
		Coordinate p = pts[n];
		Trapezoid lower = find(p);
		if (p.y < lower.getYMin() || p.y > lower.getYMax()) {
			throw new IllegalStateException("Point " + n + " " + p + " is outside the Y range of " + lower);
		}
		Node leaf = nodes.get(lower.getNode());

		int upperSlot = traps.size();
		Trapezoid upper = new Trapezoid(upperSlot, p.y, lower.getYMax(), lower.getLeft(), lower.getRight(), newNode(Kind.LEAF, upperSlot));
		traps.add(upper);

		upper.copyTops(lower);
		for (int t : upper.tops()) {
			if (t != Trapezoid.NONE) {
				traps.get(t).replaceBottom(lower.getId(), upperSlot);
			}
		}
		lower.setYMax(p.y);
		lower.setNode(newNode(Kind.LEAF, lower.getId()));
		lower.setSingleTop(upperSlot);
		upper.setSingleBottom(lower.getId());

		leaf.split(Kind.Y, n, lower.getNode(), upper.getNode());
		done[n] = true;

		LOGGER.debug("Inserted point {} at ({}, {}): T{} below, T{} above", n, p.x, p.y, lower.getId(), upperSlot);
		return upper;
	}

	/**
	 * Inserts segment {@code n}: inserts both endpoints, then slices every
	 * trapezoid the segment crosses, from top to bottom.
	 *
	 * @return the left halves of the sliced trapezoids, top first; empty if the
	 *         segment was already inserted
	 * @throws UnsupportedOperationException if the segment is horizontal
	 */
	public List<Trapezoid> insertSegment(int n) {
		checkSegmentIndex(n);
		Segment seg = segs[n];
		if (seg.isHorizontal()) {
			throw new UnsupportedOperationException(describeHorizontal(n));
		}
		if (sliced[n]) {
			return Collections.emptyList();
		}
		insertPoint(seg.getA());
		insertPoint(seg.getB());

		Trapezoid first = locateEnd(seg, true);
		Trapezoid last = locateEnd(seg, false);
		List<Trapezoid> chain = sliceChain(n, first, last);
		sliced[n] = true;

		LOGGER.debug("Inserted segment {} through {} trapezoids", n, chain.size());
		return chain;
	}

	/**
	 * Fails if any polygon edge is horizontal.
	 *
	 * @throws UnsupportedOperationException naming the first horizontal edge
	 */
	public void checkSupported() {
		for (int i = 0; i < max; i++) {
			if (segs[i].isHorizontal()) {
				throw new UnsupportedOperationException(describeHorizontal(i));
			}
		}
	}

	private String describeHorizontal(int n) {
		Segment seg = segs[n];
		return "Horizontal polygon edges are not supported: segment " + n + " from " + pts[seg.getA()] + " to " + pts[seg.getB()];
	}

	private List<Trapezoid> sliceChain(int n, Trapezoid first, Trapezoid last) {
		Segment seg = segs[n];
		List<Trapezoid> lefts = new ArrayList<>();
		Trapezoid t = first;
		Trapezoid prevLeft = null;
		Trapezoid prevRight = null;
		int steps = 0;
		while (true) {
			if (verify) {
				checkSliceable(t, n);
			}
			Trapezoid right = slice(t, n);

			// restitch the boundary above this slice
			if (prevLeft == null) {
				relink(t.getYMax(), neighbours(t.tops()), List.of(t, right));
			} else {
				List<Trapezoid> uppers = new ArrayList<>(List.of(prevLeft, prevRight));
				for (int u : t.tops()) {
					if (u != Trapezoid.NONE && u != prevLeft.getId()) {
						uppers.add(traps.get(u));
					}
				}
				List<Trapezoid> lowers = new ArrayList<>(List.of(t, right));
				for (int l : prevLeft.bots()) {
					if (l != Trapezoid.NONE && l != t.getId()) {
						lowers.add(traps.get(l));
					}
				}
				relink(t.getYMax(), uppers, lowers);
			}
			lefts.add(t);

			if (t == last) {
				relink(t.getYMin(), List.of(t, right), neighbours(t.bots()));
				return lefts;
			}
			if (++steps > traps.size()) {
				throw new IllegalStateException("Segment " + n + " chain walk did not reach " + last);
			}
			Trapezoid next = nextInChain(t, seg, n);
			prevLeft = t;
			prevRight = right;
			t = next;
		}
	}

	/**
	 * Picks, among the bottom neighbours of a just-sliced trapezoid, the one the
	 * segment continues into.
	 */
	private Trapezoid nextInChain(Trapezoid t, Segment seg, int n) {
		double y = t.getYMin();
		double x = seg.getX(pts, y);
		Trapezoid best = null;
		double bestMargin = Double.NEGATIVE_INFINITY;
		for (int b : t.bots()) {
			if (b == Trapezoid.NONE) {
				continue;
			}
			Trapezoid c = traps.get(b);
			double margin = Math.min(x - xAt(c.getLeft(), y), xAt(c.getRight(), y) - x);
			if (margin > bestMargin) {
				bestMargin = margin;
				best = c;
			}
		}
		if (best == null || bestMargin < -TrapConstants.FINE) {
			throw new IllegalStateException("Segment " + n + " leaves " + t + " through no bottom neighbour at x=" + x);
		}
		if (bestMargin < 0) {
			LOGGER.warn("Segment {} leaves T{} at x={}, {} outside T{}; within tolerance", n, t.getId(), x, -bestMargin, best.getId());
		}
		return best;
	}

	/**
	 * Cuts a trapezoid along segment {@code n}. The trapezoid keeps its slot as
	 * the left half; the right half is appended.
	 */
	private Trapezoid slice(Trapezoid t, int n) {
		Node leaf = nodes.get(t.getNode());
		int rightSlot = traps.size();
		Trapezoid right = new Trapezoid(rightSlot, t.getYMin(), t.getYMax(), n, t.getRight(), newNode(Kind.LEAF, rightSlot));
		traps.add(right);
		t.setRight(n);
		t.setNode(newNode(Kind.LEAF, t.getId()));
		leaf.split(Kind.X, n, t.getNode(), right.getNode());
		LOGGER.debug("Sliced T{} by segment {}: T{} left, T{} right", t.getId(), n, t.getId(), rightSlot);
		return right;
	}

	private void checkSliceable(Trapezoid t, int n) {
		Node leaf = nodes.get(t.getNode());
		if (!leaf.isLeaf() || leaf.getIndex() != t.getId()) {
			throw new IllegalStateException(t + " is not represented by a leaf: " + leaf);
		}
		double y = (t.getYMin() + t.getYMax()) / 2;
		double x = segs[n].getX(pts, y);
		double xl = xAt(t.getLeft(), y);
		double xr = xAt(t.getRight(), y);
		boolean inside;
		if (t.getYMax() - t.getYMin() > TrapConstants.FINE) {
			inside = x > xl && x < xr;
		} else {
			inside = x >= xl - TrapConstants.FINE && x <= xr + TrapConstants.FINE;
		}
		if (!inside) {
			throw new IllegalStateException("Segment " + n + " at x=" + x + " does not cross " + t + " (" + xl + " to " + xr + ")");
		}
	}

	/**
	 * Rebuilds the adjacency across the horizontal line {@code y} between two
	 * groups of trapezoids: pairs are linked exactly when their extents on the
	 * line overlap.
	 */
	private void relink(double y, List<Trapezoid> uppers, List<Trapezoid> lowers) {
		for (Trapezoid u : uppers) {
			for (Trapezoid l : lowers) {
				Trapezoid.remove(u.bots(), l.getId());
				Trapezoid.remove(l.tops(), u.getId());
			}
		}
		for (Trapezoid u : uppers) {
			for (Trapezoid l : lowers) {
				double o = TrapezoidUtils.overlap(xAt(u.getLeft(), y), xAt(u.getRight(), y), xAt(l.getLeft(), y), xAt(l.getRight(), y));
				if (o > TrapConstants.FINE) {
					Trapezoid.add(u.bots(), l.getId(), u);
					Trapezoid.add(l.tops(), u.getId(), l);
					orderSide(u.bots(), y);
					orderSide(l.tops(), y);
				}
			}
		}
	}

	private void orderSide(int[] side, double y) {
		if (side[0] != Trapezoid.NONE && side[1] != Trapezoid.NONE && midX(side[0], y) > midX(side[1], y)) {
			int t = side[0];
			side[0] = side[1];
			side[1] = t;
		}
	}

	private double midX(int t, double y) {
		Trapezoid trap = traps.get(t);
		return (xAt(trap.getLeft(), y) + xAt(trap.getRight(), y)) / 2;
	}

	private List<Trapezoid> neighbours(int[] side) {
		List<Trapezoid> list = new ArrayList<>(2);
		for (int t : side) {
			if (t != Trapezoid.NONE) {
				list.add(traps.get(t));
			}
		}
		return list;
	}

	private double xAt(int seg, double y) {
		return segs[seg].getX(pts, y);
	}

	private int newNode(Kind kind, int index) {
		int id = nodes.size();
		nodes.add(new Node(id, kind, index));
		return id;
	}

	// --- Validation ---

	/**
	 * Checks the structural invariants of the map and search structure.
	 *
	 * @throws IllegalStateException describing the first violation found
	 */
	public void validate() {
		for (int i = 0; i < traps.size(); i++) {
			Trapezoid t = traps.get(i);
			check(t.getId() == i, "Trapezoid in slot " + i + " has id " + t.getId());
			Node leaf = nodes.get(t.getNode());
			check(leaf.isLeaf() && leaf.getIndex() == i, t + " is controlled by " + leaf);
			check(t.getYMin() <= t.getYMax(), t + " has yMin above yMax");
			for (double y : new double[] { t.getYMin(), t.getYMax() }) {
				check(xAt(t.getLeft(), y) <= xAt(t.getRight(), y) + TrapConstants.FINE, t + " has crossed sides at y=" + y);
			}
			checkSide(t, t.tops(), true);
			checkSide(t, t.bots(), false);
		}

		int[] parents = new int[nodes.size()];
		int[] keys = new int[max + 4];
		for (Node node : nodes) {
			switch (node.getKind()) {
				case LEAF:
					check(node.getIndex() >= 0 && node.getIndex() < traps.size(), node + " refers to no trapezoid");
					check(traps.get(node.getIndex()).getNode() == node.getId(), node + " is not the leaf of its trapezoid");
					break;
				case Y:
					check(node.getIndex() >= 0 && node.getIndex() < max, node + " is keyed on a non-polygon point");
					keys[node.getIndex()]++;
					parents[node.getFirst()]++;
					parents[node.getSecond()]++;
					break;
				case X:
					check(node.getIndex() >= 0 && node.getIndex() < max, node + " is keyed on a non-polygon segment");
					parents[node.getFirst()]++;
					parents[node.getSecond()]++;
					break;
				default:
					throw new IllegalStateException("Unknown node kind " + node.getKind());
			}
		}
		for (int i = 0; i < nodes.size(); i++) {
			check(parents[i] == (i == root ? 0 : 1), "Node " + i + " has " + parents[i] + " parents");
		}
		for (int i = 0; i < max; i++) {
			check(keys[i] == (done[i] ? 1 : 0), "Point " + i + " keys " + keys[i] + " Y nodes (inserted: " + done[i] + ")");
		}
	}

	private void checkSide(Trapezoid t, int[] side, boolean top) {
		String name = top ? "top" : "bottom";
		check(side[0] != Trapezoid.NONE || side[1] == Trapezoid.NONE, t + " has a gap in its " + name + " neighbours");
		check(side[0] == Trapezoid.NONE || side[0] != side[1], t + " lists a " + name + " neighbour twice");
		for (int s : side) {
			if (s == Trapezoid.NONE) {
				continue;
			}
			check(s >= 0 && s < traps.size(), t + " has an invalid " + name + " neighbour " + s);
			Trapezoid other = traps.get(s);
			check(top ? other.hasBottom(t.getId()) : other.hasTop(t.getId()), t + " and T" + s + " disagree on adjacency");
		}
	}

	private static void check(boolean condition, String message) {
		if (!condition) {
			throw new IllegalStateException(message);
		}
	}

	private void checkPointIndex(int n) {
		if (n < 0 || n >= max) {
			throw new IllegalArgumentException("Point index " + n + " out of range [0, " + max + ")");
		}
	}

	private void checkSegmentIndex(int n) {
		if (n < 0 || n >= max) {
			throw new IllegalArgumentException("Segment index " + n + " out of range [0, " + max + ")");
		}
	}

	// --- Accessors ---

	/**
	 * Number of polygon points, which is also the number of polygon segments.
	 */
	public int getPolygonPointCount() {
		return max;
	}

	/**
	 * Size of the point table, including the four bounding box corners.
	 */
	public int getPointCount() {
		return pts.length;
	}

	public Coordinate getPoint(int i) {
		return pts[i].copy();
	}

	/**
	 * Size of the segment table, including the two bounding box sides.
	 */
	public int getSegmentCount() {
		return segs.length;
	}

	public Segment getSegment(int i) {
		return segs[i];
	}

	/**
	 * X of segment {@code seg}'s supporting line at the given Y.
	 */
	public double getX(int seg, double y) {
		return xAt(seg, y);
	}

	public int getTrapezoidCount() {
		return traps.size();
	}

	public Trapezoid getTrapezoid(int i) {
		return traps.get(i);
	}

	public List<Trapezoid> getTrapezoids() {
		return Collections.unmodifiableList(traps);
	}

	public int getNodeCount() {
		return nodes.size();
	}

	public Node getNode(int i) {
		return nodes.get(i);
	}

	public Node getRoot() {
		return nodes.get(root);
	}

	/**
	 * The randomised order in which the driver inserts segments.
	 */
	public int[] getOrder() {
		return Arrays.copyOf(order, order.length);
	}

	public boolean isPointInserted(int n) {
		checkPointIndex(n);
		return done[n];
	}

	public boolean isSegmentInserted(int n) {
		checkSegmentIndex(n);
		return sliced[n];
	}

	/**
	 * The bounding box of the map: the input envelope grown by the margin.
	 */
	public Envelope getBounds() {
		return new Envelope(bounds);
	}

	public boolean isVerify() {
		return verify;
	}

	/**
	 * Enables or disables the per-slice precondition checks (on by default).
	 */
	public void setVerify(boolean verify) {
		this.verify = verify;
	}
}
