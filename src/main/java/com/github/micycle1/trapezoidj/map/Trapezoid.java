package com.github.micycle1.trapezoidj.map;

import com.github.micycle1.trapezoidj.TrapezoidUtils;

/**
 * A region of the trapezoidal map: bounded above by {@code y = yMax}, below by
 * {@code y = yMin}, and on the sides by two segments.
 * <p>
 * A trapezoid has at most two neighbours above and two below, held as slots in
 * the owning map's trapezoid table ({@link #NONE} when absent). When both are
 * present, {@code A} is the left one and {@code B} the right one.
 * <p>
 * The slot is stable, but the record itself is recycled by splits: after a
 * point insertion it describes the lower half, after a segment insertion the
 * left half.
 */
public class Trapezoid {

	public static final int NONE = -1;

	private final int id;
	private double yMin;
	private double yMax;
	private int left; // segment index
	private int right; // segment index
	private int node; // node slot of the controlling leaf

	private final int[] tops = { NONE, NONE };
	private final int[] bots = { NONE, NONE };

	Trapezoid(int id, double yMin, double yMax, int left, int right, int node) {
		this.id = id;
		this.yMin = yMin;
		this.yMax = yMax;
		this.left = left;
		this.right = right;
		this.node = node;
	}

	// --- Getters ---

	public int getId() {
		return id;
	}

	public double getYMin() {
		return yMin;
	}

	public double getYMax() {
		return yMax;
	}

	public int getLeft() {
		return left;
	}

	public int getRight() {
		return right;
	}

	public int getNode() {
		return node;
	}

	public int getTopA() {
		return tops[0];
	}

	public int getTopB() {
		return tops[1];
	}

	public int getBotA() {
		return bots[0];
	}

	public int getBotB() {
		return bots[1];
	}

	public int getTopCount() {
		return count(tops);
	}

	public int getBottomCount() {
		return count(bots);
	}

	public boolean hasTop(int t) {
		return t != NONE && (tops[0] == t || tops[1] == t);
	}

	public boolean hasBottom(int t) {
		return t != NONE && (bots[0] == t || bots[1] == t);
	}

	// --- Mutators used by the owning map ---

	void setYMax(double yMax) {
		this.yMax = yMax;
	}

	void setRight(int right) {
		this.right = right;
	}

	void setNode(int node) {
		this.node = node;
	}

	int[] tops() {
		return tops;
	}

	int[] bots() {
		return bots;
	}

	/**
	 * Replaces this trapezoid's top neighbours with those of another, leaving
	 * that one's untouched.
	 */
	void copyTops(Trapezoid other) {
		tops[0] = other.tops[0];
		tops[1] = other.tops[1];
	}

	void setSingleTop(int t) {
		tops[0] = t;
		tops[1] = NONE;
	}

	void setSingleBottom(int t) {
		bots[0] = t;
		bots[1] = NONE;
	}

	void replaceBottom(int old, int t) {
		if (bots[0] == old) {
			bots[0] = t;
		} else if (bots[1] == old) {
			bots[1] = t;
		} else {
			throw new IllegalStateException("T" + old + " is not a bottom neighbour of " + this);
		}
	}

	/**
	 * Appends a neighbour to one side. The caller restores left-to-right order.
	 */
	static void add(int[] side, int t, Trapezoid owner) {
		if (side[0] == NONE) {
			side[0] = t;
		} else if (side[1] == NONE) {
			side[1] = t;
		} else {
			throw new IllegalStateException("Neighbour overflow: cannot attach T" + t + " to " + owner);
		}
	}

	/**
	 * Removes a neighbour from one side if present, keeping the survivor in slot
	 * A.
	 */
	static void remove(int[] side, int t) {
		if (side[0] == t) {
			side[0] = side[1];
			side[1] = NONE;
		} else if (side[1] == t) {
			side[1] = NONE;
		}
	}

	private static int count(int[] side) {
		return (side[0] == NONE ? 0 : 1) + (side[1] == NONE ? 0 : 1);
	}

	@Override
	public String toString() {
		return "Trap#" + id + " Y:" + TrapezoidUtils.round(yMin) + " to " + TrapezoidUtils.round(yMax) + " Left:" + left + " Right:" + right;
	}
}
