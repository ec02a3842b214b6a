package com.github.micycle1.trapezoidj.map;

/**
 * A node of the point-location structure. The kind tags how {@link #getIndex()}
 * is read:
 * <ul>
 * <li>{@link Kind#Y}: a point index. {@code first} holds queries below the
 * point, {@code second} queries at or above it.</li>
 * <li>{@link Kind#X}: a segment index. {@code first} holds queries left of the
 * segment, {@code second} the rest.</li>
 * <li>{@link Kind#LEAF}: a trapezoid slot; no children.</li>
 * </ul>
 * A leaf is converted in place into a {@code Y} or {@code X} node when its
 * trapezoid is split, so parents never need to be updated.
 */
public class Node {

	public enum Kind {
		Y, X, LEAF;

		public String label() {
			return this == LEAF ? "Leaf" : name();
		}
	}

	public static final int NONE = -1;

	private final int id;
	private Kind kind;
	private int index;
	private int first = NONE;
	private int second = NONE;

	Node(int id, Kind kind, int index) {
		this.id = id;
		this.kind = kind;
		this.index = index;
	}

	public int getId() {
		return id;
	}

	public Kind getKind() {
		return kind;
	}

	public int getIndex() {
		return index;
	}

	public int getFirst() {
		return first;
	}

	public int getSecond() {
		return second;
	}

	public boolean isLeaf() {
		return kind == Kind.LEAF;
	}

	/**
	 * Turns this leaf into an interior node with the given payload and children.
	 */
	void split(Kind kind, int index, int first, int second) {
		if (this.kind != Kind.LEAF) {
			throw new IllegalStateException("Only a leaf can be split, not " + this);
		}
		this.kind = kind;
		this.index = index;
		this.first = first;
		this.second = second;
	}

	@Override
	public String toString() {
		return "Node#" + id + " Kind:" + kind.label() + " Index:" + index;
	}
}
