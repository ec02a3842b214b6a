package com.github.micycle1.trapezoidj;

public class TrapConstants {

	/**
	 * Tolerance for boundary alignment checks. X values are recomputed from
	 * segment slopes many times over, so coincident boundaries rarely compare
	 * exactly equal.
	 */
	public static final double FINE = 1e-9;
	// bounding box of the input is grown by this much on every side
	public static final double DEFAULT_MARGIN = 1.0;
	public static final long DEFAULT_SEED = 4;
	public static final double DEFAULT_OUTLINE_INSET = 0.0;
	// decimal places kept by the text dumps
	public static final int DUMP_DECIMALS = 6;
}
