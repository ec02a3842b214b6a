package com.github.micycle1.trapezoidj;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.locationtech.jts.geom.Coordinate;

public class TrapezoidUtils {

	/**
	 * Sweep order used by the search structure: lower Y first, ties broken by
	 * lower X. This behaves like an infinitesimal shear of the plane, so two
	 * vertices on the same horizontal line are still strictly ordered.
	 */
	public static boolean isBelow(Coordinate q, Coordinate p) {
		return q.y < p.y || (q.y == p.y && q.x < p.x);
	}

	/**
	 * Length of the overlap of the closed intervals [a0,a1] and [b0,b1];
	 * negative when they are disjoint.
	 */
	public static double overlap(double a0, double a1, double b0, double b1) {
		return Math.min(a1, b1) - Math.max(a0, b0);
	}

	public static boolean isFinite(Coordinate c) {
		return Double.isFinite(c.x) && Double.isFinite(c.y);
	}

	/**
	 * Formats a value for the text dumps: rounded half-up to
	 * {@link TrapConstants#DUMP_DECIMALS} places, trailing zeros stripped, never
	 * "-0".
	 */
	public static String round(double v) {
		if (!Double.isFinite(v)) {
			return Double.toString(v);
		}
		BigDecimal d = BigDecimal.valueOf(v).setScale(TrapConstants.DUMP_DECIMALS, RoundingMode.HALF_UP).stripTrailingZeros();
		if (d.signum() == 0) {
			return "0";
		}
		return d.toPlainString();
	}
}
