package org.fairswap.utils;

/**
 * Helpers for integer asset quantities.
 * <p>
 * Quantities are whole base units. Display assumes 8 decimal places.
 */
public abstract class Amounts {

	public static final long MULTIPLIER = 100000000L;

	public static String prettyAmount(long amount) {
		String sign = amount < 0 ? "-" : "";
		long absolute = Math.abs(amount);

		return String.format("%s%d.%08d", sign, absolute / MULTIPLIER, absolute % MULTIPLIER);
	}

	/** Returns <tt>a + b</tt>, throwing ArithmeticException on overflow. */
	public static long add(long a, long b) {
		return Math.addExact(a, b);
	}

}
