package org.fairswap.utils;

/** Supplies current time in milliseconds since epoch. */
@FunctionalInterface
public interface TimeSource {

	/**
	 * @return current time (ms), or null if time is not yet trustworthy
	 */
	public Long getTime();

}
