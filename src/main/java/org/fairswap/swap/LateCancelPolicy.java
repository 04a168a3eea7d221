package org.fairswap.swap;

/**
 * What happens when a party cancels after collateral is posted,
 * but only the other party has confirmed their deposit.
 */
public enum LateCancelPolicy {
	/** Committed party receives both collaterals. */
	FORFEIT,
	/** Cancellation refused. */
	BLOCK
}
