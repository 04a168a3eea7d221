package org.fairswap.swap;

/** Broad classes of swap operation failure. */
public enum ErrorCategory {
	/** Caller or arguments not acceptable at this point, e.g. wrong stage or mismatched collateral. */
	PRECONDITION_VIOLATION,
	/** Operation already performed, e.g. terms set twice. */
	INVALID_STATE,
	/** Deposit escrow holds less than the agreed quantity. */
	INSUFFICIENT_DEPOSIT,
	/** Cancellation not permitted at this point. */
	CANCEL_BLOCKED,
	/** Caller lacks authority. */
	UNAUTHORIZED,
	/** Too soon, or time unknown. */
	TIMING_VIOLATION
}
