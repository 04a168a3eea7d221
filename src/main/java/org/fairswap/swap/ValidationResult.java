package org.fairswap.swap;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Map;

public enum ValidationResult {
	OK(1, null),

	WRONG_STAGE(10, ErrorCategory.PRECONDITION_VIOLATION),
	INVALID_PARTY(11, ErrorCategory.PRECONDITION_VIOLATION),
	INVALID_ADDRESS(12, ErrorCategory.PRECONDITION_VIOLATION),
	COLLATERAL_MISMATCH(13, ErrorCategory.PRECONDITION_VIOLATION),
	NEGATIVE_AMOUNT(14, ErrorCategory.PRECONDITION_VIOLATION),
	INVALID_ASSET_ACCOUNT(15, ErrorCategory.PRECONDITION_VIOLATION),
	NO_BALANCE(16, ErrorCategory.PRECONDITION_VIOLATION),
	SWAP_UNKNOWN(17, ErrorCategory.PRECONDITION_VIOLATION),
	SWAP_NOT_ACTIVE(18, ErrorCategory.PRECONDITION_VIOLATION),
	AMOUNT_TOO_LARGE(19, ErrorCategory.PRECONDITION_VIOLATION),

	TERMS_ALREADY_SET(20, ErrorCategory.INVALID_STATE),
	ALREADY_EXECUTED(21, ErrorCategory.INVALID_STATE),
	ALREADY_COMPLETED(22, ErrorCategory.INVALID_STATE),
	PAYMENT_PENDING(23, ErrorCategory.INVALID_STATE),

	INSUFFICIENT_DEPOSIT(30, ErrorCategory.INSUFFICIENT_DEPOSIT),

	CANCEL_BLOCKED(40, ErrorCategory.CANCEL_BLOCKED),

	NOT_A_PARTY(50, ErrorCategory.UNAUTHORIZED),
	NOT_ADMIN(51, ErrorCategory.UNAUTHORIZED),

	TOO_EARLY(60, ErrorCategory.TIMING_VIOLATION),
	CLOCK_NOT_SYNCED(61, ErrorCategory.TIMING_VIOLATION),

	LEDGER_UNAVAILABLE(90, ErrorCategory.PRECONDITION_VIOLATION);

	public final int value;
	public final ErrorCategory category;

	private static final Map<Integer, ValidationResult> map = stream(ValidationResult.values()).collect(toMap(result -> result.value, result -> result));

	ValidationResult(int value, ErrorCategory category) {
		this.value = value;
		this.category = category;
	}

	public static ValidationResult valueOf(int value) {
		return map.get(value);
	}
}
