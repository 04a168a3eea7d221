package org.fairswap.api;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Map;

import javax.servlet.http.HttpServletResponse;

import org.fairswap.swap.ValidationResult;

//    COMMON
//    VALIDATION
//    SWAP
//    LEDGER
public enum ApiError {
	// COMMON
	// UNKNOWN(0, 500),
	JSON(1, 400),
	INVALID_SIGNATURE(2, 400),
	UNAUTHORIZED(3, 401),
	REPOSITORY_ISSUE(4, 500),
	INVALID_CRITERIA(5, 400),

	// VALIDATION
	INVALID_ADDRESS(102, 400),
	INVALID_AMOUNT(103, 400),
	INVALID_ASSET_ACCOUNT(104, 400),
	INSUFFICIENT_BALANCE(105, 422),

	// SWAP
	SWAP_UNKNOWN(201, 404),
	SWAP_NOT_ACTIVE(202, 409),
	WRONG_STAGE(203, 409),
	INVALID_PARTY(204, 400),
	NOT_A_PARTY(205, 403),
	NOT_ADMIN(206, 403),
	COLLATERAL_MISMATCH(207, 400),
	TERMS_ALREADY_SET(208, 409),
	ALREADY_COMPLETED(209, 409),
	ALREADY_EXECUTED(210, 409),
	INSUFFICIENT_DEPOSIT(211, 422),
	CANCEL_BLOCKED(212, 409),
	TOO_EARLY(213, 425),
	CLOCK_NOT_SYNCED(214, 503),
	PAYMENT_PENDING(215, 409),

	// LEDGER
	LEDGER_ISSUE(301, 502);

	private static final Map<Integer, ApiError> map = stream(ApiError.values()).collect(toMap(apiError -> apiError.code, apiError -> apiError));

	private final int code; // API error code
	private final int status; // HTTP status code

	ApiError(int code) {
		this(code, HttpServletResponse.SC_BAD_REQUEST); // default to 400
	}

	ApiError(int code, int status) {
		this.code = code;
		this.status = status;
	}

	public static ApiError fromCode(int code) {
		return map.get(code);
	}

	/** Maps swap rejection to corresponding API error. */
	public static ApiError fromValidationResult(ValidationResult result) {
		switch (result) {
			case WRONG_STAGE:
				return WRONG_STAGE;
			case INVALID_PARTY:
				return INVALID_PARTY;
			case INVALID_ADDRESS:
				return INVALID_ADDRESS;
			case COLLATERAL_MISMATCH:
				return COLLATERAL_MISMATCH;
			case NEGATIVE_AMOUNT:
			case AMOUNT_TOO_LARGE:
				return INVALID_AMOUNT;
			case INVALID_ASSET_ACCOUNT:
				return INVALID_ASSET_ACCOUNT;
			case NO_BALANCE:
				return INSUFFICIENT_BALANCE;
			case SWAP_UNKNOWN:
				return SWAP_UNKNOWN;
			case SWAP_NOT_ACTIVE:
				return SWAP_NOT_ACTIVE;
			case TERMS_ALREADY_SET:
				return TERMS_ALREADY_SET;
			case ALREADY_EXECUTED:
				return ALREADY_EXECUTED;
			case ALREADY_COMPLETED:
				return ALREADY_COMPLETED;
			case PAYMENT_PENDING:
				return PAYMENT_PENDING;
			case INSUFFICIENT_DEPOSIT:
				return INSUFFICIENT_DEPOSIT;
			case CANCEL_BLOCKED:
				return CANCEL_BLOCKED;
			case NOT_A_PARTY:
				return NOT_A_PARTY;
			case NOT_ADMIN:
				return NOT_ADMIN;
			case TOO_EARLY:
				return TOO_EARLY;
			case CLOCK_NOT_SYNCED:
				return CLOCK_NOT_SYNCED;
			case LEDGER_UNAVAILABLE:
				return LEDGER_ISSUE;
			default:
				return INVALID_CRITERIA;
		}
	}

	public int getCode() {
		return this.code;
	}

	public int getStatus() {
		return this.status;
	}

}
