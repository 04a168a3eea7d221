package org.fairswap.swap;

/**
 * Swap operation rejected. Swap state is unchanged.
 */
@SuppressWarnings("serial")
public class SwapException extends Exception {

	private final ValidationResult result;

	public SwapException(ValidationResult result) {
		super(result.name());
		this.result = result;
	}

	public SwapException(ValidationResult result, String message) {
		super(String.format("%s: %s", result.name(), message));
		this.result = result;
	}

	public SwapException(ValidationResult result, Throwable cause) {
		super(result.name(), cause);
		this.result = result;
	}

	public ValidationResult getResult() {
		return this.result;
	}

	public ErrorCategory getCategory() {
		return this.result.category;
	}

}
