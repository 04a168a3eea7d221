package org.fairswap.api;

import javax.servlet.http.HttpServletRequest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fairswap.swap.SwapException;

public enum ApiExceptionFactory {
	INSTANCE;

	private static final Logger LOGGER = LogManager.getLogger(ApiExceptionFactory.class);

	public ApiException createException(HttpServletRequest request, ApiError apiError, Throwable throwable, Object... args) {
		String message = apiError.name().toLowerCase().replace('_', ' ');

		if (args.length > 0)
			message = String.format("%s: %s", message, args[0]);

		if (apiError.getStatus() >= 500) {
			final String logMessage = message;
			LOGGER.warn(() -> String.format("API call %s failed: %s", request == null ? "?" : request.getRequestURI(), logMessage), throwable);
		}

		return new ApiException(apiError.getStatus(), apiError.getCode(), message, throwable);
	}

	public ApiException createException(HttpServletRequest request, ApiError apiError, Throwable throwable) {
		return createException(request, apiError, throwable, new Object[0]);
	}

	public ApiException createException(HttpServletRequest request, ApiError apiError) {
		return createException(request, apiError, null);
	}

	public ApiException createCustomException(HttpServletRequest request, ApiError apiError, String message) {
		return new ApiException(apiError.getStatus(), apiError.getCode(), message);
	}

	/** Converts rejected swap operation into API error. */
	public ApiException fromSwapException(HttpServletRequest request, SwapException e) {
		return createCustomException(request, ApiError.fromValidationResult(e.getResult()), e.getMessage());
	}
}
