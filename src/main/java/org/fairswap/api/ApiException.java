package org.fairswap.api;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;

public class ApiException extends WebApplicationException {

	private static final long serialVersionUID = -2418523375233398231L;

	// HTTP status code
	public final int status;

	// API error code
	public final int error;

	public final String message;

	public ApiException(int status, int error, String message) {
		this(status, error, message, null);
	}

	public ApiException(int status, int error, String message, Throwable throwable) {
		super(
			message,
			throwable,
			Response.status(statusOf(status))
			.entity(new ApiErrorMessage(error, message))
			.type(MediaType.APPLICATION_JSON)
			.build()
		);

		this.status = status;
		this.error = error;
		this.message = message;
	}

	private static Response.StatusType statusOf(int status) {
		Status knownStatus = Status.fromStatusCode(status);
		if (knownStatus != null)
			return knownStatus;

		// e.g. 425 Too Early isn't in older JAX-RS status list
		return new Response.StatusType() {
			@Override
			public int getStatusCode() {
				return status;
			}

			@Override
			public Status.Family getFamily() {
				return Status.Family.familyOf(status);
			}

			@Override
			public String getReasonPhrase() {
				return "";
			}
		};
	}
}
