package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

import java.net.http.HttpTimeoutException;

/**
 * Exception thrown when a cluster API call fails.
 *
 * <p>
 * Carries the HTTP status and, for throttled responses, the server supplied
 * {@code Retry-After} delay so that {@link RetryingKubeApiClient} can back off
 * accordingly. A status of {@code -1} means no response was received (I/O failure or
 * timeout).
 */
public class KubeApiException extends ClusterCollectorException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	private final long retryAfterSeconds;

	public KubeApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1);
	}

	public KubeApiException(String message, int statusCode, @Nullable String responseBody, long retryAfterSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.retryAfterSeconds = retryAfterSeconds;
	}

	public KubeApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.retryAfterSeconds = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public long getRetryAfterSeconds() {
		return retryAfterSeconds;
	}

	public boolean isUnauthorized() {
		return statusCode == 401;
	}

	public boolean isForbidden() {
		return statusCode == 403;
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}

	/**
	 * Returns true when the request exceeded its timeout.
	 */
	public boolean isTimeout() {
		return getCause() instanceof HttpTimeoutException;
	}

	/**
	 * Returns true for failures worth repeating: no response, throttling (429) or a
	 * server side error (5xx). A timed out request is not repeated, so one fetch never
	 * waits longer than its timeout.
	 */
	public boolean isRetryable() {
		if (isTimeout()) {
			return false;
		}
		return statusCode == -1 || statusCode == 429 || statusCode >= 500;
	}

}
