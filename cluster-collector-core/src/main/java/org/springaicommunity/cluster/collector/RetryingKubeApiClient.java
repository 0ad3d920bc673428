package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorator that adds automatic retry with backoff to a {@link KubeApiClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff for transient errors (5xx, network)</li>
 * <li>Timed out requests fail immediately; the request timeout bounds a fetch</li>
 * <li>Throttling-aware backoff: a 429 carrying {@code Retry-After} waits exactly that
 * long (capped) instead of the exponential delay</li>
 * <li>Other client errors (401, 403, 404, ...) fail immediately so that permission and
 * not-served failures are recorded without delay</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * KubeApiClient client = RetryingKubeApiClient.builder()
 *     .wrapping(new KubeHttpClient(config, Duration.ofSeconds(30)))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofMillis(500))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingKubeApiClient implements KubeApiClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingKubeApiClient.class);

	/**
	 * Upper bound for a server supplied {@code Retry-After}.
	 */
	private static final long MAX_RETRY_AFTER_SECONDS = 60;

	private final KubeApiClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingKubeApiClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	/**
	 * Create a new builder for RetryingKubeApiClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	public String serverUrl() {
		return delegate.serverUrl();
	}

	private String executeWithRetry(RequestSupplier supplier, String description) {
		long delay = initialDelayMs;

		for (int attempt = 0;; attempt++) {
			try {
				return supplier.get();
			}
			catch (KubeApiException e) {
				if (!e.isRetryable() || attempt >= maxRetries || Thread.currentThread().isInterrupted()) {
					if (e.isRetryable() && attempt > 0) {
						logger.warn("{} failed after {} attempts", description, attempt + 1);
					}
					throw e;
				}
				long waitMs = computeWaitTime(e, delay);
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), waitMs);
				sleep(waitMs, e);
				delay *= 2;
			}
		}
	}

	private long computeWaitTime(KubeApiException e, long defaultDelay) {
		if (e.getStatusCode() == 429 && e.getRetryAfterSeconds() > 0) {
			return Math.min(e.getRetryAfterSeconds(), MAX_RETRY_AFTER_SECONDS) * 1000;
		}
		return defaultDelay;
	}

	private void sleep(long ms, KubeApiException pending) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			pending.addSuppressed(e);
			throw pending;
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		String get();

	}

	/**
	 * Builder for {@link RetryingKubeApiClient}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay.
	 */
	public static class Builder {

		@Nullable
		private KubeApiClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the KubeApiClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(KubeApiClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingKubeApiClient.
		 * @return configured RetryingKubeApiClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingKubeApiClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A KubeApiClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingKubeApiClient(this);
		}

	}

}
