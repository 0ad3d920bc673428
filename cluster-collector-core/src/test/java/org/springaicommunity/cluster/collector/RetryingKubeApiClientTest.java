package org.springaicommunity.cluster.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingKubeApiClient}.
 *
 * Tests retry logic, backoff, and error classification.
 */
@DisplayName("RetryingKubeApiClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingKubeApiClientTest {

	@Mock
	private KubeApiClient mockDelegate;

	private RetryingKubeApiClient retryingClient;

	@BeforeEach
	void setUp() {
		// Use minimal delay for fast tests
		retryingClient = RetryingKubeApiClient.builder().wrapping(mockDelegate).maxRetries(3).initialDelayMs(1).build();
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate get() to wrapped client")
		void shouldDelegateGet() {
			when(mockDelegate.get("/version")).thenReturn("{\"gitVersion\":\"v1.30.8+k3s1\"}");

			String result = retryingClient.get("/version");

			assertThat(result).isEqualTo("{\"gitVersion\":\"v1.30.8+k3s1\"}");
			verify(mockDelegate, times(1)).get("/version");
		}

		@Test
		@DisplayName("Should delegate getWithQuery() to wrapped client")
		void shouldDelegateGetWithQuery() {
			when(mockDelegate.getWithQuery("/api/v1/namespaces", "limit=500")).thenReturn("{\"items\":[]}");

			String result = retryingClient.getWithQuery("/api/v1/namespaces", "limit=500");

			assertThat(result).isEqualTo("{\"items\":[]}");
			verify(mockDelegate, times(1)).getWithQuery("/api/v1/namespaces", "limit=500");
		}

		@Test
		@DisplayName("Should delegate serverUrl() to wrapped client")
		void shouldDelegateServerUrl() {
			when(mockDelegate.serverUrl()).thenReturn("https://10.0.0.1:6443");

			assertThat(retryingClient.serverUrl()).isEqualTo("https://10.0.0.1:6443");
		}

	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should retry on server error (5xx)")
		void shouldRetryOnServerError() {
			KubeApiException serverError = new KubeApiException("Server error", 503, "unavailable");

			when(mockDelegate.get("/path")).thenThrow(serverError).thenThrow(serverError).thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			verify(mockDelegate, times(3)).get("/path");
		}

		@Test
		@DisplayName("Should retry on throttling (429)")
		void shouldRetryOnThrottling() {
			when(mockDelegate.get("/path")).thenThrow(new KubeApiException("Too many requests", 429, null))
				.thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			verify(mockDelegate, times(2)).get("/path");
		}

		@Test
		@DisplayName("Should retry when no response was received")
		void shouldRetryOnIoFailure() {
			when(mockDelegate.get("/path"))
				.thenThrow(new KubeApiException("Request failed", new IOException("reset")))
				.thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			verify(mockDelegate, times(2)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry a timed out request")
		void shouldNotRetryOnTimeout() {
			when(mockDelegate.getWithQuery("/api/v1/nodes", "limit=500"))
				.thenThrow(new KubeApiException("Request timed out after 30s", new HttpTimeoutException("timed out")));

			assertThatThrownBy(() -> retryingClient.getWithQuery("/api/v1/nodes", "limit=500"))
				.isInstanceOf(KubeApiException.class)
				.satisfies(e -> assertThat(((KubeApiException) e).isTimeout()).isTrue());
			verify(mockDelegate, times(1)).getWithQuery("/api/v1/nodes", "limit=500");
		}

		@Test
		@DisplayName("Should NOT retry on forbidden (403)")
		void shouldNotRetryOnForbidden() {
			when(mockDelegate.get("/path")).thenThrow(new KubeApiException("Forbidden", 403, null));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(KubeApiException.class)
				.satisfies(e -> assertThat(((KubeApiException) e).isForbidden()).isTrue());
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry on not found (404)")
		void shouldNotRetryOnNotFound() {
			when(mockDelegate.getWithQuery("/apis/x/v1/things", "limit=1"))
				.thenThrow(new KubeApiException("Not found", 404, null));

			assertThatThrownBy(() -> retryingClient.getWithQuery("/apis/x/v1/things", "limit=1"))
				.isInstanceOf(KubeApiException.class);
			verify(mockDelegate, times(1)).getWithQuery("/apis/x/v1/things", "limit=1");
		}

		@Test
		@DisplayName("Should give up after max retries")
		void shouldGiveUpAfterMaxRetries() {
			when(mockDelegate.get("/path")).thenThrow(new KubeApiException("Server error", 500, null));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(KubeApiException.class)
				.hasMessage("Server error");
			verify(mockDelegate, times(4)).get("/path");
		}

		@Test
		@DisplayName("Should not retry at all when maxRetries is zero")
		void shouldNotRetryWithZeroRetries() {
			RetryingKubeApiClient noRetry = RetryingKubeApiClient.builder()
				.wrapping(mockDelegate)
				.maxRetries(0)
				.initialDelay(Duration.ofMillis(1))
				.build();
			when(mockDelegate.get("/path")).thenThrow(new KubeApiException("Server error", 500, null));

			assertThatThrownBy(() -> noRetry.get("/path")).isInstanceOf(KubeApiException.class);
			verify(mockDelegate, times(1)).get("/path");
		}

	}

	@Nested
	@DisplayName("Builder Validation Tests")
	class BuilderValidationTest {

		@Test
		@DisplayName("Should require a delegate")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingKubeApiClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject negative retries")
		void shouldRejectNegativeRetries() {
			assertThatThrownBy(() -> RetryingKubeApiClient.builder().wrapping(mockDelegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should reject non-positive delay")
		void shouldRejectNonPositiveDelay() {
			assertThatThrownBy(() -> RetryingKubeApiClient.builder().wrapping(mockDelegate).initialDelayMs(0).build())
				.isInstanceOf(IllegalStateException.class);
		}

	}

}
