package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * HTTP client for cluster API calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Trusts the certificate authority named in the kubeconfig (or the JDK defaults when none
 * is given) and sends the bearer token, if any, with every request. Each request is
 * bounded by the configured request timeout; a timed out request surfaces as a
 * {@link KubeApiException} without status.
 */
public class KubeHttpClient implements KubeApiClient {

	private static final Logger logger = LoggerFactory.getLogger(KubeHttpClient.class);

	private final HttpClient httpClient;

	private final String server;

	@Nullable
	private final String token;

	private final Duration requestTimeout;

	public KubeHttpClient(KubeConfig config, Duration requestTimeout) {
		this.server = stripTrailingSlash(config.server());
		this.token = config.token();
		this.requestTimeout = requestTimeout;
		HttpClient.Builder builder = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL);
		if (server.startsWith("https")) {
			builder.sslContext(createSslContext(config));
		}
		this.httpClient = builder.build();
	}

	@Override
	public String serverUrl() {
		return server;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : server + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Accept", "application/json")
			.header("User-Agent", "cluster-collector")
			.GET();
		if (token != null && !token.isEmpty()) {
			request.header("Authorization", "Bearer " + token);
		}

		try {
			String response = executeRequest(request.build());
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (KubeApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		String url = server + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new KubeApiException("Unauthorized: the cluster rejected the credential", statusCode,
						response.body());
			}
			else if (statusCode == 403) {
				throw new KubeApiException("Forbidden: " + request.uri().getPath(), statusCode, response.body());
			}
			else if (statusCode == 404) {
				throw new KubeApiException("Not found: " + request.uri().getPath(), statusCode, response.body());
			}
			else if (statusCode == 429) {
				long retryAfter = response.headers().firstValue("Retry-After").map(v -> {
					try {
						return Long.parseLong(v.trim());
					}
					catch (NumberFormatException e) {
						return -1L;
					}
				}).orElse(-1L);
				throw new KubeApiException("Too Many Requests (429)", statusCode, response.body(), retryAfter);
			}
			else {
				throw new KubeApiException("Cluster API error: " + statusCode, statusCode, response.body());
			}
		}
		catch (HttpTimeoutException e) {
			throw new KubeApiException("Request timed out after " + requestTimeout.toSeconds() + "s", e);
		}
		catch (IOException e) {
			throw new KubeApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new KubeApiException("HTTP request interrupted", e);
		}
	}

	private static SSLContext createSslContext(KubeConfig config) {
		try {
			SSLContext context = SSLContext.getInstance("TLS");
			if (config.insecureSkipTlsVerify()) {
				logger.warn("TLS verification disabled for {} (insecure-skip-tls-verify)", config.server());
				context.init(null, new TrustManager[] { new TrustAllManager() }, null);
			}
			else if (config.certificateAuthorityData() != null) {
				context.init(null, trustManagersFor(config.certificateAuthorityData()), null);
			}
			else {
				context.init(null, null, null);
			}
			return context;
		}
		catch (GeneralSecurityException | IOException e) {
			throw new SessionException("Cannot set up TLS for " + config.server() + ": " + e.getMessage(), e);
		}
	}

	private static TrustManager[] trustManagersFor(String pem) throws GeneralSecurityException, IOException {
		CertificateFactory factory = CertificateFactory.getInstance("X.509");
		KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
		trustStore.load(null, null);
		int index = 0;
		for (Certificate certificate : factory
			.generateCertificates(new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)))) {
			trustStore.setCertificateEntry("ca-" + index++, certificate);
		}
		if (index == 0) {
			throw new GeneralSecurityException("no certificates in certificate authority data");
		}
		TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
		tmf.init(trustStore);
		return tmf.getTrustManagers();
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	/**
	 * Accepts every server certificate and host name.
	 */
	private static final class TrustAllManager extends X509ExtendedTrustManager {

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
		}

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
		}

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType) {
		}

		@Override
		public X509Certificate[] getAcceptedIssuers() {
			return new X509Certificate[0];
		}

	}

}
