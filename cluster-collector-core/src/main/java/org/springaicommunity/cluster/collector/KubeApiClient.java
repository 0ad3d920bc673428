package org.springaicommunity.cluster.collector;

/**
 * Interface for read-only cluster API HTTP operations.
 *
 * <p>
 * Provides abstraction over the Kubernetes REST API, enabling testability and decorator
 * implementations (retrying, logging). The collector never issues mutating requests, so
 * only GET is exposed.
 */
public interface KubeApiClient {

	/**
	 * Execute a GET request against the cluster API.
	 * @param path API path (e.g., "/api/v1/namespaces")
	 * @return Response body as String
	 * @throws KubeApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), already URL-encoded
	 * @return Response body as String
	 * @throws KubeApiException if the request fails
	 */
	String getWithQuery(String path, String queryString);

	/**
	 * Base URL of the API server, for diagnostics.
	 * @return server URL without trailing slash
	 */
	String serverUrl();

}
