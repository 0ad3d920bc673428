package org.springaicommunity.cluster.collector;

/**
 * A list request that failed and was skipped.
 *
 * @param resource resource directory name (plural, group-qualified for custom kinds)
 * @param namespace namespace listed, empty for cluster-scoped lists
 * @param statusCode HTTP status, -1 when no response was received
 * @param reason failure description
 */
public record FetchFailure(String resource, String namespace, int statusCode, String reason) {

	public static FetchFailure of(ResourceType type, String namespace, KubeApiException e) {
		return new FetchFailure(type.directoryName(), namespace, e.getStatusCode(), e.getMessage());
	}

}
