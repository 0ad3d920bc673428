package org.springaicommunity.cluster.collector;

/**
 * Raised when a resource document does not have the shape expected for its kind. Only
 * the offending record is affected.
 */
public class SanitizationException extends ClusterCollectorException {

	public SanitizationException(String message) {
		super(message);
	}

}
