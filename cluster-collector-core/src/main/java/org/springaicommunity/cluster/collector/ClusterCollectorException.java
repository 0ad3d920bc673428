package org.springaicommunity.cluster.collector;

/**
 * Base class for all exceptions raised by the cluster collector.
 */
public class ClusterCollectorException extends RuntimeException {

	public ClusterCollectorException(String message) {
		super(message);
	}

	public ClusterCollectorException(String message, Throwable cause) {
		super(message, cause);
	}

}
