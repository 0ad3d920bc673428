package org.springaicommunity.cluster.collector;

/**
 * Raised when access to the cluster API cannot be established. Fatal: no collection is
 * attempted after it.
 */
public class SessionException extends ClusterCollectorException {

	public SessionException(String message) {
		super(message);
	}

	public SessionException(String message, Throwable cause) {
		super(message, cause);
	}

}
