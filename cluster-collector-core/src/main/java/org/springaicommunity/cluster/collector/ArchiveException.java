package org.springaicommunity.cluster.collector;

/**
 * Raised when the requested archive cannot be produced. The uncompressed output tree is
 * left on disk.
 */
public class ArchiveException extends ClusterCollectorException {

	public ArchiveException(String message, Throwable cause) {
		super(message, cause);
	}

}
