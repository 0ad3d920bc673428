package org.springaicommunity.cluster.collector;

import java.util.Collection;

/**
 * Receives records from the enumerator as they are listed. Called concurrently from the
 * fetch workers.
 */
@FunctionalInterface
public interface ResourceSink {

	/**
	 * Handle a collected record.
	 * @param record the listed record, not yet sanitized
	 */
	void accept(ResourceRecord record);

	/**
	 * Handle a record read only to inform detection. It is not part of the collection.
	 * @param record the listed record
	 */
	default void observe(ResourceRecord record) {
	}

	/**
	 * Called once with every namespace visible to the credential.
	 * @param namespaces namespace names
	 */
	default void namespacesDiscovered(Collection<String> namespaces) {
	}

}
