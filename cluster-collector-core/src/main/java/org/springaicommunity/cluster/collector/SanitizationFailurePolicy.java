package org.springaicommunity.cluster.collector;

/**
 * What happens to a record whose sanitization failed.
 */
public enum SanitizationFailurePolicy {

	/**
	 * Write the raw document with an {@code .unsanitized} file name marker.
	 */
	INCLUDE_UNSANITIZED,

	/**
	 * Drop the record from the output.
	 */
	OMIT

}
