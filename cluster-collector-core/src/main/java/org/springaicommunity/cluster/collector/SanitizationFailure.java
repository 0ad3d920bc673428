package org.springaicommunity.cluster.collector;

/**
 * A record whose sanitization failed.
 *
 * @param resource the record's display name
 * @param reason failure description
 * @param includedUnsanitized whether the raw document was written with the unsanitized
 * marker
 */
public record SanitizationFailure(String resource, String reason, boolean includedUnsanitized) {
}
