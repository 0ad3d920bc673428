package org.springaicommunity.cluster.collector;

/**
 * A file that could not be written.
 *
 * @param resource the record or report affected
 * @param path path relative to the run directory
 * @param reason failure description
 */
public record WriteFailure(String resource, String path, String reason) {
}
