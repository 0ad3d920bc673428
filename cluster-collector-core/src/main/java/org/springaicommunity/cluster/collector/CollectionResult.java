package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Results of a collection run.
 *
 * @param runId name of the run directory, also the archive's root entry
 * @param runDirectory the uncompressed tree, null when it was removed after compression
 * @param archive the archive, null when none was requested
 * @param summary the summary document as written
 * @param detection the analysis as written, null when detection was disabled
 * @param enumeration enumeration outcome
 */
public record CollectionResult(String runId, @Nullable Path runDirectory, @Nullable Path archive,
		CollectionSummary summary, @Nullable DetectionResult detection, EnumerationResult enumeration) {

	/**
	 * Returns true if no resource file was written.
	 */
	public boolean empty() {
		return summary.empty();
	}

}
