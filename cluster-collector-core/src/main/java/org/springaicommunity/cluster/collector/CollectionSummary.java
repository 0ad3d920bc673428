package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The collection summary document, built by {@link CollectionTracker#summarize} at the
 * end of a run. Serialized with snake_case keys.
 *
 * @param collectionInfo run identity, timing and cluster identity
 * @param configuration the options the run was started with
 * @param clusterSummary resource totals and counts per kind
 * @param namespaceDetails counts per kind for each namespace
 * @param highlights counts per kind grouped by category
 * @param sanitization sanitization mode and outcome
 * @param fetchFailures list requests that failed
 * @param writeFailures files that could not be written
 * @param reapplyHints kubectl commands to recreate the collected state, relative to the
 * run directory
 * @param empty true when no resource file was written
 * @param outputPaths where the run's artifacts are
 */
public record CollectionSummary(CollectionInfo collectionInfo, Configuration configuration,
		ClusterSummary clusterSummary, Map<String, Map<String, Integer>> namespaceDetails,
		Map<String, Map<String, Integer>> highlights, Sanitization sanitization, List<FetchFailure> fetchFailures,
		List<WriteFailure> writeFailures, List<String> reapplyHints, boolean empty, OutputPaths outputPaths) {

	public static final String TOOL_NAME = "cluster-collector";

	/**
	 * Version of the running collector from the jar manifest.
	 */
	public static String toolVersion() {
		String version = CollectionSummary.class.getPackage().getImplementationVersion();
		return version != null ? version : "development";
	}

	public record CollectionInfo(String runId, Instant startedAt, Instant finishedAt, long durationMs, String tool,
			String toolVersion, String serverUrl, String serverVersion, boolean deadlineExceeded) {
	}

	public record Configuration(List<String> namespaces, String outputFormat, String compression,
			boolean includeCustomResources, boolean rawMode, boolean detectionEnabled) {
	}

	public record ClusterSummary(int totalResources, int clusterResources, int namespacedResources,
			int namespaceCount, int filesWritten, int successfulFetches, Map<String, Integer> resourceCounts) {
	}

	public record Sanitization(String mode, String failurePolicy, int processed, int succeeded, int failed,
			List<SanitizationFailure> failures) {
	}

	public record OutputPaths(String runDirectory, @Nullable String archive, List<String> reports) {
	}

	/**
	 * Run facts the tracker does not see itself.
	 *
	 * @param serverUrl API server URL
	 * @param serverVersion API server version
	 * @param finishedAt end of collection
	 * @param deadlineExceeded whether the run deadline cut enumeration short
	 * @param runDirectory the run directory
	 * @param archive archive path if one is requested
	 * @param reports report file names relative to the run directory
	 * @param failurePolicy handling of failed sanitization
	 */
	public record RunDetails(String serverUrl, String serverVersion, Instant finishedAt, boolean deadlineExceeded,
			String runDirectory, @Nullable String archive, List<String> reports,
			SanitizationFailurePolicy failurePolicy) {
	}

}
