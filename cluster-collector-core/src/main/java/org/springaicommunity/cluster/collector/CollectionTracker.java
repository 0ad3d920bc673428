package org.springaicommunity.cluster.collector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Single aggregation point for the counters and failure lists of one run.
 *
 * <p>
 * Fetch workers report to it concurrently, so every method is synchronized. A tracker is
 * created per run and passed explicitly to the stages that report to it; counts only ever
 * reflect files that were actually written.
 */
public class CollectionTracker {

	/**
	 * Cluster kinds in the order they have to be applied. Nodes are never reapplied.
	 */
	private static final List<String> CLUSTER_APPLY_ORDER = List.of("customresourcedefinitions", "storageclasses",
			"persistentvolumes", "clusterroles", "clusterrolebindings");

	private final Map<String, Integer> resourceCounts = new TreeMap<>();

	private final Map<String, Map<String, Integer>> namespaceCounts = new TreeMap<>();

	private final Map<String, Map<String, Integer>> highlights = new TreeMap<>();

	private final List<FetchFailure> fetchFailures = new ArrayList<>();

	private final List<WriteFailure> writeFailures = new ArrayList<>();

	private final List<SanitizationFailure> sanitizationFailures = new ArrayList<>();

	private boolean clusterCustomResourcesWritten;

	private int clusterResources;

	private int namespacedResources;

	private int filesWritten;

	private int sanitizationSucceeded;

	private int successfulFetches;

	public synchronized void recordWritten(ResourceRecord record, int files) {
		String resource = record.type().directoryName();
		resourceCounts.merge(resource, 1, Integer::sum);
		highlights.computeIfAbsent(ResourceCatalog.categoryOf(record.type()), c -> new TreeMap<>())
			.merge(resource, 1, Integer::sum);
		if (record.type().isNamespaced()) {
			namespacedResources++;
			namespaceCounts.computeIfAbsent(record.namespace(), ns -> new TreeMap<>()).merge(resource, 1, Integer::sum);
		}
		else {
			clusterResources++;
			clusterCustomResourcesWritten |= record.type().custom();
		}
		filesWritten += files;
	}

	public synchronized void recordSanitized() {
		sanitizationSucceeded++;
	}

	public synchronized void recordSanitizationFailure(SanitizationFailure failure) {
		sanitizationFailures.add(failure);
	}

	public synchronized void recordFetchSuccess() {
		successfulFetches++;
	}

	public synchronized void recordFetchFailure(FetchFailure failure) {
		fetchFailures.add(failure);
	}

	public synchronized void recordWriteFailure(WriteFailure failure) {
		writeFailures.add(failure);
	}

	public synchronized int totalResources() {
		return clusterResources + namespacedResources;
	}

	public synchronized int clusterResources() {
		return clusterResources;
	}

	public synchronized int namespacedResources() {
		return namespacedResources;
	}

	public synchronized int count(String resource) {
		return resourceCounts.getOrDefault(resource, 0);
	}

	public synchronized int successfulFetches() {
		return successfulFetches;
	}

	public synchronized List<FetchFailure> fetchFailures() {
		return List.copyOf(fetchFailures);
	}

	public synchronized List<WriteFailure> writeFailures() {
		return List.copyOf(writeFailures);
	}

	public synchronized List<SanitizationFailure> sanitizationFailures() {
		return List.copyOf(sanitizationFailures);
	}

	/**
	 * Build the summary document from the current counters.
	 * @param run the run configuration
	 * @param details run facts not tracked here
	 * @return the summary
	 */
	public synchronized CollectionSummary summarize(CollectionRun run, CollectionSummary.RunDetails details) {
		CollectionSummary.CollectionInfo info = new CollectionSummary.CollectionInfo(run.runId(), run.startedAt(),
				details.finishedAt(), Duration.between(run.startedAt(), details.finishedAt()).toMillis(),
				CollectionSummary.TOOL_NAME, CollectionSummary.toolVersion(), details.serverUrl(),
				details.serverVersion(), details.deadlineExceeded());

		List<String> namespaces = run.allNamespaces() ? List.of("all")
				: run.namespaceFilter().stream().sorted().toList();
		CollectionSummary.Configuration configuration = new CollectionSummary.Configuration(namespaces,
				lower(run.outputFormat()), lower(run.compressionMode()), run.includeCustomResources(), run.rawMode(),
				run.detectionEnabled());

		CollectionSummary.ClusterSummary clusterSummary = new CollectionSummary.ClusterSummary(totalResources(),
				clusterResources, namespacedResources, namespaceCounts.size(), filesWritten, successfulFetches,
				new TreeMap<>(resourceCounts));

		int failed = sanitizationFailures.size();
		CollectionSummary.Sanitization sanitization = new CollectionSummary.Sanitization(
				run.rawMode() ? "raw" : "sanitized", lower(details.failurePolicy()), sanitizationSucceeded + failed,
				sanitizationSucceeded, failed, List.copyOf(sanitizationFailures));

		Map<String, Map<String, Integer>> namespaceDetails = new TreeMap<>();
		namespaceCounts.forEach((ns, counts) -> namespaceDetails.put(ns, new TreeMap<>(counts)));
		Map<String, Map<String, Integer>> categoryHighlights = new TreeMap<>();
		highlights.forEach((category, counts) -> categoryHighlights.put(category, new TreeMap<>(counts)));

		CollectionSummary.OutputPaths outputPaths = new CollectionSummary.OutputPaths(details.runDirectory(),
				details.archive(), details.reports());

		return new CollectionSummary(info, configuration, clusterSummary, namespaceDetails, categoryHighlights,
				sanitization, List.copyOf(fetchFailures), List.copyOf(writeFailures), reapplyHints(),
				totalResources() == 0, outputPaths);
	}

	/**
	 * Apply commands in dependency order: cluster kinds first, then each namespace after
	 * creating it.
	 */
	private List<String> reapplyHints() {
		List<String> hints = new ArrayList<>();
		for (String resource : CLUSTER_APPLY_ORDER) {
			if (resourceCounts.containsKey(resource)) {
				hints.add("kubectl apply -R -f " + OutputOrganizer.CLUSTER_DIR + "/" + resource + "/");
			}
		}
		if (clusterCustomResourcesWritten) {
			hints.add("kubectl apply -R -f " + OutputOrganizer.CLUSTER_DIR + "/" + OutputOrganizer.CUSTOM_DIR + "/");
		}
		for (String namespace : namespaceCounts.keySet()) {
			hints.add("kubectl create namespace " + namespace);
			hints.add("kubectl apply -R -f " + OutputOrganizer.NAMESPACED_DIR + "/" + namespace + "/");
		}
		if (sanitizationFailures.stream().anyMatch(SanitizationFailure::includedUnsanitized)) {
			hints.add("# review *" + OutputOrganizer.UNSANITIZED_MARKER + ".* files before applying them");
		}
		return hints;
	}

	private static String lower(Enum<?> value) {
		return value.name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Counts per resource, for logging.
	 */
	public synchronized Map<String, Integer> resourceCounts() {
		return new LinkedHashMap<>(resourceCounts);
	}

}
