package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs a complete collection: session check, enumeration with streaming sanitization and
 * writing, detection, reports and archive.
 *
 * <p>
 * Only two failures end a run early: a {@link SessionException} before anything is
 * collected, and an {@link ArchiveException} when a requested archive cannot be written
 * (the uncompressed tree is then left on disk). Everything else is recorded in the
 * summary and the run completes.
 */
public class ClusterCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(ClusterCollectionService.class);

	private final KubeApiService apiService;

	private final ClusterResourceEnumerator enumerator;

	private final ResourceSanitizer sanitizer;

	private final ComponentDetectionEngine detectionEngine;

	private final ArchiveService archiveService;

	private final CollectionProperties properties;

	private final ObjectMapper jsonMapper;

	private final ObjectMapper yamlMapper;

	private final JsonNodeUtils jsonNodeUtils;

	private final Clock clock;

	public ClusterCollectionService(KubeApiService apiService, ClusterResourceEnumerator enumerator,
			ResourceSanitizer sanitizer, ComponentDetectionEngine detectionEngine, ArchiveService archiveService,
			CollectionProperties properties, ObjectMapper jsonMapper, ObjectMapper yamlMapper,
			JsonNodeUtils jsonNodeUtils) {
		this(apiService, enumerator, sanitizer, detectionEngine, archiveService, properties, jsonMapper, yamlMapper,
				jsonNodeUtils, Clock.systemUTC());
	}

	public ClusterCollectionService(KubeApiService apiService, ClusterResourceEnumerator enumerator,
			ResourceSanitizer sanitizer, ComponentDetectionEngine detectionEngine, ArchiveService archiveService,
			CollectionProperties properties, ObjectMapper jsonMapper, ObjectMapper yamlMapper,
			JsonNodeUtils jsonNodeUtils, Clock clock) {
		this.apiService = apiService;
		this.enumerator = enumerator;
		this.sanitizer = sanitizer;
		this.detectionEngine = detectionEngine;
		this.archiveService = archiveService;
		this.properties = properties;
		this.jsonMapper = jsonMapper;
		this.yamlMapper = yamlMapper;
		this.jsonNodeUtils = jsonNodeUtils;
		this.clock = clock;
	}

	/**
	 * Collect a snapshot of the cluster.
	 * @param run the run configuration
	 * @return the run's outcome
	 * @throws SessionException if the cluster API cannot be reached
	 * @throws ArchiveException if a requested archive cannot be written
	 */
	public CollectionResult collect(CollectionRun run) {
		logger.info("Starting collection {} against {}", run.runId(), apiService.serverUrl());
		String serverVersion = apiService.serverVersion();
		logger.info("Connected to cluster API {} (version {})", apiService.serverUrl(), serverVersion);

		Path runDirectory = OutputOrganizer.createRunDirectory(run.outputDirectory(), run.runId());
		String runName = runDirectory.getFileName().toString();
		CollectionTracker tracker = new CollectionTracker();
		DetectionFacts facts = new DetectionFacts(jsonNodeUtils);
		OutputOrganizer organizer = new OutputOrganizer(runDirectory, run.outputFormat(), jsonMapper, yamlMapper,
				tracker);

		EnumerationResult enumeration = enumerator.enumerate(run, tracker,
				new RunSink(run, tracker, facts, organizer));
		logger.info("Collected {} resources ({} cluster-scoped, {} namespaced), {} fetch failures",
				tracker.totalResources(), tracker.clusterResources(), tracker.namespacedResources(),
				tracker.fetchFailures().size());

		@Nullable
		DetectionResult detection = run.detectionEnabled() ? detect(facts) : null;

		@Nullable
		Path archive = run.compressionMode().createsArchive()
				? run.outputDirectory().resolve(runName + archiveService.extension()) : null;

		List<String> reports = new ArrayList<>(organizer.reportFileNames(OutputOrganizer.SUMMARY_NAME));
		if (detection != null) {
			reports.addAll(organizer.writeReport(OutputOrganizer.ANALYSIS_NAME, detection));
		}
		CollectionSummary summary = tracker.summarize(run,
				new CollectionSummary.RunDetails(apiService.serverUrl(), serverVersion, clock.instant(),
						enumeration.deadlineExceeded(), runDirectory.toString(),
						archive != null ? archive.toString() : null, reports,
						properties.getSanitizationFailurePolicy()));
		organizer.writeReport(OutputOrganizer.SUMMARY_NAME, summary);
		if (summary.empty()) {
			logger.warn("Run {} completed without collecting any resource", runName);
		}

		@Nullable
		Path keptTree = runDirectory;
		if (archive != null) {
			archiveService.createArchive(runDirectory, archive);
			if (!run.compressionMode().keepsTree()) {
				keptTree = deleteTree(runDirectory) ? null : runDirectory;
			}
		}

		logger.info("Collection {} finished: {} resources, output {}", runName,
				summary.clusterSummary().totalResources(), archive != null ? archive : runDirectory);
		return new CollectionResult(runName, keptTree, archive, summary, detection, enumeration);
	}

	private DetectionResult detect(DetectionFacts facts) {
		try {
			return detectionEngine.detect(facts);
		}
		catch (RuntimeException e) {
			logger.warn("Component detection failed, reporting Unknown: {}", e.getMessage(), e);
			return DetectionResult.unknown(properties.getMaxConfidenceScore());
		}
	}

	/**
	 * Remove the uncompressed tree after it was archived.
	 * @return true if the tree is gone
	 */
	private static boolean deleteTree(Path directory) {
		try (Stream<Path> walk = Files.walk(directory)) {
			for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
				Files.delete(path);
			}
			return true;
		}
		catch (IOException | UncheckedIOException e) {
			logger.warn("Could not remove uncompressed tree {}: {}", directory, e.getMessage());
			return false;
		}
	}

	/**
	 * Feeds detection, sanitizes and writes each record on the fetch worker that listed
	 * it.
	 */
	private final class RunSink implements ResourceSink {

		private final CollectionRun run;

		private final CollectionTracker tracker;

		private final DetectionFacts facts;

		private final OutputOrganizer organizer;

		RunSink(CollectionRun run, CollectionTracker tracker, DetectionFacts facts, OutputOrganizer organizer) {
			this.run = run;
			this.tracker = tracker;
			this.facts = facts;
			this.organizer = organizer;
		}

		@Override
		public void accept(ResourceRecord record) {
			if (run.detectionEnabled()) {
				facts.accept(record);
			}

			ResourceRecord sanitized;
			boolean unsanitized = false;
			try {
				sanitized = sanitizer.sanitize(record, run.rawMode());
				if (!run.rawMode()) {
					tracker.recordSanitized();
				}
			}
			catch (SanitizationException e) {
				boolean include = properties
					.getSanitizationFailurePolicy() == SanitizationFailurePolicy.INCLUDE_UNSANITIZED;
				tracker.recordSanitizationFailure(
						new SanitizationFailure(record.displayName(), e.getMessage(), include));
				if (!include) {
					logger.warn("Sanitization failed for {}, omitting it: {}", record.displayName(), e.getMessage());
					return;
				}
				logger.warn("Sanitization failed for {}, writing it unsanitized: {}", record.displayName(),
						e.getMessage());
				sanitized = record;
				unsanitized = true;
			}
			organizer.write(sanitized, unsanitized);
		}

		@Override
		public void observe(ResourceRecord record) {
			if (run.detectionEnabled()) {
				facts.observe(record);
			}
		}

		@Override
		public void namespacesDiscovered(Collection<String> namespaces) {
			facts.addNamespaces(namespaces);
		}

	}

}
