package org.springaicommunity.cluster.collector.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.cluster.collector.*;

import java.nio.file.Path;

/**
 * Cluster Collector CLI Application
 *
 * Plain Java command-line application that collects a sanitized snapshot of a Kubernetes
 * cluster and analyzes the components running on it. No Spring dependencies - uses
 * ClusterCollectorBuilder for service wiring.
 *
 * Usage: java -jar cluster-collector-cli.jar [OPTIONS]
 *
 * Environment Variables: KUBECONFIG - kubeconfig used when --kubeconfig is not given
 *
 * Examples: java -jar cluster-collector-cli.jar --kubeconfig ~/.kube/config java -jar
 * cluster-collector-cli.jar -n default,kube-system -f both java -jar
 * cluster-collector-cli.jar --include-custom-resources --deadline 300
 */
public class ClusterCollectorCli {

	private static final Logger logger = LoggerFactory.getLogger(ClusterCollectorCli.class);

	static final String COLLECTOR_LOGGER = "org.springaicommunity.cluster.collector";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * Run the collector.
	 * @param args command-line arguments
	 * @return process exit code: 0 on success (including partial failures) and help, 1
	 * when arguments are invalid, no session could be established or the archive could
	 * not be written
	 */
	public static int run(String[] args) {
		// Create argument parser with default properties
		CollectionProperties properties = new CollectionProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		Path kubeconfig;
		try {
			config = argumentParser.parseAndValidate(args);
			kubeconfig = argumentParser.resolveKubeconfig(config);
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error("{}", e.getMessage());
			System.err.println("Run with --help for usage.");
			return 1;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}
		logConfiguration(config, kubeconfig);

		try {
			ClusterCollectionService collector = ClusterCollectorBuilder.create()
				.kubeconfig(kubeconfig)
				.properties(config.applyTo(properties))
				.buildCollectionService();

			CollectionResult result = collector.collect(config.toCollectionRun());
			logResults(result, config.verbose);
			return 0;
		}
		catch (SessionException e) {
			logger.error("Cannot reach the cluster: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
		catch (ArchiveException e) {
			logger.error("Archive could not be written: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
		catch (ClusterCollectorException e) {
			logger.error("Collection failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
		catch (RuntimeException e) {
			logger.error("Collection failed unexpectedly: {}", e.toString());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	static void enableVerboseLogging() {
		if (LoggerFactory.getLogger(COLLECTOR_LOGGER) instanceof ch.qos.logback.classic.Logger collectorLogger) {
			collectorLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config, Path kubeconfig) {
		logger.info("Configuration:");
		logger.info("  Kubeconfig: {}", kubeconfig);
		logger.info("  Namespaces: {}", config.namespaces.isEmpty() ? "(all visible)" : config.namespaces);
		logger.info("  Output directory: {}", config.outputDirectory);
		logger.info("  Format: {}", config.format);
		logger.info("  Compression: {}", config.compression);
		logger.info("  Include custom resources: {}", config.includeCustomResources);
		logger.info("  Raw mode: {}", config.rawMode);
		logger.info("  Detection: {}", config.disableDetection ? "disabled" : "enabled");
		logger.info("  Unsanitized records: {}", config.omitUnsanitized ? "omitted" : "included with marker");
		logger.info("  Concurrency: {}", config.concurrency);
		logger.info("  Fetch timeout: {}s", config.fetchTimeoutSeconds);
		logger.info("  Deadline: {}", config.deadlineSeconds > 0 ? config.deadlineSeconds + "s" : "(none)");
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(CollectionResult result, boolean verbose) {
		CollectionSummary summary = result.summary();
		CollectionSummary.ClusterSummary counts = summary.clusterSummary();
		logger.info("Collection completed successfully!");
		logger.info("Run: {}", result.runId());
		logger.info("Total resources: {} ({} cluster-scoped, {} namespaced)", counts.totalResources(),
				counts.clusterResources(), counts.namespacedResources());
		logger.info("Namespaces: {}", counts.namespaceCount());
		logger.info("Fetch failures: {}", summary.fetchFailures().size());
		logger.info("Sanitization failures: {}", summary.sanitization().failed());
		logger.info("Write failures: {}", summary.writeFailures().size());
		if (result.runDirectory() != null) {
			logger.info("Output directory: {}", result.runDirectory());
		}
		if (result.archive() != null) {
			logger.info("Archive: {}", result.archive());
		}

		DetectionResult detection = result.detection();
		if (detection != null) {
			logger.info("Distribution: {}{}", detection.distribution().displayName(),
					detection.distributionVersion() != null ? " " + detection.distributionVersion() : "");
			logger.info("Deployment: {}", detection.deploymentClass().displayName());
			logger.info("Confidence: {} ({})", String.format("%.2f", detection.confidenceScore()),
					detection.confidenceLevel().displayName());
			if (!detection.matchedComponents().isEmpty()) {
				logger.info("Components: {}", String.join(", ", detection.matchedComponents()));
			}
		}

		if (verbose) {
			for (FetchFailure failure : summary.fetchFailures()) {
				logger.info("  FETCH: {} {} ({}): {}", failure.resource(),
						failure.namespace().isEmpty() ? "(cluster)" : failure.namespace(), failure.statusCode(),
						failure.reason());
			}
			for (WriteFailure failure : summary.writeFailures()) {
				logger.info("  WRITE: {} -> {}: {}", failure.resource(), failure.path(), failure.reason());
			}
			if (!summary.reapplyHints().isEmpty()) {
				logger.info("Reapply with:");
				for (String hint : summary.reapplyHints()) {
					logger.info("  {}", hint);
				}
			}
		}
	}

}
