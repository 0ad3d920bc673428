package org.springaicommunity.cluster.collector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Cluster access
	public String kubeconfig = null; // null = resolve from KUBECONFIG

	// Scope
	public List<String> namespaces = new ArrayList<>(); // empty = all namespaces

	public boolean includeCustomResources = false;

	// Output
	public String outputDirectory;

	public OutputFormat format;

	public CompressionMode compression;

	// Processing
	public boolean rawMode = false;

	public boolean disableDetection = false;

	public boolean omitUnsanitized = false;

	// Tuning
	public int concurrency;

	public int fetchTimeoutSeconds;

	public int deadlineSeconds;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(CollectionProperties defaultProperties) {
		this.outputDirectory = defaultProperties.getDefaultOutputDir();
		this.format = OutputFormat.parse(defaultProperties.getDefaultFormat());
		this.compression = CompressionMode.parse(defaultProperties.getDefaultCompression());
		this.concurrency = defaultProperties.getFetchConcurrency();
		this.fetchTimeoutSeconds = defaultProperties.getFetchTimeoutSeconds();
		this.deadlineSeconds = defaultProperties.getRunDeadlineSeconds();
		this.omitUnsanitized = defaultProperties.getSanitizationFailurePolicy() == SanitizationFailurePolicy.OMIT;
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Build the run configuration. The run id is taken from the current time.
	 * @return the run to execute
	 */
	public CollectionRun toCollectionRun() {
		return CollectionRun.builder()
			.outputDirectory(Path.of(outputDirectory))
			.namespaces(namespaces)
			.outputFormat(format)
			.compressionMode(compression)
			.includeCustomResources(includeCustomResources)
			.rawMode(rawMode)
			.detectionEnabled(!disableDetection)
			.build();
	}

	/**
	 * Copy the tuning options onto properties used to build the collector.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public CollectionProperties applyTo(CollectionProperties properties) {
		properties.setDefaultOutputDir(outputDirectory);
		properties.setFetchConcurrency(concurrency);
		properties.setFetchTimeoutSeconds(fetchTimeoutSeconds);
		properties.setRunDeadlineSeconds(deadlineSeconds);
		properties.setSanitizationFailurePolicy(
				omitUnsanitized ? SanitizationFailurePolicy.OMIT : SanitizationFailurePolicy.INCLUDE_UNSANITIZED);
		properties.setVerbose(verbose);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "kubeconfig='" + kubeconfig + '\'' + ", namespaces=" + namespaces
				+ ", includeCustomResources=" + includeCustomResources + ", outputDirectory='" + outputDirectory + '\''
				+ ", format=" + format + ", compression=" + compression + ", rawMode=" + rawMode
				+ ", disableDetection=" + disableDetection + ", omitUnsanitized=" + omitUnsanitized + ", concurrency="
				+ concurrency + ", fetchTimeoutSeconds=" + fetchTimeoutSeconds + ", deadlineSeconds="
				+ deadlineSeconds + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
