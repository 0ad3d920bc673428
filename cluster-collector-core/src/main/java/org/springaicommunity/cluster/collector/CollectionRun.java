package org.springaicommunity.cluster.collector;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable configuration of one collection run.
 *
 * @param runId identifier derived from the start time, also the run directory name
 * @param startedAt run start time
 * @param outputDirectory parent directory of the run directory and archive
 * @param namespaceFilter namespaces to collect, empty meaning every visible namespace
 * @param outputFormat serialization format for records and reports
 * @param compressionMode which artifacts to produce
 * @param includeCustomResources whether custom resource definitions and their instances
 * are collected
 * @param rawMode when true records are written exactly as returned by the API
 * @param detectionEnabled whether the component analysis is produced
 */
public record CollectionRun(String runId, Instant startedAt, Path outputDirectory, Set<String> namespaceFilter,
		OutputFormat outputFormat, CompressionMode compressionMode, boolean includeCustomResources, boolean rawMode,
		boolean detectionEnabled) {

	public static final String RUN_ID_PREFIX = "cluster-collection-";

	private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss")
		.withZone(ZoneOffset.UTC);

	public CollectionRun {
		namespaceFilter = Set.copyOf(namespaceFilter);
	}

	/**
	 * Returns true if every visible namespace should be collected.
	 */
	public boolean allNamespaces() {
		return namespaceFilter.isEmpty();
	}

	/**
	 * Derive the run id for a start time.
	 * @param startedAt run start time
	 * @return {@code cluster-collection-yyyy-MM-dd-HH-mm-ss} in UTC
	 */
	public static String runIdFor(Instant startedAt) {
		return RUN_ID_PREFIX + RUN_ID_FORMAT.format(startedAt);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CollectionRun}. The run id and start time are taken from the
	 * clock when {@link #build()} is called.
	 */
	public static class Builder {

		private Clock clock = Clock.systemUTC();

		private Path outputDirectory = Path.of(System.getProperty("java.io.tmpdir"), "cluster-collector");

		private final Set<String> namespaces = new LinkedHashSet<>();

		private OutputFormat outputFormat = OutputFormat.YAML;

		private CompressionMode compressionMode = CompressionMode.BOTH;

		private boolean includeCustomResources = false;

		private boolean rawMode = false;

		private boolean detectionEnabled = true;

		private Builder() {
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder outputDirectory(Path outputDirectory) {
			this.outputDirectory = outputDirectory;
			return this;
		}

		public Builder namespaces(Iterable<String> namespaces) {
			this.namespaces.clear();
			for (String namespace : namespaces) {
				String trimmed = namespace.trim();
				if (!trimmed.isEmpty()) {
					this.namespaces.add(trimmed);
				}
			}
			return this;
		}

		public Builder outputFormat(OutputFormat outputFormat) {
			this.outputFormat = outputFormat;
			return this;
		}

		public Builder compressionMode(CompressionMode compressionMode) {
			this.compressionMode = compressionMode;
			return this;
		}

		public Builder includeCustomResources(boolean includeCustomResources) {
			this.includeCustomResources = includeCustomResources;
			return this;
		}

		public Builder rawMode(boolean rawMode) {
			this.rawMode = rawMode;
			return this;
		}

		public Builder detectionEnabled(boolean detectionEnabled) {
			this.detectionEnabled = detectionEnabled;
			return this;
		}

		public CollectionRun build() {
			Instant now = clock.instant();
			return new CollectionRun(runIdFor(now), now, outputDirectory, namespaces, outputFormat, compressionMode,
					includeCustomResources, rawMode, detectionEnabled);
		}

	}

}
