package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Writes records and reports into the run directory.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * &lt;run-id&gt;/
 *   collection-summary.&lt;fmt&gt;
 *   suse-edge-analysis.&lt;fmt&gt;
 *   cluster-wide-resources/&lt;plural&gt;/&lt;name&gt;.&lt;fmt&gt;
 *   cluster-wide-resources/custom-resources/&lt;plural&gt;.&lt;group&gt;/&lt;name&gt;.&lt;fmt&gt;
 *   namespaced-resources/&lt;namespace&gt;/&lt;plural&gt;/&lt;name&gt;.&lt;fmt&gt;
 *   namespaced-resources/&lt;namespace&gt;/custom-resources/&lt;plural&gt;.&lt;group&gt;/&lt;name&gt;.&lt;fmt&gt;
 * </pre>
 *
 * <p>
 * A record's path depends only on its own type, namespace and name, and each path is
 * claimed before it is written, so concurrent workers never write the same file. A record
 * is counted in the {@link CollectionTracker} only after all of its files were written;
 * otherwise the files already written for it are removed again.
 */
public class OutputOrganizer {

	private static final Logger logger = LoggerFactory.getLogger(OutputOrganizer.class);

	public static final String CLUSTER_DIR = "cluster-wide-resources";

	public static final String NAMESPACED_DIR = "namespaced-resources";

	public static final String CUSTOM_DIR = "custom-resources";

	public static final String SUMMARY_NAME = "collection-summary";

	public static final String ANALYSIS_NAME = "suse-edge-analysis";

	public static final String UNSANITIZED_MARKER = ".unsanitized";

	private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^A-Za-z0-9._-]");

	private final Path runDirectory;

	private final OutputFormat format;

	private final ObjectMapper jsonMapper;

	private final ObjectMapper yamlMapper;

	private final CollectionTracker tracker;

	private final Set<String> claimedPaths = ConcurrentHashMap.newKeySet();

	public OutputOrganizer(Path runDirectory, OutputFormat format, ObjectMapper jsonMapper, ObjectMapper yamlMapper,
			CollectionTracker tracker) {
		this.runDirectory = runDirectory;
		this.format = format;
		this.jsonMapper = jsonMapper;
		this.yamlMapper = yamlMapper;
		this.tracker = tracker;
	}

	/**
	 * Create the directory for a run. When a directory of that name already exists a
	 * numeric suffix is appended.
	 * @param outputDirectory parent directory, created if missing
	 * @param runId the run id
	 * @return the created run directory
	 * @throws ClusterCollectorException if no directory can be created
	 */
	public static Path createRunDirectory(Path outputDirectory, String runId) {
		try {
			Files.createDirectories(outputDirectory);
			for (int attempt = 0; attempt < 100; attempt++) {
				Path candidate = outputDirectory.resolve(attempt == 0 ? runId : runId + "-" + attempt);
				try {
					return Files.createDirectory(candidate);
				}
				catch (FileAlreadyExistsException e) {
					logger.debug("Run directory {} exists, trying next suffix", candidate);
				}
			}
			throw new ClusterCollectorException("No free run directory name for " + runId + " in " + outputDirectory);
		}
		catch (IOException e) {
			throw new ClusterCollectorException("Cannot create run directory in " + outputDirectory + ": "
					+ e.getMessage(), e);
		}
	}

	public Path runDirectory() {
		return runDirectory;
	}

	/**
	 * Directory of a type within a namespace, relative to the run directory.
	 */
	public static Path relativeDirectory(ResourceType type, String namespace) {
		Path base = type.isNamespaced() ? Path.of(NAMESPACED_DIR, safeFileName(namespace)) : Path.of(CLUSTER_DIR);
		if (type.custom()) {
			base = base.resolve(CUSTOM_DIR);
		}
		return base.resolve(safeFileName(type.directoryName()));
	}

	/**
	 * Replace every character outside {@code [A-Za-z0-9._-]} with {@code _}. Names made of
	 * dots only are prefixed so they cannot escape the directory.
	 */
	public static String safeFileName(String name) {
		String safe = UNSAFE_CHARACTERS.matcher(name).replaceAll("_");
		if (safe.isEmpty() || safe.chars().allMatch(c -> c == '.')) {
			safe = "_" + safe;
		}
		return safe;
	}

	/**
	 * Write a record in every requested format.
	 * @param record the record; its sanitized body is written, or the raw body when it has
	 * none
	 * @param unsanitized whether to mark the files as unsanitized
	 * @return true if all files were written and the record was counted
	 */
	public boolean write(ResourceRecord record, boolean unsanitized) {
		JsonNode body = record.sanitizedBody() != null ? record.sanitizedBody() : record.rawBody();
		String baseName = claim(relativeDirectory(record.type(), record.namespace()),
				safeFileName(record.name()) + (unsanitized ? UNSANITIZED_MARKER : ""));

		List<Path> written = new ArrayList<>();
		for (String extension : format.extensions()) {
			Path relative = Path.of(baseName + "." + extension);
			try {
				writeFile(relative, serialize(body, extension));
				written.add(relative);
			}
			catch (IOException e) {
				logger.warn("Failed to write {} to {}: {}", record.displayName(), relative, e.getMessage());
				removeAll(written);
				tracker.recordWriteFailure(new WriteFailure(record.displayName(), relative.toString(), e.getMessage()));
				return false;
			}
		}
		tracker.recordWritten(record, written.size());
		return true;
	}

	/**
	 * Write a report document at the top of the run directory in every requested format.
	 * A failure is recorded and leaves the other formats in place.
	 * @param name file name without extension
	 * @param document the report record
	 * @return file names written, relative to the run directory
	 */
	public List<String> writeReport(String name, Object document) {
		List<String> written = new ArrayList<>();
		for (String extension : format.extensions()) {
			String fileName = name + "." + extension;
			try {
				byte[] bytes = extension.equals("json") ? jsonMapper.writerWithDefaultPrettyPrinter()
					.writeValueAsBytes(document) : yamlMapper.writeValueAsBytes(document);
				Files.write(runDirectory.resolve(fileName), bytes);
				written.add(fileName);
			}
			catch (IOException e) {
				logger.warn("Failed to write report {}: {}", fileName, e.getMessage());
				tracker.recordWriteFailure(new WriteFailure(name, fileName, e.getMessage()));
			}
		}
		return written;
	}

	/**
	 * Report file names in every requested format, relative to the run directory.
	 */
	public List<String> reportFileNames(String name) {
		return format.extensions().stream().map(extension -> name + "." + extension).toList();
	}

	private String claim(Path directory, String fileName) {
		String base = directory.resolve(fileName).toString();
		if (claimedPaths.add(base)) {
			return base;
		}
		for (int suffix = 2;; suffix++) {
			String candidate = base + "-" + suffix;
			if (claimedPaths.add(candidate)) {
				logger.debug("File name {} already taken, using {}", base, candidate);
				return candidate;
			}
		}
	}

	private byte[] serialize(JsonNode body, String extension) throws JsonProcessingException {
		if (extension.equals("json")) {
			return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(body);
		}
		return yamlMapper.writeValueAsBytes(body);
	}

	private void writeFile(Path relative, byte[] bytes) throws IOException {
		Path target = runDirectory.resolve(relative);
		Files.createDirectories(target.getParent());
		Files.write(target, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
	}

	private void removeAll(List<Path> written) {
		for (Path relative : written) {
			try {
				Files.deleteIfExists(runDirectory.resolve(relative));
			}
			catch (IOException e) {
				logger.warn("Could not remove partial output {}: {}", relative, e.getMessage());
			}
		}
	}

}
