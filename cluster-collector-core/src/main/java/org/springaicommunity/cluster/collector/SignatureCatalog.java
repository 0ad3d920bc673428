package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The table of {@link ComponentSignature}s the detection engine matches against.
 *
 * <p>
 * Loaded from YAML so that components can be added without touching the matching code.
 * A location is looked up on the file system first and then on the classpath.
 */
public class SignatureCatalog {

	private static final Logger logger = LoggerFactory.getLogger(SignatureCatalog.class);

	public static final String DEFAULT_LOCATION = "component-signatures.yaml";

	private final List<ComponentSignature> signatures;

	public SignatureCatalog(List<ComponentSignature> signatures) {
		Set<String> names = new HashSet<>();
		for (ComponentSignature signature : signatures) {
			if (!names.add(signature.name())) {
				throw new IllegalArgumentException("Duplicate component signature: " + signature.name());
			}
		}
		this.signatures = List.copyOf(signatures);
	}

	/**
	 * Load the bundled signature table.
	 * @return catalog of the default signatures
	 */
	public static SignatureCatalog loadDefault() {
		return load(DEFAULT_LOCATION);
	}

	/**
	 * Load a signature table. The default location always names the bundled table; any
	 * other location is looked up on the file system first, then on the classpath.
	 * @param location file path or classpath resource name
	 * @return the loaded catalog
	 * @throws ClusterCollectorException if the table cannot be found or parsed
	 */
	public static SignatureCatalog load(String location) {
		return load(location, Path.of(""));
	}

	static SignatureCatalog load(String location, Path workingDirectory) {
		ObjectMapper yaml = ObjectMapperFactory.createYaml();
		TypeReference<List<ComponentSignature>> type = new TypeReference<>() {
		};
		Path file = workingDirectory.resolve(location);
		try {
			List<ComponentSignature> signatures;
			if (!DEFAULT_LOCATION.equals(location) && Files.isRegularFile(file)) {
				signatures = yaml.readValue(file.toFile(), type);
			}
			else {
				try (InputStream in = SignatureCatalog.class.getClassLoader().getResourceAsStream(location)) {
					if (in == null) {
						throw new ClusterCollectorException("Signature table not found: " + location);
					}
					signatures = yaml.readValue(in, type);
				}
			}
			logger.debug("Loaded {} component signatures from {}", signatures.size(), location);
			return new SignatureCatalog(signatures);
		}
		catch (IOException | IllegalArgumentException e) {
			throw new ClusterCollectorException("Invalid signature table " + location + ": " + e.getMessage(), e);
		}
	}

	public List<ComponentSignature> signatures() {
		return signatures;
	}

	public int size() {
		return signatures.size();
	}

}
