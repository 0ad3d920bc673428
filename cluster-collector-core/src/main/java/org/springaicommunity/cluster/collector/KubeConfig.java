package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Connection settings resolved from a kubeconfig file for its current context.
 *
 * <p>
 * Only bearer-token credentials (inline {@code token} or {@code tokenFile}) are resolved.
 * A user entry that offers nothing but client certificates or an exec plugin is rejected
 * with a {@link SessionException}; a user entry with no credentials at all yields an
 * anonymous session (e.g. through {@code kubectl proxy}).
 *
 * @param contextName name of the selected context
 * @param server API server URL
 * @param certificateAuthorityData PEM bundle trusted for the server, or null for the JDK
 * default trust store
 * @param insecureSkipTlsVerify whether server certificates are accepted unverified
 * @param token bearer token, or null for anonymous access
 */
public record KubeConfig(String contextName, String server, @Nullable String certificateAuthorityData,
		boolean insecureSkipTlsVerify, @Nullable String token) {

	private static final Logger logger = LoggerFactory.getLogger(KubeConfig.class);

	/**
	 * Load and resolve a kubeconfig file.
	 * @param path kubeconfig file
	 * @return settings for the file's current context
	 * @throws SessionException if the file cannot be read or does not describe a usable
	 * context
	 */
	public static KubeConfig load(Path path) {
		if (!Files.isRegularFile(path)) {
			throw new SessionException("Kubeconfig not found: " + path);
		}
		try {
			ObjectMapper yaml = ObjectMapperFactory.createYaml();
			JsonNode root = yaml.readTree(path.toFile());
			Path baseDir = path.toAbsolutePath().getParent();
			return resolve(root, baseDir);
		}
		catch (IOException e) {
			throw new SessionException("Cannot read kubeconfig " + path + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Resolve the current context of a parsed kubeconfig document.
	 * @param root parsed kubeconfig
	 * @param baseDir directory against which relative file references are resolved
	 * @return resolved settings
	 */
	static KubeConfig resolve(JsonNode root, @Nullable Path baseDir) throws IOException {
		String contextName = root.path("current-context").asText("");
		if (contextName.isEmpty()) {
			throw new SessionException("Kubeconfig has no current-context");
		}

		JsonNode context = findNamed(root, "contexts", contextName, "context");
		if (context == null) {
			throw new SessionException("Context '" + contextName + "' not found in kubeconfig");
		}

		String clusterName = context.path("cluster").asText("");
		JsonNode cluster = findNamed(root, "clusters", clusterName, "cluster");
		if (cluster == null) {
			throw new SessionException("Cluster '" + clusterName + "' not found in kubeconfig");
		}
		String server = cluster.path("server").asText("");
		if (server.isEmpty()) {
			throw new SessionException("Cluster '" + clusterName + "' has no server URL");
		}

		String caData = null;
		if (cluster.hasNonNull("certificate-authority-data")) {
			try {
				caData = new String(Base64.getDecoder().decode(cluster.get("certificate-authority-data").asText()),
						StandardCharsets.US_ASCII);
			}
			catch (IllegalArgumentException e) {
				throw new SessionException(
						"Cluster '" + clusterName + "' has invalid certificate-authority-data: " + e.getMessage(), e);
			}
		}
		else if (cluster.hasNonNull("certificate-authority")) {
			caData = Files.readString(resolvePath(baseDir, cluster.get("certificate-authority").asText()),
					StandardCharsets.US_ASCII);
		}
		boolean insecure = cluster.path("insecure-skip-tls-verify").asBoolean(false);

		String userName = context.path("user").asText("");
		JsonNode user = userName.isEmpty() ? null : findNamed(root, "users", userName, "user");
		String token = user == null ? null : resolveToken(user, userName, baseDir);

		logger.debug("Using kubeconfig context '{}' (cluster '{}', server {})", contextName, clusterName, server);
		return new KubeConfig(contextName, server, caData, insecure, token);
	}

	@Nullable
	private static String resolveToken(JsonNode user, String userName, @Nullable Path baseDir) throws IOException {
		if (user.hasNonNull("token")) {
			return user.get("token").asText().trim();
		}
		if (user.hasNonNull("tokenFile")) {
			return Files.readString(resolvePath(baseDir, user.get("tokenFile").asText()), StandardCharsets.UTF_8)
				.trim();
		}
		if (user.has("client-certificate-data") || user.has("client-certificate") || user.has("exec")
				|| user.has("auth-provider")) {
			throw new SessionException("User '" + userName
					+ "' only offers client-certificate, exec or auth-provider credentials; provide a bearer token");
		}
		return null;
	}

	@Nullable
	private static JsonNode findNamed(JsonNode root, String listField, String name, String entryField) {
		for (JsonNode entry : root.path(listField)) {
			if (name.equals(entry.path("name").asText())) {
				return entry.path(entryField);
			}
		}
		return null;
	}

	private static Path resolvePath(@Nullable Path baseDir, String file) {
		Path path = Path.of(file);
		return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path);
	}

	@Override
	public String toString() {
		return "KubeConfig[context=" + contextName + ", server=" + server + ", token="
				+ (token == null ? "none" : "***") + "]";
	}

}
