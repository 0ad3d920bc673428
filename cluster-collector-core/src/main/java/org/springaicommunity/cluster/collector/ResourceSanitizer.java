package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns raw resource documents into documents that can be reapplied to another cluster.
 *
 * <p>
 * Every document loses its {@code status} subtree, the server-populated metadata fields
 * and the annotations and finalizers on the configured denylists. Kind-specific rules
 * then clear cluster-assigned bindings:
 * <ul>
 * <li>Service: {@code spec.clusterIP} and {@code spec.clusterIPs} (headless services
 * keep {@code None}), and every node port inside the auto-assigned range</li>
 * <li>PersistentVolumeClaim: {@code spec.volumeName}</li>
 * <li>PersistentVolume: {@code spec.claimRef}</li>
 * </ul>
 *
 * <p>
 * The raw document is never modified; the rules work on a deep copy. Every rule only
 * removes fields, so applying the sanitizer to its own output changes nothing.
 * {@code kind}, {@code metadata.name} and {@code metadata.namespace} are never touched.
 */
public class ResourceSanitizer {

	static final List<String> SERVER_METADATA_FIELDS = List.of("uid", "resourceVersion", "creationTimestamp",
			"generation", "managedFields", "selfLink");

	private static final String HEADLESS_CLUSTER_IP = "None";

	private final Denylist annotationDenylist;

	private final Denylist finalizerDenylist;

	private final int nodePortRangeStart;

	private final int nodePortRangeEnd;

	private final Map<String, KindRule> kindRules;

	public ResourceSanitizer(CollectionProperties properties) {
		this(properties.getAnnotationDenylist(), properties.getFinalizerDenylist(),
				properties.getNodePortRangeStart(), properties.getNodePortRangeEnd());
	}

	public ResourceSanitizer(List<String> annotationDenylist, List<String> finalizerDenylist, int nodePortRangeStart,
			int nodePortRangeEnd) {
		if (nodePortRangeStart > nodePortRangeEnd) {
			throw new IllegalArgumentException(
					"Invalid node port range " + nodePortRangeStart + "-" + nodePortRangeEnd);
		}
		this.annotationDenylist = new Denylist(annotationDenylist);
		this.finalizerDenylist = new Denylist(finalizerDenylist);
		this.nodePortRangeStart = nodePortRangeStart;
		this.nodePortRangeEnd = nodePortRangeEnd;
		this.kindRules = Map.of("Service", this::sanitizeService, "PersistentVolumeClaim",
				spec -> spec.remove("volumeName"), "PersistentVolume", spec -> spec.remove("claimRef"));
	}

	/**
	 * Attach the document to write for a record.
	 * @param record record carrying the raw document
	 * @param rawMode when true the raw document is used unchanged
	 * @return the record with its sanitized body set
	 * @throws SanitizationException if the document does not have the structure expected
	 * for its kind
	 */
	public ResourceRecord sanitize(ResourceRecord record, boolean rawMode) {
		if (rawMode) {
			return record.withSanitizedBody(record.rawBody());
		}
		JsonNode sanitized = sanitize(record.kind(), record.rawBody());
		verifyIdentity(record, sanitized);
		return record.withSanitizedBody(sanitized);
	}

	/**
	 * Sanitize a document of the given kind.
	 * @param kind resource kind selecting the kind-specific rules
	 * @param raw raw document, left unmodified
	 * @return sanitized copy
	 * @throws SanitizationException if the document does not have the expected structure
	 */
	public JsonNode sanitize(String kind, JsonNode raw) {
		if (!(raw instanceof ObjectNode)) {
			throw new SanitizationException(kind + " document is not an object");
		}
		ObjectNode body = ((ObjectNode) raw).deepCopy();
		body.remove("status");

		JsonNode metadata = body.path("metadata");
		if (!(metadata instanceof ObjectNode)) {
			throw new SanitizationException(kind + " document has no metadata object");
		}
		sanitizeMetadata((ObjectNode) metadata);

		KindRule rule = kindRules.get(kind);
		JsonNode spec = body.get("spec");
		if (spec != null && !spec.isNull() && !spec.isObject()) {
			throw new SanitizationException(kind + " spec is not an object");
		}
		if (rule != null && spec instanceof ObjectNode) {
			rule.apply((ObjectNode) spec);
		}
		return body;
	}

	private void sanitizeMetadata(ObjectNode metadata) {
		metadata.remove(SERVER_METADATA_FIELDS);

		JsonNode annotations = metadata.get("annotations");
		if (annotations instanceof ObjectNode annotationMap) {
			Iterator<String> keys = annotationMap.fieldNames();
			while (keys.hasNext()) {
				if (annotationDenylist.matches(keys.next())) {
					keys.remove();
				}
			}
			if (annotationMap.isEmpty()) {
				metadata.remove("annotations");
			}
		}
		else if (annotations != null && !annotations.isNull()) {
			throw new SanitizationException("metadata.annotations is not an object");
		}

		JsonNode finalizers = metadata.get("finalizers");
		if (finalizers instanceof ArrayNode finalizerList) {
			for (int i = finalizerList.size() - 1; i >= 0; i--) {
				if (finalizerDenylist.matches(finalizerList.get(i).asText())) {
					finalizerList.remove(i);
				}
			}
			if (finalizerList.isEmpty()) {
				metadata.remove("finalizers");
			}
		}
		else if (finalizers != null && !finalizers.isNull()) {
			throw new SanitizationException("metadata.finalizers is not an array");
		}
	}

	private void sanitizeService(ObjectNode spec) {
		if (!HEADLESS_CLUSTER_IP.equals(spec.path("clusterIP").asText())) {
			spec.remove("clusterIP");
			spec.remove("clusterIPs");
		}

		JsonNode ports = spec.get("ports");
		if (ports != null && !ports.isNull()) {
			if (!ports.isArray()) {
				throw new SanitizationException("Service spec.ports is not an array");
			}
			for (JsonNode port : ports) {
				if (!(port instanceof ObjectNode)) {
					throw new SanitizationException("Service spec.ports entry is not an object");
				}
				if (!isUserSpecifiedNodePort(port.get("nodePort"))) {
					((ObjectNode) port).remove("nodePort");
				}
			}
		}

		if (!isUserSpecifiedNodePort(spec.get("healthCheckNodePort"))) {
			spec.remove("healthCheckNodePort");
		}
	}

	/**
	 * A node port is kept only when it is a nonzero integer outside the auto-assigned
	 * range. Anything else is either cluster-assigned or ambiguous.
	 */
	boolean isUserSpecifiedNodePort(@Nullable JsonNode nodePort) {
		if (nodePort == null || !nodePort.isIntegralNumber()) {
			return false;
		}
		int port = nodePort.asInt();
		return port != 0 && (port < nodePortRangeStart || port > nodePortRangeEnd);
	}

	private static void verifyIdentity(ResourceRecord record, JsonNode sanitized) {
		JsonNode before = record.rawBody();
		if (!before.path("kind").equals(sanitized.path("kind"))
				|| !before.path("metadata").path("name").equals(sanitized.path("metadata").path("name"))
				|| !before.path("metadata")
					.path("namespace")
					.equals(sanitized.path("metadata").path("namespace"))) {
			throw new SanitizationException("Sanitization changed the identity of " + record.displayName());
		}
	}

	@FunctionalInterface
	private interface KindRule {

		void apply(ObjectNode spec);

	}

	/**
	 * Exact names, plus prefixes for entries ending in {@code *}.
	 */
	private static final class Denylist {

		private final List<String> exact;

		private final List<String> prefixes;

		Denylist(List<String> entries) {
			this.exact = entries.stream().filter(e -> !e.endsWith("*")).toList();
			this.prefixes = entries.stream()
				.filter(e -> e.endsWith("*"))
				.map(e -> e.substring(0, e.length() - 1))
				.toList();
		}

		boolean matches(String value) {
			return exact.contains(value) || prefixes.stream().anyMatch(value::startsWith);
		}

	}

}
