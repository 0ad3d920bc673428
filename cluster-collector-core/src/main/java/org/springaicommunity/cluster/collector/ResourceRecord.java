package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * One collected resource instance.
 *
 * <p>
 * Identity is {@code (kind, namespace, name)}. Cluster-scoped records carry an empty
 * namespace; namespaced records always carry a non-empty one.
 *
 * @param type the resource type the record was listed as
 * @param namespace namespace, empty for cluster-scoped resources
 * @param name resource name
 * @param rawBody the document as returned by the API
 * @param sanitizedBody the reapply-safe document, null until sanitized
 */
public record ResourceRecord(ResourceType type, String namespace, String name, JsonNode rawBody,
		@Nullable JsonNode sanitizedBody) {

	public ResourceRecord {
		if (type.isNamespaced() && (namespace == null || namespace.isEmpty())) {
			throw new IllegalArgumentException("Namespaced " + type.kind() + " '" + name + "' requires a namespace");
		}
		if (!type.isNamespaced()) {
			namespace = "";
		}
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Resource of kind " + type.kind() + " requires a name");
		}
	}

	public static ResourceRecord of(ResourceType type, String namespace, String name, JsonNode rawBody) {
		return new ResourceRecord(type, namespace, name, rawBody, null);
	}

	public String kind() {
		return type.kind();
	}

	public ResourceRecord withSanitizedBody(JsonNode body) {
		return new ResourceRecord(type, namespace, name, rawBody, body);
	}

	/**
	 * Returns the identity key {@code kind/namespace/name}.
	 */
	public String key() {
		return type.kind() + "/" + namespace + "/" + name;
	}

	/**
	 * Human readable reference, {@code plural/name} or {@code plural/namespace/name}.
	 */
	public String displayName() {
		return namespace.isEmpty() ? type.directoryName() + "/" + name
				: type.directoryName() + "/" + namespace + "/" + name;
	}

}
