package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe accumulator of the facts detection matches against.
 *
 * <p>
 * Fed raw records from the fetch workers as they arrive, it keeps only what signatures
 * can refer to: container images, namespace names, label and annotation keys, custom
 * resource definition groups, resource identities and kubelet versions.
 */
public class DetectionFacts {

	private final JsonNodeUtils jsonNodeUtils;

	private final Set<String> images = ConcurrentHashMap.newKeySet();

	private final Set<String> namespaces = ConcurrentHashMap.newKeySet();

	private final Set<String> labelKeys = ConcurrentHashMap.newKeySet();

	private final Set<String> annotationKeys = ConcurrentHashMap.newKeySet();

	private final Set<String> kubeletVersions = ConcurrentHashMap.newKeySet();

	private final Map<String, Set<String>> crdsByGroup = new ConcurrentHashMap<>();

	private final Set<ResourceRef> resources = ConcurrentHashMap.newKeySet();

	private final AtomicInteger collectedRecords = new AtomicInteger();

	private final AtomicInteger nodes = new AtomicInteger();

	public DetectionFacts() {
		this(new JsonNodeUtils());
	}

	public DetectionFacts(JsonNodeUtils jsonNodeUtils) {
		this.jsonNodeUtils = jsonNodeUtils;
	}

	/**
	 * Record the facts of a collected record.
	 */
	public void accept(ResourceRecord record) {
		collectedRecords.incrementAndGet();
		observe(record);
	}

	/**
	 * Record the facts of a record that was read for detection only and is not part of
	 * the collection.
	 */
	public void observe(ResourceRecord record) {
		JsonNode body = record.rawBody();
		resources.add(new ResourceRef(record.kind(), record.namespace(), record.name()));
		if (!record.namespace().isEmpty()) {
			namespaces.add(record.namespace());
		}
		images.addAll(jsonNodeUtils.getContainerImages(body));
		labelKeys.addAll(jsonNodeUtils.getKeys(body, "metadata", "labels"));
		annotationKeys.addAll(jsonNodeUtils.getKeys(body, "metadata", "annotations"));

		if ("Node".equals(record.kind())) {
			nodes.incrementAndGet();
			jsonNodeUtils.getString(body, "status", "nodeInfo", "kubeletVersion").ifPresent(kubeletVersions::add);
		}
		if (ResourceCatalog.CUSTOM_RESOURCE_DEFINITIONS.kind().equals(record.kind())) {
			jsonNodeUtils.getString(body, "spec", "group").ifPresent(group -> addCrd(group, record.name()));
		}
	}

	public void addNamespaces(Collection<String> names) {
		namespaces.addAll(names);
	}

	private void addCrd(String group, String crdName) {
		crdsByGroup.computeIfAbsent(group, g -> ConcurrentHashMap.newKeySet()).add(crdName);
	}

	public Set<String> images() {
		return Set.copyOf(images);
	}

	public Set<String> namespaces() {
		return Set.copyOf(namespaces);
	}

	public Set<String> labelKeys() {
		return Set.copyOf(labelKeys);
	}

	public Set<String> annotationKeys() {
		return Set.copyOf(annotationKeys);
	}

	public Set<String> kubeletVersions() {
		return Set.copyOf(kubeletVersions);
	}

	/**
	 * Returns the names of the custom resource definitions seen, keyed by API group.
	 */
	public Map<String, Set<String>> crdsByGroup() {
		Map<String, Set<String>> copy = new TreeMap<>();
		crdsByGroup.forEach((group, names) -> copy.put(group, Set.copyOf(names)));
		return copy;
	}

	public Set<ResourceRef> resources() {
		return Set.copyOf(resources);
	}

	/**
	 * Returns the number of collected records, excluding observed-only ones.
	 */
	public int collectedRecords() {
		return collectedRecords.get();
	}

	public int nodeCount() {
		return nodes.get();
	}

	/**
	 * Identity of a seen resource.
	 *
	 * @param kind resource kind
	 * @param namespace namespace, empty for cluster-scoped resources
	 * @param name resource name
	 */
	public record ResourceRef(String kind, String namespace, String name) {

		@Override
		public String toString() {
			return namespace.isEmpty() ? kind + " " + name : kind + " " + namespace + "/" + name;
		}

	}

}
