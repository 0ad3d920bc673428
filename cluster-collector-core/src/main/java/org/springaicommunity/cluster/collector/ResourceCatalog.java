package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springaicommunity.cluster.collector.ResourceScope.CLUSTER;
import static org.springaicommunity.cluster.collector.ResourceScope.NAMESPACED;

/**
 * Fixed catalog of built-in kinds collected on every run, plus the conversion of custom
 * resource definitions into listable {@link ResourceType}s.
 */
public final class ResourceCatalog {

	public static final ResourceType NAMESPACES = ResourceType.core("namespaces", "Namespace", CLUSTER);

	public static final ResourceType CUSTOM_RESOURCE_DEFINITIONS = ResourceType.builtIn("apiextensions.k8s.io", "v1",
			"customresourcedefinitions", "CustomResourceDefinition", CLUSTER);

	public static final List<ResourceType> CLUSTER_SCOPED = List.of(ResourceType.core("nodes", "Node", CLUSTER),
			ResourceType.builtIn("rbac.authorization.k8s.io", "v1", "clusterroles", "ClusterRole", CLUSTER),
			ResourceType.builtIn("rbac.authorization.k8s.io", "v1", "clusterrolebindings", "ClusterRoleBinding",
					CLUSTER),
			ResourceType.core("persistentvolumes", "PersistentVolume", CLUSTER),
			ResourceType.builtIn("storage.k8s.io", "v1", "storageclasses", "StorageClass", CLUSTER));

	public static final List<ResourceType> NAMESPACE_SCOPED = List.of(ResourceType.core("pods", "Pod", NAMESPACED),
			ResourceType.builtIn("apps", "v1", "deployments", "Deployment", NAMESPACED),
			ResourceType.builtIn("apps", "v1", "replicasets", "ReplicaSet", NAMESPACED),
			ResourceType.builtIn("apps", "v1", "daemonsets", "DaemonSet", NAMESPACED),
			ResourceType.builtIn("apps", "v1", "statefulsets", "StatefulSet", NAMESPACED),
			ResourceType.builtIn("batch", "v1", "jobs", "Job", NAMESPACED),
			ResourceType.builtIn("batch", "v1", "cronjobs", "CronJob", NAMESPACED),
			ResourceType.core("services", "Service", NAMESPACED),
			ResourceType.core("endpoints", "Endpoints", NAMESPACED),
			ResourceType.builtIn("discovery.k8s.io", "v1", "endpointslices", "EndpointSlice", NAMESPACED),
			ResourceType.builtIn("networking.k8s.io", "v1", "ingresses", "Ingress", NAMESPACED),
			ResourceType.builtIn("networking.k8s.io", "v1", "networkpolicies", "NetworkPolicy", NAMESPACED),
			ResourceType.core("configmaps", "ConfigMap", NAMESPACED),
			ResourceType.core("secrets", "Secret", NAMESPACED),
			ResourceType.core("persistentvolumeclaims", "PersistentVolumeClaim", NAMESPACED),
			ResourceType.core("serviceaccounts", "ServiceAccount", NAMESPACED),
			ResourceType.builtIn("rbac.authorization.k8s.io", "v1", "roles", "Role", NAMESPACED),
			ResourceType.builtIn("rbac.authorization.k8s.io", "v1", "rolebindings", "RoleBinding", NAMESPACED),
			ResourceType.core("resourcequotas", "ResourceQuota", NAMESPACED),
			ResourceType.core("limitranges", "LimitRange", NAMESPACED),
			ResourceType.builtIn("autoscaling", "v2", "horizontalpodautoscalers", "HorizontalPodAutoscaler",
					NAMESPACED),
			ResourceType.builtIn("policy", "v1", "poddisruptionbudgets", "PodDisruptionBudget", NAMESPACED));

	private static final Map<String, String> CATEGORIES = Map.ofEntries(Map.entry("Pod", "workloads"),
			Map.entry("Deployment", "workloads"), Map.entry("ReplicaSet", "workloads"),
			Map.entry("DaemonSet", "workloads"), Map.entry("StatefulSet", "workloads"), Map.entry("Job", "workloads"),
			Map.entry("CronJob", "workloads"), Map.entry("HorizontalPodAutoscaler", "workloads"),
			Map.entry("PodDisruptionBudget", "workloads"), Map.entry("Service", "networking"),
			Map.entry("Endpoints", "networking"), Map.entry("EndpointSlice", "networking"),
			Map.entry("Ingress", "networking"), Map.entry("NetworkPolicy", "networking"),
			Map.entry("ConfigMap", "configuration"), Map.entry("Secret", "configuration"),
			Map.entry("ServiceAccount", "configuration"), Map.entry("ResourceQuota", "configuration"),
			Map.entry("LimitRange", "configuration"), Map.entry("PersistentVolumeClaim", "storage"),
			Map.entry("PersistentVolume", "storage"), Map.entry("StorageClass", "storage"),
			Map.entry("Role", "rbac"), Map.entry("RoleBinding", "rbac"), Map.entry("ClusterRole", "rbac"),
			Map.entry("ClusterRoleBinding", "rbac"), Map.entry("Node", "cluster"),
			Map.entry("CustomResourceDefinition", "custom"));

	private ResourceCatalog() {
	}

	/**
	 * Summary highlight category of a type: workloads, networking, configuration, storage,
	 * rbac, cluster or custom.
	 */
	public static String categoryOf(ResourceType type) {
		if (type.custom()) {
			return "custom";
		}
		return CATEGORIES.getOrDefault(type.kind(), "other");
	}

	/**
	 * Derive the listable type declared by a custom resource definition. The storage
	 * version is preferred, falling back to the first served version.
	 * @param crd a CustomResourceDefinition document
	 * @return the declared type, or empty when the definition serves no version or lacks
	 * names
	 */
	public static Optional<ResourceType> fromCustomResourceDefinition(JsonNode crd) {
		JsonNode spec = crd.path("spec");
		String group = spec.path("group").asText("");
		String plural = spec.path("names").path("plural").asText("");
		String kind = spec.path("names").path("kind").asText("");
		String scope = spec.path("scope").asText("");
		if (group.isEmpty() || plural.isEmpty() || kind.isEmpty() || scope.isEmpty()) {
			return Optional.empty();
		}

		String version = null;
		for (JsonNode candidate : spec.path("versions")) {
			if (!candidate.path("served").asBoolean(false)) {
				continue;
			}
			if (version == null || candidate.path("storage").asBoolean(false)) {
				version = candidate.path("name").asText();
			}
		}
		if (version == null || version.isEmpty()) {
			return Optional.empty();
		}

		try {
			return Optional.of(new ResourceType(group, version, plural, kind, ResourceScope.fromCrdScope(scope), true));
		}
		catch (IllegalArgumentException e) {
			return Optional.empty();
		}
	}

}
