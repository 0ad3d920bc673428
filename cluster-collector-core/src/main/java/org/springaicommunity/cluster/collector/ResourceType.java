package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

/**
 * A listable resource kind as served by the cluster API.
 *
 * @param group API group, empty for the core group
 * @param version API version within the group
 * @param plural lower-case plural used in API paths and output directories
 * @param kind singular kind as it appears in documents
 * @param scope cluster or namespace scope
 * @param custom true for kinds discovered from custom resource definitions
 */
public record ResourceType(String group, String version, String plural, String kind, ResourceScope scope,
		boolean custom) {

	public static ResourceType core(String plural, String kind, ResourceScope scope) {
		return new ResourceType("", "v1", plural, kind, scope, false);
	}

	public static ResourceType builtIn(String group, String version, String plural, String kind,
			ResourceScope scope) {
		return new ResourceType(group, version, plural, kind, scope, false);
	}

	/**
	 * Returns the {@code apiVersion} value for documents of this kind.
	 */
	public String apiVersion() {
		return group.isEmpty() ? version : group + "/" + version;
	}

	public boolean isNamespaced() {
		return scope == ResourceScope.NAMESPACED;
	}

	/**
	 * Build the list path for this kind.
	 * @param namespace namespace to list in, ignored for cluster-scoped kinds
	 * @return API path without query string
	 */
	public String listPath(@Nullable String namespace) {
		StringBuilder path = new StringBuilder(group.isEmpty() ? "/api/" + version : "/apis/" + group + "/" + version);
		if (isNamespaced() && namespace != null) {
			path.append("/namespaces/").append(namespace);
		}
		return path.append('/').append(plural).toString();
	}

	/**
	 * Directory name used for this kind in the output tree. Custom kinds are qualified by
	 * group since groups commonly reuse plurals.
	 */
	public String directoryName() {
		return custom && !group.isEmpty() ? plural + "." + group : plural;
	}

	@Override
	public String toString() {
		return directoryName();
	}

}
