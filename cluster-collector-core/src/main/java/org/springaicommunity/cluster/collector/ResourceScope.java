package org.springaicommunity.cluster.collector;

/**
 * Whether a resource kind lives at cluster level or inside a namespace.
 */
public enum ResourceScope {

	CLUSTER, NAMESPACED;

	/**
	 * Parse the {@code spec.scope} value of a custom resource definition.
	 * @param value "Cluster" or "Namespaced"
	 * @return the matching scope
	 * @throws IllegalArgumentException for any other value
	 */
	public static ResourceScope fromCrdScope(String value) {
		return switch (value) {
			case "Cluster" -> CLUSTER;
			case "Namespaced" -> NAMESPACED;
			default -> throw new IllegalArgumentException("Unknown CRD scope: " + value);
		};
	}

}
