package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

/**
 * One pattern of a {@link ComponentSignature}.
 *
 * @param type what the pattern is matched against
 * @param value the pattern
 * @param kind for {@link Type#RESOURCE_NAME}, restricts matches to this kind
 * @param namespace for {@link Type#RESOURCE_NAME}, restricts matches to this namespace
 */
public record MatchRule(Type type, String value, @Nullable String kind, @Nullable String namespace) {

	public MatchRule {
		if (type == null) {
			throw new IllegalArgumentException("Match rule requires a type");
		}
		if (value == null || value.isEmpty()) {
			throw new IllegalArgumentException("Match rule of type " + type + " requires a value");
		}
	}

	public static MatchRule of(Type type, String value) {
		return new MatchRule(type, value, null, null);
	}

	/**
	 * Match a name against the value: exact, or by prefix when the value ends in
	 * {@code *}.
	 */
	boolean matchesName(String name) {
		if (value.endsWith("*")) {
			return name.startsWith(value.substring(0, value.length() - 1));
		}
		return name.equals(value);
	}

	public enum Type {

		IMAGE_PREFIX, IMAGE_CONTAINS, NAMESPACE, LABEL_KEY, ANNOTATION_KEY, CRD_GROUP, RESOURCE_NAME, KUBELET_VERSION

	}

}
