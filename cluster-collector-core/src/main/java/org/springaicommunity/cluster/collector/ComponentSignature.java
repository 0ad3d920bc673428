package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Declarative fingerprint of a platform component.
 *
 * @param name component name reported when matched
 * @param category grouping reported with the component (Core, Storage, ...)
 * @param weight contribution to the confidence score when matched
 * @param role how a match affects the deployment classification
 * @param distribution the distribution the component identifies, if any
 * @param rules patterns of which at least one must fire
 */
public record ComponentSignature(String name, String category, int weight, Role role,
		@Nullable Distribution distribution, List<MatchRule> rules) {

	public ComponentSignature {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Component signature requires a name");
		}
		if (weight < 0) {
			throw new IllegalArgumentException("Component '" + name + "' has a negative weight");
		}
		if (rules == null || rules.isEmpty()) {
			throw new IllegalArgumentException("Component '" + name + "' declares no rules");
		}
		if (category == null) {
			category = "Other";
		}
		if (role == null) {
			role = Role.COMPONENT;
		}
		rules = List.copyOf(rules);
	}

	public enum Role {

		COMPONENT, MANAGEMENT, DOWNSTREAM

	}

}
