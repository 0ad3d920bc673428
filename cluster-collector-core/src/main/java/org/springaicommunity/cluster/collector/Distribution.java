package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kubernetes distribution inferred for the inspected cluster.
 */
public enum Distribution {

	K3S("K3s"), RKE2("RKE2"), STANDARD("Standard"), UNKNOWN("Unknown");

	private final String displayName;

	Distribution(String displayName) {
		this.displayName = displayName;
	}

	@JsonValue
	public String displayName() {
		return displayName;
	}

}
