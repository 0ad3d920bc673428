package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of the inspected cluster in a multi-cluster setup.
 */
public enum DeploymentClass {

	MANAGEMENT("Management"), DOWNSTREAM("Downstream"), STANDALONE("Standalone"), UNKNOWN("Unknown");

	private final String displayName;

	DeploymentClass(String displayName) {
		this.displayName = displayName;
	}

	@JsonValue
	public String displayName() {
		return displayName;
	}

}
