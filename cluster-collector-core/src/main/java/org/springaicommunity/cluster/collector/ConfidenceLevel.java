package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered confidence bands over the normalized detection score.
 */
public enum ConfidenceLevel {

	MINIMAL("Minimal", 0.0), LOW("Low", 0.10), MEDIUM("Medium", 0.20), HIGH("High", 0.40),
	VERY_HIGH("VeryHigh", 0.60);

	private final String displayName;

	private final double lowerBound;

	ConfidenceLevel(String displayName, double lowerBound) {
		this.displayName = displayName;
		this.lowerBound = lowerBound;
	}

	@JsonValue
	public String displayName() {
		return displayName;
	}

	/**
	 * Map a normalized score to its band. Non-decreasing in {@code score}.
	 * @param score normalized score in [0, 1]
	 * @return the highest band whose lower bound the score reaches
	 */
	public static ConfidenceLevel fromScore(double score) {
		ConfidenceLevel level = MINIMAL;
		for (ConfidenceLevel candidate : values()) {
			if (score >= candidate.lowerBound) {
				level = candidate;
			}
		}
		return level;
	}

}
