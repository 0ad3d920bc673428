package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of component detection, written as the analysis document.
 *
 * @param distribution inferred Kubernetes distribution
 * @param distributionVersion kubelet version backing the distribution, if known
 * @param matchedComponents names of the matched components, sorted
 * @param confidenceScore normalized score in [0, 1]
 * @param confidenceLevel band of the score
 * @param deploymentClass inferred multi-cluster role
 * @param totalWeight sum of the weights of matched components
 * @param maxScore weight sum at which the score saturates
 * @param components matched components with their evidence
 */
public record DetectionResult(Distribution distribution, @Nullable String distributionVersion,
		Set<String> matchedComponents, double confidenceScore, ConfidenceLevel confidenceLevel,
		DeploymentClass deploymentClass, int totalWeight, int maxScore, List<ComponentMatch> components) {

	public DetectionResult {
		matchedComponents = Collections.unmodifiableSortedSet(new TreeSet<>(matchedComponents));
		components = List.copyOf(components);
	}

	/**
	 * Result used when nothing could be inferred.
	 * @param maxScore configured maximum score
	 * @return an Unknown/Minimal result
	 */
	public static DetectionResult unknown(int maxScore) {
		return new DetectionResult(Distribution.UNKNOWN, null, Set.of(), 0.0, ConfidenceLevel.MINIMAL,
				DeploymentClass.UNKNOWN, 0, maxScore, List.of());
	}

}
