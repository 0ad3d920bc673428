package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A component whose signature matched, with the evidence that matched it.
 *
 * @param name component name
 * @param category component category
 * @param version version derived from a matched image tag or kubelet version, if any
 * @param foundIn evidence of the match (images, resources, groups)
 * @param weight the component's contribution to the confidence score
 */
public record ComponentMatch(String name, String category, @Nullable String version, List<String> foundIn,
		int weight) {

	public ComponentMatch {
		foundIn = List.copyOf(foundIn);
	}

}
