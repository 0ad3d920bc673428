package org.springaicommunity.cluster.collector;

import java.util.List;

/**
 * Outcome of enumeration. Per-resource counts and failures are in the run's
 * {@link CollectionTracker}.
 *
 * @param targetNamespaces namespaces whose resources were listed
 * @param customResourceTypes custom kinds discovered from definitions
 * @param fetchTasks number of list tasks scheduled
 * @param failedTasks number of list tasks that failed or were cancelled
 * @param deadlineExceeded whether the run deadline cancelled pending tasks
 */
public record EnumerationResult(List<String> targetNamespaces, List<ResourceType> customResourceTypes,
		int fetchTasks, int failedTasks, boolean deadlineExceeded) {

	public EnumerationResult {
		targetNamespaces = List.copyOf(targetNamespaces);
		customResourceTypes = List.copyOf(customResourceTypes);
	}

}
