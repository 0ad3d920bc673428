package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Utility service for navigating resource documents.
 */
@Service
public class JsonNodeUtils {

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	/**
	 * Returns the field names of the object at {@code path}, e.g. the keys of
	 * {@code metadata.labels}. Empty when the target is missing or not an object.
	 */
	public List<String> getKeys(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isObject()) {
			return List.of();
		}
		List<String> keys = new ArrayList<>();
		Iterator<String> names = target.fieldNames();
		names.forEachRemaining(keys::add);
		return keys;
	}

	/**
	 * Collects the container images of a workload document. Handles pods, pod
	 * templates of workload controllers and the job template nested in cron jobs.
	 */
	public List<String> getContainerImages(JsonNode resource) {
		JsonNode spec = resource.path("spec");
		JsonNode podSpec;
		if (spec.has("containers")) {
			podSpec = spec;
		}
		else if (spec.path("jobTemplate").isObject()) {
			podSpec = spec.path("jobTemplate").path("spec").path("template").path("spec");
		}
		else {
			podSpec = spec.path("template").path("spec");
		}

		List<String> images = new ArrayList<>();
		for (String field : List.of("initContainers", "containers")) {
			for (JsonNode container : podSpec.path(field)) {
				String image = container.path("image").asText("");
				if (!image.isEmpty()) {
					images.add(image);
				}
			}
		}
		return images;
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
