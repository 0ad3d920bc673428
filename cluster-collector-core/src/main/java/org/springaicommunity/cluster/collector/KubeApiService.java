package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Typed read operations over a {@link KubeApiClient}.
 *
 * <p>
 * List calls page through results with {@code limit}/{@code continue} and hand each item
 * to the caller as soon as its page arrives. List responses omit {@code apiVersion} and
 * {@code kind} on their items, so both are filled in from the listed type.
 */
public class KubeApiService {

	private static final Logger logger = LoggerFactory.getLogger(KubeApiService.class);

	private final KubeApiClient client;

	private final ObjectMapper objectMapper;

	private final int pageSize;

	public KubeApiService(KubeApiClient client, ObjectMapper objectMapper, int pageSize) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.pageSize = pageSize;
	}

	public String serverUrl() {
		return client.serverUrl();
	}

	/**
	 * Verify the session by fetching the server version.
	 * @return the server's {@code gitVersion}, e.g. {@code v1.28.9+k3s1}
	 * @throws SessionException if the API cannot be reached or rejects the credential
	 */
	public String serverVersion() {
		try {
			JsonNode version = parse(client.get("/version"));
			return version.path("gitVersion").asText("unknown");
		}
		catch (KubeApiException e) {
			String reason = e.isUnauthorized() ? "credential rejected" : e.getMessage();
			throw new SessionException("Cannot establish session with " + client.serverUrl() + ": " + reason, e);
		}
	}

	/**
	 * List the names of every namespace visible to the credential.
	 * @return namespace names in API order
	 */
	public List<String> listNamespaces() {
		List<String> names = new ArrayList<>();
		forEachResource(ResourceCatalog.NAMESPACES, null,
				item -> names.add(item.path("metadata").path("name").asText()));
		return names;
	}

	public List<JsonNode> listCustomResourceDefinitions() {
		return listResources(ResourceCatalog.CUSTOM_RESOURCE_DEFINITIONS, null);
	}

	/**
	 * List every instance of a type, collected into memory.
	 * @param type resource type
	 * @param namespace namespace for namespaced types, null for all namespaces or for
	 * cluster-scoped types
	 * @return all items
	 */
	public List<JsonNode> listResources(ResourceType type, @Nullable String namespace) {
		List<JsonNode> items = new ArrayList<>();
		forEachResource(type, namespace, items::add);
		return items;
	}

	/**
	 * Stream every instance of a type to a consumer, page by page.
	 * @param type resource type
	 * @param namespace namespace for namespaced types, null for all namespaces or for
	 * cluster-scoped types
	 * @param consumer receives each item with {@code apiVersion} and {@code kind} set
	 * @return number of items delivered
	 * @throws KubeApiException if any page cannot be fetched
	 */
	public int forEachResource(ResourceType type, @Nullable String namespace, Consumer<JsonNode> consumer) {
		String path = type.listPath(namespace);
		String continueToken = null;
		int count = 0;
		int pages = 0;

		do {
			StringBuilder query = new StringBuilder("limit=").append(pageSize);
			if (continueToken != null) {
				query.append("&continue=").append(URLEncoder.encode(continueToken, StandardCharsets.UTF_8));
			}
			JsonNode page = parse(client.getWithQuery(path, query.toString()));
			pages++;

			for (JsonNode item : page.path("items")) {
				if (item instanceof ObjectNode object) {
					if (!object.hasNonNull("apiVersion")) {
						object.put("apiVersion", type.apiVersion());
					}
					if (!object.hasNonNull("kind")) {
						object.put("kind", type.kind());
					}
				}
				consumer.accept(item);
				count++;
			}

			String next = page.path("metadata").path("continue").asText("");
			continueToken = next.isEmpty() ? null : next;
		}
		while (continueToken != null);

		logger.debug("Listed {} {} in {} page(s) from {}", count, type, pages, path);
		return count;
	}

	private JsonNode parse(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new KubeApiException("Malformed API response: " + e.getOriginalMessage(), 0, body);
		}
	}

}
