package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Builder for creating the cluster collector without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Kubeconfig from the KUBECONFIG environment variable
 * ClusterCollectionService collector = ClusterCollectorBuilder.create()
 *     .kubeconfigFromEnv()
 *     .buildCollectionService();
 *
 * // With custom configuration
 * CollectionProperties props = new CollectionProperties();
 * props.setFetchConcurrency(4);
 *
 * ClusterCollectionService collector = ClusterCollectorBuilder.create()
 *     .kubeconfig(Path.of("/etc/rancher/k3s/k3s.yaml"))
 *     .properties(props)
 *     .buildCollectionService();
 *
 * CollectionResult result = collector.collect(CollectionRun.builder().build());
 *
 * // For testing with a mock API client
 * KubeApiClient mockClient = mock(KubeApiClient.class);
 * ClusterCollectionService testCollector = ClusterCollectorBuilder.create()
 *     .apiClient(mockClient)
 *     .buildCollectionService();
 * }
 * </pre>
 */
public class ClusterCollectorBuilder {

	private @Nullable Path kubeconfig;

	private CollectionProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable KubeApiClient apiClient;

	private @Nullable ArchiveService archiveService;

	private @Nullable SignatureCatalog signatureCatalog;

	private Clock clock = Clock.systemUTC();

	private ClusterCollectorBuilder() {
		this.properties = new CollectionProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ClusterCollectorBuilder
	 */
	public static ClusterCollectorBuilder create() {
		return new ClusterCollectorBuilder();
	}

	/**
	 * Use the given kubeconfig file.
	 * @param kubeconfig kubeconfig path
	 * @return this builder
	 */
	public ClusterCollectorBuilder kubeconfig(Path kubeconfig) {
		this.kubeconfig = kubeconfig;
		return this;
	}

	/**
	 * Read the kubeconfig location from the {@code KUBECONFIG} environment variable.
	 * @return this builder
	 * @throws IllegalStateException if KUBECONFIG is not set
	 */
	public ClusterCollectorBuilder kubeconfigFromEnv() {
		this.kubeconfig = EnvironmentSupport.kubeconfigPath()
			.orElseThrow(() -> new IllegalStateException(
					"KUBECONFIG environment variable is required. Please point it at your cluster's kubeconfig."));
		return this;
	}

	/**
	 * Set collection properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ClusterCollectorBuilder properties(@Nullable CollectionProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper for JSON output and API parsing.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ClusterCollectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom KubeApiClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom client is provided, no kubeconfig is required and the client is used
	 * as is, without the retrying wrapper.
	 * @param apiClient custom KubeApiClient implementation (null to use default)
	 * @return this builder
	 */
	public ClusterCollectorBuilder apiClient(@Nullable KubeApiClient apiClient) {
		this.apiClient = apiClient;
		return this;
	}

	/**
	 * Set a custom ArchiveService implementation.
	 * @param archiveService custom ArchiveService implementation (null to use default)
	 * @return this builder
	 */
	public ClusterCollectorBuilder archiveService(@Nullable ArchiveService archiveService) {
		this.archiveService = archiveService;
		return this;
	}

	/**
	 * Set the component signatures used for detection.
	 * @param signatureCatalog signature catalog (null to load
	 * {@link CollectionProperties#getSignaturesLocation()})
	 * @return this builder
	 */
	public ClusterCollectorBuilder signatureCatalog(@Nullable SignatureCatalog signatureCatalog) {
		this.signatureCatalog = signatureCatalog;
		return this;
	}

	public ClusterCollectorBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build a ClusterCollectionService.
	 * @return configured ClusterCollectionService
	 * @throws SessionException if the kubeconfig cannot be loaded
	 */
	public ClusterCollectionService buildCollectionService() {
		validateKubeconfig();
		Components components = buildComponents();
		return new ClusterCollectionService(components.apiService, components.enumerator, components.sanitizer,
				components.detectionEngine, components.archiveService, properties, components.jsonMapper,
				components.yamlMapper, components.jsonNodeUtils, clock);
	}

	/**
	 * Build the KubeApiService directly (for advanced usage).
	 * @return configured KubeApiService
	 */
	public KubeApiService buildApiService() {
		validateKubeconfig();
		return new KubeApiService(resolveClient(), resolveMapper(), properties.getPageSize());
	}

	private void validateKubeconfig() {
		// Skip kubeconfig validation if a custom apiClient is provided
		if (apiClient != null) {
			return;
		}
		if (kubeconfig == null) {
			throw new IllegalStateException("A kubeconfig is required. Call kubeconfig() or kubeconfigFromEnv() first.");
		}
	}

	private Components buildComponents() {
		ObjectMapper jsonMapper = resolveMapper();
		ObjectMapper yamlMapper = ObjectMapperFactory.createYaml();
		JsonNodeUtils jsonNodeUtils = new JsonNodeUtils();
		KubeApiService apiService = new KubeApiService(resolveClient(), jsonMapper, properties.getPageSize());
		ClusterResourceEnumerator enumerator = new ClusterResourceEnumerator(apiService, properties);
		ResourceSanitizer sanitizer = new ResourceSanitizer(properties);
		SignatureCatalog catalog = this.signatureCatalog != null ? this.signatureCatalog
				: SignatureCatalog.load(properties.getSignaturesLocation());
		ComponentDetectionEngine engine = new ComponentDetectionEngine(catalog, properties.getMaxConfidenceScore());
		ArchiveService archive = this.archiveService != null ? this.archiveService : new TarGzArchiveService();

		return new Components(apiService, enumerator, sanitizer, engine, archive, jsonMapper, yamlMapper,
				jsonNodeUtils);
	}

	private ObjectMapper resolveMapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private KubeApiClient resolveClient() {
		if (this.apiClient != null) {
			return this.apiClient;
		}
		KubeConfig config = KubeConfig.load(kubeconfig);
		KubeHttpClient httpClient = new KubeHttpClient(config,
				Duration.ofSeconds(properties.getFetchTimeoutSeconds()));
		return RetryingKubeApiClient.builder()
			.wrapping(httpClient)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.build();
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(KubeApiService apiService, ClusterResourceEnumerator enumerator,
			ResourceSanitizer sanitizer, ComponentDetectionEngine detectionEngine, ArchiveService archiveService,
			ObjectMapper jsonMapper, ObjectMapper yamlMapper, JsonNodeUtils jsonNodeUtils) {
	}

}
