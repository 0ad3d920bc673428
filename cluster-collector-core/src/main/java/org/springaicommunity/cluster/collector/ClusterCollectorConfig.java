package org.springaicommunity.cluster.collector;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Spring configuration for the collection pipeline. The {@link KubeApiClient} bean comes
 * from {@link KubeClientConfig} or from the application.
 */
@Configuration
@Import(JsonNodeUtils.class)
public class ClusterCollectorConfig {

	@Bean
	public CollectionProperties collectionProperties() {
		return new CollectionProperties();
	}

	@Bean
	public KubeApiService kubeApiService(KubeApiClient kubeApiClient, CollectionProperties properties) {
		return new KubeApiService(kubeApiClient, ObjectMapperFactory.create(), properties.getPageSize());
	}

	@Bean
	public ClusterResourceEnumerator clusterResourceEnumerator(KubeApiService kubeApiService,
			CollectionProperties properties) {
		return new ClusterResourceEnumerator(kubeApiService, properties);
	}

	@Bean
	public ResourceSanitizer resourceSanitizer(CollectionProperties properties) {
		return new ResourceSanitizer(properties);
	}

	@Bean
	public SignatureCatalog signatureCatalog(CollectionProperties properties) {
		return SignatureCatalog.load(properties.getSignaturesLocation());
	}

	@Bean
	public ComponentDetectionEngine componentDetectionEngine(SignatureCatalog signatureCatalog,
			CollectionProperties properties) {
		return new ComponentDetectionEngine(signatureCatalog, properties.getMaxConfidenceScore());
	}

	@Bean
	public ArchiveService archiveService() {
		return new TarGzArchiveService();
	}

	@Bean
	public ClusterCollectionService clusterCollectionService(KubeApiService kubeApiService,
			ClusterResourceEnumerator clusterResourceEnumerator, ResourceSanitizer resourceSanitizer,
			ComponentDetectionEngine componentDetectionEngine, ArchiveService archiveService,
			CollectionProperties properties, JsonNodeUtils jsonNodeUtils) {
		return new ClusterCollectionService(kubeApiService, clusterResourceEnumerator, resourceSanitizer,
				componentDetectionEngine, archiveService, properties, ObjectMapperFactory.create(),
				ObjectMapperFactory.createYaml(), jsonNodeUtils);
	}

}
