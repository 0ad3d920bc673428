package org.springaicommunity.cluster.collector;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Spring configuration for the cluster API client, built from the kubeconfig named by
 * the {@code KUBECONFIG} property or environment variable.
 */
@Configuration
public class KubeClientConfig {

	@Value("${KUBECONFIG:}")
	private String kubeconfig;

	@Bean
	public KubeConfig kubeConfig() {
		Path path = kubeconfig.isBlank()
				? EnvironmentSupport.kubeconfigPath()
					.orElseThrow(() -> new IllegalStateException("KUBECONFIG is required to reach the cluster"))
				: Path.of(kubeconfig.split(File.pathSeparator)[0]);
		return KubeConfig.load(path);
	}

	@Bean
	public KubeApiClient kubeApiClient(KubeConfig kubeConfig, CollectionProperties properties) {
		KubeHttpClient httpClient = new KubeHttpClient(kubeConfig,
				Duration.ofSeconds(properties.getFetchTimeoutSeconds()));
		return RetryingKubeApiClient.builder()
			.wrapping(httpClient)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.build();
	}

}
