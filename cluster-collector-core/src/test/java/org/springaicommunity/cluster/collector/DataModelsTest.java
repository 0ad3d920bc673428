package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the value types of a collection run.
 */
@DisplayName("Data Models Tests")
class DataModelsTest {

	private static final JsonNode BODY = JsonNodeFactory.instance.objectNode();

	@Nested
	@DisplayName("ResourceType Tests")
	class ResourceTypeTest {

		@Test
		@DisplayName("Core kinds should list under /api")
		void coreKindsShouldListUnderApi() {
			ResourceType pods = ResourceType.core("pods", "Pod", ResourceScope.NAMESPACED);

			assertThat(pods.apiVersion()).isEqualTo("v1");
			assertThat(pods.listPath("web")).isEqualTo("/api/v1/namespaces/web/pods");
			assertThat(pods.listPath(null)).isEqualTo("/api/v1/pods");
		}

		@Test
		@DisplayName("Grouped kinds should list under /apis")
		void groupedKindsShouldListUnderApis() {
			ResourceType deployments = ResourceType.builtIn("apps", "v1", "deployments", "Deployment",
					ResourceScope.NAMESPACED);

			assertThat(deployments.apiVersion()).isEqualTo("apps/v1");
			assertThat(deployments.listPath("web")).isEqualTo("/apis/apps/v1/namespaces/web/deployments");
		}

		@Test
		@DisplayName("Cluster-scoped kinds should ignore the namespace")
		void clusterKindsShouldIgnoreNamespace() {
			assertThat(ResourceCatalog.NAMESPACES.listPath("web")).isEqualTo("/api/v1/namespaces");
		}

		@Test
		@DisplayName("Custom kinds should be qualified by group on disk")
		void customKindsShouldBeGroupQualified() {
			ResourceType custom = new ResourceType("longhorn.io", "v1beta2", "volumes", "Volume",
					ResourceScope.NAMESPACED, true);

			assertThat(custom.directoryName()).isEqualTo("volumes.longhorn.io");
			assertThat(ResourceCatalog.categoryOf(custom)).isEqualTo("custom");
		}

		@Test
		@DisplayName("The built-in catalog should contain no duplicate kinds")
		void catalogShouldBeDistinct() {
			assertThat(ResourceCatalog.NAMESPACE_SCOPED).doesNotHaveDuplicates().allMatch(ResourceType::isNamespaced);
			assertThat(ResourceCatalog.CLUSTER_SCOPED).doesNotHaveDuplicates().noneMatch(ResourceType::isNamespaced);
		}

	}

	@Nested
	@DisplayName("Custom Resource Definition Tests")
	class CustomResourceDefinitionTest {

		private final ObjectMapper mapper = ObjectMapperFactory.create();

		@Test
		@DisplayName("Should prefer the storage version")
		void shouldPreferStorageVersion() throws Exception {
			JsonNode crd = mapper.readTree("""
					{"spec":{"group":"longhorn.io","scope":"Namespaced",
					 "names":{"plural":"volumes","kind":"Volume"},
					 "versions":[{"name":"v1beta1","served":true,"storage":false},
					             {"name":"v1beta2","served":true,"storage":true}]}}
					""");

			ResourceType type = ResourceCatalog.fromCustomResourceDefinition(crd).orElseThrow();

			assertThat(type.version()).isEqualTo("v1beta2");
			assertThat(type.isNamespaced()).isTrue();
			assertThat(type.custom()).isTrue();
		}

		@Test
		@DisplayName("Should reject a definition serving no version")
		void shouldRejectUnservedDefinition() throws Exception {
			JsonNode crd = mapper.readTree("""
					{"spec":{"group":"example.com","scope":"Cluster",
					 "names":{"plural":"widgets","kind":"Widget"},
					 "versions":[{"name":"v1","served":false,"storage":true}]}}
					""");

			assertThat(ResourceCatalog.fromCustomResourceDefinition(crd)).isEmpty();
		}

	}

	@Nested
	@DisplayName("ResourceRecord Tests")
	class ResourceRecordTest {

		private final ResourceType configMaps = ResourceType.core("configmaps", "ConfigMap",
				ResourceScope.NAMESPACED);

		@Test
		@DisplayName("Namespaced records should require a namespace")
		void namespacedRecordShouldRequireNamespace() {
			assertThatThrownBy(() -> ResourceRecord.of(configMaps, "", "app", BODY))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("requires a namespace");
		}

		@Test
		@DisplayName("Records should require a name")
		void recordShouldRequireName() {
			assertThatThrownBy(() -> ResourceRecord.of(configMaps, "web", "", BODY))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Cluster-scoped records should drop the namespace")
		void clusterRecordShouldDropNamespace() {
			ResourceRecord record = ResourceRecord.of(ResourceCatalog.NAMESPACES, "web", "web", BODY);

			assertThat(record.namespace()).isEmpty();
			assertThat(record.displayName()).isEqualTo("namespaces/web");
		}

		@Test
		@DisplayName("Should expose identity and display name")
		void shouldExposeIdentity() {
			ResourceRecord record = ResourceRecord.of(configMaps, "web", "app", BODY);

			assertThat(record.key()).isEqualTo("ConfigMap/web/app");
			assertThat(record.displayName()).isEqualTo("configmaps/web/app");
			assertThat(record.sanitizedBody()).isNull();
			assertThat(record.withSanitizedBody(BODY).sanitizedBody()).isSameAs(BODY);
		}

	}

	@Nested
	@DisplayName("Run Configuration Tests")
	class RunConfigurationTest {

		@Test
		@DisplayName("Run id should be derived from the UTC start time")
		void runIdShouldUseUtcStartTime() {
			assertThat(CollectionRun.runIdFor(Instant.parse("2024-12-31T23:59:59Z")))
				.isEqualTo("cluster-collection-2024-12-31-23-59-59");
		}

		@Test
		@DisplayName("Blank namespaces should be ignored")
		void blankNamespacesShouldBeIgnored() {
			CollectionRun run = CollectionRun.builder().namespaces(List.of(" web ", "", "  ")).build();

			assertThat(run.namespaceFilter()).containsExactly("web");
			assertThat(run.allNamespaces()).isFalse();
			assertThat(CollectionRun.builder().build().allNamespaces()).isTrue();
		}

		@ParameterizedTest
		@CsvSource({ "COMPRESSED, true, false", "UNCOMPRESSED, false, true", "BOTH, true, true" })
		@DisplayName("Compression modes should decide archive and tree")
		void compressionModesShouldDecideOutputs(CompressionMode mode, boolean archive, boolean tree) {
			assertThat(mode.createsArchive()).isEqualTo(archive);
			assertThat(mode.keepsTree()).isEqualTo(tree);
		}

		@Test
		@DisplayName("Both format should write json before yaml")
		void bothFormatShouldListExtensions() {
			assertThat(OutputFormat.BOTH.extensions()).containsExactly("json", "yaml");
		}

	}

	@Nested
	@DisplayName("Confidence Level Tests")
	class ConfidenceLevelTest {

		@ParameterizedTest
		@CsvSource({ "0.0, MINIMAL", "0.09, MINIMAL", "0.10, LOW", "0.19, LOW", "0.20, MEDIUM", "0.40, HIGH",
				"0.59, HIGH", "0.60, VERY_HIGH", "1.0, VERY_HIGH" })
		@DisplayName("Scores should map to their bands")
		void scoresShouldMapToBands(double score, ConfidenceLevel expected) {
			assertThat(ConfidenceLevel.fromScore(score)).isEqualTo(expected);
		}

	}

	@Nested
	@DisplayName("KubeApiException Tests")
	class KubeApiExceptionTest {

		@ParameterizedTest
		@CsvSource({ "-1, true", "429, true", "500, true", "503, true", "401, false", "403, false", "404, false" })
		@DisplayName("Only transport, throttling and server errors should be retryable")
		void retryableStatuses(int status, boolean retryable) {
			assertThat(new KubeApiException("failed", status, null).isRetryable()).isEqualTo(retryable);
		}

		@Test
		@DisplayName("Status failures should keep the response body")
		void statusFailureShouldKeepBody() {
			KubeApiException e = new KubeApiException("Forbidden", 403, "{\"reason\":\"Forbidden\"}");

			assertThat(e.isForbidden()).isTrue();
			assertThat(e.getResponseBody()).contains("Forbidden");
		}

		@Test
		@DisplayName("Transport failures should carry no status")
		void transportFailureShouldHaveNoStatus() {
			KubeApiException e = new KubeApiException("Connection refused", new IOException("refused"));

			assertThat(e.getStatusCode()).isEqualTo(-1);
			assertThat(e.getCause()).isInstanceOf(IOException.class);
		}

	}

}
