package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ResourceSanitizer}.
 */
@DisplayName("ResourceSanitizer Tests")
class ResourceSanitizerTest {

	private static final ResourceType SERVICES = ResourceType.core("services", "Service", ResourceScope.NAMESPACED);

	private static final ResourceType CONFIG_MAPS = ResourceType.core("configmaps", "ConfigMap",
			ResourceScope.NAMESPACED);

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private ResourceSanitizer sanitizer;

	@BeforeEach
	void setUp() {
		sanitizer = new ResourceSanitizer(new CollectionProperties());
	}

	private JsonNode json(String value) throws Exception {
		return objectMapper.readTree(value.replace('\'', '"'));
	}

	@Nested
	@DisplayName("Common Rules")
	class CommonRulesTest {

		@Test
		@DisplayName("Should remove status and server-populated metadata")
		void shouldRemoveStatusAndServerMetadata() throws Exception {
			JsonNode raw = json("{'apiVersion':'v1','kind':'ConfigMap','metadata':{'name':'app','namespace':'web',"
					+ "'uid':'1234','resourceVersion':'99','creationTimestamp':'2024-01-01T00:00:00Z',"
					+ "'generation':3,'selfLink':'/x','managedFields':[{'manager':'kubectl'}],"
					+ "'labels':{'app':'web'}},'data':{'key':'value'},'status':{'phase':'Active'}}");

			JsonNode sanitized = sanitizer.sanitize("ConfigMap", raw);

			assertThat(sanitized.has("status")).isFalse();
			assertThat(sanitized.path("metadata").has("uid")).isFalse();
			assertThat(sanitized.path("metadata").has("resourceVersion")).isFalse();
			assertThat(sanitized.path("metadata").has("creationTimestamp")).isFalse();
			assertThat(sanitized.path("metadata").has("generation")).isFalse();
			assertThat(sanitized.path("metadata").has("selfLink")).isFalse();
			assertThat(sanitized.path("metadata").has("managedFields")).isFalse();
			assertThat(sanitized.path("metadata").path("labels").path("app").asText()).isEqualTo("web");
			assertThat(sanitized.path("data").path("key").asText()).isEqualTo("value");
		}

		@Test
		@DisplayName("Should never modify the raw document")
		void shouldNotModifyRawDocument() throws Exception {
			JsonNode raw = json("{'kind':'ConfigMap','metadata':{'name':'app','uid':'1'},'status':{}}");
			JsonNode copy = raw.deepCopy();

			sanitizer.sanitize("ConfigMap", raw);

			assertThat(raw).isEqualTo(copy);
		}

		@Test
		@DisplayName("Should be idempotent")
		void shouldBeIdempotent() throws Exception {
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'web','namespace':'prod','uid':'1',"
					+ "'annotations':{'kubectl.kubernetes.io/last-applied-configuration':'{}','team':'a'},"
					+ "'finalizers':['kubernetes.io/pvc-protection','example.com/keep']},"
					+ "'spec':{'type':'NodePort','clusterIP':'10.0.0.5','clusterIPs':['10.0.0.5'],"
					+ "'ports':[{'port':80,'nodePort':31999},{'port':443,'nodePort':8443}]},'status':{}}");

			JsonNode once = sanitizer.sanitize("Service", raw);
			JsonNode twice = sanitizer.sanitize("Service", once);

			assertThat(twice).isEqualTo(once);
		}

		@Test
		@DisplayName("Should preserve identity fields")
		void shouldPreserveIdentity() throws Exception {
			JsonNode raw = json("{'apiVersion':'v1','kind':'ConfigMap','metadata':{'name':'app','namespace':'web',"
					+ "'uid':'1'}}");

			ResourceRecord record = sanitizer.sanitize(ResourceRecord.of(CONFIG_MAPS, "web", "app", raw), false);

			JsonNode sanitized = record.sanitizedBody();
			assertThat(sanitized).isNotNull();
			assertThat(sanitized.path("kind").asText()).isEqualTo("ConfigMap");
			assertThat(sanitized.path("metadata").path("name").asText()).isEqualTo("app");
			assertThat(sanitized.path("metadata").path("namespace").asText()).isEqualTo("web");
		}

		@Test
		@DisplayName("Raw mode should return the document unchanged")
		void rawModeShouldReturnDocumentUnchanged() throws Exception {
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'web','namespace':'prod','uid':'1'},"
					+ "'spec':{'clusterIP':'10.0.0.5'},'status':{'loadBalancer':{}}}");

			ResourceRecord record = sanitizer.sanitize(ResourceRecord.of(SERVICES, "prod", "web", raw), true);

			assertThat(record.sanitizedBody()).isSameAs(raw);
			assertThat(objectMapper.writeValueAsString(record.sanitizedBody()))
				.isEqualTo(objectMapper.writeValueAsString(raw));
		}

	}

	@Nested
	@DisplayName("Service Rules")
	class ServiceRulesTest {

		@Test
		@DisplayName("Should clear cluster IP and auto-assigned node port")
		void shouldClearClusterIpAndAutoAssignedNodePort() throws Exception {
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'web','namespace':'prod'},"
					+ "'spec':{'type':'NodePort','clusterIP':'10.0.0.5','clusterIPs':['10.0.0.5'],"
					+ "'ports':[{'name':'http','port':80,'targetPort':8080,'nodePort':31999}]}}");

			JsonNode spec = sanitizer.sanitize("Service", raw).path("spec");

			assertThat(spec.has("clusterIP")).isFalse();
			assertThat(spec.has("clusterIPs")).isFalse();
			assertThat(spec.path("ports").get(0).has("nodePort")).isFalse();
			assertThat(spec.path("ports").get(0).path("port").asInt()).isEqualTo(80);
			assertThat(spec.path("ports").get(0).path("targetPort").asInt()).isEqualTo(8080);
			assertThat(spec.path("type").asText()).isEqualTo("NodePort");
		}

		@Test
		@DisplayName("Should keep headless cluster IP")
		void shouldKeepHeadlessClusterIp() throws Exception {
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'db','namespace':'prod'},"
					+ "'spec':{'clusterIP':'None','clusterIPs':['None']}}");

			JsonNode spec = sanitizer.sanitize("Service", raw).path("spec");

			assertThat(spec.path("clusterIP").asText()).isEqualTo("None");
			assertThat(spec.path("clusterIPs").get(0).asText()).isEqualTo("None");
		}

		@Test
		@DisplayName("Should keep node ports outside the auto-assigned range")
		void shouldKeepNodePortsOutsideRange() throws Exception {
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'web','namespace':'prod'},"
					+ "'spec':{'ports':[{'port':80,'nodePort':8080}],'healthCheckNodePort':32000}}");

			JsonNode spec = sanitizer.sanitize("Service", raw).path("spec");

			assertThat(spec.path("ports").get(0).path("nodePort").asInt()).isEqualTo(8080);
			assertThat(spec.has("healthCheckNodePort")).isFalse();
		}

		@Test
		@DisplayName("Should honour a configured node port range")
		void shouldHonourConfiguredRange() throws Exception {
			ResourceSanitizer narrow = new ResourceSanitizer(List.of(), List.of(), 31000, 31100);
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'web','namespace':'prod'},"
					+ "'spec':{'ports':[{'port':80,'nodePort':31050},{'port':81,'nodePort':31999}]}}");

			JsonNode ports = narrow.sanitize("Service", raw).path("spec").path("ports");

			assertThat(ports.get(0).has("nodePort")).isFalse();
			assertThat(ports.get(1).path("nodePort").asInt()).isEqualTo(31999);
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "30000", "32767", "\"31000\"" })
		@DisplayName("Should treat zero, in-range and non-integer node ports as assigned")
		void shouldTreatAmbiguousNodePortsAsAssigned(String nodePort) throws Exception {
			assertThat(sanitizer.isUserSpecifiedNodePort(objectMapper.readTree(nodePort))).isFalse();
		}

		@Test
		@DisplayName("Should reject ports that are not an array")
		void shouldRejectMalformedPorts() throws Exception {
			JsonNode raw = json("{'kind':'Service','metadata':{'name':'web','namespace':'prod'},"
					+ "'spec':{'ports':'80'}}");

			assertThatThrownBy(() -> sanitizer.sanitize("Service", raw)).isInstanceOf(SanitizationException.class)
				.hasMessageContaining("ports");
		}

	}

	@Nested
	@DisplayName("Storage Rules")
	class StorageRulesTest {

		@Test
		@DisplayName("Should remove volume binding from claims")
		void shouldRemoveVolumeNameFromClaims() throws Exception {
			JsonNode raw = json("{'kind':'PersistentVolumeClaim','metadata':{'name':'data','namespace':'db'},"
					+ "'spec':{'volumeName':'pvc-123','storageClassName':'longhorn'}}");

			JsonNode spec = sanitizer.sanitize("PersistentVolumeClaim", raw).path("spec");

			assertThat(spec.has("volumeName")).isFalse();
			assertThat(spec.path("storageClassName").asText()).isEqualTo("longhorn");
		}

		@Test
		@DisplayName("Should remove claim reference from volumes")
		void shouldRemoveClaimRefFromVolumes() throws Exception {
			JsonNode raw = json("{'kind':'PersistentVolume','metadata':{'name':'pvc-123'},"
					+ "'spec':{'claimRef':{'name':'data','namespace':'db'},'capacity':{'storage':'1Gi'}}}");

			JsonNode spec = sanitizer.sanitize("PersistentVolume", raw).path("spec");

			assertThat(spec.has("claimRef")).isFalse();
			assertThat(spec.path("capacity").path("storage").asText()).isEqualTo("1Gi");
		}

	}

	@Nested
	@DisplayName("Denylists")
	class DenylistTest {

		@Test
		@DisplayName("Should remove denied annotations by exact name and prefix")
		void shouldRemoveDeniedAnnotations() throws Exception {
			JsonNode raw = json("{'kind':'ConfigMap','metadata':{'name':'app','namespace':'web','annotations':{"
					+ "'kubectl.kubernetes.io/last-applied-configuration':'{}',"
					+ "'objectset.rio.cattle.io/hash':'abc','team':'platform'}}}");

			JsonNode annotations = sanitizer.sanitize("ConfigMap", raw).path("metadata").path("annotations");

			assertThat(annotations.size()).isEqualTo(1);
			assertThat(annotations.path("team").asText()).isEqualTo("platform");
		}

		@Test
		@DisplayName("Should drop annotations and finalizers that end up empty")
		void shouldDropEmptiedMaps() throws Exception {
			JsonNode raw = json("{'kind':'PersistentVolumeClaim','metadata':{'name':'data','namespace':'db',"
					+ "'annotations':{'kubectl.kubernetes.io/last-applied-configuration':'{}'},"
					+ "'finalizers':['kubernetes.io/pvc-protection']}}");

			JsonNode metadata = sanitizer.sanitize("PersistentVolumeClaim", raw).path("metadata");

			assertThat(metadata.has("annotations")).isFalse();
			assertThat(metadata.has("finalizers")).isFalse();
		}

		@Test
		@DisplayName("Should keep finalizers not on the denylist")
		void shouldKeepOtherFinalizers() throws Exception {
			JsonNode raw = json("{'kind':'ConfigMap','metadata':{'name':'app','namespace':'web',"
					+ "'finalizers':['kubernetes.io/pvc-protection','example.com/cleanup']}}");

			JsonNode finalizers = sanitizer.sanitize("ConfigMap", raw).path("metadata").path("finalizers");

			assertThat(finalizers.size()).isEqualTo(1);
			assertThat(finalizers.get(0).asText()).isEqualTo("example.com/cleanup");
		}

	}

	@Nested
	@DisplayName("Malformed Documents")
	class MalformedDocumentTest {

		@Test
		@DisplayName("Should reject documents without metadata")
		void shouldRejectMissingMetadata() throws Exception {
			JsonNode raw = json("{'kind':'ConfigMap','data':{}}");

			assertThatThrownBy(() -> sanitizer.sanitize("ConfigMap", raw)).isInstanceOf(SanitizationException.class)
				.hasMessageContaining("metadata");
		}

		@Test
		@DisplayName("Should reject non-object documents")
		void shouldRejectNonObject() throws Exception {
			assertThatThrownBy(() -> sanitizer.sanitize("ConfigMap", json("['a']")))
				.isInstanceOf(SanitizationException.class);
		}

		@Test
		@DisplayName("Should reject annotations that are not a map")
		void shouldRejectMalformedAnnotations() throws Exception {
			JsonNode raw = json("{'kind':'ConfigMap','metadata':{'name':'app','annotations':['a']}}");

			assertThatThrownBy(() -> sanitizer.sanitize("ConfigMap", raw)).isInstanceOf(SanitizationException.class)
				.hasMessageContaining("annotations");
		}

		@Test
		@DisplayName("Should reject an inverted node port range")
		void shouldRejectInvertedRange() {
			assertThatThrownBy(() -> new ResourceSanitizer(List.of(), List.of(), 32767, 30000))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

}
