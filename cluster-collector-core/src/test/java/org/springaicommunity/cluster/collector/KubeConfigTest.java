package org.springaicommunity.cluster.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KubeConfig Tests")
class KubeConfigTest {

	@TempDir
	Path tempDir;

	private Path write(String content) throws Exception {
		Path file = tempDir.resolve("config");
		Files.writeString(file, content);
		return file;
	}

	@Test
	@DisplayName("Should resolve the current context with an inline token")
	void shouldResolveCurrentContext() throws Exception {
		String ca = Base64.getEncoder()
			.encodeToString("-----BEGIN CERTIFICATE-----\nMIIB\n-----END CERTIFICATE-----\n"
				.getBytes(StandardCharsets.US_ASCII));
		Path file = write("""
				apiVersion: v1
				kind: Config
				current-context: edge
				contexts:
				  - name: other
				    context:
				      cluster: other
				      user: other
				  - name: edge
				    context:
				      cluster: edge-cluster
				      user: admin
				clusters:
				  - name: edge-cluster
				    cluster:
				      server: https://10.0.0.1:6443
				      certificate-authority-data: %s
				users:
				  - name: admin
				    user:
				      token: " abc123 "
				""".formatted(ca));

		KubeConfig config = KubeConfig.load(file);

		assertThat(config.contextName()).isEqualTo("edge");
		assertThat(config.server()).isEqualTo("https://10.0.0.1:6443");
		assertThat(config.certificateAuthorityData()).startsWith("-----BEGIN CERTIFICATE-----");
		assertThat(config.insecureSkipTlsVerify()).isFalse();
		assertThat(config.token()).isEqualTo("abc123");
		assertThat(config.toString()).doesNotContain("abc123");
	}

	@Test
	@DisplayName("Should read the token from a file relative to the kubeconfig")
	void shouldReadTokenFile() throws Exception {
		Files.writeString(tempDir.resolve("token"), "from-file\n");
		Path file = write("""
				current-context: c
				contexts:
				  - name: c
				    context: {cluster: k, user: u}
				clusters:
				  - name: k
				    cluster: {server: "https://k:6443", insecure-skip-tls-verify: true}
				users:
				  - name: u
				    user: {tokenFile: token}
				""");

		KubeConfig config = KubeConfig.load(file);

		assertThat(config.token()).isEqualTo("from-file");
		assertThat(config.insecureSkipTlsVerify()).isTrue();
	}

	@Test
	@DisplayName("Should allow anonymous access when the user has no credentials")
	void shouldAllowAnonymous() throws Exception {
		Path file = write("""
				current-context: proxy
				contexts:
				  - name: proxy
				    context: {cluster: local}
				clusters:
				  - name: local
				    cluster: {server: "http://127.0.0.1:8001"}
				""");

		assertThat(KubeConfig.load(file).token()).isNull();
	}

	@Test
	@DisplayName("Should reject users offering only client certificates")
	void shouldRejectClientCertificateOnly() throws Exception {
		Path file = write("""
				current-context: c
				contexts:
				  - name: c
				    context: {cluster: k, user: u}
				clusters:
				  - name: k
				    cluster: {server: "https://k:6443"}
				users:
				  - name: u
				    user: {client-certificate-data: AAAA, client-key-data: BBBB}
				""");

		assertThatThrownBy(() -> KubeConfig.load(file)).isInstanceOf(SessionException.class)
			.hasMessageContaining("bearer token");
	}

	@Test
	@DisplayName("Should reject certificate authority data that is not base64")
	void shouldRejectUndecodableCertificateData() throws Exception {
		Path file = write("""
				current-context: c
				contexts:
				  - name: c
				    context: {cluster: k}
				clusters:
				  - name: k
				    cluster: {server: "https://k:6443", certificate-authority-data: "not*base64!"}
				""");

		assertThatThrownBy(() -> KubeConfig.load(file)).isInstanceOf(SessionException.class)
			.hasMessageContaining("certificate-authority-data");
	}

	@Test
	@DisplayName("Should reject a missing context")
	void shouldRejectMissingContext() throws Exception {
		Path file = write("""
				current-context: gone
				contexts: []
				clusters: []
				""");

		assertThatThrownBy(() -> KubeConfig.load(file)).isInstanceOf(SessionException.class)
			.hasMessageContaining("gone");
	}

	@Test
	@DisplayName("Should reject a missing file")
	void shouldRejectMissingFile() {
		assertThatThrownBy(() -> KubeConfig.load(tempDir.resolve("absent"))).isInstanceOf(SessionException.class)
			.hasMessageContaining("not found");
	}

}
