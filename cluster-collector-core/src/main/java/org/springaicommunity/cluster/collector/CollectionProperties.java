package org.springaicommunity.cluster.collector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for cluster collection.
 *
 * <p>
 * Tunables for enumeration, sanitization and detection. Properties can be set directly
 * via setters or passed to {@link ClusterCollectorBuilder}. The node-port range and the
 * annotation and finalizer denylists vary between clusters and versions, so they are kept
 * here rather than in the sanitizer.
 *
 * <p>
 * Default values are suitable for most clusters. Lower the fetch concurrency for API
 * servers that throttle aggressively.
 */
public class CollectionProperties {

	/**
	 * Annotations written by controllers for their own bookkeeping. Entries ending in
	 * {@code *} match by prefix.
	 */
	public static final List<String> DEFAULT_ANNOTATION_DENYLIST = List.of(
			"kubectl.kubernetes.io/last-applied-configuration", "deployment.kubernetes.io/revision",
			"deployment.kubernetes.io/desired-replicas", "deployment.kubernetes.io/max-replicas",
			"pv.kubernetes.io/bind-completed", "pv.kubernetes.io/bound-by-controller",
			"pv.kubernetes.io/provisioned-by", "volume.kubernetes.io/selected-node",
			"volume.kubernetes.io/storage-provisioner", "volume.beta.kubernetes.io/storage-provisioner",
			"endpoints.kubernetes.io/last-change-trigger-time", "control-plane.alpha.kubernetes.io/leader",
			"kubernetes.io/service-account.uid", "objectset.rio.cattle.io/*", "field.cattle.io/publicEndpoints");

	/**
	 * Finalizers owned by platform controllers. Entries ending in {@code *} match by
	 * prefix.
	 */
	public static final List<String> DEFAULT_FINALIZER_DENYLIST = List.of("kubernetes.io/pvc-protection",
			"kubernetes.io/pv-protection", "foregroundDeletion", "orphan", "wrangler.cattle.io/*",
			"controller.cattle.io/*");

	/**
	 * Parent directory for run directories and archives.
	 */
	private String defaultOutputDir = Path.of(System.getProperty("java.io.tmpdir"), "cluster-collector").toString();

	/**
	 * Default output format ("json", "yaml" or "both").
	 */
	private String defaultFormat = "yaml";

	/**
	 * Default compression mode ("compressed", "uncompressed" or "both").
	 */
	private String defaultCompression = "both";

	/**
	 * Maximum number of list requests in flight at once.
	 */
	private int fetchConcurrency = 8;

	/**
	 * Timeout in seconds for a single API request.
	 */
	private int fetchTimeoutSeconds = 30;

	/**
	 * Overall run deadline in seconds, 0 for none. When exceeded, pending fetches are
	 * cancelled and the partial result is written and archived.
	 */
	private int runDeadlineSeconds = 0;

	/**
	 * Page size for list requests ({@code limit} parameter).
	 */
	private int pageSize = 500;

	/**
	 * Maximum number of retry attempts for retryable API failures.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds between retry attempts, doubled after each attempt.
	 */
	private long retryDelayMs = 1000;

	/**
	 * First port of the range from which the cluster auto-assigns node ports.
	 */
	private int nodePortRangeStart = 30000;

	/**
	 * Last port (inclusive) of the auto-assigned node port range.
	 */
	private int nodePortRangeEnd = 32767;

	/**
	 * Annotation keys removed during sanitization.
	 */
	private List<String> annotationDenylist = new ArrayList<>(DEFAULT_ANNOTATION_DENYLIST);

	/**
	 * Finalizers removed during sanitization.
	 */
	private List<String> finalizerDenylist = new ArrayList<>(DEFAULT_FINALIZER_DENYLIST);

	/**
	 * Handling of records whose sanitization failed.
	 */
	private SanitizationFailurePolicy sanitizationFailurePolicy = SanitizationFailurePolicy.INCLUDE_UNSANITIZED;

	/**
	 * Score at which the detection confidence saturates at 1.0.
	 */
	private int maxConfidenceScore = 100;

	/**
	 * Location of the component signature table: a classpath resource or a file path.
	 */
	private String signaturesLocation = SignatureCatalog.DEFAULT_LOCATION;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getDefaultOutputDir() {
		return defaultOutputDir;
	}

	public void setDefaultOutputDir(String defaultOutputDir) {
		this.defaultOutputDir = defaultOutputDir;
	}

	public String getDefaultFormat() {
		return defaultFormat;
	}

	public void setDefaultFormat(String defaultFormat) {
		this.defaultFormat = defaultFormat;
	}

	public String getDefaultCompression() {
		return defaultCompression;
	}

	public void setDefaultCompression(String defaultCompression) {
		this.defaultCompression = defaultCompression;
	}

	/**
	 * Returns the maximum number of concurrent list requests.
	 * @return the fetch concurrency
	 */
	public int getFetchConcurrency() {
		return fetchConcurrency;
	}

	/**
	 * Sets the maximum number of concurrent list requests.
	 * @param fetchConcurrency positive concurrency cap
	 */
	public void setFetchConcurrency(int fetchConcurrency) {
		this.fetchConcurrency = fetchConcurrency;
	}

	public int getFetchTimeoutSeconds() {
		return fetchTimeoutSeconds;
	}

	public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
		this.fetchTimeoutSeconds = fetchTimeoutSeconds;
	}

	public int getRunDeadlineSeconds() {
		return runDeadlineSeconds;
	}

	public void setRunDeadlineSeconds(int runDeadlineSeconds) {
		this.runDeadlineSeconds = runDeadlineSeconds;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	/**
	 * Returns the maximum number of retry attempts.
	 * @return the maximum retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the maximum number of retry attempts for failed requests.
	 * @param maxRetries the maximum retries
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public int getNodePortRangeStart() {
		return nodePortRangeStart;
	}

	public void setNodePortRangeStart(int nodePortRangeStart) {
		this.nodePortRangeStart = nodePortRangeStart;
	}

	public int getNodePortRangeEnd() {
		return nodePortRangeEnd;
	}

	public void setNodePortRangeEnd(int nodePortRangeEnd) {
		this.nodePortRangeEnd = nodePortRangeEnd;
	}

	public List<String> getAnnotationDenylist() {
		return annotationDenylist;
	}

	public void setAnnotationDenylist(List<String> annotationDenylist) {
		this.annotationDenylist = annotationDenylist;
	}

	public List<String> getFinalizerDenylist() {
		return finalizerDenylist;
	}

	public void setFinalizerDenylist(List<String> finalizerDenylist) {
		this.finalizerDenylist = finalizerDenylist;
	}

	public SanitizationFailurePolicy getSanitizationFailurePolicy() {
		return sanitizationFailurePolicy;
	}

	public void setSanitizationFailurePolicy(SanitizationFailurePolicy sanitizationFailurePolicy) {
		this.sanitizationFailurePolicy = sanitizationFailurePolicy;
	}

	public int getMaxConfidenceScore() {
		return maxConfidenceScore;
	}

	public void setMaxConfidenceScore(int maxConfidenceScore) {
		this.maxConfidenceScore = maxConfidenceScore;
	}

	public String getSignaturesLocation() {
		return signaturesLocation;
	}

	public void setSignaturesLocation(String signaturesLocation) {
		this.signaturesLocation = signaturesLocation;
	}

	/**
	 * Returns whether verbose logging is enabled.
	 * @return true if verbose logging is enabled
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Enables or disables verbose logging.
	 * @param verbose true to enable verbose logging
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
