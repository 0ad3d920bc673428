package org.springaicommunity.cluster.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Matches accumulated {@link DetectionFacts} against a {@link SignatureCatalog}.
 *
 * <p>
 * The confidence score depends only on which components matched, and facts only ever
 * grow, so adding resources never lowers the score. Detection never throws for odd input;
 * an empty fact set yields {@link Distribution#UNKNOWN} with
 * {@link ConfidenceLevel#MINIMAL} confidence.
 */
public class ComponentDetectionEngine {

	private static final Logger logger = LoggerFactory.getLogger(ComponentDetectionEngine.class);

	private static final Pattern VERSION_TAG = Pattern.compile("v\\d+(\\.\\d+)+\\S*");

	private static final int MAX_EVIDENCE = 10;

	private final SignatureCatalog catalog;

	private final int maxScore;

	public ComponentDetectionEngine(SignatureCatalog catalog, int maxScore) {
		if (maxScore <= 0) {
			throw new IllegalArgumentException("maxScore must be positive");
		}
		this.catalog = catalog;
		this.maxScore = maxScore;
	}

	/**
	 * Run detection over the accumulated facts.
	 * @param facts facts gathered during enumeration
	 * @return the detection result
	 */
	public DetectionResult detect(DetectionFacts facts) {
		List<ComponentMatch> matches = new ArrayList<>();
		Set<Distribution> distributions = new TreeSet<>();
		String distributionVersion = null;
		boolean management = false;
		boolean downstream = false;
		int totalWeight = 0;

		for (ComponentSignature signature : catalog.signatures()) {
			Set<String> evidence = new TreeSet<>();
			String version = null;
			for (MatchRule rule : signature.rules()) {
				List<String> found = evaluate(rule, facts);
				evidence.addAll(found);
				if (version == null && isImageRule(rule)) {
					version = versionFromImages(found);
				}
			}
			if (evidence.isEmpty()) {
				continue;
			}

			if (signature.distribution() != null) {
				String kubeletVersion = kubeletVersionFor(signature, facts);
				version = kubeletVersion != null ? kubeletVersion : version;
				distributions.add(signature.distribution());
			}
			management |= signature.role() == ComponentSignature.Role.MANAGEMENT;
			downstream |= signature.role() == ComponentSignature.Role.DOWNSTREAM;
			totalWeight += signature.weight();
			matches.add(new ComponentMatch(signature.name(), signature.category(), version,
					evidence.stream().limit(MAX_EVIDENCE).toList(), signature.weight()));
			logger.debug("Matched component {} ({})", signature.name(), evidence);
		}

		Distribution distribution = classifyDistribution(distributions, facts);
		if (distribution == Distribution.K3S || distribution == Distribution.RKE2) {
			distributionVersion = matches.stream()
				.filter(m -> m.name().equals(distributionComponent(distribution)))
				.map(ComponentMatch::version)
				.filter(v -> v != null)
				.findFirst()
				.orElse(null);
		}
		else if (distribution == Distribution.STANDARD) {
			distributionVersion = new TreeSet<>(facts.kubeletVersions()).stream().findFirst().orElse(null);
		}

		DeploymentClass deploymentClass;
		if (management) {
			deploymentClass = DeploymentClass.MANAGEMENT;
		}
		else if (downstream) {
			deploymentClass = DeploymentClass.DOWNSTREAM;
		}
		else if (facts.collectedRecords() > 0) {
			deploymentClass = DeploymentClass.STANDALONE;
		}
		else {
			deploymentClass = DeploymentClass.UNKNOWN;
		}

		double score = Math.min(1.0, totalWeight / (double) maxScore);
		ConfidenceLevel level = ConfidenceLevel.fromScore(score);
		Set<String> names = new TreeSet<>();
		matches.forEach(m -> names.add(m.name()));

		logger.info("Detection: distribution={}, components={}, confidence={} ({}), class={}",
				distribution.displayName(), matches.size(), level.displayName(), String.format("%.2f", score),
				deploymentClass.displayName());
		return new DetectionResult(distribution, distributionVersion, names, score, level, deploymentClass,
				totalWeight, maxScore, matches);
	}

	/**
	 * Evaluate one rule.
	 * @return evidence strings, empty when the rule does not fire
	 */
	List<String> evaluate(MatchRule rule, DetectionFacts facts) {
		String value = rule.value();
		List<String> evidence = new ArrayList<>();
		switch (rule.type()) {
			case IMAGE_PREFIX -> facts.images().stream().filter(i -> i.startsWith(value)).forEach(evidence::add);
			case IMAGE_CONTAINS -> facts.images().stream().filter(i -> i.contains(value)).forEach(evidence::add);
			case NAMESPACE -> {
				if (facts.namespaces().contains(value)) {
					evidence.add("namespace " + value);
				}
			}
			case LABEL_KEY -> {
				if (facts.labelKeys().contains(value)) {
					evidence.add("label " + value);
				}
			}
			case ANNOTATION_KEY -> {
				if (facts.annotationKeys().contains(value)) {
					evidence.add("annotation " + value);
				}
			}
			case CRD_GROUP -> {
				for (Map.Entry<String, Set<String>> entry : facts.crdsByGroup().entrySet()) {
					String group = entry.getKey();
					if (group.equals(value) || group.endsWith("." + value)) {
						evidence.add(entry.getValue().size() + " CRDs in " + group);
					}
				}
			}
			case RESOURCE_NAME -> facts.resources()
				.stream()
				.filter(r -> rule.kind() == null || rule.kind().equals(r.kind()))
				.filter(r -> rule.namespace() == null || rule.namespace().equals(r.namespace()))
				.filter(r -> rule.matchesName(r.name()))
				.forEach(r -> evidence.add(r.toString()));
			case KUBELET_VERSION -> facts.kubeletVersions()
				.stream()
				.filter(v -> v.contains(value))
				.forEach(v -> evidence.add("kubelet " + v));
		}
		return evidence;
	}

	private static Distribution classifyDistribution(Set<Distribution> matched, DetectionFacts facts) {
		if (matched.contains(Distribution.K3S)) {
			return Distribution.K3S;
		}
		if (matched.contains(Distribution.RKE2)) {
			return Distribution.RKE2;
		}
		return facts.nodeCount() > 0 ? Distribution.STANDARD : Distribution.UNKNOWN;
	}

	private String distributionComponent(Distribution distribution) {
		return catalog.signatures()
			.stream()
			.filter(s -> s.distribution() == distribution)
			.map(ComponentSignature::name)
			.findFirst()
			.orElse("");
	}

	/**
	 * Kubelet version naming the distribution, e.g. {@code v1.30.8+k3s1}.
	 */
	@Nullable
	private static String kubeletVersionFor(ComponentSignature signature, DetectionFacts facts) {
		List<String> markers = signature.rules()
			.stream()
			.filter(r -> r.type() == MatchRule.Type.KUBELET_VERSION)
			.map(MatchRule::value)
			.toList();
		return new TreeSet<>(facts.kubeletVersions()).stream()
			.filter(v -> markers.stream().anyMatch(v::contains))
			.findFirst()
			.orElse(null);
	}

	private static boolean isImageRule(MatchRule rule) {
		return rule.type() == MatchRule.Type.IMAGE_PREFIX || rule.type() == MatchRule.Type.IMAGE_CONTAINS;
	}

	@Nullable
	private static String versionFromImages(List<String> images) {
		return new TreeSet<>(images).stream()
			.map(ComponentDetectionEngine::versionTag)
			.filter(v -> v != null)
			.findFirst()
			.orElse(null);
	}

	/**
	 * Extract a semantic version tag such as {@code v2.9.3} from an image reference.
	 * Digests and registry ports are not mistaken for tags.
	 */
	@Nullable
	static String versionTag(String image) {
		String reference = image.contains("@") ? image.substring(0, image.indexOf('@')) : image;
		int slash = reference.lastIndexOf('/');
		int colon = reference.lastIndexOf(':');
		if (colon <= slash) {
			return null;
		}
		String tag = reference.substring(colon + 1);
		return VERSION_TAG.matcher(tag).matches() ? tag : null;
	}

}
