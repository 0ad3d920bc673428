package org.springaicommunity.cluster.collector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the cluster collector. Pure Java implementation with
 * no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final CollectionProperties defaultProperties;

	public ArgumentParser(CollectionProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-k", "--kubeconfig":
					config.kubeconfig = getRequiredValue(args, i, "kubeconfig");
					i++; // Skip next argument since we consumed it
					break;

				case "-n", "--namespaces":
					String namespaceStr = getRequiredValue(args, i, "namespaces");
					config.namespaces = Arrays.stream(namespaceStr.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++;
					break;

				case "-o", "--output":
					config.outputDirectory = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-f", "--format":
					config.format = OutputFormat.parse(getRequiredValue(args, i, "format"));
					i++;
					break;

				case "-c", "--compression":
					config.compression = CompressionMode.parse(getRequiredValue(args, i, "compression"));
					i++;
					break;

				case "--include-custom-resources":
					config.includeCustomResources = true;
					break;

				case "--raw":
					config.rawMode = true;
					break;

				case "--disable-detection":
					config.disableDetection = true;
					break;

				case "--omit-unsanitized":
					config.omitUnsanitized = true;
					break;

				case "--concurrency":
					config.concurrency = parsePositiveInt(getRequiredValue(args, i, "concurrency"), "concurrency");
					i++;
					break;

				case "--fetch-timeout":
					config.fetchTimeoutSeconds = parsePositiveInt(getRequiredValue(args, i, "fetch-timeout"),
							"fetch timeout");
					i++;
					break;

				case "--deadline":
					config.deadlineSeconds = parsePositiveInt(getRequiredValue(args, i, "deadline"), "deadline");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Resolve the kubeconfig to use: {@code --kubeconfig}, otherwise {@code KUBECONFIG}.
	 * No other location is searched.
	 * @param config parsed configuration
	 * @return kubeconfig path
	 * @throws IllegalStateException if neither is set
	 */
	public Path resolveKubeconfig(ParsedConfiguration config) {
		if (config.kubeconfig != null) {
			return Path.of(config.kubeconfig);
		}
		return EnvironmentSupport.kubeconfigPath()
			.orElseThrow(() -> new IllegalStateException(
					"No kubeconfig given. Pass --kubeconfig <file> or set the KUBECONFIG environment variable."));
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: cluster-collector [OPTIONS]\n");
		help.append("\n");
		help.append("Collect a sanitized, reapplyable snapshot of a Kubernetes cluster and analyze its components.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("    -k, --kubeconfig FILE       Kubeconfig to use (default: $KUBECONFIG)\n");
		help.append("    -n, --namespaces NS[,NS]    Namespaces to collect (default: all visible namespaces)\n");
		help.append("    -o, --output DIR            Output directory (default: ")
			.append(defaultProperties.getDefaultOutputDir())
			.append(")\n");
		help.append("    -f, --format FORMAT         json, yaml or both (default: ")
			.append(defaultProperties.getDefaultFormat())
			.append(")\n");
		help.append("    -c, --compression MODE      compressed, uncompressed or both (default: ")
			.append(defaultProperties.getDefaultCompression())
			.append(")\n");
		help.append("    --include-custom-resources  Also collect custom resource definitions and their instances\n");
		help.append("    --raw                       Write resources exactly as returned by the API\n");
		help.append("    --disable-detection         Skip the component analysis\n");
		help.append("    --omit-unsanitized          Drop resources that fail sanitization instead of writing\n");
		help.append("                                them with the .unsanitized marker\n");
		help.append("    -v, --verbose               Enable verbose logging\n");
		help.append("\n");
		help.append("TUNING OPTIONS:\n");
		help.append("    --concurrency N             Concurrent list requests (default: ")
			.append(defaultProperties.getFetchConcurrency())
			.append(")\n");
		help.append("    --fetch-timeout SECONDS     Timeout of a single API request (default: ")
			.append(defaultProperties.getFetchTimeoutSeconds())
			.append(")\n");
		help.append("    --deadline SECONDS          Stop listing after this long and keep what was collected\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    KUBECONFIG                  Kubeconfig path when --kubeconfig is not given\n");
		help.append("                                (also read from a .env file)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    cluster-collector --kubeconfig ~/.kube/config\n");
		help.append("    cluster-collector -n default,kube-system -f both -c uncompressed\n");
		help.append("    cluster-collector --include-custom-resources --deadline 300\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  collection completed (individual failures are listed in the summary)\n");
		help.append("    1  invalid arguments, no cluster session, or the archive could not be written\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parsePositiveInt(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be positive");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.outputDirectory == null || config.outputDirectory.isBlank()) {
			errors.add("Output directory cannot be empty");
		}

		for (String namespace : config.namespaces) {
			if (!namespace.matches("[a-z0-9]([-a-z0-9]*[a-z0-9])?") || namespace.length() > 63) {
				errors.add("Invalid namespace name: " + namespace);
			}
		}

		if (config.concurrency > 64) {
			errors.add("Concurrency too large (got: " + config.concurrency + ", max: 64)");
		}

		if (config.rawMode && config.omitUnsanitized) {
			errors.add("--omit-unsanitized has no effect together with --raw");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
