package org.springaicommunity.cluster.collector;

import java.util.List;
import java.util.Locale;

/**
 * Serialization formats written for every record and report.
 */
public enum OutputFormat {

	JSON(List.of("json")), YAML(List.of("yaml")), BOTH(List.of("json", "yaml"));

	private final List<String> extensions;

	OutputFormat(List<String> extensions) {
		this.extensions = extensions;
	}

	/**
	 * File extensions written for this format, in write order.
	 */
	public List<String> extensions() {
		return extensions;
	}

	public static OutputFormat parse(String value) {
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "json" -> JSON;
			case "yaml", "yml" -> YAML;
			case "both" -> BOTH;
			default -> throw new IllegalArgumentException(
					"Invalid format '" + value + "': must be 'json', 'yaml', or 'both'");
		};
	}

}
