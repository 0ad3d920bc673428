package org.springaicommunity.cluster.collector;

import java.util.Locale;

/**
 * Which artifacts a run leaves behind: the compressed archive, the uncompressed tree, or
 * both.
 */
public enum CompressionMode {

	COMPRESSED, UNCOMPRESSED, BOTH;

	public boolean createsArchive() {
		return this != UNCOMPRESSED;
	}

	public boolean keepsTree() {
		return this != COMPRESSED;
	}

	public static CompressionMode parse(String value) {
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "compressed" -> COMPRESSED;
			case "uncompressed" -> UNCOMPRESSED;
			case "both" -> BOTH;
			default -> throw new IllegalArgumentException(
					"Invalid compression '" + value + "': must be 'compressed', 'uncompressed', or 'both'");
		};
	}

}
