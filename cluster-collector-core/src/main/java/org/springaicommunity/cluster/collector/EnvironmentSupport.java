package org.springaicommunity.cluster.collector;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.jspecify.annotations.Nullable;

import java.io.File;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves environment variables such as {@code KUBECONFIG}, checking {@code .env} files
 * as well as the process environment. The {@code .env} files are loaded once and cached
 * for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/**
	 * Variable naming the kubeconfig file when {@code --kubeconfig} is not given.
	 */
	public static final String KUBECONFIG = "KUBECONFIG";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	@Nullable
	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	@Nullable
	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
			.stream()
			.filter(entry -> entry.getKey().equals(name))
			.map(DotenvEntry::getValue)
			.findFirst()
			.orElse(null);
		if (value == null) {
			value = System.getenv(name);
		}
		if (value == null && HOME_DOTENV != null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Resolve the kubeconfig path from {@code KUBECONFIG}. Only the first entry of a
	 * path-separated list is used.
	 * @return the kubeconfig path, or empty if the variable is unset
	 */
	public static Optional<Path> kubeconfigPath() {
		String value = get(KUBECONFIG);
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String first = value.split(File.pathSeparator)[0].trim();
		return first.isEmpty() ? Optional.empty() : Optional.of(Path.of(first));
	}

}
