package org.springaicommunity.github.watcher;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables from {@code .env} files and the process environment.
 * The {@code .env} files are loaded once and cached for the lifetime of the process.
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

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name, null);
		if (isBlank(value)) {
			value = System.getenv(name);
		}
		if (isBlank(value)) {
			value = HOME_DOTENV.get(name, null);
		}
		return isBlank(value) ? null : value;
	}

	/**
	 * Get the GitHub token.
	 * @return the token
	 * @throws IllegalStateException if {@code GITHUB_TOKEN} is not set anywhere
	 */
	public static String requireGitHubToken() {
		String token = get("GITHUB_TOKEN");
		if (token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
		return token;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.trim().isEmpty();
	}

}
