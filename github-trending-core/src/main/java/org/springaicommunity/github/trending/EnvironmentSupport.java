package org.springaicommunity.github.trending;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Resolves environment variables by checking a {@code .env} file first, then falling back
 * to the system environment. The {@code .env} files are loaded once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable</li>
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
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Get an environment variable holding a whole number of seconds.
	 * @param name the variable name
	 * @return the duration, or {@code null} if the variable is not set
	 * @throws IllegalStateException if the value is not a positive integer
	 */
	@Nullable
	public static Duration getSeconds(String name) {
		String value = get(name);
		if (value == null || value.isBlank()) {
			return null;
		}
		return parseSeconds(name, value);
	}

	static Duration parseSeconds(String name, String value) {
		try {
			long seconds = Long.parseLong(value.trim());
			if (seconds <= 0) {
				throw new IllegalStateException(name + " must be a positive number of seconds (got: " + value + ")");
			}
			return Duration.ofSeconds(seconds);
		}
		catch (NumberFormatException e) {
			throw new IllegalStateException(name + " must be a positive number of seconds (got: " + value + ")", e);
		}
	}

}
