package org.springaicommunity.github.trending;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the trending CLI. Pure Java implementation with no
 * Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	public static final String TRENDING_COMMAND = "trending";

	public static final String README_COMMAND = "readme";

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-s", "--since":
					config.since = getRequiredValue(args, i, "since");
					i++;
					break;

				case "-l", "--language":
					config.language = getRequiredValue(args, i, "language");
					i++;
					break;

				case "-f", "--format":
					String format = getRequiredValue(args, i, "format").toLowerCase();
					if (!List.of("text", "json").contains(format)) {
						throw new IllegalArgumentException("Invalid format '" + format + "': must be 'text' or 'json'");
					}
					config.format = format;
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
					if (config.command == null) {
						config.command = arg;
					}
					else {
						config.repositories.add(arg);
					}
					break;
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
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: trending.java <command> [OPTIONS] [REPOSITORIES...]\n");
		help.append("\n");
		help.append("Discover trending GitHub repositories and read their README files.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    trending                List trending repositories\n");
		help.append("    readme REPO [REPO...]   Print the README of each owner/repo\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -s, --since <period>    Time range: ")
			.append(TrendingPeriod.validValues())
			.append(" (default: daily)\n");
		help.append("    -l, --language <lang>   Programming language filter, e.g. python (default: all)\n");
		help.append("    -f, --format <format>   Output format: text, json (default: text)\n");
		help.append("    -v, --verbose           Enable debug logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TRENDING_USER_AGENT        User-Agent header (default: github-trending)\n");
		help.append("    GITHUB_TRENDING_TIMEOUT_SECONDS   Trending page timeout (default: 30)\n");
		help.append("    GITHUB_README_TIMEOUT_SECONDS     Timeout per README candidate (default: 20)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    ./trending.java trending\n");
		help.append("    ./trending.java trending --since weekly --language java\n");
		help.append("    ./trending.java readme spring-projects/spring-ai openai/openai-python\n");
		help.append("    ./trending.java trending --format json > trending.json\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}

		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("Command is required ('" + TRENDING_COMMAND + "' or '" + README_COMMAND + "')");
		}
		else if (TRENDING_COMMAND.equals(config.command)) {
			try {
				TrendingPeriod.fromValue(config.since);
			}
			catch (IllegalArgumentException e) {
				errors.add(e.getMessage());
			}
			if (!config.repositories.isEmpty()) {
				errors.add("Unexpected arguments for trending: " + config.repositories);
			}
		}
		else if (README_COMMAND.equals(config.command)) {
			if (config.repositories.isEmpty()) {
				errors.add("At least one repository (owner/repo) is required");
			}
		}
		else {
			errors.add("Unknown command: " + config.command + " (must be '" + TRENDING_COMMAND + "' or '"
					+ README_COMMAND + "')");
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
