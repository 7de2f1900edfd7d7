package org.springaicommunity.github.trending.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.trending.*;

import java.io.PrintStream;

/**
 * GitHub Trending CLI Application
 *
 * Plain Java command-line application to list trending GitHub repositories and print
 * repository READMEs. No Spring dependencies - uses GitHubTrendingBuilder for service
 * wiring. Reports go to stdout, logs to stderr.
 *
 * Usage: java -jar github-trending-cli.jar <trending|readme> [OPTIONS]
 *
 * Examples: java -jar github-trending-cli.jar trending --since weekly --language java
 * java -jar github-trending-cli.jar readme spring-projects/spring-ai java -jar
 * github-trending-cli.jar trending --format json
 */
public class GitHubTrendingCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubTrendingCli.class);

	static final int EXIT_USAGE = TrendingCommandRunner.EXIT_USAGE;

	static final int EXIT_FETCH_FAILED = TrendingCommandRunner.EXIT_FETCH_FAILED;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Command failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, System.out,
				GitHubTrendingBuilder.create().properties(TrendingProperties.fromEnvironment()));
	}

	static int run(String[] args, PrintStream out, GitHubTrendingBuilder builder) throws Exception {
		ArgumentParser argumentParser = new ArgumentParser();

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			out.println(argumentParser.generateHelpText());
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableDebugLogging();
		}

		TrendingCommandRunner runner = new TrendingCommandRunner(builder.buildPageParser(),
				builder.buildReadmeResolver(), builder.buildTools());
		return runner.execute(config, out);
	}

	static void enableDebugLogging() {
		org.slf4j.Logger packageLogger = LoggerFactory.getLogger("org.springaicommunity.github.trending");
		if (packageLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

}
