package org.springaicommunity.github.trending.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.trending.*;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * GitHub Trending Spring Boot Application
 *
 * Same commands as {@link GitHubTrendingCli}, with the services wired by
 * {@link GitHubTrendingConfig} and settings taken from {@code github.trending.*}
 * properties.
 *
 * Usage: java -cp github-trending-cli.jar
 * org.springaicommunity.github.trending.cli.GitHubTrendingApp trending --since weekly
 */
@SpringBootApplication
@Import(GitHubTrendingConfig.class)
public class GitHubTrendingApp implements CommandLineRunner, ExitCodeGenerator {

	private static final Logger logger = LoggerFactory.getLogger(GitHubTrendingApp.class);

	private final TrendingPageParser pageParser;

	private final ReadmeResolver readmeResolver;

	private final GitHubTrendingTools tools;

	private final ArgumentParser argumentParser = new ArgumentParser();

	private int exitCode;

	public GitHubTrendingApp(TrendingPageParser pageParser, ReadmeResolver readmeResolver,
			GitHubTrendingTools tools) {
		this.pageParser = pageParser;
		this.readmeResolver = readmeResolver;
		this.tools = tools;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(GitHubTrendingApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		System.exit(SpringApplication.exit(app.run(args)));
	}

	@Override
	public void run(String... args) throws Exception {
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.out.println(argumentParser.generateHelpText());
			exitCode = TrendingCommandRunner.EXIT_USAGE;
			return;
		}

		if (config.verbose) {
			GitHubTrendingCli.enableDebugLogging();
		}
		exitCode = new TrendingCommandRunner(pageParser, readmeResolver, tools).execute(config, System.out);
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

}
