package org.springaicommunity.github.trending.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.trending.*;

import java.io.PrintStream;
import java.util.List;

/**
 * Executes one parsed command against the trending services and prints the result.
 * Shared by the plain-Java and Spring Boot entry points.
 */
class TrendingCommandRunner {

	private static final Logger logger = LoggerFactory.getLogger(TrendingCommandRunner.class);

	static final int EXIT_OK = 0;

	static final int EXIT_USAGE = 1;

	static final int EXIT_FETCH_FAILED = 2;

	private final TrendingPageParser pageParser;

	private final ReadmeResolver readmeResolver;

	private final GitHubTrendingTools tools;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	TrendingCommandRunner(TrendingPageParser pageParser, ReadmeResolver readmeResolver, GitHubTrendingTools tools) {
		this.pageParser = pageParser;
		this.readmeResolver = readmeResolver;
		this.tools = tools;
	}

	int execute(ParsedConfiguration config, PrintStream out) throws JsonProcessingException {
		logger.debug("Configuration: {}", config);

		if (config.isJson()) {
			return executeJson(config, out);
		}

		String report = config.isTrending() ? tools.getGitHubTrending(config.since, config.language)
				: tools.getRepositoryReadme(config.repositories);
		out.println(report);
		return EXIT_OK;
	}

	private int executeJson(ParsedConfiguration config, PrintStream out) throws JsonProcessingException {
		if (!config.isTrending()) {
			List<ReadmeLookupResult> results = readmeResolver.resolveAll(config.repositories);
			out.println(objectMapper.writeValueAsString(results));
			return EXIT_OK;
		}

		try {
			TrendingPage page = pageParser.parse(config.since, config.language);
			out.println(objectMapper.writeValueAsString(page));
			return EXIT_OK;
		}
		catch (GitHubFetchException e) {
			logger.error("Network request error: {} (URL: {})", e.getMessage(), e.getUrl());
			return EXIT_FETCH_FAILED;
		}
		catch (NoTrendingEntriesException e) {
			logger.error("No trending projects found, possible page structure change (URL: {})", e.getUrl());
			return EXIT_FETCH_FAILED;
		}
	}

}
