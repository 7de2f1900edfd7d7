package org.springaicommunity.github.trending;

import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for creating trending services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults, with overrides from the environment
 * GitHubTrendingTools tools = GitHubTrendingBuilder.create()
 *     .properties(TrendingProperties.fromEnvironment())
 *     .buildTools();
 *
 * String report = tools.getGitHubTrending("weekly", "java");
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * ReadmeResolver resolver = GitHubTrendingBuilder.create()
 *     .httpClient(mockClient)
 *     .buildReadmeResolver();
 * }
 * </pre>
 */
public class GitHubTrendingBuilder {

	private TrendingProperties properties;

	private @Nullable GitHubClient httpClient;

	private Clock clock;

	private GitHubTrendingBuilder() {
		this.properties = new TrendingProperties();
		this.clock = Clock.systemDefaultZone();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubTrendingBuilder
	 */
	public static GitHubTrendingBuilder create() {
		return new GitHubTrendingBuilder();
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubTrendingBuilder properties(@Nullable TrendingProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or stub
	 * transports.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubTrendingBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the clock used for report dates.
	 * @param clock clock (null to use the system clock)
	 * @return this builder
	 */
	public GitHubTrendingBuilder clock(@Nullable Clock clock) {
		if (clock != null) {
			this.clock = clock;
		}
		return this;
	}

	public TrendingPageParser buildPageParser() {
		return new TrendingPageParser(client(), new TrendingEntryExtractor(properties.getSiteUrl()), properties);
	}

	public ReadmeResolver buildReadmeResolver() {
		return new ReadmeResolver(client(), properties);
	}

	public ReportFormatter buildReportFormatter() {
		return new ReportFormatter(clock);
	}

	/**
	 * Build the tool boundary with all services sharing one HTTP client.
	 * @return configured GitHubTrendingTools
	 */
	public GitHubTrendingTools buildTools() {
		GitHubClient client = client();
		return new GitHubTrendingTools(
				new TrendingPageParser(client, new TrendingEntryExtractor(properties.getSiteUrl()), properties),
				new ReadmeResolver(client, properties), buildReportFormatter());
	}

	private GitHubClient client() {
		if (httpClient == null) {
			httpClient = new GitHubHttpClient(properties);
		}
		return httpClient;
	}

}
