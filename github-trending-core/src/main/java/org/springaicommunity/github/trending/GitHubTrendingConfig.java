package org.springaicommunity.github.trending;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the trending services. Settings are read from
 * {@code github.trending.*} properties and fall back to the {@link TrendingProperties}
 * defaults.
 */
@Configuration
public class GitHubTrendingConfig {

	@Bean
	public TrendingProperties trendingProperties(
			@Value("${github.trending.user-agent:github-trending}") String userAgent,
			@Value("${github.trending.timeout-seconds:30}") long trendingTimeoutSeconds,
			@Value("${github.trending.readme-timeout-seconds:20}") long readmeTimeoutSeconds,
			@Value("${github.trending.max-readme-length:50000}") int maxReadmeLength) {
		TrendingProperties properties = new TrendingProperties();
		properties.setUserAgent(userAgent);
		properties.setTrendingTimeout(Duration.ofSeconds(trendingTimeoutSeconds));
		properties.setReadmeTimeout(Duration.ofSeconds(readmeTimeoutSeconds));
		properties.setMaxReadmeLength(maxReadmeLength);
		return properties;
	}

	@Bean
	public GitHubClient gitHubClient(TrendingProperties properties) {
		return new GitHubHttpClient(properties);
	}

	@Bean
	public TrendingPageParser trendingPageParser(GitHubClient gitHubClient, TrendingProperties properties) {
		return new TrendingPageParser(gitHubClient, new TrendingEntryExtractor(properties.getSiteUrl()), properties);
	}

	@Bean
	public ReadmeResolver readmeResolver(GitHubClient gitHubClient, TrendingProperties properties) {
		return new ReadmeResolver(gitHubClient, properties);
	}

	@Bean
	public ReportFormatter reportFormatter() {
		return new ReportFormatter(Clock.systemDefaultZone());
	}

	@Bean
	public GitHubTrendingTools gitHubTrendingTools(TrendingPageParser trendingPageParser,
			ReadmeResolver readmeResolver, ReportFormatter reportFormatter) {
		return new GitHubTrendingTools(trendingPageParser, readmeResolver, reportFormatter);
	}

}
