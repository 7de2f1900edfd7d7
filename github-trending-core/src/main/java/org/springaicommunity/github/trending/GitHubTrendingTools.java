package org.springaicommunity.github.trending;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry points exposed to an assistant tool-invocation layer.
 *
 * <p>
 * Both operations always return a text report. Validation errors, fetch failures and
 * empty results are rendered as prefixed lines; nothing is thrown to the caller.
 */
public class GitHubTrendingTools {

	private static final Logger logger = LoggerFactory.getLogger(GitHubTrendingTools.class);

	private final TrendingPageParser pageParser;

	private final ReadmeResolver readmeResolver;

	private final ReportFormatter formatter;

	public GitHubTrendingTools(TrendingPageParser pageParser, ReadmeResolver readmeResolver,
			ReportFormatter formatter) {
		this.pageParser = pageParser;
		this.readmeResolver = readmeResolver;
		this.formatter = formatter;
	}

	/**
	 * Get GitHub trending repositories.
	 * @param since one of {@code daily}, {@code weekly}, {@code monthly}
	 * @param language optional language filter, e.g. {@code python}
	 * @return the report
	 */
	public String getGitHubTrending(String since, @Nullable String language) {
		TrendingQuery query;
		try {
			query = TrendingQuery.of(since, language);
		}
		catch (IllegalArgumentException e) {
			return formatter.formatInvalidArgument(e.getMessage());
		}

		String url = pageParser.buildUrl(query);
		try {
			return formatter.formatTrending(pageParser.parse(query));
		}
		catch (GitHubFetchException e) {
			logger.warn("Trending fetch failed: {}", e.getMessage());
			return formatter.formatFetchError(e);
		}
		catch (NoTrendingEntriesException e) {
			return formatter.formatNoEntries(e);
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure while reading {}", url, e);
			return formatter.formatUnexpectedError(url, e);
		}
	}

	/**
	 * Get README content for the given repositories.
	 * @param repositories repository identifiers in {@code owner/name} form
	 * @return the report
	 */
	public String getRepositoryReadme(List<String> repositories) {
		try {
			return formatter.formatReadmes(readmeResolver.resolveAll(repositories));
		}
		catch (IllegalArgumentException e) {
			return formatter.formatInvalidArgument(e.getMessage());
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure while resolving READMEs for {}", repositories, e);
			return ReportFormatter.ERROR_PREFIX + "Program execution error: " + e.getMessage();
		}
	}

}
