package org.springaicommunity.github.trending;

import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches the GitHub trending page for a {@link TrendingQuery} and turns every project
 * fragment into a {@link TrendingEntry}, in listing order.
 *
 * <p>
 * A fragment that cannot be extracted is recorded as a skip note and never aborts the
 * page.
 */
public class TrendingPageParser {

	private static final Logger logger = LoggerFactory.getLogger(TrendingPageParser.class);

	static final String FRAGMENT_SELECTOR = "article.Box-row";

	private final GitHubClient client;

	private final TrendingEntryExtractor extractor;

	private final TrendingProperties properties;

	public TrendingPageParser(GitHubClient client, TrendingEntryExtractor extractor, TrendingProperties properties) {
		this.client = client;
		this.extractor = extractor;
		this.properties = properties;
	}

	/**
	 * Validate raw arguments, then fetch and parse the page.
	 * @param since time window value
	 * @param language optional language filter
	 * @return the parsed page
	 * @throws IllegalArgumentException if {@code since} is invalid; nothing is fetched
	 * @throws GitHubFetchException on transport failure or non-2xx status
	 * @throws NoTrendingEntriesException if the page holds no project fragments
	 */
	public TrendingPage parse(String since, @Nullable String language) {
		return parse(TrendingQuery.of(since, language));
	}

	/**
	 * Fetch and parse the trending page for a validated query.
	 * @param query the query
	 * @return the parsed page
	 * @throws GitHubFetchException on transport failure or non-2xx status
	 * @throws NoTrendingEntriesException if the page holds no project fragments
	 */
	public TrendingPage parse(TrendingQuery query) {
		String url = buildUrl(query);
		logger.info("Fetching trending repositories: {}", url);

		FetchResponse response = client.get(url, properties.getTrendingTimeout());
		if (!response.isSuccessful()) {
			throw new GitHubFetchException(url, response.statusCode(),
					"GitHub returned HTTP " + response.statusCode() + " for " + url);
		}

		TrendingPage page = parseDocument(response.body(), query, url);
		logger.info("Extracted {} of {} trending projects ({} skipped)", page.entries().size(), page.fragmentCount(),
				page.skipNotes().size());
		return page;
	}

	/**
	 * Build the listing URL: {@code /trending/{language}?since=...} when filtered,
	 * {@code /trending?since=...} otherwise.
	 * @param query the query
	 * @return the absolute URL
	 */
	public String buildUrl(TrendingQuery query) {
		StringBuilder url = new StringBuilder(properties.getSiteUrl()).append("/trending");
		if (query.hasLanguageFilter()) {
			url.append('/').append(encodePathSegment(query.languageSlug()));
		}
		return url.append("?since=").append(query.since().value()).toString();
	}

	TrendingPage parseDocument(String html, TrendingQuery query, String url) {
		Document document = Jsoup.parse(html, properties.getSiteUrl());
		Elements fragments = document.select(FRAGMENT_SELECTOR);
		if (fragments.isEmpty()) {
			logger.warn("No project fragments found at {}", url);
			throw new NoTrendingEntriesException(url);
		}

		List<TrendingEntry> entries = new ArrayList<>();
		List<String> skipNotes = new ArrayList<>();
		int position = 0;
		for (Element fragment : fragments) {
			position++;
			try {
				Optional<TrendingEntry> entry = extractor.extract(fragment, query.since());
				if (entry.isPresent()) {
					entries.add(entry.get());
				}
				else {
					logger.warn("Skipping project {}: no title link", position);
					skipNotes.add("Skipped project " + position + ": no title link found");
				}
			}
			catch (RuntimeException e) {
				logger.warn("Skipping project {}: {}", position, e.getMessage());
				skipNotes.add("Skipped project " + position + ": " + e.getMessage());
			}
		}
		return new TrendingPage(query, url, fragments.size(), entries, skipNotes);
	}

	private static String encodePathSegment(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}

}
