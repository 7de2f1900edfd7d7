package org.springaicommunity.github.trending;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Parameters of one trending lookup.
 *
 * @param since the time window
 * @param language language filter as supplied, trimmed; empty for all languages
 */
public record TrendingQuery(TrendingPeriod since, String language) {

	public TrendingQuery {
		language = language.trim();
	}

	/**
	 * Validate raw caller arguments and build a query.
	 * @param since time window value, see {@link TrendingPeriod#fromValue(String)}
	 * @param language optional language filter
	 * @return the validated query
	 * @throws IllegalArgumentException if {@code since} is not a known period
	 */
	public static TrendingQuery of(String since, @Nullable String language) {
		return new TrendingQuery(TrendingPeriod.fromValue(since), language != null ? language : "");
	}

	public boolean hasLanguageFilter() {
		return !language.isEmpty();
	}

	/**
	 * Returns the lower-cased language used in the listing path.
	 */
	public String languageSlug() {
		return language.toLowerCase(Locale.ROOT);
	}

}
