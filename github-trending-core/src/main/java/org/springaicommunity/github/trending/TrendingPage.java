package org.springaicommunity.github.trending;

import java.util.List;

/**
 * Result of parsing one trending listing page.
 *
 * @param query the query that produced the page
 * @param url the URL that was fetched
 * @param fragmentCount number of project fragments found on the page
 * @param entries extracted entries in listing order
 * @param skipNotes one note per fragment that could not be turned into an entry
 */
public record TrendingPage(TrendingQuery query, String url, int fragmentCount, List<TrendingEntry> entries,
		List<String> skipNotes) {

	public TrendingPage {
		entries = List.copyOf(entries);
		skipNotes = List.copyOf(skipNotes);
	}

}
