package org.springaicommunity.github.trending;

/**
 * Thrown when the trending page was fetched successfully but contained no project
 * fragments. Either the period is genuinely empty or the page layout changed.
 */
public class NoTrendingEntriesException extends RuntimeException {

	private final String url;

	public NoTrendingEntriesException(String url) {
		super("No trending projects found at " + url);
		this.url = url;
	}

	public String getUrl() {
		return url;
	}

}
