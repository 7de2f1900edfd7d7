package org.springaicommunity.github.trending;

import java.time.Duration;

/**
 * Interface for plain HTTP reads against GitHub-hosted content.
 *
 * <p>
 * Provides abstraction over the trending listing page and the raw content endpoint,
 * enabling testability with stub transports.
 */
public interface GitHubClient {

	/**
	 * Execute a single GET request bounded by the given timeout. No retries are made.
	 * @param url absolute URL to fetch
	 * @param timeout upper bound for the whole request
	 * @return the status code and body, whatever the status
	 * @throws GitHubFetchException if the request could not be completed (DNS, connect,
	 * timeout, interruption)
	 */
	FetchResponse get(String url, Duration timeout);

}
