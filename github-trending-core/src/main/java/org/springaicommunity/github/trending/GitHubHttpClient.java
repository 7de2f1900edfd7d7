package org.springaicommunity.github.trending;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Simple HTTP client wrapper for GitHub pages using Java 11+ HttpClient.
 *
 * <p>
 * Unauthenticated. Every status code is handed back to the caller; only transport
 * failures raise {@link GitHubFetchException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private final HttpClient httpClient;

	private final String userAgent;

	public GitHubHttpClient(TrendingProperties properties) {
		this(properties.getUserAgent(), properties.getConnectTimeout());
	}

	public GitHubHttpClient(String userAgent, Duration connectTimeout) {
		this.userAgent = userAgent;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public FetchResponse get(String url, Duration timeout) {
		logger.debug("GET {} (timeout {}s)", url, timeout.toSeconds());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(timeout)
			.header("User-Agent", userAgent)
			.header("Accept", "text/html,text/plain;q=0.9,*/*;q=0.8")
			.GET()
			.build();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			logger.debug("GET {} returned {} in {}ms ({} chars)", url, response.statusCode(),
					System.currentTimeMillis() - start, response.body().length());
			return new FetchResponse(url, response.statusCode(), response.body());
		}
		catch (HttpTimeoutException e) {
			logger.debug("GET {} timed out after {}ms", url, System.currentTimeMillis() - start);
			throw new GitHubFetchException(url, "Request timed out after " + timeout.toSeconds() + "s", e);
		}
		catch (IOException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw new GitHubFetchException(url, "HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubFetchException(url, "HTTP request interrupted", e);
		}
	}

}
