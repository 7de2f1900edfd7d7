package org.springaicommunity.github.trending;

/**
 * Exception thrown when a GitHub page cannot be fetched.
 *
 * <p>
 * Covers both transport failures (status code {@code -1}) and requests that completed
 * with an unacceptable status. Always carries the attempted URL so the failure can be
 * reported back to the caller.
 */
public class GitHubFetchException extends RuntimeException {

	private final String url;

	private final int statusCode;

	public GitHubFetchException(String url, int statusCode, String message) {
		super(message);
		this.url = url;
		this.statusCode = statusCode;
	}

	public GitHubFetchException(String url, String message, Throwable cause) {
		super(message, cause);
		this.url = url;
		this.statusCode = -1;
	}

	public String getUrl() {
		return url;
	}

	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * Returns true if no HTTP response was received at all.
	 */
	public boolean isTransportFailure() {
		return statusCode == -1;
	}

}
