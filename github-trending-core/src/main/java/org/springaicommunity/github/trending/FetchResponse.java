package org.springaicommunity.github.trending;

/**
 * Outcome of a completed HTTP request.
 *
 * @param url the requested URL
 * @param statusCode the HTTP status code
 * @param body the response body decoded as a string
 */
public record FetchResponse(String url, int statusCode, String body) {

	/**
	 * Returns true for any 2xx status.
	 * @return whether the request succeeded
	 */
	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

	/**
	 * Returns true only for status 200.
	 * @return whether the response is a plain OK
	 */
	public boolean isOk() {
		return statusCode == 200;
	}

}
