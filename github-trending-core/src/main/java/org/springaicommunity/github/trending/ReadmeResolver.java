package org.springaicommunity.github.trending;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves repository READMEs from the raw content host by probing candidate locations.
 *
 * <p>
 * Candidates are tried branch by branch in {@link TrendingProperties#getReadmeBranches()}
 * order, and within a branch in {@link TrendingProperties#getReadmeFilenames()} order.
 * The first candidate answering 200 wins. Any other status, and any transport failure,
 * is a miss. Content length is measured in code points.
 */
public class ReadmeResolver {

	private static final Logger logger = LoggerFactory.getLogger(ReadmeResolver.class);

	public static final String TRUNCATION_MARKER = "\n\n... [Content too long, truncated] ...";

	private final GitHubClient client;

	private final TrendingProperties properties;

	public ReadmeResolver(GitHubClient client, TrendingProperties properties) {
		this.client = client;
		this.properties = properties;
	}

	/**
	 * Resolve each repository in order. Blank identifiers are skipped and produce no
	 * result; a failure on one repository never stops the others.
	 * @param repositories repository identifiers in {@code owner/name} form
	 * @return one result per non-blank identifier, in input order
	 * @throws IllegalArgumentException if the list is empty
	 */
	public List<ReadmeLookupResult> resolveAll(List<String> repositories) {
		if (repositories.isEmpty()) {
			throw new IllegalArgumentException(
					"repositories parameter cannot be empty, please provide at least one repository name");
		}

		List<ReadmeLookupResult> results = new ArrayList<>();
		for (String repository : repositories) {
			String trimmed = repository.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			try {
				results.add(resolve(trimmed));
			}
			catch (RuntimeException e) {
				logger.warn("Failed to resolve README for {}: {}", trimmed, e.getMessage());
				results.add(ReadmeLookupResult.failed(trimmed, e.getMessage() != null ? e.getMessage() : e.toString()));
			}
		}
		return results;
	}

	/**
	 * Resolve the README of a single repository.
	 * @param repository identifier in {@code owner/name} form
	 * @return the lookup result; identifiers without {@code /} are rejected without any
	 * request
	 */
	public ReadmeLookupResult resolve(String repository) {
		String trimmed = repository.trim();
		if (!trimmed.contains("/")) {
			logger.debug("Rejecting malformed repository identifier '{}'", trimmed);
			return ReadmeLookupResult.invalidFormat(trimmed);
		}

		for (ReadmeCandidate candidate : candidates()) {
			String url = candidate.url(properties.getRawContentUrl(), trimmed);
			try {
				FetchResponse response = client.get(url, properties.getReadmeTimeout());
				if (response.isOk()) {
					logger.info("Found README for {} at {}", trimmed, url);
					return found(trimmed, url, response.body());
				}
				if (response.statusCode() == 404) {
					logger.debug("README miss {} (HTTP 404)", url);
				}
				else {
					logger.warn("README miss {} (HTTP {})", url, response.statusCode());
				}
			}
			catch (RuntimeException e) {
				logger.warn("README miss {} ({})", url, e.getMessage());
			}
		}

		logger.info("No README found for {}", trimmed);
		return ReadmeLookupResult.notFound(trimmed, properties.getReadmeBranches(), properties.getReadmeFilenames());
	}

	/**
	 * Returns the candidate locations in probing order: branches outer, filenames inner.
	 */
	public List<ReadmeCandidate> candidates() {
		List<ReadmeCandidate> candidates = new ArrayList<>();
		for (String branch : properties.getReadmeBranches()) {
			for (String filename : properties.getReadmeFilenames()) {
				candidates.add(new ReadmeCandidate(branch, filename));
			}
		}
		return candidates;
	}

	private ReadmeLookupResult found(String repository, String url, String content) {
		int maxLength = properties.getMaxReadmeLength();
		int length = content.codePointCount(0, content.length());
		if (length > maxLength) {
			logger.debug("Truncating README of {} from {} to {} characters", repository, length, maxLength);
			String kept = content.substring(0, content.offsetByCodePoints(0, maxLength));
			return ReadmeLookupResult.found(repository, url, kept + TRUNCATION_MARKER, true);
		}
		return ReadmeLookupResult.found(repository, url, content, false);
	}

}
