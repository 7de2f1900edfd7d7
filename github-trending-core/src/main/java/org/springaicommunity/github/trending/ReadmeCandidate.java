package org.springaicommunity.github.trending;

/**
 * One (branch, filename) location probed while resolving a README.
 *
 * @param branch branch name, e.g. {@code main}
 * @param filename file name, e.g. {@code README.md}
 */
public record ReadmeCandidate(String branch, String filename) {

	/**
	 * Build the raw content URL of this candidate.
	 * @param rawContentUrl base URL of the raw content host, without trailing slash
	 * @param repository repository in {@code owner/name} form
	 * @return the fully qualified location
	 */
	public String url(String rawContentUrl, String repository) {
		return rawContentUrl + "/" + repository + "/refs/heads/" + branch + "/" + filename;
	}

}
