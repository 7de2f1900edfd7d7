package org.springaicommunity.github.trending;

/**
 * One project listed on the trending page.
 *
 * <p>
 * Counts are kept as display strings (e.g. {@code "12,345"}) exactly as GitHub renders
 * them.
 *
 * @param title repository title, whitespace collapsed (e.g. "spring-projects / spring-ai")
 * @param projectUrl absolute repository URL
 * @param description repository description or {@link #NO_DESCRIPTION}
 * @param primaryLanguage primary language or {@link #UNKNOWN_LANGUAGE}
 * @param totalStars lifetime star count
 * @param totalForks fork count
 * @param periodStars stars gained within the requested period
 */
public record TrendingEntry(String title, String projectUrl, String description, String primaryLanguage,
		String totalStars, String totalForks, String periodStars) {

	public static final String NO_DESCRIPTION = "No description";

	public static final String UNKNOWN_LANGUAGE = "Unknown";

	public static final String ZERO_COUNT = "0";

}
