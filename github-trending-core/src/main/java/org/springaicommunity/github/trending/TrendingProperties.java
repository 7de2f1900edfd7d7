package org.springaicommunity.github.trending;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for trending discovery and README resolution.
 *
 * <p>
 * Properties can be set directly via setters, loaded from the environment with
 * {@link #fromEnvironment()}, or passed to {@link GitHubTrendingBuilder}.
 *
 * <p>
 * Default values match github.com and are suitable for most use cases. The branch and
 * filename lists are ordered: earlier entries are probed first.
 */
public class TrendingProperties {

	static final String USER_AGENT_ENV = "GITHUB_TRENDING_USER_AGENT";

	static final String TRENDING_TIMEOUT_ENV = "GITHUB_TRENDING_TIMEOUT_SECONDS";

	static final String README_TIMEOUT_ENV = "GITHUB_README_TIMEOUT_SECONDS";

	/**
	 * Base URL of the site hosting the trending page, also used to resolve project links.
	 */
	private String siteUrl = "https://github.com";

	/**
	 * Base URL of the raw content host.
	 */
	private String rawContentUrl = "https://raw.githubusercontent.com";

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "github-trending";

	/**
	 * Connection establishment timeout.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Bound for the trending page request.
	 */
	private Duration trendingTimeout = Duration.ofSeconds(30);

	/**
	 * Bound for each README candidate request.
	 */
	private Duration readmeTimeout = Duration.ofSeconds(20);

	/**
	 * README content longer than this many characters is truncated.
	 */
	private int maxReadmeLength = 50_000;

	/**
	 * Branches probed for a README, in priority order.
	 */
	private List<String> readmeBranches = new ArrayList<>(List.of("main", "master"));

	/**
	 * README file names probed on each branch, in priority order.
	 */
	private List<String> readmeFilenames = new ArrayList<>(
			List.of("README.md", "readme.md", "Readme.md", "README.txt", "readme.txt"));

	/**
	 * Create properties with defaults, overridden by {@code GITHUB_TRENDING_USER_AGENT},
	 * {@code GITHUB_TRENDING_TIMEOUT_SECONDS} and {@code GITHUB_README_TIMEOUT_SECONDS}
	 * when present in a {@code .env} file or the environment.
	 * @return configured properties
	 * @throws IllegalStateException if a timeout variable is not a positive integer
	 */
	public static TrendingProperties fromEnvironment() {
		TrendingProperties properties = new TrendingProperties();
		String userAgent = EnvironmentSupport.get(USER_AGENT_ENV);
		if (userAgent != null && !userAgent.isBlank()) {
			properties.setUserAgent(userAgent.trim());
		}
		Duration trendingTimeout = EnvironmentSupport.getSeconds(TRENDING_TIMEOUT_ENV);
		if (trendingTimeout != null) {
			properties.setTrendingTimeout(trendingTimeout);
		}
		Duration readmeTimeout = EnvironmentSupport.getSeconds(README_TIMEOUT_ENV);
		if (readmeTimeout != null) {
			properties.setReadmeTimeout(readmeTimeout);
		}
		return properties;
	}

	public String getSiteUrl() {
		return siteUrl;
	}

	public void setSiteUrl(String siteUrl) {
		this.siteUrl = stripTrailingSlash(siteUrl);
	}

	public String getRawContentUrl() {
		return rawContentUrl;
	}

	public void setRawContentUrl(String rawContentUrl) {
		this.rawContentUrl = stripTrailingSlash(rawContentUrl);
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getTrendingTimeout() {
		return trendingTimeout;
	}

	public void setTrendingTimeout(Duration trendingTimeout) {
		this.trendingTimeout = trendingTimeout;
	}

	public Duration getReadmeTimeout() {
		return readmeTimeout;
	}

	public void setReadmeTimeout(Duration readmeTimeout) {
		this.readmeTimeout = readmeTimeout;
	}

	public int getMaxReadmeLength() {
		return maxReadmeLength;
	}

	public void setMaxReadmeLength(int maxReadmeLength) {
		if (maxReadmeLength <= 0) {
			throw new IllegalArgumentException("Max README length must be positive: " + maxReadmeLength);
		}
		this.maxReadmeLength = maxReadmeLength;
	}

	public List<String> getReadmeBranches() {
		return readmeBranches;
	}

	public void setReadmeBranches(List<String> readmeBranches) {
		this.readmeBranches = new ArrayList<>(readmeBranches);
	}

	public List<String> getReadmeFilenames() {
		return readmeFilenames;
	}

	public void setReadmeFilenames(List<String> readmeFilenames) {
		this.readmeFilenames = new ArrayList<>(readmeFilenames);
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}
