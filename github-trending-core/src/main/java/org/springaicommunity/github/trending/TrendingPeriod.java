package org.springaicommunity.github.trending;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Time window of the trending listing.
 */
public enum TrendingPeriod {

	DAILY("daily", "Today", "today"),

	WEEKLY("weekly", "This Week", "this week"),

	MONTHLY("monthly", "This Month", "this month");

	private final String value;

	private final String displayName;

	private final String windowPhrase;

	TrendingPeriod(String value, String displayName, String windowPhrase) {
		this.value = value;
		this.displayName = displayName;
		this.windowPhrase = windowPhrase;
	}

	/**
	 * Returns the value used in the {@code since} query parameter.
	 */
	public String value() {
		return value;
	}

	/**
	 * Returns the label shown in reports (e.g. "This Week").
	 */
	public String displayName() {
		return displayName;
	}

	/**
	 * Returns the lower-case phrase GitHub prints next to the period star count (e.g.
	 * "1,234 stars this week").
	 */
	public String windowPhrase() {
		return windowPhrase;
	}

	/**
	 * Resolve a period from its query parameter value. Matching is exact.
	 * @param value one of {@code daily}, {@code weekly}, {@code monthly}
	 * @return the matching period
	 * @throws IllegalArgumentException if the value is not recognized
	 */
	public static TrendingPeriod fromValue(String value) {
		for (TrendingPeriod period : values()) {
			if (period.value.equals(value)) {
				return period;
			}
		}
		throw new IllegalArgumentException("since parameter must be one of: " + validValues());
	}

	/**
	 * Returns the accepted values, comma separated, in declaration order.
	 */
	public static String validValues() {
		return Arrays.stream(values()).map(TrendingPeriod::value).collect(Collectors.joining(", "));
	}

}
