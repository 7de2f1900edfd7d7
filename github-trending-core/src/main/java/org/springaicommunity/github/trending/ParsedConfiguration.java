package org.springaicommunity.github.trending;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// trending or readme
	@Nullable
	public String command;

	// Trending options
	public String since = TrendingPeriod.DAILY.value();

	public String language = "";

	// README options
	public List<String> repositories = new ArrayList<>();

	// Output
	public String format = "text"; // text or json

	public boolean verbose = false;

	public boolean helpRequested = false;

	public boolean isTrending() {
		return ArgumentParser.TRENDING_COMMAND.equals(command);
	}

	public boolean isJson() {
		return "json".equals(format);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", since='" + since + '\'' + ", language='"
				+ language + '\'' + ", repositories=" + repositories + ", format='" + format + '\'' + ", verbose="
				+ verbose + ", helpRequested=" + helpRequested + '}';
	}

}
