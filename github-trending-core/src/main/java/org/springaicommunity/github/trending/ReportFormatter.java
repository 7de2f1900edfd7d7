package org.springaicommunity.github.trending;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders trending pages, README lookups and their failures as plain text reports.
 */
public class ReportFormatter {

	static final String ERROR_PREFIX = "❌ ";

	private final Clock clock;

	public ReportFormatter(Clock clock) {
		this.clock = clock;
	}

	public String formatTrending(TrendingPage page) {
		LocalDate today = LocalDate.now(clock);
		TrendingQuery query = page.query();
		String periodLabel = query.since().displayName();

		List<String> lines = new ArrayList<>();
		lines.add("🌟 GitHub Trending Repositories");
		lines.add("📅 Retrieved on: " + today.format(DateTimeFormatter.ISO_LOCAL_DATE) + " "
				+ today.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
		lines.add("⏰ Time Range: " + periodLabel);
		if (query.hasLanguageFilter()) {
			lines.add("💻 Language: " + query.language());
		}
		lines.add("📊 Found " + page.fragmentCount() + " trending projects");
		lines.add("");

		int position = 1;
		for (TrendingEntry entry : page.entries()) {
			lines.add(position++ + ". " + entry.title());
			lines.add("   🔗 " + entry.projectUrl());
			lines.add("   📝 " + entry.description());
			lines.add("   💻 Language: " + entry.primaryLanguage() + " | ⭐ Total Stars: " + entry.totalStars()
					+ " | 🍴 Forks: " + entry.totalForks() + " | 🔥 " + periodLabel + ": +" + entry.periodStars());
		}
		for (String note : page.skipNotes()) {
			lines.add("⚠️ " + note);
		}

		lines.add("");
		lines.add("💡 Suggested next steps:");
		lines.add("1. Analyze GitHub trending project trends");
		lines.add("2. If interested in specific projects, "
				+ "use get_repository_readme tool to get detailed documentation");
		return String.join("\n", lines);
	}

	public String formatInvalidArgument(String message) {
		return ERROR_PREFIX + "Error: " + message;
	}

	public String formatFetchError(GitHubFetchException e) {
		return ERROR_PREFIX + "Network request error: " + e.getMessage() + "\nRequested URL: " + e.getUrl()
				+ "\nSuggest checking network connection or retry later";
	}

	public String formatNoEntries(NoTrendingEntriesException e) {
		return ERROR_PREFIX + "No trending projects found, possible page structure change or empty period"
				+ "\nRequested URL: " + e.getUrl();
	}

	public String formatUnexpectedError(String url, Exception e) {
		return ERROR_PREFIX + "Program execution error: " + e.getMessage() + "\nRequested URL: " + url;
	}

	public String formatReadmes(List<ReadmeLookupResult> results) {
		List<String> lines = new ArrayList<>();
		lines.add("📚 GitHub Repository README Documents");

		for (ReadmeLookupResult result : results) {
			switch (result.status()) {
				case FOUND:
					lines.add("✅ Successfully retrieved (Source: " + result.sourceLocation() + ")");
					lines.add("Repository: " + result.repository());
					lines.add("README:");
					lines.add(result.content());
					break;
				case NOT_FOUND:
					lines.add(ERROR_PREFIX + "README file not found");
					lines.add("   " + result.errorDetail());
					lines.add("Repository: " + result.repository());
					lines.add("README: No readable README file found");
					break;
				case INVALID_FORMAT:
					lines.add(ERROR_PREFIX + "Invalid repository name format: " + result.repository());
					lines.add("   Correct format should be: owner/repository-name");
					break;
				default:
					lines.add(ERROR_PREFIX + "Error processing repository " + result.repository() + ": "
							+ result.errorDetail());
					lines.add("Repository: " + result.repository());
					lines.add("README: Failed to retrieve - " + result.errorDetail());
					break;
			}
			lines.add("---");
			lines.add("");
		}

		lines.add("💡 Suggested next steps:");
		lines.add("- 1. Analyze detailed information and technical features of each project");
		lines.add("- 2. If particularly interested in a project, further study its implementation details");
		lines.add("- 3. Summarize technical highlights and application scenarios of the projects");
		return String.join("\n", lines);
	}

}
