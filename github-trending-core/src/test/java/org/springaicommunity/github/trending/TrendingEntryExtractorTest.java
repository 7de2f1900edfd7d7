package org.springaicommunity.github.trending;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.trending.TestFixtures.*;

/**
 * Tests for TrendingEntryExtractor using plain JUnit against HTML fragments.
 */
@DisplayName("TrendingEntryExtractor Tests")
class TrendingEntryExtractorTest {

	private TrendingEntryExtractor extractor;

	@BeforeEach
	void setUp() {
		extractor = new TrendingEntryExtractor(SITE_URL);
	}

	private static Element fragment(String articleHtml) {
		return Jsoup.parse(page(articleHtml), SITE_URL).selectFirst("article.Box-row");
	}

	@Nested
	@DisplayName("Mandatory Field Tests")
	class MandatoryFieldTest {

		@Test
		@DisplayName("Should collapse multi-line title into single spaces")
		void shouldCollapseMultiLineTitle() {
			Element fragment = fragment(
					article(titleLink("/spring-projects/spring-ai", "spring-projects", "spring-ai")));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.title()).isEqualTo("spring-projects / spring-ai");
		}

		@Test
		@DisplayName("Should resolve relative link against site root")
		void shouldResolveRelativeLink() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.projectUrl()).isEqualTo("https://github.com/owner/repo");
		}

		@Test
		@DisplayName("Should skip fragment without title link")
		void shouldSkipFragmentWithoutTitleLink() {
			Element fragment = fragment(article("<h2 class=\"h3\">no link here</h2><p class=\"col-9\">desc</p>"));

			assertThat(extractor.extract(fragment, TrendingPeriod.DAILY)).isEmpty();
		}

		@Test
		@DisplayName("Should skip fragment whose title link has no href")
		void shouldSkipFragmentWithoutHref() {
			Element fragment = fragment(article("<h2 class=\"h3\"><a>owner / repo</a></h2>"));

			assertThat(extractor.extract(fragment, TrendingPeriod.DAILY)).isEmpty();
		}

		@Test
		@DisplayName("Should ignore links outside the title heading")
		void shouldIgnoreLinksOutsideHeading() {
			Element fragment = fragment(article("<a href=\"/owner/repo/stargazers\">10</a>"));

			assertThat(extractor.extract(fragment, TrendingPeriod.DAILY)).isEmpty();
		}

	}

	@Nested
	@DisplayName("Optional Field Tests")
	class OptionalFieldTest {

		@Test
		@DisplayName("Should extract every field from a complete fragment")
		void shouldExtractEveryField() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")
					+ "<p class=\"col-9 color-fg-muted\"> A fast thing </p>"
					+ "<span class=\"d-inline-block\"><span itemprop=\"programmingLanguage\">Rust</span></span>"
					+ "<a href=\"/owner/repo/stargazers\">12,345</a>" + "<a href=\"/owner/repo/forks\">678</a>"
					+ "<span class=\"float-sm-right\">1,001 stars today</span>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry).isEqualTo(new TrendingEntry("owner / repo", "https://github.com/owner/repo",
					"A fast thing", "Rust", "12,345", "678", "1,001"));
		}

		@Test
		@DisplayName("Should default every optional field independently")
		void shouldDefaultOptionalFields() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.description()).isEqualTo(TrendingEntry.NO_DESCRIPTION);
			assertThat(entry.primaryLanguage()).isEqualTo(TrendingEntry.UNKNOWN_LANGUAGE);
			assertThat(entry.totalStars()).isEqualTo("0");
			assertThat(entry.totalForks()).isEqualTo("0");
			assertThat(entry.periodStars()).isEqualTo("0");
		}

		@Test
		@DisplayName("Should default period stars when the label is absent and keep other fields")
		void shouldDefaultPeriodStarsWhenLabelAbsent() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")
					+ "<p class=\"col-9\">desc</p><span itemprop=\"programmingLanguage\">Go</span>"
					+ "<a href=\"/owner/repo/stargazers\">42</a><a href=\"/owner/repo/forks\">7</a>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.periodStars()).isEqualTo("0");
			assertThat(entry.description()).isEqualTo("desc");
			assertThat(entry.primaryLanguage()).isEqualTo("Go");
			assertThat(entry.totalStars()).isEqualTo("42");
			assertThat(entry.totalForks()).isEqualTo("7");
		}

		@Test
		@DisplayName("Should treat blank description as missing")
		void shouldTreatBlankDescriptionAsMissing() {
			Element fragment = fragment(
					article(titleLink("/owner/repo", "owner", "repo") + "<p class=\"col-9\">  </p>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.description()).isEqualTo(TrendingEntry.NO_DESCRIPTION);
		}

		@Test
		@DisplayName("Should not take star count from unrelated links")
		void shouldNotTakeStarCountFromUnrelatedLinks() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")
					+ "<a href=\"/owner/repo/stargazers/you_know\">99</a><a href=\"/owner/repo/network\">5</a>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.totalStars()).isEqualTo("0");
			assertThat(entry.totalForks()).isEqualTo("0");
		}

	}

	@Nested
	@DisplayName("Period Stars Tests")
	class PeriodStarsTest {

		@ParameterizedTest
		@CsvSource({ "DAILY, 312 stars today, 312", "WEEKLY, '2,480 stars this week', '2,480'",
				"MONTHLY, '10,001 stars this month', '10,001'", "DAILY, 1 Stars Today, 1" })
		@DisplayName("Should read the leading number of the period label")
		void shouldReadPeriodStars(TrendingPeriod period, String label, String expected) {
			Element fragment = fragment(article(
					titleLink("/owner/repo", "owner", "repo") + "<span class=\"float-sm-right\">" + label + "</span>"));

			Optional<TrendingEntry> entry = extractor.extract(fragment, period);

			assertThat(entry).map(TrendingEntry::periodStars).contains(expected);
		}

		@Test
		@DisplayName("Should ignore a label for a different period")
		void shouldIgnoreLabelForDifferentPeriod() {
			Element fragment = fragment(
					article(titleLink("/owner/repo", "owner", "repo") + "<span>312 stars today</span>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.WEEKLY).orElseThrow();

			assertThat(entry.periodStars()).isEqualTo("0");
		}

		@Test
		@DisplayName("Should use only the first matching label")
		void shouldUseFirstMatchingLabel() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")
					+ "<span>stars today: none yet</span><span>77 stars today</span>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.periodStars()).isEqualTo("0");
		}

		@Test
		@DisplayName("Should ignore spans that mention stars without the period phrase")
		void shouldIgnoreSpansWithoutPeriodPhrase() {
			Element fragment = fragment(article(titleLink("/owner/repo", "owner", "repo")
					+ "<span>500 stars overall</span><span>9 stars today</span>"));

			TrendingEntry entry = extractor.extract(fragment, TrendingPeriod.DAILY).orElseThrow();

			assertThat(entry.periodStars()).isEqualTo("9");
		}

	}

	@Nested
	@DisplayName("URL Resolution Tests")
	class UrlResolutionTest {

		@Test
		@DisplayName("Should keep absolute links unchanged")
		void shouldKeepAbsoluteLinks() {
			assertThat(extractor.resolveUrl("https://example.com/owner/repo"))
				.isEqualTo("https://example.com/owner/repo");
		}

		@Test
		@DisplayName("Should add missing leading slash")
		void shouldAddMissingLeadingSlash() {
			assertThat(extractor.resolveUrl("owner/repo")).isEqualTo("https://github.com/owner/repo");
		}

	}

}
