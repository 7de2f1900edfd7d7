package org.springaicommunity.github.trending;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for TrendingProperties, TrendingPeriod and TrendingQuery using plain JUnit.
 */
@DisplayName("Configuration Tests")
class TrendingPropertiesTest {

	@Nested
	@DisplayName("TrendingProperties Tests")
	class PropertiesTest {

		private TrendingProperties properties;

		@BeforeEach
		void setUp() {
			properties = new TrendingProperties();
		}

		@Test
		@DisplayName("Should have correct default properties")
		void shouldHaveCorrectDefaults() {
			assertThat(properties.getSiteUrl()).isEqualTo("https://github.com");
			assertThat(properties.getRawContentUrl()).isEqualTo("https://raw.githubusercontent.com");
			assertThat(properties.getTrendingTimeout()).isEqualTo(Duration.ofSeconds(30));
			assertThat(properties.getReadmeTimeout()).isEqualTo(Duration.ofSeconds(20));
			assertThat(properties.getMaxReadmeLength()).isEqualTo(50_000);
			assertThat(properties.getReadmeBranches()).containsExactly("main", "master");
			assertThat(properties.getReadmeFilenames()).containsExactly("README.md", "readme.md", "Readme.md",
					"README.txt", "readme.txt");
		}

		@Test
		@DisplayName("Should strip trailing slash from base URLs")
		void shouldStripTrailingSlash() {
			properties.setSiteUrl("http://localhost:9000/");
			properties.setRawContentUrl("http://localhost:9001/");

			assertThat(properties.getSiteUrl()).isEqualTo("http://localhost:9000");
			assertThat(properties.getRawContentUrl()).isEqualTo("http://localhost:9001");
		}

		@Test
		@DisplayName("Should copy branch list on set")
		void shouldCopyBranchList() {
			List<String> branches = new java.util.ArrayList<>(List.of("develop"));
			properties.setReadmeBranches(branches);
			branches.add("main");

			assertThat(properties.getReadmeBranches()).containsExactly("develop");
		}

		@Test
		@DisplayName("Should reject non-positive README length")
		void shouldRejectNonPositiveLength() {
			assertThatThrownBy(() -> properties.setMaxReadmeLength(0)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("EnvironmentSupport Tests")
	class EnvironmentSupportTest {

		@Test
		@DisplayName("Should parse positive seconds")
		void shouldParseSeconds() {
			assertThat(EnvironmentSupport.parseSeconds("X", " 15 ")).isEqualTo(Duration.ofSeconds(15));
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-3", "ten", "1.5" })
		@DisplayName("Should reject invalid seconds")
		void shouldRejectInvalidSeconds(String value) {
			assertThatThrownBy(() -> EnvironmentSupport.parseSeconds("GITHUB_README_TIMEOUT_SECONDS", value))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("GITHUB_README_TIMEOUT_SECONDS");
		}

		@Test
		@DisplayName("Should return null for unset variable")
		void shouldReturnNullForUnsetVariable() {
			assertThat(EnvironmentSupport.getSeconds("GITHUB_TRENDING_SURELY_UNSET_VARIABLE")).isNull();
		}

	}

	@Nested
	@DisplayName("TrendingQuery Tests")
	class QueryTest {

		@ParameterizedTest
		@ValueSource(strings = { "daily", "weekly", "monthly" })
		@DisplayName("Should accept valid periods")
		void shouldAcceptValidPeriods(String since) {
			assertThat(TrendingQuery.of(since, "").since().value()).isEqualTo(since);
		}

		@Test
		@DisplayName("Should trim language and lower-case only the path slug")
		void shouldNormalizeLanguage() {
			TrendingQuery query = TrendingQuery.of("daily", " TypeScript ");

			assertThat(query.language()).isEqualTo("TypeScript");
			assertThat(query.languageSlug()).isEqualTo("typescript");
			assertThat(query.hasLanguageFilter()).isTrue();
		}

		@Test
		@DisplayName("Should treat null language as unfiltered")
		void shouldTreatNullLanguageAsUnfiltered() {
			assertThat(TrendingQuery.of("daily", null).hasLanguageFilter()).isFalse();
		}

		@Test
		@DisplayName("Should expose period labels and phrases")
		void shouldExposePeriodLabels() {
			assertThat(TrendingPeriod.WEEKLY.displayName()).isEqualTo("This Week");
			assertThat(TrendingPeriod.MONTHLY.windowPhrase()).isEqualTo("this month");
			assertThat(TrendingPeriod.validValues()).isEqualTo("daily, weekly, monthly");
		}

	}

}
