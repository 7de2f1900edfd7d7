package org.springaicommunity.github.trending;

import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link TrendingEntry} from one {@code article.Box-row} fragment of the
 * trending page.
 *
 * <p>
 * Title and link are mandatory: a fragment without them yields no entry. Every other
 * field is an independent lookup with its own fallback, so a missing or malformed element
 * only ever defaults that one field.
 */
public class TrendingEntryExtractor {

	private static final Logger logger = LoggerFactory.getLogger(TrendingEntryExtractor.class);

	static final String TITLE_LINK_SELECTOR = "h2.h3 a";

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final Pattern PERIOD_STARS = Pattern.compile("(\\d+[,\\d]*)\\s*stars?", Pattern.CASE_INSENSITIVE);

	static final String DESCRIPTION = "description";

	static final String LANGUAGE = "language";

	static final String TOTAL_STARS = "totalStars";

	static final String TOTAL_FORKS = "totalForks";

	static final String PERIOD_STARS_FIELD = "periodStars";

	private static final List<FieldRule> OPTIONAL_FIELDS = List.of(
			new FieldRule(DESCRIPTION, (fragment, period) -> textOf(fragment.selectFirst("p.col-9")),
					TrendingEntry.NO_DESCRIPTION),
			new FieldRule(LANGUAGE,
					(fragment, period) -> textOf(fragment.selectFirst("span[itemprop=programmingLanguage]")),
					TrendingEntry.UNKNOWN_LANGUAGE),
			new FieldRule(TOTAL_STARS, (fragment, period) -> textOf(fragment.selectFirst("a[href$=/stargazers]")),
					TrendingEntry.ZERO_COUNT),
			new FieldRule(TOTAL_FORKS, (fragment, period) -> textOf(fragment.selectFirst("a[href$=/forks]")),
					TrendingEntry.ZERO_COUNT),
			new FieldRule(PERIOD_STARS_FIELD, TrendingEntryExtractor::periodStars, TrendingEntry.ZERO_COUNT));

	private final String siteUrl;

	public TrendingEntryExtractor(String siteUrl) {
		this.siteUrl = siteUrl;
	}

	/**
	 * Extract one entry.
	 * @param fragment the project fragment
	 * @param period the requested period, selects which star label counts as period
	 * stars
	 * @return the entry, or empty if the fragment has no title link
	 */
	public Optional<TrendingEntry> extract(Element fragment, TrendingPeriod period) {
		Element titleLink = fragment.selectFirst(TITLE_LINK_SELECTOR);
		if (titleLink == null) {
			logger.debug("Fragment has no title link");
			return Optional.empty();
		}
		String title = WHITESPACE.matcher(titleLink.text()).replaceAll(" ").trim();
		String href = titleLink.attr("href").trim();
		if (title.isEmpty() || href.isEmpty()) {
			logger.debug("Title link is missing text or href: title='{}', href='{}'", title, href);
			return Optional.empty();
		}

		Map<String, String> fields = new HashMap<>();
		for (FieldRule rule : OPTIONAL_FIELDS) {
			fields.put(rule.name(), rule.evaluate(fragment, period));
		}
		return Optional.of(new TrendingEntry(title, resolveUrl(href), fields.get(DESCRIPTION), fields.get(LANGUAGE),
				fields.get(TOTAL_STARS), fields.get(TOTAL_FORKS), fields.get(PERIOD_STARS_FIELD)));
	}

	String resolveUrl(String href) {
		if (href.startsWith("http://") || href.startsWith("https://")) {
			return href;
		}
		return siteUrl + (href.startsWith("/") ? href : "/" + href);
	}

	/**
	 * The first span mentioning stars together with the period phrase decides the value,
	 * even if no number can be read from it.
	 */
	private static Optional<String> periodStars(Element fragment, TrendingPeriod period) {
		for (Element span : fragment.select("span")) {
			String text = span.text();
			String lower = text.toLowerCase(Locale.ROOT);
			if (lower.contains("stars") && lower.contains(period.windowPhrase())) {
				Matcher matcher = PERIOD_STARS.matcher(text);
				return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
			}
		}
		return Optional.empty();
	}

	private static Optional<String> textOf(@Nullable Element element) {
		return Optional.ofNullable(element).map(Element::text);
	}

	@FunctionalInterface
	private interface FieldLocator {

		Optional<String> locate(Element fragment, TrendingPeriod period);

	}

	private record FieldRule(String name, FieldLocator locator, String fallback) {

		String evaluate(Element fragment, TrendingPeriod period) {
			try {
				Optional<String> value = locator.locate(fragment, period).map(String::trim).filter(v -> !v.isEmpty());
				if (value.isPresent()) {
					return value.get();
				}
				logger.debug("Field '{}' not found, defaulting to '{}'", name, fallback);
			}
			catch (RuntimeException e) {
				logger.warn("Failed to extract field '{}', defaulting to '{}': {}", name, fallback, e.getMessage());
			}
			return fallback;
		}

	}

}
