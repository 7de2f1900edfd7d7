package org.springaicommunity.github.trending;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared fixtures for trending tests.
 */
final class TestFixtures {

	static final String SITE_URL = "https://github.com";

	/**
	 * 2026-10-19, a Monday.
	 */
	static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-10-19T09:30:00Z"), ZoneOffset.UTC);

	private TestFixtures() {
	}

	static String trendingPage() {
		try (InputStream in = TestFixtures.class.getResourceAsStream("/trending-daily.html")) {
			if (in == null) {
				throw new IllegalStateException("trending-daily.html not on classpath");
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	static String article(String body) {
		return "<article class=\"Box-row\">" + body + "</article>";
	}

	static String titleLink(String href, String owner, String name) {
		return "<h2 class=\"h3 lh-condensed\"><a href=\"" + href + "\"><span class=\"text-normal\">" + owner
				+ " /\n   </span>\n   " + name + "\n</a></h2>";
	}

	static String page(String... articles) {
		return "<html><body><div class=\"Box\">" + String.join("\n", articles) + "</div></body></html>";
	}

}
