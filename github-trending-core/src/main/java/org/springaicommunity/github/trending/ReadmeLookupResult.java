package org.springaicommunity.github.trending;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of resolving the README of one repository.
 *
 * @param repository repository identifier as supplied, trimmed
 * @param status how the lookup ended
 * @param sourceLocation the candidate URL that succeeded, when found
 * @param content README text, possibly truncated, when found
 * @param truncated whether {@code content} was cut to the configured maximum
 * @param errorDetail diagnostic text when not found
 */
public record ReadmeLookupResult(String repository, Status status, @Nullable String sourceLocation,
		@Nullable String content, boolean truncated, @Nullable String errorDetail) {

	/**
	 * How a lookup ended.
	 */
	public enum Status {

		FOUND, NOT_FOUND, INVALID_FORMAT, FAILED

	}

	public static ReadmeLookupResult found(String repository, String sourceLocation, String content,
			boolean truncated) {
		return new ReadmeLookupResult(repository, Status.FOUND, sourceLocation, content, truncated, null);
	}

	public static ReadmeLookupResult notFound(String repository, List<String> branches, List<String> filenames) {
		return new ReadmeLookupResult(repository, Status.NOT_FOUND, null, null, false, "Tried branches: "
				+ String.join(", ", branches) + "; tried files: " + String.join(", ", filenames));
	}

	public static ReadmeLookupResult invalidFormat(String repository) {
		return new ReadmeLookupResult(repository, Status.INVALID_FORMAT, null, null, false,
				"Invalid repository name format: " + repository + " (expected owner/repository-name)");
	}

	public static ReadmeLookupResult failed(String repository, String message) {
		return new ReadmeLookupResult(repository, Status.FAILED, null, null, false, message);
	}

	@JsonProperty("found")
	public boolean found() {
		return status == Status.FOUND;
	}

}
