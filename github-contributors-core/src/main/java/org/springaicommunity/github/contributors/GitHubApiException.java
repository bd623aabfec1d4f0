package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when GitHub API calls fail.
 *
 * <p>
 * Carries rate limit information when available, so that
 * {@link RateLimitedPageFetcher} can wait until the reported reset instead of failing.
 * A status code of {@code -1} means the request never produced an HTTP response
 * (connection refused, DNS failure, reset stream).
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	private final @Nullable String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	private final long retryAfterSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		this(message, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds, long retryAfterSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
		this.retryAfterSeconds = retryAfterSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
		this.retryAfterSeconds = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Seconds from the {@code Retry-After} header, or {@code -1} when absent.
	 */
	public long getRetryAfterSeconds() {
		return retryAfterSeconds;
	}

	/**
	 * Returns true if the repository does not exist or is not visible to the token.
	 */
	public boolean isNotFound() {
		return statusCode == 404;
	}

	/**
	 * Returns true if this exception represents a rate limit error: a 429, or a 403 that
	 * either reports an exhausted quota ({@code X-RateLimit-Remaining: 0}) or carries a
	 * {@code Retry-After} header (secondary limit). Any other 403 is a plain refusal.
	 */
	public boolean isRateLimitError() {
		return statusCode == 429 || (statusCode == 403 && (rateLimitRemaining == 0 || retryAfterSeconds >= 0));
	}

}
