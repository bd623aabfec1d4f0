package org.springaicommunity.github.contributors;

/**
 * Thrown when a GitHub API request does not complete within the configured request
 * timeout. Timeouts are retried with exponential backoff by
 * {@link RateLimitedPageFetcher}; every other transport failure is not.
 */
public class GitHubTimeoutException extends GitHubApiException {

	public GitHubTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}

}
