package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the commit listing endpoint, enabling testability with mocks
 * and keeping pagination and retry policy out of the transport.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo/commits") or full URL, as returned
	 * in a {@code Link} header
	 * @return the successful response
	 * @throws GitHubApiException if the request fails or returns a non-2xx status
	 * @throws GitHubTimeoutException if the request times out
	 */
	ApiResponse get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), or null
	 * @return the successful response
	 * @throws GitHubApiException if the request fails or returns a non-2xx status
	 * @throws GitHubTimeoutException if the request times out
	 */
	ApiResponse getWithQuery(String path, @Nullable String queryString);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
