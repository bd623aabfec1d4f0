package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

/**
 * A successful (2xx) response from the GitHub REST API.
 *
 * @param body the response body
 * @param linkHeader the raw {@code Link} pagination header, or null when the resource
 * fits on a single page
 */
public record ApiResponse(String body, @Nullable String linkHeader) {

	/**
	 * Create a successful response without pagination.
	 * @param body the response body
	 * @return the response
	 */
	public static ApiResponse ok(String body) {
		return new ApiResponse(body, null);
	}

	/**
	 * Create a successful response carrying a {@code Link} header.
	 * @param body the response body
	 * @param linkHeader the raw header value
	 * @return the response
	 */
	public static ApiResponse ok(String body, @Nullable String linkHeader) {
		return new ApiResponse(body, linkHeader);
	}

}
