package org.springaicommunity.github.contributors;

import java.time.Instant;

/**
 * Rate limit information from the GitHub API response headers.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

	/**
	 * Seconds left until the window resets, never negative.
	 * @param now the current time
	 * @return seconds until reset
	 */
	public long secondsUntilReset(Instant now) {
		return Math.max(0, reset - now.getEpochSecond());
	}

}
