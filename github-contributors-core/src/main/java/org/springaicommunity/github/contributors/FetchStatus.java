package org.springaicommunity.github.contributors;

/**
 * Outcome of fetching one page of commits.
 */
public enum FetchStatus {

	/** The page was fetched and parsed. */
	OK,

	/** The repository does not exist or is not visible (404). */
	NOT_FOUND,

	/** Consecutive request timeouts exceeded the retry budget. */
	RETRIES_EXHAUSTED,

	/** Any other failure: connection error, unexpected status, malformed body. */
	TRANSPORT_ERROR,

	/** The job thread was interrupted while waiting or during a request. */
	INTERRUPTED

}
