package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Fetches one page of commits through a {@link GitHubClient}, waiting out rate limits and
 * retrying timeouts.
 *
 * <p>
 * Each call runs a small state machine with two independent policies:
 * <ul>
 * <li>Rate limit (429, or 403 with an exhausted quota or a {@code Retry-After}): sleep
 * until {@code X-RateLimit-Reset} plus a safety margin, then retry the same page.
 * Unbounded in attempts; only the reset time bounds it.</li>
 * <li>Timeout: exponential backoff of {@code backoffBase * 2^attempt}, at most
 * {@code maxRetries} consecutive times. The counter is local to the page, so a later
 * timeout after a successful page starts again from attempt 1.</li>
 * </ul>
 * A 404, an interrupt and every other failure (including a 403 with quota left) end
 * pagination for the repository immediately. Failures are returned as a terminal
 * {@link CommitPage}, never thrown.
 *
 * <pre>
 * {@code
 * RateLimitedPageFetcher fetcher = RateLimitedPageFetcher.builder()
 *     .client(new GitHubHttpClient(token))
 *     .parser(new CommitJsonParser(ObjectMapperFactory.create()))
 *     .maxRetries(5)
 *     .build();
 * }
 * </pre>
 */
public final class RateLimitedPageFetcher {

	private static final DateTimeFormatter CLOCK_TIME = DateTimeFormatter.ofPattern("HH:mm");

	private final GitHubClient client;

	private final CommitJsonParser parser;

	private final int maxRetries;

	private final Duration backoffBase;

	private final Duration rateLimitMargin;

	private final Sleeper sleeper;

	private final Clock clock;

	private RateLimitedPageFetcher(Builder builder) {
		this.client = builder.client;
		this.parser = builder.parser;
		this.maxRetries = builder.maxRetries;
		this.backoffBase = builder.backoffBase;
		this.rateLimitMargin = builder.rateLimitMargin;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Fetch a single page.
	 * @param repository {@code owner/name}, used for diagnostics only
	 * @param target API path or absolute {@code rel="next"} URL
	 * @param queryString query string for the first page, null when following a cursor
	 * @param diagnostics receives retries, waits and failures
	 * @return the page, or a terminal page describing why pagination stopped
	 */
	public CommitPage fetch(String repository, String target, @Nullable String queryString,
			DiagnosticSink diagnostics) {
		String description = queryString != null ? target + "?" + queryString : target;
		int consecutiveTimeouts = 0;

		while (true) {
			ApiResponse response;
			try {
				diagnostics.info(repository, "Fetching commits for " + repository + " with URL: " + description);
				response = queryString != null ? client.getWithQuery(target, queryString) : client.get(target);
			}
			catch (GitHubTimeoutException e) {
				consecutiveTimeouts++;
				if (consecutiveTimeouts > maxRetries) {
					diagnostics.warn(repository, "Max retries exceeded for " + repository + ". Skipping.");
					return CommitPage.failed(FetchStatus.RETRIES_EXHAUSTED);
				}
				Duration backoff = backoffBase.multipliedBy(1L << Math.min(consecutiveTimeouts, 30));
				diagnostics.warn(repository, "Request timed out for " + repository + ". Retrying in "
						+ backoff.toSeconds() + " seconds...");
				if (!pause(repository, backoff, diagnostics)) {
					return CommitPage.failed(FetchStatus.INTERRUPTED);
				}
				continue;
			}
			catch (GitHubApiException e) {
				if (Thread.currentThread().isInterrupted() || e.getCause() instanceof InterruptedException) {
					diagnostics.warn(repository, "Interrupted while fetching commits for " + repository);
					return CommitPage.failed(FetchStatus.INTERRUPTED);
				}
				if (e.isNotFound()) {
					diagnostics.warn(repository, "Repository " + repository + " not found (404). Skipping.");
					return CommitPage.failed(FetchStatus.NOT_FOUND);
				}
				if (e.isRateLimitError()) {
					Duration wait = rateLimitWait(e);
					diagnostics.warn(repository, "Rate limit exceeded for " + repository + ". Retrying in "
							+ wait.toSeconds() + " seconds...");
					if (!pause(repository, wait, diagnostics)) {
						return CommitPage.failed(FetchStatus.INTERRUPTED);
					}
					continue;
				}
				diagnostics.warn(repository,
						"Error fetching commits for " + repository + " from " + description + ": " + e.getMessage());
				return CommitPage.failed(FetchStatus.TRANSPORT_ERROR);
			}

			return toPage(repository, description, response, diagnostics);
		}
	}

	/**
	 * Time to wait for a rate limit reset, plus the safety margin. A {@code Retry-After}
	 * wins over the reset epoch. Without either on the error, the reset of the last
	 * exhausted quota the client observed is used; failing that only the margin is waited.
	 */
	Duration rateLimitWait(GitHubApiException e) {
		if (e.getRetryAfterSeconds() >= 0) {
			return Duration.ofSeconds(e.getRetryAfterSeconds()).plus(rateLimitMargin);
		}
		Instant now = clock.instant();
		long seconds;
		if (e.getResetEpochSeconds() >= 0) {
			seconds = Math.max(0, e.getResetEpochSeconds() - now.getEpochSecond());
		}
		else {
			RateLimitInfo last = client.getLastRateLimitInfo();
			seconds = last != null && last.isExceeded() ? last.secondsUntilReset(now) : 0;
		}
		return Duration.ofSeconds(seconds).plus(rateLimitMargin);
	}

	private CommitPage toPage(String repository, String description, ApiResponse response,
			DiagnosticSink diagnostics) {
		List<CommitRecord> commits;
		try {
			commits = parser.parsePage(response.body());
		}
		catch (IOException e) {
			diagnostics.warn(repository,
					"Malformed response for " + repository + " from " + description + ": " + e.getMessage());
			return CommitPage.failed(FetchStatus.TRANSPORT_ERROR);
		}

		String next = null;
		if (response.linkHeader() != null) {
			try {
				next = LinkHeaderParser.parse(response.linkHeader()).get(LinkHeaderParser.NEXT);
			}
			catch (LinkHeaderParser.MalformedLinkHeaderException e) {
				diagnostics.warn(repository, "Unparseable Link header for " + repository + ", treating page as last: "
						+ e.getMessage());
			}
		}
		return CommitPage.of(commits, next);
	}

	private boolean pause(String repository, Duration duration, DiagnosticSink diagnostics) {
		long minutes = duration.toMinutes();
		long seconds = duration.minusMinutes(minutes).getSeconds();
		LocalTime resumeAt = LocalTime.ofInstant(clock.instant().plus(duration), clock.getZone());
		diagnostics.info(repository, String.format("Waiting %dm%02ds, expected to resume at %s", minutes, seconds,
				resumeAt.format(CLOCK_TIME)));
		try {
			sleeper.sleep(duration);
			return true;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			diagnostics.warn(repository, "Interrupted while waiting to fetch commits for " + repository);
			return false;
		}
	}

	/**
	 * Builder for {@link RateLimitedPageFetcher}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxRetries: 5</li>
	 * <li>backoffBase: 1 second (waits 2, 4, 8, 16, 32 seconds)</li>
	 * <li>rateLimitMargin: 3 seconds</li>
	 * <li>sleeper: {@link Sleeper#SYSTEM}, clock: system UTC</li>
	 * </ul>
	 */
	public static class Builder {

		private GitHubClient client;

		private CommitJsonParser parser;

		private int maxRetries = 5;

		private Duration backoffBase = Duration.ofSeconds(1);

		private Duration rateLimitMargin = Duration.ofSeconds(3);

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the client pages are fetched with.
		 * @param client the GitHubClient (required)
		 * @return this builder
		 */
		public Builder client(GitHubClient client) {
			this.client = client;
			return this;
		}

		/**
		 * Set the parser for page bodies.
		 * @param parser the commit parser (required)
		 * @return this builder
		 */
		public Builder parser(CommitJsonParser parser) {
			this.parser = parser;
			return this;
		}

		/**
		 * Set the maximum number of consecutive timeout retries per page.
		 * @param maxRetries maximum retries (default: 5)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the unit of the exponential timeout backoff.
		 * @param backoffBase the wait before retry n is {@code backoffBase * 2^n}
		 * @return this builder
		 */
		public Builder backoffBase(Duration backoffBase) {
			this.backoffBase = backoffBase;
			return this;
		}

		/**
		 * Set the extra wait added after a rate limit reset.
		 * @param rateLimitMargin safety margin (default: 3 seconds)
		 * @return this builder
		 */
		public Builder rateLimitMargin(Duration rateLimitMargin) {
			this.rateLimitMargin = rateLimitMargin;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RateLimitedPageFetcher.
		 * @return configured fetcher
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RateLimitedPageFetcher build() {
			if (client == null) {
				throw new IllegalStateException("A GitHubClient is required. Call client() first.");
			}
			if (parser == null) {
				throw new IllegalStateException("A CommitJsonParser is required. Call parser() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (backoffBase.isNegative() || rateLimitMargin.isNegative()) {
				throw new IllegalStateException("backoffBase and rateLimitMargin must not be negative");
			}
			return new RateLimitedPageFetcher(this);
		}

	}

}
