package org.springaicommunity.github.contributors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RateLimitedPageFetcher}.
 *
 * Waits are recorded by a fake {@link Sleeper} against a fixed clock, so no test sleeps.
 */
@DisplayName("RateLimitedPageFetcher Tests")
@ExtendWith(MockitoExtension.class)
class RateLimitedPageFetcherTest {

	private static final String REPO = "acme/app";

	private static final String PATH = "/repos/acme/app/commits";

	private static final String QUERY = "per_page=100";

	private static final String NEXT_URL = "https://api.github.com/repositories/42/commits?per_page=100&page=2";

	private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

	private static final String ONE_COMMIT = TestCommits
		.page(TestCommits.human("a1", "alice", "Alice", "alice@example.com", "2024-01-02T10:00:00Z"));

	@Mock
	private GitHubClient client;

	private final List<Duration> sleeps = new ArrayList<>();

	private final List<Diagnostic> events = new ArrayList<>();

	private final DiagnosticSink sink = events::add;

	private RateLimitedPageFetcher fetcher;

	@BeforeEach
	void setUp() {
		fetcher = fetcherWithRetries(5);
	}

	@AfterEach
	void clearInterrupt() {
		Thread.interrupted();
	}

	private RateLimitedPageFetcher fetcherWithRetries(int maxRetries) {
		return RateLimitedPageFetcher.builder()
			.client(client)
			.parser(new CommitJsonParser(ObjectMapperFactory.create()))
			.maxRetries(maxRetries)
			.sleeper(sleeps::add)
			.clock(Clock.fixed(NOW, ZoneOffset.UTC))
			.build();
	}

	private static GitHubTimeoutException timeout() {
		return new GitHubTimeoutException("Request timed out", new HttpTimeoutException("request timed out"));
	}

	private List<Diagnostic> warnings() {
		return events.stream().filter(d -> d.severity() == Diagnostic.Severity.WARNING).toList();
	}

	@Nested
	@DisplayName("Successful pages")
	class SuccessTest {

		@Test
		@DisplayName("Should return commits and the next cursor")
		void shouldReturnCommitsAndNextCursor() {
			when(client.getWithQuery(PATH, QUERY)).thenReturn(ApiResponse.ok(ONE_COMMIT, TestCommits.link(NEXT_URL)));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(page.commits()).hasSize(1);
			assertThat(page.commits().get(0).author().email()).isEqualTo("alice@example.com");
			assertThat(page.nextUrl()).isEqualTo(NEXT_URL);
			assertThat(page.hasNext()).isTrue();
			assertThat(sleeps).isEmpty();
			assertThat(warnings()).isEmpty();
		}

		@Test
		@DisplayName("Should follow an absolute cursor URL without a query string")
		void shouldFetchCursorWithGet() {
			when(client.get(NEXT_URL)).thenReturn(ApiResponse.ok(ONE_COMMIT));

			CommitPage page = fetcher.fetch(REPO, NEXT_URL, null, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(page.hasNext()).isFalse();
			verify(client, never()).getWithQuery(anyString(), anyString());
		}

		@Test
		@DisplayName("Should report the URL of every attempt")
		void shouldReportAttemptUrl() {
			when(client.getWithQuery(PATH, QUERY)).thenReturn(ApiResponse.ok("[]"));

			fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(events).extracting(Diagnostic::message)
				.contains("Fetching commits for acme/app with URL: " + PATH + "?" + QUERY);
		}

	}

	@Nested
	@DisplayName("Rate limit handling")
	class RateLimitTest {

		@Test
		@DisplayName("Should wait until reset plus margin after a 403, then succeed")
		void shouldWaitForResetOn403() {
			long reset = NOW.getEpochSecond() + 5;
			when(client.getWithQuery(PATH, QUERY))
				.thenThrow(new GitHubApiException("Rate limit exceeded", 403, "{}", 0, reset))
				.thenReturn(ApiResponse.ok(ONE_COMMIT));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(page.commits()).hasSize(1);
			assertThat(sleeps).containsExactly(Duration.ofSeconds(8));
			assertThat(warnings()).extracting(Diagnostic::message)
				.containsExactly("Rate limit exceeded for acme/app. Retrying in 8 seconds...");
			verify(client, times(2)).getWithQuery(PATH, QUERY);
		}

		@Test
		@DisplayName("Should wait only the margin when 429 carries no reset")
		void shouldWaitMarginWithoutReset() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(new GitHubApiException("Too Many Requests", 429, ""))
				.thenReturn(ApiResponse.ok("[]"));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(sleeps).containsExactly(Duration.ofSeconds(3));
		}

		@Test
		@DisplayName("Should not wait negative time when the reset already passed")
		void shouldClampPastReset() {
			GitHubApiException past = new GitHubApiException("Rate limit", 403, "", 0, NOW.getEpochSecond() - 120);

			assertThat(fetcher.rateLimitWait(past)).isEqualTo(Duration.ofSeconds(3));
		}

		@Test
		@DisplayName("Should keep waiting through repeated rate limits without a retry budget")
		void shouldRetryRateLimitsUnbounded() {
			GitHubApiException limited = new GitHubApiException("Rate limit", 403, "", 0, NOW.getEpochSecond() + 60);
			when(client.getWithQuery(PATH, QUERY)).thenThrow(limited, limited, limited, limited, limited, limited,
					limited)
				.thenReturn(ApiResponse.ok("[]"));

			CommitPage page = fetcherWithRetries(1).fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(sleeps).hasSize(7).allMatch(d -> d.equals(Duration.ofSeconds(63)));
		}

		@Test
		@DisplayName("Should wait Retry-After plus margin on a secondary limit 403")
		void shouldHonorRetryAfterOnSecondaryLimit() {
			when(client.getWithQuery(PATH, QUERY))
				.thenThrow(new GitHubApiException("Secondary rate limit", 403, "", 4999, -1, 60))
				.thenReturn(ApiResponse.ok("[]"));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(sleeps).containsExactly(Duration.ofSeconds(63));
		}

		@Test
		@DisplayName("Should fall back to the last exhausted quota's reset when 429 carries none")
		void shouldUseLastObservedReset() {
			when(client.getLastRateLimitInfo())
				.thenReturn(new RateLimitInfo(5000, 0, NOW.getEpochSecond() + 10, 5000));

			assertThat(fetcher.rateLimitWait(new GitHubApiException("Too Many Requests", 429, "")))
				.isEqualTo(Duration.ofSeconds(13));
		}

		@Test
		@DisplayName("Should ignore the last observed reset while quota remains")
		void shouldIgnoreLastResetWithQuotaLeft() {
			when(client.getLastRateLimitInfo())
				.thenReturn(new RateLimitInfo(5000, 12, NOW.getEpochSecond() + 600, 4988));

			assertThat(fetcher.rateLimitWait(new GitHubApiException("Too Many Requests", 429, "")))
				.isEqualTo(Duration.ofSeconds(3));
		}

		@Test
		@DisplayName("Should not count rate limits against the timeout budget")
		void shouldNotConsumeTimeoutBudget() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(timeout())
				.thenThrow(new GitHubApiException("Rate limit", 429, ""))
				.thenReturn(ApiResponse.ok("[]"));

			CommitPage page = fetcherWithRetries(1).fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(3));
		}

	}

	@Nested
	@DisplayName("Timeout handling")
	class TimeoutTest {

		@Test
		@DisplayName("Should back off exponentially and give up after max retries")
		void shouldExhaustRetries() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(timeout());

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.RETRIES_EXHAUSTED);
			assertThat(page.commits()).isEmpty();
			assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8),
					Duration.ofSeconds(16), Duration.ofSeconds(32));
			assertThat(warnings()).extracting(Diagnostic::message)
				.last()
				.isEqualTo("Max retries exceeded for acme/app. Skipping.");
			verify(client, times(6)).getWithQuery(PATH, QUERY);
		}

		@Test
		@DisplayName("Should succeed when a retry eventually answers")
		void shouldRecoverAfterTimeouts() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(timeout(), timeout())
				.thenReturn(ApiResponse.ok(ONE_COMMIT));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
		}

		@Test
		@DisplayName("Should start a fresh retry budget for every page")
		void shouldResetBudgetPerPage() {
			when(client.getWithQuery(PATH, QUERY))
				.thenThrow(timeout(), timeout(), timeout(), timeout(), timeout())
				.thenReturn(ApiResponse.ok(ONE_COMMIT, TestCommits.link(NEXT_URL)));
			when(client.get(NEXT_URL)).thenThrow(timeout(), timeout(), timeout(), timeout(), timeout())
				.thenReturn(ApiResponse.ok(ONE_COMMIT));

			CommitPage first = fetcher.fetch(REPO, PATH, QUERY, sink);
			CommitPage second = fetcher.fetch(REPO, first.nextUrl(), null, sink);

			assertThat(first.status()).isEqualTo(FetchStatus.OK);
			assertThat(second.status()).isEqualTo(FetchStatus.OK);
			assertThat(sleeps).hasSize(10);
			assertThat(sleeps.get(5)).isEqualTo(Duration.ofSeconds(2));
		}

		@Test
		@DisplayName("Should give up immediately when no retries are allowed")
		void shouldHonorZeroRetries() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(timeout());

			CommitPage page = fetcherWithRetries(0).fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.RETRIES_EXHAUSTED);
			assertThat(sleeps).isEmpty();
		}

	}

	@Nested
	@DisplayName("Terminal failures")
	class TerminalTest {

		@Test
		@DisplayName("Should stop on 404 without retrying")
		void shouldStopOnNotFound() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(new GitHubApiException("Not found", 404, ""));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.NOT_FOUND);
			assertThat(sleeps).isEmpty();
			assertThat(warnings()).extracting(Diagnostic::message)
				.containsExactly("Repository acme/app not found (404). Skipping.");
			verify(client, times(1)).getWithQuery(PATH, QUERY);
		}

		@Test
		@DisplayName("Should stop on a 403 that leaves quota, without waiting")
		void shouldStopOnForbiddenWithQuotaLeft() {
			when(client.getWithQuery(PATH, QUERY))
				.thenThrow(new GitHubApiException("Forbidden: " + PATH, 403, "{}", 4999, -1));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.TRANSPORT_ERROR);
			assertThat(sleeps).isEmpty();
			assertThat(warnings()).singleElement()
				.extracting(Diagnostic::message)
				.asString()
				.startsWith("Error fetching commits for acme/app")
				.contains("Forbidden");
			verify(client, times(1)).getWithQuery(PATH, QUERY);
		}

		@Test
		@DisplayName("Should stop on a server error without retrying")
		void shouldStopOnServerError() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(new GitHubApiException("GitHub API error: 502", 502, ""));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.TRANSPORT_ERROR);
			assertThat(warnings()).singleElement()
				.extracting(Diagnostic::message)
				.asString()
				.startsWith("Error fetching commits for acme/app")
				.contains("502");
		}

		@Test
		@DisplayName("Should stop on a body that is not a JSON array")
		void shouldStopOnMalformedBody() {
			when(client.getWithQuery(PATH, QUERY)).thenReturn(ApiResponse.ok("{\"message\":\"odd\"}"));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.TRANSPORT_ERROR);
			assertThat(page.hasNext()).isFalse();
		}

		@Test
		@DisplayName("Should keep the commits but end pagination on a malformed Link header")
		void shouldTreatMalformedLinkAsLastPage() {
			when(client.getWithQuery(PATH, QUERY)).thenReturn(ApiResponse.ok(ONE_COMMIT, "not a link header"));

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.OK);
			assertThat(page.commits()).hasSize(1);
			assertThat(page.hasNext()).isFalse();
			assertThat(warnings()).singleElement()
				.extracting(Diagnostic::message)
				.asString()
				.startsWith("Unparseable Link header for acme/app");
		}

		@Test
		@DisplayName("Should return INTERRUPTED when a wait is interrupted")
		void shouldStopWhenInterrupted() {
			when(client.getWithQuery(PATH, QUERY)).thenThrow(timeout());
			RateLimitedPageFetcher interrupted = RateLimitedPageFetcher.builder()
				.client(client)
				.parser(new CommitJsonParser(ObjectMapperFactory.create()))
				.sleeper(duration -> {
					throw new InterruptedException("stop");
				})
				.build();

			CommitPage page = interrupted.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.INTERRUPTED);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}

		@Test
		@DisplayName("Should return INTERRUPTED when the request itself is interrupted")
		void shouldStopWhenRequestInterrupted() {
			when(client.getWithQuery(PATH, QUERY)).thenAnswer(invocation -> {
				Thread.currentThread().interrupt();
				throw new GitHubApiException("HTTP request interrupted", new InterruptedException());
			});

			CommitPage page = fetcher.fetch(REPO, PATH, QUERY, sink);

			assertThat(page.status()).isEqualTo(FetchStatus.INTERRUPTED);
			assertThat(sleeps).isEmpty();
			assertThat(warnings()).extracting(Diagnostic::message)
				.containsExactly("Interrupted while fetching commits for acme/app");
		}

	}

	@Nested
	@DisplayName("Builder validation")
	class BuilderTest {

		@Test
		@DisplayName("Should require a client")
		void shouldRequireClient() {
			assertThatThrownBy(() -> RateLimitedPageFetcher.builder()
				.parser(new CommitJsonParser(ObjectMapperFactory.create()))
				.build()).isInstanceOf(IllegalStateException.class).hasMessageContaining("GitHubClient");
		}

		@Test
		@DisplayName("Should reject negative retries")
		void shouldRejectNegativeRetries() {
			assertThatThrownBy(() -> RateLimitedPageFetcher.builder()
				.client(client)
				.parser(new CommitJsonParser(ObjectMapperFactory.create()))
				.maxRetries(-1)
				.build()).isInstanceOf(IllegalStateException.class);
		}

	}

}
