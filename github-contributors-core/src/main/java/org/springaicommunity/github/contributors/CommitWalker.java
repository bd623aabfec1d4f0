package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks every page of a repository's commit listing.
 *
 * <p>
 * Starts at {@code /repos/{owner}/{name}/commits?since=...&per_page=...} and follows
 * {@code rel="next"} until the last page or a terminal fetch status. Commits keep the API
 * order (newest first). Whatever was accumulated is returned even when pagination stops
 * early; failures are reported to the {@link DiagnosticSink} instead of thrown.
 */
public class CommitWalker {

	private final RateLimitedPageFetcher fetcher;

	private final int pageSize;

	public CommitWalker(RateLimitedPageFetcher fetcher, int pageSize) {
		if (pageSize <= 0 || pageSize > 100) {
			throw new IllegalArgumentException("Page size must be between 1 and 100 (got: " + pageSize + ")");
		}
		this.fetcher = fetcher;
		this.pageSize = pageSize;
	}

	/**
	 * Fetch all commits of one repository.
	 * @param repository the repository to walk
	 * @param since inclusive lower bound on the commit date (ISO-8601), or null for the
	 * full history
	 * @param diagnostics receives progress and failures
	 * @return the commits, newest first; possibly partial or empty
	 */
	public List<CommitRecord> walk(RepositoryId repository, @Nullable String since, DiagnosticSink diagnostics) {
		String name = repository.fullName();
		List<CommitRecord> commits = new ArrayList<>();
		int pages = 0;

		try {
			CommitPage page = fetcher.fetch(name, repository.commitsPath(), buildQuery(since), diagnostics);
			while (page.status() == FetchStatus.OK) {
				pages++;
				commits.addAll(page.commits());
				diagnostics.info(name, "Fetched " + page.commits().size() + " commits for " + name
						+ ". Total so far: " + commits.size());

				if (!page.hasNext()) {
					break;
				}
				page = fetcher.fetch(name, page.nextUrl(), null, diagnostics);
			}
		}
		catch (RuntimeException e) {
			diagnostics.error(name, "Unexpected error walking commits for " + name + " after " + pages + " pages: "
					+ e.getMessage());
		}

		return commits;
	}

	String buildQuery(@Nullable String since) {
		StringBuilder query = new StringBuilder();
		if (since != null) {
			query.append("since=").append(URLEncoder.encode(since, StandardCharsets.UTF_8)).append('&');
		}
		query.append("per_page=").append(pageSize);
		return query.toString();
	}

	/**
	 * Compute the {@code since} filter for a look-back window.
	 * @param days number of days to look back; 0 means no lower bound
	 * @param clock source of the current time
	 * @return UTC timestamp such as {@code 2024-01-31T12:00:00Z}, or null when
	 * {@code days} is 0
	 */
	public static @Nullable String sinceTimestamp(int days, Clock clock) {
		if (days <= 0) {
			return null;
		}
		Instant since = clock.instant().minus(Duration.ofDays(days)).truncatedTo(ChronoUnit.SECONDS);
		return DateTimeFormatter.ISO_INSTANT.format(since);
	}

}
