package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of commits and the cursor to the next one.
 *
 * @param status the fetch outcome
 * @param commits the commits on the page, empty unless {@code status} is
 * {@link FetchStatus#OK}
 * @param nextUrl the {@code rel="next"} URL, or null on the last page
 */
public record CommitPage(FetchStatus status, List<CommitRecord> commits, @Nullable String nextUrl) {

	public static CommitPage of(List<CommitRecord> commits, @Nullable String nextUrl) {
		return new CommitPage(FetchStatus.OK, List.copyOf(commits), nextUrl);
	}

	public static CommitPage failed(FetchStatus status) {
		return new CommitPage(status, List.of(), null);
	}

	public boolean hasNext() {
		return status == FetchStatus.OK && nextUrl != null;
	}

}
