package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

/**
 * The fields of a GitHub commit listing entry that contributor extraction reads.
 *
 * <p>
 * GitHub returns two identities per commit: the linked GitHub account ({@code author},
 * absent when the commit email is not associated with any account) and the raw git
 * author metadata ({@code commit.author}).
 *
 * @param sha the commit SHA, or null if the entry carried none
 * @param account the linked GitHub account, or null
 * @param author the git author metadata, or null when the entry lacks it
 */
public record CommitRecord(@Nullable String sha, @Nullable Account account, @Nullable GitAuthor author) {

	static final String NOT_AVAILABLE = "N/A";

	/**
	 * The GitHub account linked to a commit.
	 *
	 * @param login the account handle, e.g. {@code dependabot[bot]}
	 * @param type the account type, {@code "User"} or {@code "Bot"}
	 */
	public record Account(String login, String type) {
	}

	/**
	 * Git author metadata as recorded in the commit object. Missing values are
	 * {@code "N/A"}.
	 *
	 * @param name the author name
	 * @param email the author email, as recorded (not normalized)
	 * @param date the ISO-8601 author date, as recorded
	 */
	public record GitAuthor(String name, String email, String date) {
	}

}
