package org.springaicommunity.github.contributors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Separates bot commits from human ones and deduplicates human authors by email.
 *
 * <p>
 * A commit is a bot commit when its linked account has type {@code Bot}, its account
 * login ends with {@code [bot]}, or its git author email ends with {@code [bot]} (both
 * case-insensitive). Once an email is seen on a bot commit it never appears as a
 * contributor of that repository.
 *
 * <p>
 * Humans are keyed by lower-cased email and the first commit seen wins. The commit
 * listing is ordered newest first, so the kept date is the author's most recent commit.
 * With any other input order the kept date is simply the first one encountered.
 */
public class ContributorExtractor {

	private static final String BOT_TYPE = "Bot";

	private static final String BOT_SUFFIX = "[bot]";

	/**
	 * Extract the contributors of one repository.
	 * @param repository {@code owner/name}, used for diagnostics only
	 * @param commits the commits, newest first
	 * @param diagnostics receives skipped records and classification events
	 * @return contributors by lower-cased email, in first-seen order
	 */
	public Map<String, Contributor> extract(String repository, List<CommitRecord> commits,
			DiagnosticSink diagnostics) {
		Map<String, Contributor> contributors = new LinkedHashMap<>();
		Set<String> bots = new LinkedHashSet<>();

		for (CommitRecord commit : commits) {
			CommitRecord.GitAuthor author = commit.author();
			if (author == null) {
				diagnostics.info(repository, "Skipping commit " + (commit.sha() != null ? commit.sha() : "(no sha)")
						+ " in " + repository + " with no author metadata");
				continue;
			}

			String email = author.email().toLowerCase(Locale.ROOT);
			String name = author.name();

			if (isBot(commit)) {
				if (bots.add(email)) {
					diagnostics.info(repository, "Contributor " + name + " (" + email + ") to " + repository
							+ " is a bot");
				}
				if (contributors.remove(email) != null) {
					diagnostics.info(repository, "Removed " + email + " from contributors of " + repository
							+ " on encountering a bot commit with the same email");
				}
				continue;
			}

			if (bots.contains(email) || contributors.containsKey(email)) {
				continue;
			}

			diagnostics.info(repository, "Adding " + name + " (" + email + ") as contributor to " + repository);
			contributors.put(email, new Contributor(name, email, author.date()));
		}

		return Collections.unmodifiableMap(contributors);
	}

	/**
	 * Returns true if the commit was made by an automated account.
	 * @param commit the commit to classify
	 * @return true for bot commits
	 */
	public static boolean isBot(CommitRecord commit) {
		CommitRecord.Account account = commit.account();
		if (account != null) {
			if (BOT_TYPE.equals(account.type())) {
				return true;
			}
			if (endsWithBotSuffix(account.login())) {
				return true;
			}
		}

		CommitRecord.GitAuthor author = commit.author();
		return author != null && endsWithBotSuffix(author.email());
	}

	private static boolean endsWithBotSuffix(String value) {
		return value.toLowerCase(Locale.ROOT).endsWith(BOT_SUFFIX);
	}

}
