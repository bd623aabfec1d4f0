package org.springaicommunity.github.contributors;

/**
 * One line of the contributor report: a contributor of a specific repository. The same
 * email appears once per repository it contributed to.
 *
 * @param repository the {@code owner/name} coordinate
 * @param email the lower-cased contributor email
 * @param name the contributor name
 * @param lastCommit the author date of the contributor's most recent commit
 */
public record ContributorRow(String repository, String email, String name, String lastCommit) {

	public static ContributorRow of(String repository, Contributor contributor) {
		return new ContributorRow(repository, contributor.email(), contributor.name(), contributor.lastCommit());
	}

}
