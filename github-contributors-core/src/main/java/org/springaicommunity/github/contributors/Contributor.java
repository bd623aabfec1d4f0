package org.springaicommunity.github.contributors;

/**
 * A human commit author of one repository, keyed by lower-cased email.
 *
 * @param name the author name from the most recent commit seen
 * @param email the lower-cased author email
 * @param lastCommit the author date of the most recent commit, as reported by GitHub
 */
public record Contributor(String name, String email, String lastCommit) {
}
