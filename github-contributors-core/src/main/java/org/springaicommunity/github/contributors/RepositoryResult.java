package org.springaicommunity.github.contributors;

import java.util.List;

/**
 * Output of one repository job, owned by that job until the orchestrator merges it.
 *
 * @param repository the {@code owner/name} coordinate as listed in the input
 * @param contributors unique human contributors in first-seen order
 * @param commitCount number of commits observed, including bots and skipped records
 * @param diagnostics events reported while processing the repository
 */
public record RepositoryResult(String repository, List<Contributor> contributors, int commitCount,
		List<Diagnostic> diagnostics) {

	public int contributorCount() {
		return contributors.size();
	}

}
