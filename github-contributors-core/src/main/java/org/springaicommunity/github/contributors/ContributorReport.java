package org.springaicommunity.github.contributors;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merged result of a run over many repositories.
 *
 * @param rows one row per (repository, contributor), in job completion order and then
 * first-seen order within a job
 * @param contributorCounts unique contributors per repository, in job completion order;
 * failed repositories are absent
 * @param diagnostics everything reported during the run
 */
public record ContributorReport(List<ContributorRow> rows, Map<String, Integer> contributorCounts,
		RunDiagnostics diagnostics) {

	/**
	 * Number of distinct emails across all repositories. An author of several
	 * repositories is counted once here but once per repository in
	 * {@link #contributorCounts()}.
	 * @return global unique contributor count
	 */
	public int totalUniqueContributors() {
		return rows.stream().map(ContributorRow::email).collect(Collectors.toSet()).size();
	}

	public boolean hasErrorsOrWarnings() {
		return diagnostics.hasErrorsOrWarnings();
	}

}
