package org.springaicommunity.github.contributors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-run record of everything that went wrong, returned to the caller with the report.
 *
 * <p>
 * Only the thread collecting job completions mutates an instance, one finished job at a
 * time, so no synchronization is needed.
 */
public class RunDiagnostics {

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	private final Set<String> failedRepositories = new LinkedHashSet<>();

	/**
	 * Fold in the events of one finished job.
	 * @param jobDiagnostics events the job reported
	 */
	public void addAll(List<Diagnostic> jobDiagnostics) {
		diagnostics.addAll(jobDiagnostics);
	}

	/**
	 * Record a job that failed with an exception and was excluded from the report.
	 * @param repository the repository whose job failed
	 * @param message failure detail
	 */
	public void recordFailure(String repository, String message) {
		diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, repository, message));
		failedRepositories.add(repository);
	}

	public boolean hasErrorsOrWarnings() {
		return diagnostics.stream().anyMatch(Diagnostic::isProblem);
	}

	public long errorCount() {
		return count(Diagnostic.Severity.ERROR);
	}

	public long warningCount() {
		return count(Diagnostic.Severity.WARNING);
	}

	public Set<String> getFailedRepositories() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(failedRepositories));
	}

	public List<Diagnostic> getDiagnostics() {
		return List.copyOf(diagnostics);
	}

	private long count(Diagnostic.Severity severity) {
		return diagnostics.stream().filter(d -> d.severity() == severity).count();
	}

}
