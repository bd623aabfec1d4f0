package org.springaicommunity.github.contributors;

/**
 * Receives the events raised by the fetch, walk and extraction steps.
 *
 * <p>
 * Passed explicitly into each component instead of relying on a process-wide flag, so the
 * components stay unit-testable and every run owns its own failure record.
 */
@FunctionalInterface
public interface DiagnosticSink {

	void report(Diagnostic diagnostic);

	default void info(String repository, String message) {
		report(new Diagnostic(Diagnostic.Severity.INFO, repository, message));
	}

	default void warn(String repository, String message) {
		report(new Diagnostic(Diagnostic.Severity.WARNING, repository, message));
	}

	default void error(String repository, String message) {
		report(new Diagnostic(Diagnostic.Severity.ERROR, repository, message));
	}

}
