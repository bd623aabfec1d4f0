package org.springaicommunity.github.contributors;

/**
 * A single event reported while processing a repository.
 *
 * @param severity how serious the event is
 * @param repository the {@code owner/name} the event belongs to
 * @param message human readable detail, including the URL or error where relevant
 */
public record Diagnostic(Severity severity, String repository, String message) {

	public enum Severity {

		INFO, WARNING, ERROR;

		/**
		 * Returns true for severities that make a run "completed with errors or
		 * warnings".
		 */
		public boolean isProblem() {
			return this != INFO;
		}

	}

	public boolean isProblem() {
		return severity.isProblem();
	}

}
