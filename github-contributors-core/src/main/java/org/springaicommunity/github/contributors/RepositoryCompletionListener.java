package org.springaicommunity.github.contributors;

/**
 * Notified on the coordinating thread each time a repository job finishes, successfully
 * or not. Used by the command line to advance its progress bar.
 */
@FunctionalInterface
public interface RepositoryCompletionListener {

	RepositoryCompletionListener NONE = (repository, completed, total) -> {
	};

	void onRepositoryCompleted(String repository, int completed, int total);

}
