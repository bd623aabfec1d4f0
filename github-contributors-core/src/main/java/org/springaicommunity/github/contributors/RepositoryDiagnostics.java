package org.springaicommunity.github.contributors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic sink owned by a single repository job. Every event is written to the log
 * and kept, so the orchestrator can fold it into the run once the job has finished.
 *
 * <p>
 * Not thread-safe: one instance per job thread.
 */
public class RepositoryDiagnostics implements DiagnosticSink {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryDiagnostics.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	@Override
	public void report(Diagnostic diagnostic) {
		switch (diagnostic.severity()) {
			case ERROR -> logger.error(diagnostic.message());
			case WARNING -> logger.warn(diagnostic.message());
			default -> logger.info(diagnostic.message());
		}
		diagnostics.add(diagnostic);
	}

	public List<Diagnostic> getDiagnostics() {
		return List.copyOf(diagnostics);
	}

}
