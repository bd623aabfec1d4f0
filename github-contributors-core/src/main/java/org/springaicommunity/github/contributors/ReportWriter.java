package org.springaicommunity.github.contributors;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists the contributor rows of a report.
 */
public interface ReportWriter {

	/**
	 * Write the rows, replacing any existing file.
	 * @param file destination
	 * @param rows rows in report order
	 * @throws IOException if the file cannot be written
	 */
	void write(Path file, List<ContributorRow> rows) throws IOException;

}
