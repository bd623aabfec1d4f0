package org.springaicommunity.github.contributors;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes contributor rows as CSV with a header row, using Apache Commons CSV.
 */
public class CsvReportWriter implements ReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(CsvReportWriter.class);

	static final String[] HEADERS = { "Repository", "Contributor Email", "Contributor Name",
			"Last Commit Timestamp" };

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setHeader(HEADERS).build();

	@Override
	public void write(Path file, List<ContributorRow> rows) throws IOException {
		logger.info("Writing {} rows to CSV: {}", rows.size(), file);
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
				CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
			for (ContributorRow row : rows) {
				printer.printRecord(row.repository(), row.email(), row.name(), row.lastCommit());
			}
		}
	}

}
