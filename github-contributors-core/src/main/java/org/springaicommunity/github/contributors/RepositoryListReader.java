package org.springaicommunity.github.contributors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the newline-delimited repository list. Lines are trimmed and blank lines are
 * skipped; the remaining order is kept. Coordinates are validated later, per job.
 */
public final class RepositoryListReader {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryListReader.class);

	private RepositoryListReader() {
	}

	/**
	 * Read repositories from a UTF-8 file.
	 * @param file the repository list
	 * @return {@code owner/name} entries in file order
	 * @throws IOException if the file cannot be read
	 */
	public static List<String> read(Path file) throws IOException {
		logger.info("Reading repositories from file: {}", file);
		List<String> repositories = Files.readAllLines(file, StandardCharsets.UTF_8)
			.stream()
			.map(String::trim)
			.filter(line -> !line.isEmpty())
			.collect(Collectors.toList());
		logger.info("Processing {} repositories", repositories.size());
		return repositories;
	}

}
