package org.springaicommunity.github.contributors.cli;

import me.tongfei.progressbar.ProgressBar;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.contributors.*;
import org.tinylog.configuration.Configuration;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * GitHub Contributors CLI Application
 *
 * Plain Java command-line application that counts unique human commit authors across a
 * list of repositories. Wires services through {@link ContributorCountBuilder}, writes a
 * CSV report and prints a summary table.
 *
 * Usage: java -jar github-contributors-cli.jar REPO_FILE [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token, used when --token
 * is not given
 *
 * Examples: java -jar github-contributors-cli.jar repos.txt java -jar
 * github-contributors-cli.jar repos.txt --days 30 --output recent.csv java -jar
 * github-contributors-cli.jar repos.txt --debug
 */
public class ContributorCountCli {

	private static final String ADVISORY = "Process completed with errors or warnings. Check the logs for details.";

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run the application. Returns 0 whenever the run completed, even if repositories
	 * failed; those failures are reported as an advisory line and in the log file.
	 * @param args command-line arguments
	 * @param console destination of the summary table and advisory
	 * @return process exit code
	 */
	public static int run(String[] args, PrintStream console) {
		ContributorCountProperties properties = new ContributorCountProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			console.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			console.println(e.getMessage());
			console.println("Run with --help for usage.");
			return 1;
		}

		configureLogging(config.debug);
		Logger logger = LoggerFactory.getLogger(ContributorCountCli.class);
		logger.info("Starting process with provided arguments");
		logConfiguration(logger, config);

		config.applyTo(properties);
		ContributorCountBuilder builder = ContributorCountBuilder.create()
			.token(EnvironmentSupport.resolveToken(config.token))
			.properties(properties);

		List<String> repositories;
		try {
			repositories = RepositoryListReader.read(Paths.get(config.repoFile));
		}
		catch (IOException e) {
			logger.error("Cannot read repository file {}: {}", config.repoFile, e.getMessage());
			console.println("Cannot read repository file " + config.repoFile + ": " + e.getMessage());
			return 1;
		}

		String since = builder.sinceTimestamp();
		logger.info("Using cutoff date: {}", since != null ? since : "(none)");

		RepositoryOrchestrator orchestrator = builder.buildOrchestrator();
		ContributorReport report = collect(orchestrator, repositories, since, config.debug);

		boolean problems = report.hasErrorsOrWarnings();
		Path output = Paths.get(config.outputFile);
		try {
			new CsvReportWriter().write(output, report.rows());
		}
		catch (IOException e) {
			logger.error("Failed to write CSV {}: {}", output, e.getMessage(), e);
			problems = true;
		}

		logger.info("Calculating summary information");
		console.print(SummaryTableFormatter.format(report, properties));
		console.println();
		console.println("Detailed data written to " + output);

		if (problems) {
			console.println();
			console.println(ADVISORY);
			logger.info("Process completed with errors or warnings. Errors: {}, warnings: {}, failed repositories: {}",
					report.diagnostics().errorCount(), report.diagnostics().warningCount(),
					report.diagnostics().getFailedRepositories());
		}
		else {
			logger.info("Process completed");
		}
		return 0;
	}

	private static ContributorReport collect(RepositoryOrchestrator orchestrator, List<String> repositories,
			@Nullable String since, boolean debug) {
		if (debug) {
			return orchestrator.run(repositories, since);
		}
		try (ProgressBar progressBar = new ProgressBar("Processing repositories", repositories.size())) {
			return orchestrator.run(repositories, since, (repository, completed, total) -> progressBar.step());
		}
	}

	/**
	 * Raise console logging to debug level. Must run before the first logger is used,
	 * while tinylog still accepts configuration changes.
	 */
	private static void configureLogging(boolean debug) {
		if (debug) {
			Configuration.set("writerConsole.level", "debug");
		}
	}

	private static void logConfiguration(Logger logger, ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Repository file: {}", config.repoFile);
		logger.info("  Days: {}", config.days > 0 ? config.days : "all history");
		logger.info("  Token: {}", config.token != null ? "(from --token)" : "(from environment)");
		logger.info("  API URL: {}", config.apiUrl);
		logger.info("  Output file: {}", config.outputFile);
		logger.info("  Debug: {}", config.debug);
		logger.info("  Parallelism: {}", config.parallelism);
		logger.info("  Max retries: {}", config.maxRetries);
	}

}
