package org.springaicommunity.github.contributors;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the contributor count application. Pure Java
 * implementation with no framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ContributorCountProperties defaultProperties;

	public ArgumentParser(ContributorCountProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--days":
					config.days = parseInt(getRequiredValue(args, i, "days"), "days");
					if (config.days < 0) {
						throw new IllegalArgumentException("Days must not be negative: " + config.days);
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--token":
					config.token = getRequiredValue(args, i, "token");
					i++;
					break;

				case "--api-url":
					config.apiUrl = getRequiredValue(args, i, "api-url");
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--debug":
					config.debug = true;
					break;

				case "-p", "--parallelism":
					config.parallelism = parseInt(getRequiredValue(args, i, "parallelism"), "parallelism");
					if (config.parallelism <= 0) {
						throw new IllegalArgumentException("Parallelism must be positive: " + config.parallelism);
					}
					i++;
					break;

				case "--max-retries":
					config.maxRetries = parseInt(getRequiredValue(args, i, "max-retries"), "max-retries");
					if (config.maxRetries < 0) {
						throw new IllegalArgumentException("Max retries must not be negative: " + config.maxRetries);
					}
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.repoFile != null) {
						throw new IllegalArgumentException(
								"Unexpected argument '" + arg + "': repository file already given as '"
										+ config.repoFile + "'");
					}
					config.repoFile = arg;
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-contributors REPO_FILE [OPTIONS]\n");
		help.append("\n");
		help.append("Fetch GitHub contributors and their last commit info.\n");
		help.append("\n");
		help.append("ARGUMENTS:\n");
		help.append("    REPO_FILE               Text file with one repository per line in 'owner/repo' format\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    --days DAYS             Number of days to look back for contributions (default: ")
			.append(defaultProperties.getDays())
			.append(", 0 = all history)\n");
		help.append("    --token TOKEN           GitHub personal access token (default: GITHUB_TOKEN)\n");
		help.append("    --api-url URL           GitHub API URL (default: ")
			.append(defaultProperties.getApiUrl())
			.append(")\n");
		help.append("    -o, --output FILE       Output CSV file name (default: ")
			.append(defaultProperties.getOutputFile())
			.append(")\n");
		help.append("    --debug                 Enable debug output (disables the progress bar)\n");
		help.append("\n");
		help.append("TUNING OPTIONS:\n");
		help.append("    -p, --parallelism N     Repositories processed concurrently (default: ")
			.append(defaultProperties.getParallelism())
			.append(")\n");
		help.append("    --max-retries N         Retries per page after request timeouts (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN            Used when --token is not given (also read from .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-contributors repos.txt\n");
		help.append("    github-contributors repos.txt --days 30 --output last-month.csv\n");
		help.append("    github-contributors repos.txt --days 0 --api-url https://github.example.com/api/v3\n");
		help.append("\n");
		help.append("Log output is written to github_contributor_count.log in the working directory.\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInt(String value, String optionName) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be an integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.helpRequested) {
			return;
		}

		// Validate repository file
		if (config.repoFile == null || config.repoFile.trim().isEmpty()) {
			errors.add("Repository file is required");
		}

		// Validate API URL
		if (config.apiUrl.trim().isEmpty()) {
			errors.add("API URL cannot be empty");
		}
		else if (!config.apiUrl.startsWith("http://") && !config.apiUrl.startsWith("https://")) {
			errors.add("API URL must start with http:// or https:// (got: " + config.apiUrl + ")");
		}

		// Validate output
		if (config.outputFile.trim().isEmpty()) {
			errors.add("Output file cannot be empty");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
