package org.springaicommunity.github.contributors;

import java.util.Map;

/**
 * Renders the console summary: one line per repository with its unique contributor
 * count, then the global total. The repository column is as wide as the longest name,
 * clamped to a configurable minimum and maximum ({@link #DEFAULT_WIDTH} and
 * {@link #MAX_WIDTH} unless {@link ContributorCountProperties} says otherwise).
 */
public final class SummaryTableFormatter {

	static final int DEFAULT_WIDTH = 40;

	static final int MAX_WIDTH = 80;

	private static final int COUNT_WIDTH = 20;

	private SummaryTableFormatter() {
	}

	public static String format(ContributorReport report) {
		return format(report, DEFAULT_WIDTH, MAX_WIDTH);
	}

	public static String format(ContributorReport report, ContributorCountProperties properties) {
		return format(report, properties.getSummaryColumnWidth(), properties.getSummaryMaxColumnWidth());
	}

	static String format(ContributorReport report, int minWidth, int maxWidth) {
		if (minWidth <= 0 || maxWidth < minWidth) {
			throw new IllegalArgumentException(
					"Summary column width must be positive and not exceed the maximum: " + minWidth + "/" + maxWidth);
		}
		Map<String, Integer> counts = report.contributorCounts();
		int width = columnWidth(counts, minWidth, maxWidth);
		String rowFormat = "%-" + width + "s %-" + COUNT_WIDTH + "s%n";
		String rule = "-".repeat(width + COUNT_WIDTH + 2) + System.lineSeparator();

		StringBuilder table = new StringBuilder();
		table.append(System.lineSeparator()).append("Contributor Summary:").append(System.lineSeparator());
		table.append(String.format(rowFormat, "Repository", "Unique Contributors"));
		table.append(rule);
		counts.forEach((repository, count) -> table.append(String.format(rowFormat, repository, count)));
		table.append(rule);
		table.append(String.format(rowFormat, "Total", report.totalUniqueContributors()));
		return table.toString();
	}

	static int columnWidth(Map<String, Integer> counts, int minWidth, int maxWidth) {
		int longest = counts.keySet().stream().mapToInt(String::length).max().orElse(minWidth);
		return Math.min(Math.max(minWidth, longest), maxWidth);
	}

}
