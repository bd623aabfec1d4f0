package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Input
	public @Nullable String repoFile = null; // newline-delimited owner/name list

	// Query window
	public int days; // 0 = no lower bound

	// API access
	public @Nullable String token = null; // null = GITHUB_TOKEN or unauthenticated

	public String apiUrl;

	// Output
	public String outputFile;

	// Mode flags
	public boolean debug = false;

	public boolean helpRequested = false;

	// Tuning
	public int parallelism;

	public int maxRetries;

	public ParsedConfiguration(ContributorCountProperties defaultProperties) {
		this.days = defaultProperties.getDays();
		this.apiUrl = defaultProperties.getApiUrl();
		this.outputFile = defaultProperties.getOutputFile();
		this.debug = defaultProperties.isDebug();
		this.parallelism = defaultProperties.getParallelism();
		this.maxRetries = defaultProperties.getMaxRetries();
	}

	/**
	 * Copy the parsed values onto a properties instance.
	 * @param properties the properties to update
	 * @return the same properties instance
	 */
	public ContributorCountProperties applyTo(ContributorCountProperties properties) {
		properties.setDays(days);
		properties.setApiUrl(apiUrl);
		properties.setOutputFile(outputFile);
		properties.setDebug(debug);
		properties.setParallelism(parallelism);
		properties.setMaxRetries(maxRetries);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "repoFile='" + repoFile + '\'' + ", days=" + days + ", token="
				+ (token != null ? "'****'" : "null") + ", apiUrl='" + apiUrl + '\'' + ", outputFile='" + outputFile
				+ '\'' + ", debug=" + debug + ", helpRequested=" + helpRequested + ", parallelism=" + parallelism
				+ ", maxRetries=" + maxRetries + '}';
	}

}
