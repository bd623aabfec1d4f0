package org.springaicommunity.github.contributors;

/**
 * Configuration properties for a contributor count run.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link ContributorCountBuilder}. Defaults are suitable for github.com; raise
 * {@code parallelism} for long repository lists on a token with a high rate limit.
 */
public class ContributorCountProperties {

	/**
	 * Base URL of the GitHub REST API (GitHub Enterprise: {@code https://host/api/v3}).
	 */
	private String apiUrl = GitHubHttpClient.DEFAULT_API_URL;

	/**
	 * Look-back window in days; 0 disables the {@code since} filter.
	 */
	private int days = 90;

	/**
	 * Commits requested per page ({@code per_page}, at most 100).
	 */
	private int pageSize = 100;

	/**
	 * Maximum consecutive timeout retries per page.
	 */
	private int maxRetries = 5;

	/**
	 * Unit of the exponential timeout backoff in seconds.
	 */
	private int backoffBaseSeconds = 1;

	/**
	 * Seconds added to every rate limit reset wait.
	 */
	private int rateLimitMarginSeconds = 3;

	/**
	 * Per-request timeout in seconds.
	 */
	private int requestTimeoutSeconds = 10;

	/**
	 * Connection timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Number of repositories processed concurrently.
	 */
	private int parallelism = Runtime.getRuntime().availableProcessors();

	/**
	 * Path of the CSV report.
	 */
	private String outputFile = "contributors.csv";

	/**
	 * Verbose console logging; also disables the progress bar.
	 */
	private boolean debug = false;

	/**
	 * Minimum width of the repository column in the console summary.
	 */
	private int summaryColumnWidth = 40;

	/**
	 * Maximum width of the repository column in the console summary.
	 */
	private int summaryMaxColumnWidth = 80;

	public String getApiUrl() {
		return apiUrl;
	}

	public void setApiUrl(String apiUrl) {
		this.apiUrl = apiUrl;
	}

	public int getDays() {
		return days;
	}

	public void setDays(int days) {
		this.days = days;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public int getBackoffBaseSeconds() {
		return backoffBaseSeconds;
	}

	public void setBackoffBaseSeconds(int backoffBaseSeconds) {
		this.backoffBaseSeconds = backoffBaseSeconds;
	}

	public int getRateLimitMarginSeconds() {
		return rateLimitMarginSeconds;
	}

	public void setRateLimitMarginSeconds(int rateLimitMarginSeconds) {
		this.rateLimitMarginSeconds = rateLimitMarginSeconds;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public int getParallelism() {
		return parallelism;
	}

	public void setParallelism(int parallelism) {
		this.parallelism = parallelism;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	public int getSummaryColumnWidth() {
		return summaryColumnWidth;
	}

	public void setSummaryColumnWidth(int summaryColumnWidth) {
		this.summaryColumnWidth = summaryColumnWidth;
	}

	public int getSummaryMaxColumnWidth() {
		return summaryMaxColumnWidth;
	}

	public void setSummaryMaxColumnWidth(int summaryMaxColumnWidth) {
		this.summaryMaxColumnWidth = summaryMaxColumnWidth;
	}

}
