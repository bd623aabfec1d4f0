package org.springaicommunity.github.contributors;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Builder for wiring the contributor counting components without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from --token, GITHUB_TOKEN or .env, defaults for everything else
 * RepositoryOrchestrator orchestrator = ContributorCountBuilder.create()
 *     .token(EnvironmentSupport.resolveToken(null))
 *     .buildOrchestrator();
 *
 * ContributorReport report = orchestrator.run(List.of("spring-projects/spring-ai"), null);
 *
 * // GitHub Enterprise with custom tuning
 * ContributorCountProperties props = new ContributorCountProperties();
 * props.setParallelism(16);
 *
 * RepositoryOrchestrator orchestrator = ContributorCountBuilder.create()
 *     .token("ghp_xxxxx")
 *     .apiUrl("https://github.example.com/api/v3")
 *     .properties(props)
 *     .buildOrchestrator();
 *
 * // For testing with a mock HTTP client and no real sleeping
 * GitHubClient mockClient = mock(GitHubClient.class);
 * RepositoryOrchestrator testOrchestrator = ContributorCountBuilder.create()
 *     .httpClient(mockClient)
 *     .sleeper(duration -> {})
 *     .buildOrchestrator();
 * }
 * </pre>
 */
public class ContributorCountBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ContributorCountBuilder.class);

	private String token = "";

	private ContributorCountProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private Sleeper sleeper = Sleeper.SYSTEM;

	private Clock clock = Clock.systemDefaultZone();

	private ContributorCountBuilder() {
		this.properties = new ContributorCountProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ContributorCountBuilder
	 */
	public static ContributorCountBuilder create() {
		return new ContributorCountBuilder();
	}

	/**
	 * Set the GitHub token directly. A blank token means unauthenticated requests.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public ContributorCountBuilder token(@Nullable String token) {
		this.token = token != null ? token.trim() : "";
		return this;
	}

	/**
	 * Override the API base URL of the current properties.
	 * @param apiUrl REST API base URL
	 * @return this builder
	 */
	public ContributorCountBuilder apiUrl(String apiUrl) {
		this.properties.setApiUrl(apiUrl);
		return this;
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ContributorCountBuilder properties(@Nullable ContributorCountProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ContributorCountBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, token and API URL are not used.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public ContributorCountBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set how rate limit and backoff waits are performed.
	 * @param sleeper the sleeper (default: {@link Sleeper#SYSTEM})
	 * @return this builder
	 */
	public ContributorCountBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Set the clock used for rate limit resets and the {@code since} window.
	 * @param clock the clock (default: system clock, local zone)
	 * @return this builder
	 */
	public ContributorCountBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the HTTP client, or return the custom one.
	 * @return configured GitHubClient
	 */
	public GitHubClient buildHttpClient() {
		if (httpClient != null) {
			return httpClient;
		}
		if (token.isEmpty()) {
			logger.warn("No GitHub token provided; using unauthenticated requests with a low rate limit");
		}
		return new GitHubHttpClient(token, properties.getApiUrl(),
				Duration.ofSeconds(properties.getConnectTimeoutSeconds()),
				Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
	}

	/**
	 * Build the page fetcher.
	 * @return configured RateLimitedPageFetcher
	 */
	public RateLimitedPageFetcher buildFetcher() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		return RateLimitedPageFetcher.builder()
			.client(buildHttpClient())
			.parser(new CommitJsonParser(mapper))
			.maxRetries(properties.getMaxRetries())
			.backoffBase(Duration.ofSeconds(properties.getBackoffBaseSeconds()))
			.rateLimitMargin(Duration.ofSeconds(properties.getRateLimitMarginSeconds()))
			.sleeper(sleeper)
			.clock(clock)
			.build();
	}

	/**
	 * Build the commit walker.
	 * @return configured CommitWalker
	 */
	public CommitWalker buildWalker() {
		return new CommitWalker(buildFetcher(), properties.getPageSize());
	}

	/**
	 * Build the orchestrator running the whole pipeline.
	 * @return configured RepositoryOrchestrator
	 */
	public RepositoryOrchestrator buildOrchestrator() {
		return new RepositoryOrchestrator(buildWalker(), new ContributorExtractor(), properties.getParallelism());
	}

	/**
	 * The {@code since} filter for the configured look-back window.
	 * @return ISO-8601 UTC timestamp, or null when {@code days} is 0
	 */
	public @Nullable String sinceTimestamp() {
		return CommitWalker.sinceTimestamp(properties.getDays(), clock);
	}

}
