package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Simple HTTP client wrapper for GitHub API calls using Java 11+ HttpClient.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}. Non-2xx responses are raised as
 * {@link GitHubApiException}; requests exceeding the request timeout are raised as
 * {@link GitHubTimeoutException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String DEFAULT_API_URL = "https://api.github.com";

	private final HttpClient httpClient;

	private final String apiUrl;

	private final String token;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, DEFAULT_API_URL, Duration.ofSeconds(30), Duration.ofSeconds(10));
	}

	public GitHubHttpClient(String token, String apiUrl, Duration connectTimeout, Duration requestTimeout) {
		this.token = token;
		this.apiUrl = stripTrailingSlash(apiUrl);
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public ApiResponse get(String path) {
		String url = path.startsWith("http") ? path : apiUrl + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-contributors")
			.GET();
		if (!token.isBlank()) {
			builder.header("Authorization", "token " + token);
		}

		try {
			ApiResponse response = executeRequest(builder.build());
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.body().length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public ApiResponse getWithQuery(String path, @Nullable String queryString) {
		String url = path.startsWith("http") ? path : apiUrl + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	public String getApiUrl() {
		return apiUrl;
	}

	private ApiResponse executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);
			long retryAfter = parseLongHeader(response, "Retry-After", -1);

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
				if (remaining < 100) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return new ApiResponse(response.body(), response.headers().firstValue("Link").orElse(null));
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GitHub token.", statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403 && remaining == 0) {
				throw new GitHubApiException("Rate limit exceeded (403). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset, retryAfter);
			}
			else if (statusCode == 403 && retryAfter >= 0) {
				throw new GitHubApiException("Secondary rate limit (403). Retry after " + retryAfter + "s", statusCode,
						response.body(), remaining, reset, retryAfter);
			}
			else if (statusCode == 403) {
				throw new GitHubApiException("Forbidden: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset, retryAfter);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (HttpTimeoutException e) {
			throw new GitHubTimeoutException("Request timed out after " + requestTimeout.toSeconds() + "s: "
					+ request.uri(), e);
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
