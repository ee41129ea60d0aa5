package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API, enabling testability and decorator
 * implementations.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo", may include a query string) or full
	 * URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
