package org.springaicommunity.github.watcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;

/**
 * Builder for creating a {@link PRWatcher} wired to the GitHub REST API without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Simple usage with environment variable
 * PRWatcher watcher = GitHubWatcherBuilder.create()
 *     .tokenFromEnv()
 *     .repository("spring-projects/spring-ai")
 *     .build();
 *
 * // With custom configuration
 * WatchProperties props = new WatchProperties();
 * props.setIntervalSeconds(60);
 * props.setMyPRs(true);
 *
 * PRWatcher watcher = GitHubWatcherBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .classifier((event, activity) -> activity.reviews().isEmpty() ? "needs_review" : "reviewed")
 *     .build();
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * PRWatcher testWatcher = GitHubWatcherBuilder.create()
 *     .httpClient(mockClient)
 *     .throttle(WatchThrottle.NONE)
 *     .build();
 * }
 * </pre>
 */
public class GitHubWatcherBuilder {

	private @Nullable String token;

	private WatchProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable RestService restService;

	private @Nullable WatchThrottle throttle;

	private @Nullable StatusClassifier classifier;

	private @Nullable RepoDiscovery discovery;

	private @Nullable Clock clock;

	private GitHubWatcherBuilder() {
		this.properties = new WatchProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubWatcherBuilder
	 */
	public static GitHubWatcherBuilder create() {
		return new GitHubWatcherBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubWatcherBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN}, see {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubWatcherBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.requireGitHubToken();
		return this;
	}

	/**
	 * Set watch properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubWatcherBuilder properties(@Nullable WatchProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Add a repository to the configured properties.
	 * @param repository repository in "owner/name" or URL form
	 * @return this builder
	 */
	public GitHubWatcherBuilder repository(String repository) {
		this.properties.getRepositories().add(repository);
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubWatcherBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators (caching, logging).
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubWatcherBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom RestService, bypassing HTTP and JSON handling entirely. When set,
	 * neither a token nor an HTTP client is required.
	 * @param restService custom RestService implementation (null to use default)
	 * @return this builder
	 */
	public GitHubWatcherBuilder restService(@Nullable RestService restService) {
		this.restService = restService;
		return this;
	}

	/**
	 * Set the throttle. Defaults to a {@link RateLimitThrottle} reading the HTTP client's
	 * rate limit headers, or {@link WatchThrottle#NONE} with a custom RestService.
	 * @param throttle custom throttle (null to use default)
	 * @return this builder
	 */
	public GitHubWatcherBuilder throttle(@Nullable WatchThrottle throttle) {
		this.throttle = throttle;
		return this;
	}

	public GitHubWatcherBuilder classifier(@Nullable StatusClassifier classifier) {
		this.classifier = classifier;
		return this;
	}

	public GitHubWatcherBuilder discovery(@Nullable RepoDiscovery discovery) {
		this.discovery = discovery;
		return this;
	}

	public GitHubWatcherBuilder clock(@Nullable Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		if (restService != null) {
			return restService;
		}
		validateToken();
		return new GitHubRestService(buildClient(), mapper());
	}

	/**
	 * Build the watcher.
	 * @return a configured, not yet started PRWatcher
	 * @throws IllegalStateException if no token, client or RestService was provided
	 * @throws IllegalArgumentException if a configured repository or interval is invalid
	 */
	public PRWatcher build() {
		RestService service;
		WatchThrottle effectiveThrottle = this.throttle;
		if (restService != null) {
			service = restService;
			if (effectiveThrottle == null) {
				effectiveThrottle = WatchThrottle.NONE;
			}
		}
		else {
			validateToken();
			GitHubClient client = buildClient();
			service = new GitHubRestService(client, mapper());
			if (effectiveThrottle == null) {
				effectiveThrottle = RateLimitThrottle.builder()
					.rateLimitSource(client)
					.pacingThreshold(properties.getPacingThreshold())
					.build();
			}
		}

		PRWatcher.Builder builder = PRWatcher.builder(service)
			.repos(properties.getRepositories())
			.interval(Duration.ofSeconds(properties.getIntervalSeconds()))
			.myPRs(properties.isMyPRs())
			.username(properties.getUsername())
			.discovery(discovery)
			.classifier(classifier)
			.throttle(effectiveThrottle);
		if (properties.getStaleAfterSeconds() > 0) {
			builder.staleThreshold(Duration.ofSeconds(properties.getStaleAfterSeconds()));
		}
		if (clock != null) {
			builder.clock(clock);
		}
		return builder.build();
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private GitHubClient buildClient() {
		if (httpClient != null) {
			return httpClient;
		}
		return new GitHubHttpClient(token);
	}

	private ObjectMapper mapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

}
