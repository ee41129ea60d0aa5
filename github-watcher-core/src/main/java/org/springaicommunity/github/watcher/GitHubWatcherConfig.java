package org.springaicommunity.github.watcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

/**
 * Spring configuration exposing the watcher and its collaborators as beans.
 *
 * <p>
 * Optional: the watcher itself has no Spring dependency. Repositories are read from the
 * comma-separated {@code github.watcher.repositories} property; a {@link StatusClassifier}
 * or {@link RepoDiscovery} bean in the context is picked up when present.
 */
@Configuration
public class GitHubWatcherConfig {

	@Value("${GITHUB_TOKEN}")
	private String githubToken;

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public WatchProperties watchProperties(@Value("${github.watcher.repositories:}") String repositories,
			@Value("${github.watcher.interval-seconds:30}") int intervalSeconds,
			@Value("${github.watcher.my-prs:false}") boolean myPRs,
			@Value("${github.watcher.stale-after-seconds:0}") int staleAfterSeconds) {
		WatchProperties properties = new WatchProperties();
		properties.setRepositories(Arrays.stream(repositories.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.toList());
		properties.setIntervalSeconds(intervalSeconds);
		properties.setMyPRs(myPRs);
		properties.setStaleAfterSeconds(staleAfterSeconds);
		return properties;
	}

	@Bean
	public GitHubClient gitHubClient() {
		return new GitHubHttpClient(githubToken);
	}

	@Bean
	public RestService restService(GitHubClient gitHubClient, ObjectMapper objectMapper) {
		return new GitHubRestService(gitHubClient, objectMapper);
	}

	@Bean
	public WatchThrottle watchThrottle(GitHubClient gitHubClient, WatchProperties watchProperties) {
		return RateLimitThrottle.builder()
			.rateLimitSource(gitHubClient)
			.pacingThreshold(watchProperties.getPacingThreshold())
			.build();
	}

	@Bean(destroyMethod = "stop")
	public PRWatcher prWatcher(RestService restService, WatchThrottle watchThrottle, WatchProperties watchProperties,
			ObjectProvider<StatusClassifier> classifier, ObjectProvider<RepoDiscovery> discovery) {
		return GitHubWatcherBuilder.create()
			.restService(restService)
			.throttle(watchThrottle)
			.properties(watchProperties)
			.classifier(classifier.getIfAvailable())
			.discovery(discovery.getIfAvailable())
			.build();
	}

}
