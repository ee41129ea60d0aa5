package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for WatchProperties and GitHubWatcherBuilder. Plain JUnit, NO GitHub API calls.
 */
@DisplayName("ConfigurationSupport Tests")
class ConfigurationSupportTest {

	@Nested
	@DisplayName("WatchProperties Tests - Plain JUnit")
	class WatchPropertiesPlainTest {

		private WatchProperties watchProperties;

		@BeforeEach
		void setUp() {
			watchProperties = new WatchProperties();
		}

		@Test
		@DisplayName("Should have correct default properties")
		void shouldHaveCorrectDefaultProperties() {
			assertThat(watchProperties.getRepositories()).isNotNull().isEmpty();
			assertThat(watchProperties.getIntervalSeconds()).isEqualTo(30);
			assertThat(watchProperties.isMyPRs()).isFalse();
			assertThat(watchProperties.getUsername()).isNull();
			assertThat(watchProperties.getStaleAfterSeconds()).isZero();
			assertThat(watchProperties.getPacingThreshold()).isEqualTo(100);
		}

		@Test
		@DisplayName("Should copy the repository list on set")
		void shouldCopyRepositoryList() {
			List<String> repos = List.of("acme/widgets");
			watchProperties.setRepositories(repos);

			watchProperties.getRepositories().add("acme/gadgets");

			assertThat(repos).containsExactly("acme/widgets");
			assertThat(watchProperties.getRepositories()).containsExactly("acme/widgets", "acme/gadgets");
		}

	}

	@Nested
	@DisplayName("GitHubWatcherBuilder Tests")
	class GitHubWatcherBuilderTest {

		@Test
		@DisplayName("Should require a token without a custom client or RestService")
		void shouldRequireToken() {
			assertThatThrownBy(() -> GitHubWatcherBuilder.create().repository("acme/widgets").build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("GitHub token is required");
		}

		@Test
		@DisplayName("Should build a stopped watcher from a token")
		void shouldBuildFromToken() {
			PRWatcher watcher = GitHubWatcherBuilder.create().token("test-token").repository("acme/widgets").build();

			assertThat(watcher.isRunning()).isFalse();
			assertThat(watcher.getWatchedPRs()).isEmpty();
		}

		@Test
		@DisplayName("Should build a GitHubRestService over a custom client")
		void shouldBuildRestServiceOverCustomClient() {
			GitHubClient client = mock(GitHubClient.class);
			when(client.get("/user")).thenReturn("{\"login\": \"octocat\"}");

			RestService restService = GitHubWatcherBuilder.create().httpClient(client).buildRestService();

			assertThat(restService).isInstanceOf(GitHubRestService.class);
			assertThat(restService.getAuthenticatedLogin()).isEqualTo("octocat");
		}

		@Test
		@DisplayName("Should poll through a custom RestService on start")
		void shouldPollThroughCustomRestService() {
			RestService restService = mock(RestService.class);
			when(restService.listOpenPullRequests(TestData.REPO)).thenReturn(List.of(TestData.pr(1)));
			WatchProperties properties = new WatchProperties();
			properties.setRepositories(List.of("https://github.com/Acme/Widgets"));
			properties.setIntervalSeconds(3600);

			PRWatcher watcher = GitHubWatcherBuilder.create().restService(restService).properties(properties).build();
			try {
				List<PRStatus> statuses = watcher.start();

				assertThat(statuses).extracting(PRStatus::repo).containsExactly(TestData.REPO);
				verify(restService).listOpenPullRequests(TestData.REPO);
			}
			finally {
				watcher.stop();
			}
		}

		@Test
		@DisplayName("Should reject an invalid repository at build time")
		void shouldRejectInvalidRepository() {
			RestService restService = mock(RestService.class);

			assertThatThrownBy(
					() -> GitHubWatcherBuilder.create().restService(restService).repository("not a repo").build())
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject a non-positive interval")
		void shouldRejectInvalidInterval() {
			WatchProperties properties = new WatchProperties();
			properties.setIntervalSeconds(0);

			assertThatThrownBy(() -> GitHubWatcherBuilder.create()
				.restService(mock(RestService.class))
				.properties(properties)
				.repository("acme/widgets")
				.build()).isInstanceOf(IllegalArgumentException.class);
		}

	}

}
