package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RateLimitThrottle}. Sleeps are recorded, never performed.
 */
@DisplayName("RateLimitThrottle Tests")
@ExtendWith(MockitoExtension.class)
class RateLimitThrottleTest {

	private static final long NOW = 1_700_000_000L;

	@Mock
	private GitHubClient client;

	private final List<Long> sleeps = new ArrayList<>();

	private RateLimitThrottle throttle;

	@BeforeEach
	void setUp() {
		throttle = RateLimitThrottle.builder()
			.rateLimitSource(client)
			.clock(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC))
			.sleeper(sleeps::add)
			.build();
	}

	@Test
	@DisplayName("Should not wait before any rate limit headers were observed")
	void shouldNotWaitWithoutInfo() throws Exception {
		when(client.getLastRateLimitInfo()).thenReturn(null);

		throttle.acquire(3);

		assertThat(sleeps).isEmpty();
	}

	@Test
	@DisplayName("Should not wait with a healthy budget")
	void shouldNotWaitWithHealthyBudget() throws Exception {
		when(client.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 4000, NOW + 600, 1000));

		throttle.acquire(3);

		assertThat(sleeps).isEmpty();
	}

	@Test
	@DisplayName("Should ignore zero weight without consulting the client")
	void shouldIgnoreZeroWeight() throws Exception {
		throttle.acquire(0);

		verifyNoInteractions(client);
	}

	@Test
	@DisplayName("Should wait until reset when the budget cannot cover the weight")
	void shouldWaitUntilReset() throws Exception {
		when(client.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 12, NOW + 30, 4988));

		throttle.acquire(3);

		assertThat(sleeps).containsExactly(31_000L);
	}

	@Test
	@DisplayName("Should not wait for a reset more than an hour away")
	void shouldNotWaitForDistantReset() throws Exception {
		when(client.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 0, NOW + 7200, 5000));

		throttle.acquire(1);

		assertThat(sleeps).isEmpty();
	}

	@Test
	@DisplayName("Should pace proportionally to weight below the threshold")
	void shouldPaceByWeight() throws Exception {
		when(client.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 60, NOW + 60, 4940));

		throttle.acquire(1);
		throttle.acquire(3);

		assertThat(sleeps).containsExactly(1_000L, 3_000L);
	}

	@Test
	@DisplayName("Should clamp pacing to the allowed range")
	void shouldClampPacing() throws Exception {
		when(client.getLastRateLimitInfo()).thenReturn(new RateLimitInfo(5000, 50, NOW + 3000, 4950),
				new RateLimitInfo(5000, 99, NOW + 1, 4901));

		throttle.acquire(1);
		throttle.acquire(1);

		assertThat(sleeps).containsExactly(10_000L, 100L);
	}

	@Test
	@DisplayName("Should require a rate limit source")
	void shouldRequireSource() {
		assertThatThrownBy(() -> RateLimitThrottle.builder().build()).isInstanceOf(IllegalStateException.class);
	}

}
