package org.springaicommunity.github.watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * {@link WatchThrottle} driven by the rate limit headers the {@link GitHubClient} last
 * observed.
 *
 * <p>
 * Behavior per {@link #acquire(int)}:
 * <ul>
 * <li>When the remaining budget cannot cover the requested weight plus a small reserve,
 * waits until {@code X-RateLimit-Reset} (+1s buffer)</li>
 * <li>When the remaining budget drops below the pacing threshold, spreads the remaining
 * requests evenly across the time until reset, scaled by weight (100ms to 10s per
 * call)</li>
 * <li>Otherwise returns immediately</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = new GitHubHttpClient(token);
 * WatchThrottle throttle = RateLimitThrottle.builder()
 *     .rateLimitSource(client)
 *     .pacingThreshold(200)
 *     .build();
 * }
 * </pre>
 */
public final class RateLimitThrottle implements WatchThrottle {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitThrottle.class);

	/**
	 * Maximum time to wait for a rate limit reset (1 hour). A reset further away than this
	 * indicates a bad header; the throttle does not wait in that case.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final GitHubClient rateLimitSource;

	private final int pacingThreshold;

	private final int reserve;

	private final Clock clock;

	private final Sleeper sleeper;

	private RateLimitThrottle(Builder builder) {
		this.rateLimitSource = builder.rateLimitSource;
		this.pacingThreshold = builder.pacingThreshold;
		this.reserve = builder.reserve;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	/**
	 * Create a new builder for RateLimitThrottle.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void acquire(int weight) throws InterruptedException {
		if (weight <= 0) {
			return;
		}
		RateLimitInfo info = rateLimitSource.getLastRateLimitInfo();
		if (info == null || info.remaining() < 0) {
			return;
		}

		long secondsUntilReset = info.reset() - clock.instant().getEpochSecond();

		if (info.remaining() < weight + reserve) {
			if (secondsUntilReset > 0 && secondsUntilReset <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit budget exhausted ({}/{} remaining, need {}). Waiting {} seconds until reset",
						info.remaining(), info.limit(), weight, secondsUntilReset);
				sleeper.sleep((secondsUntilReset + 1) * 1000);
			}
			else if (secondsUntilReset > MAX_RESET_WAIT_SECONDS) {
				logger.warn("Rate limit reset is {} seconds away (> 1hr), not waiting", secondsUntilReset);
			}
			return;
		}

		if (info.remaining() < pacingThreshold && secondsUntilReset > 0) {
			long paceMs = (secondsUntilReset * 1000 * weight) / info.remaining();
			paceMs = Math.min(paceMs, 10_000);
			paceMs = Math.max(paceMs, 100);
			logger.debug("Pacing: {}/{} remaining, sleeping {}ms for weight {}", info.remaining(), info.limit(), paceMs,
					weight);
			sleeper.sleep(paceMs);
		}
	}

	@FunctionalInterface
	interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

	/**
	 * Builder for {@link RateLimitThrottle}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>pacingThreshold: 100 (start pacing when remaining drops below this)</li>
	 * <li>reserve: 10 requests kept back for interactive use of the same token</li>
	 * </ul>
	 */
	public static class Builder {

		private GitHubClient rateLimitSource;

		private int pacingThreshold = 100;

		private int reserve = 10;

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Thread::sleep;

		private Builder() {
		}

		/**
		 * Set the client whose observed rate limit headers drive the throttle.
		 * @param client the GitHubClient issuing the watcher's requests (required)
		 * @return this builder
		 */
		public Builder rateLimitSource(GitHubClient client) {
			this.rateLimitSource = client;
			return this;
		}

		/**
		 * Set the remaining request threshold below which requests are paced.
		 * @param threshold remaining request threshold (default: 100)
		 * @return this builder
		 */
		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		/**
		 * Set the number of requests never spent by the watcher.
		 * @param reserve requests kept in reserve (default: 10)
		 * @return this builder
		 */
		public Builder reserve(int reserve) {
			this.reserve = reserve;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RateLimitThrottle.
		 * @return configured RateLimitThrottle
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RateLimitThrottle build() {
			if (rateLimitSource == null) {
				throw new IllegalStateException("A GitHubClient is required. Call rateLimitSource() first.");
			}
			if (pacingThreshold < 0) {
				throw new IllegalStateException("pacingThreshold must be non-negative");
			}
			if (reserve < 0) {
				throw new IllegalStateException("reserve must be non-negative");
			}
			return new RateLimitThrottle(this);
		}

	}

}
