package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for a {@link PRWatcher}.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubWatcherBuilder}.
 * Defaults suit a handful of repositories polled with a personal access token.
 */
public class WatchProperties {

	/**
	 * Repositories to watch, in any form accepted by {@link RepoRef#parse(String)}.
	 */
	private List<String> repositories = new ArrayList<>();

	/**
	 * Seconds between poll cycles.
	 */
	private int intervalSeconds = 30;

	/**
	 * Also track open pull requests authored by {@link #username} in any repository.
	 */
	private boolean myPRs = false;

	/**
	 * GitHub login used by myPRs mode; null means the token's user.
	 */
	private @Nullable String username;

	/**
	 * Seconds after which an unobserved snapshot is evicted; 0 disables eviction.
	 */
	private int staleAfterSeconds = 0;

	/**
	 * Remaining rate limit budget below which requests are paced.
	 */
	private int pacingThreshold = 100;

	public List<String> getRepositories() {
		return repositories;
	}

	public void setRepositories(List<String> repositories) {
		this.repositories = new ArrayList<>(repositories);
	}

	public int getIntervalSeconds() {
		return intervalSeconds;
	}

	/**
	 * Sets the poll interval.
	 * @param intervalSeconds seconds between poll cycles, must be positive
	 */
	public void setIntervalSeconds(int intervalSeconds) {
		this.intervalSeconds = intervalSeconds;
	}

	public boolean isMyPRs() {
		return myPRs;
	}

	public void setMyPRs(boolean myPRs) {
		this.myPRs = myPRs;
	}

	@Nullable
	public String getUsername() {
		return username;
	}

	public void setUsername(@Nullable String username) {
		this.username = username;
	}

	public int getStaleAfterSeconds() {
		return staleAfterSeconds;
	}

	/**
	 * Sets the stale snapshot threshold.
	 * @param staleAfterSeconds seconds after which unobserved snapshots are evicted, 0 to
	 * keep them indefinitely
	 */
	public void setStaleAfterSeconds(int staleAfterSeconds) {
		this.staleAfterSeconds = staleAfterSeconds;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

}
