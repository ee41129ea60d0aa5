package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Watch set
	public List<String> repositories = new ArrayList<>();

	public boolean myPRs = false;

	public @Nullable String username;

	// Timing
	public int intervalSeconds;

	public int staleAfterSeconds; // 0 = never evict

	// Mode flags
	public boolean push = false;

	public boolean once = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(WatchProperties defaultProperties) {
		this.repositories.addAll(defaultProperties.getRepositories());
		this.myPRs = defaultProperties.isMyPRs();
		this.username = defaultProperties.getUsername();
		this.intervalSeconds = defaultProperties.getIntervalSeconds();
		this.staleAfterSeconds = defaultProperties.getStaleAfterSeconds();
	}

	/**
	 * Convert to watch properties, keeping the pacing threshold of the defaults.
	 * @param defaults properties supplying values the command line does not cover
	 * @return new properties reflecting this configuration
	 */
	public WatchProperties toProperties(WatchProperties defaults) {
		WatchProperties properties = new WatchProperties();
		properties.setRepositories(repositories);
		properties.setIntervalSeconds(intervalSeconds);
		properties.setMyPRs(myPRs);
		properties.setUsername(username);
		properties.setStaleAfterSeconds(staleAfterSeconds);
		properties.setPacingThreshold(defaults.getPacingThreshold());
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "repositories=" + repositories + ", myPRs=" + myPRs + ", username='" + username
				+ '\'' + ", intervalSeconds=" + intervalSeconds + ", staleAfterSeconds=" + staleAfterSeconds
				+ ", push=" + push + ", once=" + once + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ '}';
	}

}
