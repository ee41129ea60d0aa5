package org.springaicommunity.github.watcher;

import java.util.List;

/**
 * Hook invoked at the start of every poll cycle to find additional repositories to watch
 * in that cycle. Results are unioned with the configured repositories.
 */
@FunctionalInterface
public interface RepoDiscovery {

	/**
	 * Discover repositories.
	 * @return repositories in any form accepted by {@link RepoRef#parse(String)}
	 * @throws Exception if discovery fails; the cycle continues with the configured
	 * repositories
	 */
	List<String> discover() throws Exception;

}
