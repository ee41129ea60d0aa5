package org.springaicommunity.github.watcher;

/**
 * Rate limiter the watcher calls before every weighted group of API requests.
 *
 * <p>
 * The weight is proportional to the number of requests in the group: 1 for a list or
 * single fetch, 3 for a full activity fetch.
 */
@FunctionalInterface
public interface WatchThrottle {

	/**
	 * A throttle that never waits.
	 */
	WatchThrottle NONE = weight -> {
	};

	/**
	 * Block until the given weight of requests may be issued.
	 * @param weight relative cost of the upcoming requests
	 * @throws InterruptedException if interrupted while waiting
	 */
	void acquire(int weight) throws InterruptedException;

}
