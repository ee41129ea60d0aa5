package org.springaicommunity.github.watcher;

/**
 * Handle returned by every subscribe method. Unsubscribing more than once has no effect.
 */
@FunctionalInterface
public interface Subscription {

	void unsubscribe();

}
