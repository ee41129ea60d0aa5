package org.springaicommunity.github.watcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The statically configured repositories plus bookkeeping for runtime removals.
 *
 * <p>
 * A removal takes the repository out of the list immediately and queues a teardown of its
 * state, which the poll routine applies at the start of its next cycle. A removed
 * repository is also filtered out of discovery results until it is added again.
 */
class RepoWatchSet {

	private final Set<RepoRef> repos = new LinkedHashSet<>();

	private final Set<RepoRef> removed = new HashSet<>();

	private final Set<RepoRef> pendingTeardown = new LinkedHashSet<>();

	RepoWatchSet(Collection<RepoRef> initial) {
		repos.addAll(initial);
	}

	synchronized boolean add(RepoRef repo) {
		removed.remove(repo);
		return repos.add(repo);
	}

	synchronized boolean remove(RepoRef repo) {
		removed.add(repo);
		pendingTeardown.add(repo);
		return repos.remove(repo);
	}

	synchronized List<RepoRef> repos() {
		return new ArrayList<>(repos);
	}

	/**
	 * Union of the static list and discovered repositories, deduplicated, static entries
	 * first.
	 * @param discovered repositories returned by discovery this cycle
	 * @return the repositories to poll
	 */
	synchronized List<RepoRef> currentRepos(Collection<RepoRef> discovered) {
		Set<RepoRef> result = new LinkedHashSet<>(repos);
		for (RepoRef repo : discovered) {
			if (!removed.contains(repo)) {
				result.add(repo);
			}
		}
		return new ArrayList<>(result);
	}

	/**
	 * Take the repositories whose state must be torn down.
	 * @return queued removals, cleared by this call
	 */
	synchronized List<RepoRef> drainRemovals() {
		List<RepoRef> result = new ArrayList<>(pendingTeardown);
		pendingTeardown.clear();
		return result;
	}

}
