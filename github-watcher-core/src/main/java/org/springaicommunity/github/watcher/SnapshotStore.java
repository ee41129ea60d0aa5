package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory snapshots keyed by {@link PRIdentity}. Nothing survives a restart.
 */
class SnapshotStore {

	private final Map<PRIdentity, PRSnapshot> snapshots = new ConcurrentHashMap<>();

	@Nullable
	PRSnapshot get(PRIdentity identity) {
		return snapshots.get(identity);
	}

	void put(PRSnapshot snapshot) {
		snapshots.put(snapshot.identity(), snapshot);
	}

	void remove(PRIdentity identity) {
		snapshots.remove(identity);
	}

	/**
	 * Refresh the last-seen time of a snapshot without changing its content.
	 * @param identity the pull request
	 * @param now the current time
	 */
	void touch(PRIdentity identity, Instant now) {
		snapshots.computeIfPresent(identity, (id, snapshot) -> snapshot.seenAt(now));
	}

	/**
	 * Drop every snapshot belonging to a repository.
	 * @param repo the repository
	 * @return the number of snapshots removed
	 */
	int removeRepo(RepoRef repo) {
		List<PRIdentity> doomed = snapshots.keySet().stream().filter(id -> id.repo().equals(repo)).toList();
		doomed.forEach(snapshots::remove);
		return doomed.size();
	}

	/**
	 * Drop snapshots not seen since the cutoff.
	 * @param cutoff snapshots last seen strictly before this instant are removed
	 * @return the evicted snapshots
	 */
	List<PRSnapshot> evictStale(Instant cutoff) {
		List<PRSnapshot> stale = snapshots.values()
			.stream()
			.filter(snapshot -> snapshot.lastSeenAt().isBefore(cutoff))
			.toList();
		stale.forEach(snapshot -> snapshots.remove(snapshot.identity()));
		return stale;
	}

	List<PRSnapshot> all() {
		return new ArrayList<>(snapshots.values());
	}

	/**
	 * Returns the status of every tracked pull request, ordered by repository and number.
	 * @return current statuses
	 */
	List<PRStatus> statuses() {
		return snapshots.values()
			.stream()
			.sorted(Comparator.comparing((PRSnapshot s) -> s.repo().toString()).thenComparingInt(s -> s.pr().number()))
			.map(PRSnapshot::toStatus)
			.toList();
	}

	int size() {
		return snapshots.size();
	}

}
