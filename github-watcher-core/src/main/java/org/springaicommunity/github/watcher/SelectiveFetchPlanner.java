package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Decides how much activity to refetch for a pull request from cheap-to-compare signals.
 *
 * <p>
 * This keeps API usage proportional to the number of changed or in-flight pull requests
 * rather than to the number of watched pull requests:
 * <ol>
 * <li>{@link FetchStrategy#FULL} for a pull request without a snapshot, or when
 * {@code updated_at} or the head SHA differ from the snapshot</li>
 * <li>{@link FetchStrategy#CHECK_RUNS_ONLY} when metadata is unchanged but cached check
 * runs were still in progress</li>
 * <li>{@link FetchStrategy#NONE} otherwise</li>
 * </ol>
 */
public final class SelectiveFetchPlanner {

	private SelectiveFetchPlanner() {
	}

	/**
	 * Plan the activity fetch for a pull request.
	 * @param previous the stored snapshot, or null for a pull request seen for the first
	 * time
	 * @param current the freshly fetched pull request
	 * @return the fetch strategy
	 */
	public static FetchStrategy plan(@Nullable PRSnapshot previous, PullRequest current) {
		if (previous == null) {
			return FetchStrategy.FULL;
		}
		if (!Objects.equals(previous.pr().updatedAt(), current.updatedAt())
				|| !Objects.equals(previous.pr().headSha(), current.headSha())) {
			return FetchStrategy.FULL;
		}
		if (!previous.activity().checksComplete()) {
			return FetchStrategy.CHECK_RUNS_ONLY;
		}
		return FetchStrategy.NONE;
	}

}
