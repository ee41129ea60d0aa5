package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A check run reported against a pull request's head commit.
 *
 * <p>
 * Check runs are keyed by id; their {@code (status, conclusion)} pair is mutable and
 * changes as the run progresses.
 *
 * @param id the check run id
 * @param name the check name
 * @param status "queued", "in_progress" or "completed"
 * @param conclusion the outcome once completed ("success", "failure", ...), otherwise
 * null
 * @param startedAt when the run started
 * @param completedAt when the run completed
 * @param htmlUrl the web URL of the run
 */
public record CheckRun(long id, String name, String status, @Nullable String conclusion,
		@Nullable LocalDateTime startedAt, @Nullable LocalDateTime completedAt, String htmlUrl) {

	public static final String STATUS_COMPLETED = "completed";

	/**
	 * Returns true once the run has reached a terminal state.
	 * @return true if status is "completed"
	 */
	public boolean isCompleted() {
		return STATUS_COMPLETED.equals(status);
	}

}
