package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The subset of GitHub pull request data the watcher diffs and reports.
 *
 * @param number the pull request number within the repository
 * @param title the pull request title
 * @param body the pull request description (may be null)
 * @param state "open" or "closed"
 * @param draft whether this is a draft pull request
 * @param labels labels currently applied
 * @param mergeableState GitHub's mergeable_state ("clean", "dirty", "blocked",
 * "unknown", ...), null when not reported
 * @param createdAt when the pull request was created
 * @param updatedAt when the pull request was last updated
 * @param closedAt when the pull request was closed (null if open)
 * @param mergedAt when the pull request was merged (null if not merged)
 * @param htmlUrl the web URL of the pull request
 * @param author the user who opened the pull request
 * @param headRef the branch containing the changes
 * @param headSha the commit SHA at the head of the pull request
 * @param baseRef the branch the changes are merged into
 * @param baseRepoFullName "owner/name" of the base repository, when reported
 * @param baseRepoDefaultBranch default branch of the base repository, when reported
 */
public record PullRequest(int number, String title, @Nullable String body, String state, boolean draft,
		List<Label> labels, @Nullable String mergeableState, @Nullable LocalDateTime createdAt,
		@Nullable LocalDateTime updatedAt, @Nullable LocalDateTime closedAt, @Nullable LocalDateTime mergedAt,
		String htmlUrl, Author author, String headRef, String headSha, String baseRef,
		@Nullable String baseRepoFullName, @Nullable String baseRepoDefaultBranch) {

	public PullRequest {
		labels = List.copyOf(labels);
	}

	/**
	 * Returns true if GitHub reports this pull request as merged.
	 * @return true when merged_at is set
	 */
	public boolean isMerged() {
		return mergedAt != null;
	}

	/**
	 * Returns true if this pull request is closed (merged or not).
	 * @return true when state is "closed"
	 */
	public boolean isClosed() {
		return "closed".equals(state);
	}

}
