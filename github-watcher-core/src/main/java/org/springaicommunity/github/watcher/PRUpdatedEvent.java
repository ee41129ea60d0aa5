package org.springaicommunity.github.watcher;

import java.util.Map;

/**
 * Payload of {@code pr_updated}: every metadata field that changed in one poll.
 *
 * @param pr the pull request as observed in this poll
 * @param repo the repository it belongs to
 * @param changes changed fields keyed by {@code draft}, {@code labels} or
 * {@code mergeable_state}
 */
public record PRUpdatedEvent(PullRequest pr, RepoRef repo, Map<String, FieldChange<?>> changes) {

	public static final String DRAFT = "draft";

	public static final String LABELS = "labels";

	public static final String MERGEABLE_STATE = "mergeable_state";

	public PRUpdatedEvent {
		changes = Map.copyOf(changes);
	}

}
