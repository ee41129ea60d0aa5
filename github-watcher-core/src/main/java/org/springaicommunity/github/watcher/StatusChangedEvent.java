package org.springaicommunity.github.watcher;

/**
 * Payload of {@code status_changed}: the classifier returned a different status than in
 * the previous poll.
 *
 * @param pr the pull request
 * @param repo the repository it belongs to
 * @param previousStatus the status stored in the snapshot
 * @param status the newly classified status
 */
public record StatusChangedEvent(PullRequest pr, RepoRef repo, String previousStatus, String status) {
}
