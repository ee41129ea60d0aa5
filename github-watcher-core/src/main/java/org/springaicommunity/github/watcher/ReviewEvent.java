package org.springaicommunity.github.watcher;

/**
 * Payload of {@code review}: a review not seen in any previous poll.
 *
 * @param pr the pull request
 * @param repo the repository it belongs to
 * @param review the new review
 */
public record ReviewEvent(PullRequest pr, RepoRef repo, Review review) {
}
