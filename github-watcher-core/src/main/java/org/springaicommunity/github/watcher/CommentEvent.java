package org.springaicommunity.github.watcher;

/**
 * Payload of {@code comment}: a comment not seen in any previous poll.
 *
 * @param pr the pull request
 * @param repo the repository it belongs to
 * @param comment the new comment
 */
public record CommentEvent(PullRequest pr, RepoRef repo, Comment comment) {
}
