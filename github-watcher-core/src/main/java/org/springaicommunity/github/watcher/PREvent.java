package org.springaicommunity.github.watcher;

/**
 * Payload of {@code new_pr}, {@code merged} and {@code closed} events.
 *
 * @param pr the pull request
 * @param repo the repository it belongs to
 */
public record PREvent(PullRequest pr, RepoRef repo) {
}
