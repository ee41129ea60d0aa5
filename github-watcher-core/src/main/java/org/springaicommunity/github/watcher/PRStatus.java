package org.springaicommunity.github.watcher;

/**
 * A watched pull request together with its current classifier status.
 *
 * @param pr the pull request
 * @param repo the repository it belongs to
 * @param status the classifier status, or an empty string without a classifier
 */
public record PRStatus(PullRequest pr, RepoRef repo, String status) {
}
