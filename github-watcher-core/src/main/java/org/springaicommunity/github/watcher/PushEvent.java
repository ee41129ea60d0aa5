package org.springaicommunity.github.watcher;

/**
 * Payload of {@code push}: the head commit of a repository's default branch moved.
 *
 * @param repo the repository
 * @param branch the default branch name
 * @param sha the new head commit SHA
 * @param previousSha the head commit SHA observed in the previous poll
 */
public record PushEvent(RepoRef repo, String branch, String sha, String previousSha) {
}
