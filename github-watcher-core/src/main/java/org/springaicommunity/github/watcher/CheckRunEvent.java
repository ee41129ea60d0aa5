package org.springaicommunity.github.watcher;

/**
 * Payload of {@code check_run}: a check run that is new or whose status or conclusion
 * changed.
 *
 * @param pr the pull request
 * @param repo the repository it belongs to
 * @param checkRun the check run as observed in this poll
 */
public record CheckRunEvent(PullRequest pr, RepoRef repo, CheckRun checkRun) {
}
