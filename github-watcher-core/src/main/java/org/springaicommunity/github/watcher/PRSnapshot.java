package org.springaicommunity.github.watcher;

import java.time.Instant;

/**
 * The watcher's last-known state for one pull request, used as the diff baseline on the
 * next poll.
 *
 * @param identity the tracking key
 * @param pr the pull request fields as last observed
 * @param activity cached comments, reviews and check runs
 * @param status the last classifier result, or an empty string without a classifier
 * @param lastSeenAt when a poll last observed or confirmed this pull request
 */
public record PRSnapshot(PRIdentity identity, PullRequest pr, ActivityCache activity, String status,
		Instant lastSeenAt) {

	public RepoRef repo() {
		return identity.repo();
	}

	public PRSnapshot seenAt(Instant now) {
		return new PRSnapshot(identity, pr, activity, status, now);
	}

	public PRStatus toStatus() {
		return new PRStatus(pr, identity.repo(), status);
	}

}
