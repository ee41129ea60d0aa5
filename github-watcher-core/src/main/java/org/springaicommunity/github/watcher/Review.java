package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A pull request review.
 *
 * @param id the immutable review id, used to detect new reviews
 * @param body the review comment body (may be null if no comment provided)
 * @param state the review state: "APPROVED", "CHANGES_REQUESTED", "COMMENTED",
 * "DISMISSED" or "PENDING"
 * @param submittedAt when the review was submitted (null if pending)
 * @param author the user who submitted the review
 * @param authorAssociation the reviewer's relationship to the repository
 * @param htmlUrl the web URL of the review
 */
public record Review(long id, @Nullable String body, String state, @Nullable LocalDateTime submittedAt, Author author,
		String authorAssociation, String htmlUrl) {
}
