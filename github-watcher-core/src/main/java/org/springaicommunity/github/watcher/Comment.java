package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * An issue comment on a pull request conversation.
 *
 * @param id the immutable comment id, used to detect new comments
 * @param author the user who wrote the comment
 * @param body the comment text
 * @param createdAt when the comment was created
 * @param updatedAt when the comment was last edited
 * @param htmlUrl the web URL of the comment
 */
public record Comment(long id, Author author, String body, @Nullable LocalDateTime createdAt,
		@Nullable LocalDateTime updatedAt, String htmlUrl) {
}
