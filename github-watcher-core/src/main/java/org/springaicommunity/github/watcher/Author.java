package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

/**
 * A GitHub user attached to a pull request, comment or review.
 *
 * @param login the GitHub username
 * @param name the display name (may be null if not set in the profile)
 */
public record Author(String login, @Nullable String name) {
}
