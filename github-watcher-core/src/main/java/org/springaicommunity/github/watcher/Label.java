package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

/**
 * A label applied to a pull request. Label names are unique within a repository, so
 * label sets are compared by name.
 *
 * @param name the label name
 * @param color the hex color code (without the # prefix)
 * @param description an optional description
 */
public record Label(String name, @Nullable String color, @Nullable String description) {
}
