package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

/**
 * The previous and current value of one pull request field.
 *
 * @param from value in the stored snapshot
 * @param to value observed in this poll
 * @param <T> the field type
 */
public record FieldChange<T>(@Nullable T from, @Nullable T to) {
}
