// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a condition signaled with {@link ConditionContext#error(Condition)} makes it past every handler.
 * <p>
 * Malformed checks normally end up here, carrying their operation trace to whoever wrote the check. A failed check
 * ends up here only when it runs outside any {@link focuscheck.check.Chain chain}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("No handler took the fatal condition " + condition.getClass().getSimpleName() + ": "
            + condition.detailedMessage());
        this.condition = condition;
    }

    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
