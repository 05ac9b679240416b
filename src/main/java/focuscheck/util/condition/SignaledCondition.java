// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A condition as a handler sees it.
 *
 * @param condition The condition.
 * @param isFatal   Whether the signaling code refuses to continue if nobody unwinds.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
    static @NotNull SignaledCondition fatal(final @NotNull Condition condition) {
        return new SignaledCondition(condition, true);
    }

    static @NotNull SignaledCondition nonFatal(final @NotNull Condition condition) {
        return new SignaledCondition(condition, false);
    }
}
