// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link Handler} does when a condition reaches it.
 * <p>
 * Returning normally passes the condition on to older handlers. Calling {@link Restart#unwindTo()} takes it.
 */
@FunctionalInterface
public interface HandlerProcedure {
    void handle(@NotNull SignaledCondition signaled);
}
