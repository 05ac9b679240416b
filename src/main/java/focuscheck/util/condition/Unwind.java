// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The non-local exit thrown by {@link Restart#unwindTo()} and caught by the matching
 * {@link ConditionContext#withRestart(String, RestartCallback) withRestart}.
 * <p>
 * Deliberately neither an {@link Exception} nor an {@link Error}, so that a {@code catch (Exception e)} in a parser or
 * a check doesn't stop a chain from aborting. It is public only so that {@link RestartCallback} can declare it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        // No stack trace or suppression: this is control flow, not a problem report.
        super("Returning to restart point " + target.name(), null, false, false);
        this.target = target;
    }

    boolean isAimedAt(final @NotNull Restart restart) {
        return target == restart;
    }

    private final transient @NotNull Restart target;
}
