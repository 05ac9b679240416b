// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import focuscheck.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * A named point on the call stack that a handler can return control to.
 * <p>
 * Obtained only from {@link ConditionContext#withRestart(String, RestartCallback)}, and valid only until the callback
 * given there completes.
 */
public final class Restart {
    Restart(final @NotNull String name, final @NotNull ConditionContext owner) {
        this.name = name;
        this.owner = owner;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Abandons everything above this restart point on the call stack and makes its
     * {@link ConditionContext#withRestart(String, RestartCallback) withRestart} call return {@code null}.
     * <p>
     * The {@link Unwind} is thrown without being declared, so check code in between doesn't have to mention it.
     */
    public void unwindTo() {
        assert owner == ConditionContext.localContext() : "Unwinding to a restart point of another thread";
        assert !expired : "Unwinding to restart point " + name + " after it was disestablished";
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void expire() {
        expired = true;
    }

    @Override
    public @NotNull String toString() {
        return "Restart[" + name + "]";
    }

    private final @NotNull String name;
    private final @NotNull ConditionContext owner;
    private boolean expired = false;
}
