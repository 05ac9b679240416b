// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * An installed reaction to signaled conditions, scoped by try-with-resources.
 * <p>
 * A {@link focuscheck.check.Chain chain} of checks installs one of these to stop at the first failure; a dispatcher
 * may install one around its parser to turn syntax errors into parse error values. Newer handlers see a condition
 * first.
 */
public final class Handler implements AutoCloseable {
    public Handler(final @NotNull HandlerProcedure procedure) {
        this.procedure = procedure;
        owner = ConditionContext.localContext();
        owner.install(this);
    }

    /**
     * No-op, for naming the resource variable in try-with-resources without a warning.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed outside of its thread";
        owner.uninstall(this);
    }

    void handle(final @NotNull SignaledCondition signaled) {
        procedure.handle(signaled);
    }

    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext owner;
}
