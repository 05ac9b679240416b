// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.util.condition.ConditionContext;
import focuscheck.util.condition.UnhandledErrorError;

/**
 * The sink of failed checks.
 * <p>
 * Reporting a failure ends the chain of checks in progress, so {@link #reportFailure(String)} must never return
 * normally: implementations signal a fatal condition with {@link ConditionContext#error}, or unwind to a restart
 * point themselves.
 */
@FunctionalInterface
public interface Reporter {
    /**
     * Reports a failed check with the given student-facing message. Never returns normally.
     * <p>
     * Declared to return {@link UnhandledErrorError} so that call sites can "throw" the result, which keeps the
     * compiler's flow analysis right even if an implementation breaks the contract.
     */
    UnhandledErrorError reportFailure(String message);

    /**
     * Returns the reporter that signals failures as fatal {@link CheckFailedCondition}s, which {@link Chain} turns
     * into a {@link ChainResult.Failed}.
     */
    static Reporter signaling() {
        return SignalingReporter.instance;
    }
}
