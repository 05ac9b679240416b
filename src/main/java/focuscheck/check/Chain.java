// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import java.util.Arrays;
import focuscheck.state.State;
import focuscheck.util.Trace;
import focuscheck.util.annotation.Nullable;
import focuscheck.util.condition.ConditionContext;
import focuscheck.util.condition.Handler;
import focuscheck.util.condition.Restart;
import focuscheck.util.condition.SignaledCondition;

/**
 * Runs a sequence of checks, each starting from the state the previous one returned, stopping at the first failure.
 * <p>
 * Failures are expected to be reported with {@link Reporter#signaling()}, which is what {@link State#root} uses by
 * default. Malformed checks are not handled here: they propagate out of {@link #run} as
 * {@link focuscheck.util.condition.UnhandledErrorError}.
 * <p>
 * Chains nest. A failure inside an inner chain ends only that chain; skipped checks inside it are counted by every
 * enclosing chain too.
 */
public final class Chain {
    private Chain() {
    }

    /**
     * Runs the given steps in order, starting from {@code root}.
     */
    public static ChainResult run(final State root, final Step... steps) {
        return run(root, Arrays.asList(steps));
    }

    /**
     * Runs the given steps in order, starting from {@code root}.
     */
    public static ChainResult run(final State root, final Iterable<? extends Step> steps) {
        final var progress = new Progress(root);
        try (final var trace = new Trace("Running a chain of checks")) {
            trace.use();
            final var finalState = ConditionContext.<State>withRestart(restartName, restart -> {
                try (final var handler = new Handler(condition -> progress.handle(condition, restart))) {
                    handler.use();
                    for (final var step : steps) {
                        progress.current = step.apply(progress.current);
                    }
                    return progress.current;
                }
            });
            if (finalState != null) {
                return new ChainResult.Passed(finalState, progress.skippedChecks);
            }
            final var failure = progress.failure;
            assert failure != null : "Chain restart reached without a recorded failure";
            return new ChainResult.Failed(failure.message(), progress.current);
        }
    }

    private static final class Progress {
        Progress(final State root) {
            current = root;
        }

        void handle(final SignaledCondition signaled, final Restart restart) {
            final var condition = signaled.condition();
            if (condition instanceof CheckSkippedCondition) {
                skippedChecks += 1;
            } else if (signaled.isFatal() && condition instanceof CheckFailedCondition failed) {
                failure = failed;
                restart.unwindTo();
            }
        }

        State current;
        int skippedChecks;
        @Nullable CheckFailedCondition failure;
    }

    /**
     * The name of the restart point each chain establishes.
     */
    public static final String restartName = "abort-check-chain";
}
