// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.state.State;

/**
 * The outcome of {@link Chain#run(State, Step...)}.
 */
public sealed interface ChainResult {
    /**
     * Checks whether every step of the chain passed.
     */
    boolean passed();

    /**
     * Every step returned.
     *
     * @param state         The state returned by the last step.
     * @param skippedChecks The number of checks skipped because a tree didn't parse.
     */
    record Passed(State state, int skippedChecks) implements ChainResult {
        @Override
        public boolean passed() {
            return true;
        }
    }

    /**
     * A step reported a failure, and the remaining steps didn't run.
     *
     * @param message   The student-facing failure message.
     * @param lastState The last state the chain reached before the failing step.
     */
    record Failed(String message, State lastState) implements ChainResult {
        @Override
        public boolean passed() {
            return false;
        }
    }
}
