// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.util.condition.Condition;

/**
 * A condition type indicating that a check didn't run because the code it needs didn't parse.
 * <p>
 * Always signaled as non-fatal: the parse failure itself is reported once, by
 * {@link Checks#hasParsedAst(focuscheck.state.State)}, instead of once per check.
 */
public final class CheckSkippedCondition extends Condition {
    CheckSkippedCondition(final String checkName, final String side) {
        super("Skipped " + checkName + ": the " + side + " code did not parse");
        this.checkName = checkName;
    }

    /**
     * Retrieves the name of the check that was skipped.
     */
    public String checkName() {
        return checkName;
    }

    private final String checkName;
}
