// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.ast.Asts;
import focuscheck.state.State;
import focuscheck.util.condition.ConditionContext;

/**
 * The precondition of every check that looks at trees.
 */
public final class Guard {
    private Guard() {
    }

    /**
     * Runs {@code check} on the given state if both its trees are usable.
     * <ul>
     * <li>If either tree is missing altogether, no parser is configured, and a fatal {@link MalformedCheckCondition}
     * is signaled.
     * <li>If either tree is a parse error, a non-fatal {@link CheckSkippedCondition} is signaled and the state is
     * returned unchanged. Nothing is reported: the parse failure is {@link Checks#hasParsedAst(State)}'s business.
     * <li>Otherwise the result of {@code check} is returned. It may assume both trees are present and parsed.
     * </ul>
     */
    public static State requireAsts(final State state, final String checkName, final Step check) {
        final var studentAst = state.studentAst();
        final var solutionAst = state.solutionAst();
        if (studentAst == null || solutionAst == null) {
            throw ConditionContext.error(new MalformedCheckCondition(
                "Trying to use " + checkName + " on an AST, but there is none. Is a parser configured?"));
        }
        if (Asts.isParseError(studentAst)) {
            ConditionContext.signal(new CheckSkippedCondition(checkName, "student"));
            return state;
        }
        if (Asts.isParseError(solutionAst)) {
            ConditionContext.signal(new CheckSkippedCondition(checkName, "solution"));
            return state;
        }
        return check.apply(state);
    }
}
