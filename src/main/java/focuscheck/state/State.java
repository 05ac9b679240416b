// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.state;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import focuscheck.ast.Ast;
import focuscheck.ast.Asts;
import focuscheck.check.Reporter;
import focuscheck.dispatch.AstDispatcher;
import focuscheck.util.annotation.Nullable;
import focuscheck.util.condition.UnhandledErrorError;

/**
 * The focus of a chain of checks: the current student and solution (sub)trees, the full source texts they come from,
 * and the history of actions that led here.
 * <p>
 * States are immutable. Checks never modify a state; they either return it as is or create exactly one child with
 * {@link #toChild(Ast, Ast, Action)}. Both foci are always reached by the same actions, one applied to each side.
 */
public final class State {
    private State(
        final @Nullable Ast studentAst,
        final @Nullable Ast solutionAst,
        final @Nullable Ast studentParent,
        final String studentCode,
        final String solutionCode,
        final History history,
        final @Nullable AstDispatcher dispatcher,
        final Reporter reporter
    ) {
        this.studentAst = studentAst;
        this.solutionAst = solutionAst;
        this.studentParent = studentParent;
        this.studentCode = studentCode;
        this.solutionCode = solutionCode;
        this.history = history;
        this.dispatcher = dispatcher;
        this.reporter = reporter;
    }

    /**
     * Creates a root state by parsing both pieces of code with the dispatcher's default start rule. Failures are
     * reported with {@link Reporter#signaling()}.
     * <p>
     * Code that doesn't parse leaves an {@link Ast.ParseError} in place of the tree; see
     * {@link focuscheck.check.Checks#hasParsedAst(State)}.
     */
    public static State root(final String studentCode, final String solutionCode, final AstDispatcher dispatcher) {
        return root(studentCode, solutionCode, dispatcher, Reporter.signaling());
    }

    /**
     * Creates a root state by parsing both pieces of code with the dispatcher's default start rule, reporting
     * failures to the given reporter.
     */
    public static State root(
        final String studentCode,
        final String solutionCode,
        final AstDispatcher dispatcher,
        final Reporter reporter
    ) {
        final var startRule = dispatcher.defaultStartRule();
        return new State(
            dispatcher.parse(studentCode, startRule),
            dispatcher.parse(solutionCode, startRule),
            null,
            studentCode,
            solutionCode,
            History.empty(),
            dispatcher,
            reporter
        );
    }

    /**
     * Creates a root state with no parser at all. Only checks that work on plain text can run on it; checks that need
     * a tree treat this as a malformed check.
     */
    public static State withoutParser(final String studentCode, final String solutionCode) {
        return new State(null, null, null, studentCode, solutionCode, History.empty(), null, Reporter.signaling());
    }

    /**
     * Returns a new state focused on the given trees, with the given action appended to the history.
     */
    @CheckReturnValue
    public State toChild(final Ast studentAst, final Ast solutionAst, final Action action) {
        return new State(
            studentAst,
            solutionAst,
            this.studentAst,
            studentCode,
            solutionCode,
            history.appended(action),
            dispatcher,
            reporter
        );
    }

    /**
     * Reports a failed check with the given message. Never returns normally; the result can be "thrown" to help the
     * compiler's flow analysis.
     */
    public UnhandledErrorError reportFailure(final String message) {
        return reporter.reportFailure(message);
    }

    /**
     * Renders the current focus for use in failure messages, for example {@code first SELECT statement} or
     * {@code FROM clause of the SELECT statement}.
     */
    public String astPath() {
        final var dispatcher = this.dispatcher;
        if (dispatcher == null) {
            return defaultAstPath;
        }
        final var description = describeAstPath(dispatcher);
        return (description != null) ? description : defaultAstPath;
    }

    private @Nullable String describeAstPath(final AstDispatcher dispatcher) {
        final var actions = history.newestFirst().iterator();
        if (!actions.hasNext()) {
            final var focus = studentAst;
            return (focus != null) ? dispatcher.describe(focus, "{node_name}", null, null) : null;
        }
        final var last = actions.next();
        if (last instanceof Action.SelectNode node) {
            return dispatcher.describe(node.studentNode(), "{index}{node_name}", null, node.index());
        }
        final var field = (Action.SelectField) last;
        if (actions.hasNext() && actions.next() instanceof Action.SelectNode node) {
            return dispatcher.describe(
                node.studentNode(),
                "{index}{field_name} of the {node_name}",
                field.fieldName(),
                field.index()
            );
        }
        // The field belongs to the previous focus, so its name is looked up by that node's type.
        final var owner = studentParent;
        return (owner != null)
            ? dispatcher.describe(owner, "{index}{field_name}", field.fieldName(), field.index())
            : null;
    }

    /**
     * Retrieves the student-side focus, or {@code null} if no parser is configured.
     */
    public @Nullable Ast studentAst() {
        return studentAst;
    }

    /**
     * Retrieves the solution-side focus, or {@code null} if no parser is configured.
     */
    public @Nullable Ast solutionAst() {
        return solutionAst;
    }

    public String studentCode() {
        return studentCode;
    }

    public String solutionCode() {
        return solutionCode;
    }

    public History history() {
        return history;
    }

    /**
     * Retrieves the dispatcher the trees were parsed with, or {@code null} if no parser is configured.
     */
    public @Nullable AstDispatcher dispatcher() {
        return dispatcher;
    }

    public Reporter reporter() {
        return reporter;
    }

    @Override
    public String toString() {
        return "State[student=" + Asts.describeShape(studentAst)
            + ", solution=" + Asts.describeShape(solutionAst)
            + ", depth=" + history.size() + ']';
    }

    private static final String defaultAstPath = "code";

    private final @Nullable Ast studentAst;
    private final @Nullable Ast solutionAst;
    // The student focus this state was derived from, if any.
    private final @Nullable Ast studentParent;
    private final String studentCode;
    private final String solutionCode;
    private final History history;
    private final @Nullable AstDispatcher dispatcher;
    private final Reporter reporter;
}
