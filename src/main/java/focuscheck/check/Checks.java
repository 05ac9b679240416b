// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import focuscheck.ast.Ast;
import focuscheck.ast.Asts;
import focuscheck.dispatch.AstDispatcher;
import focuscheck.state.Action;
import focuscheck.state.State;
import focuscheck.util.Templates;
import focuscheck.util.Trace;
import focuscheck.util.annotation.Nullable;
import focuscheck.util.condition.ConditionContext;
import focuscheck.util.condition.UnhandledErrorError;

/**
 * The check primitives.
 * <p>
 * Every primitive takes the current {@link State} and either returns a state to continue from, or reports a failure
 * through the state's reporter and doesn't return. Selection primitives ({@link #checkNode} and {@link #checkField})
 * return a child state focused deeper; the others return their input.
 * <p>
 * Message templates may use the placeholders {@code {node_name}}, {@code {field_name}} and {@code {index}} (selection
 * primitives), {@code {ast_path}} and {@code {text}} ({@link #hasCode}), {@code {ast_path}} and {@code {extra}}
 * ({@link #hasEqualAst}).
 */
public final class Checks {
    private Checks() {
    }

    /**
     * Selects the first node of the given type below the current focus.
     */
    public static State checkNode(final State state, final String typeName) {
        return checkNode(state, typeName, 0);
    }

    /**
     * Selects the {@code index}-th node of the given type below the current focus, counting from zero in pre-order.
     */
    public static State checkNode(final State state, final String typeName, final int index) {
        return checkNode(state, typeName, index, checkNodeMissingMessage, null);
    }

    /**
     * Selects the {@code index}-th node of the given type below the current focus, counting from zero in pre-order.
     * <p>
     * The node must exist in the solution, otherwise the check itself is malformed. If the student doesn't have it, a
     * failure is reported using {@code missingMessage}, described from the solution node.
     *
     * @param priority The search priority, or {@code null} to use the searched type's own priority.
     */
    public static State checkNode(
        final State state,
        final String typeName,
        final int index,
        final String missingMessage,
        final @Nullable Integer priority
    ) {
        try (final var trace = new Trace(() -> "Selecting " + typeName + " node at index " + index)) {
            trace.use();
            return Guard.requireAsts(
                state,
                "checkNode",
                guarded -> selectNode(guarded, typeName, index, missingMessage, priority)
            );
        }
    }

    private static State selectNode(
        final State state,
        final String typeName,
        final int index,
        final String missingMessage,
        final @Nullable Integer priority
    ) {
        if (index < 0) {
            throw malformed("Node index must not be negative, got " + index);
        }
        final var dispatcher = requireDispatcher(state);
        final var solutionNodes = dispatcher.select(typeName, requireAst(state.solutionAst()), priority);
        if (index >= solutionNodes.size()) {
            throw malformed("Can't get " + typeName + " node at index " + index
                + ", the solution has " + solutionNodes.size());
        }
        final var solutionNode = solutionNodes.get(index);
        final var studentNodes = dispatcher.select(typeName, requireAst(state.studentAst()), priority);
        if (index >= studentNodes.size()) {
            throw state.reportFailure(orFallback(dispatcher.describe(solutionNode, missingMessage, null, index)));
        }
        final var studentNode = studentNodes.get(index);
        return state.toChild(studentNode, solutionNode, new Action.SelectNode(typeName, index, studentNode));
    }

    /**
     * Selects the given field of the current focus.
     */
    public static State checkField(final State state, final String fieldName) {
        return checkField(state, fieldName, null);
    }

    /**
     * Selects the given field of the current focus, narrowed to its {@code index}-th entry if an index is given.
     */
    public static State checkField(final State state, final String fieldName, final @Nullable Integer index) {
        return checkField(state, fieldName, index, checkFieldMissingMessage);
    }

    /**
     * Selects the given field of the current focus, narrowed to its {@code index}-th entry if an index is given.
     * <p>
     * The field must exist in the solution focus, otherwise the check itself is malformed. If the student focus doesn't
     * have it, or has {@link Ast.Nothing#NOTHING} where the solution has a value, a failure is reported using
     * {@code missingMessage}, described from the student focus.
     */
    public static State checkField(
        final State state,
        final String fieldName,
        final @Nullable Integer index,
        final String missingMessage
    ) {
        try (final var trace = new Trace(() -> (index == null)
            ? ("Selecting field " + fieldName)
            : ("Selecting entry " + index + " of field " + fieldName))) {
            trace.use();
            return Guard.requireAsts(
                state,
                "checkField",
                guarded -> selectField(guarded, fieldName, index, missingMessage)
            );
        }
    }

    private static State selectField(
        final State state,
        final String fieldName,
        final @Nullable Integer index,
        final String missingMessage
    ) {
        final var dispatcher = requireDispatcher(state);
        final var solutionAst = requireAst(state.solutionAst());
        final var studentAst = requireAst(state.studentAst());
        final var solutionValue = lookupField(solutionAst, fieldName, index);
        if (solutionValue == null) {
            throw malformed("Can't get " + fieldName + " field"
                + ((index == null) ? "" : (" entry " + index)) + " of " + Asts.describeShape(solutionAst));
        }
        final var studentValue = lookupField(studentAst, fieldName, index);
        if (studentValue == null || (studentValue == Ast.Nothing.NOTHING && solutionValue != Ast.Nothing.NOTHING)) {
            throw state.reportFailure(orFallback(dispatcher.describe(studentAst, missingMessage, fieldName, index)));
        }
        return state.toChild(studentValue, solutionValue, new Action.SelectField(fieldName, index));
    }

    private static @Nullable Ast lookupField(final Ast focus, final String fieldName, final @Nullable Integer index) {
        final var node = Asts.asNode(focus);
        if (node == null) {
            return null;
        }
        final var value = node.field(fieldName);
        if (value == null || index == null) {
            return value;
        }
        if (value instanceof Ast.NodeList list && index >= 0 && index < list.size()) {
            return list.nodes().get(index);
        }
        return null;
    }

    /**
     * Tests whether the focused student code matches the given regular expression.
     */
    public static State hasCode(final State state, final String text) {
        return hasCode(state, text, false);
    }

    /**
     * Tests whether the focused student code contains the given text, as a plain substring if {@code fixed}, or as a
     * regular expression otherwise.
     */
    public static State hasCode(final State state, final String text, final boolean fixed) {
        return hasCode(state, text, hasCodeMessage, fixed);
    }

    /**
     * Tests whether the focused student code contains the given text, as a plain substring if {@code fixed}, or as a
     * regular expression otherwise.
     * <p>
     * The focused code is the source text of the student focus, or the whole student code if there's no usable tree.
     * This check works even without a parser.
     */
    public static State hasCode(final State state, final String text, final String message, final boolean fixed) {
        try (final var trace = new Trace(() -> "Searching the student code for " + text)) {
            trace.use();
            final var studentText = focusedStudentText(state);
            final var found = fixed ? studentText.contains(text) : compile(text).matcher(studentText).find();
            if (!found) {
                throw state.reportFailure(Templates.fill(message, Map.of("ast_path", state.astPath(), "text", text)));
            }
            return state;
        }
    }

    private static Pattern compile(final String regex) {
        try {
            return Pattern.compile(regex);
        } catch (final PatternSyntaxException e) {
            throw malformed("Invalid pattern " + regex + ": " + e.getDescription());
        }
    }

    /**
     * Tests whether the student focus is structurally equal to the solution focus.
     */
    public static State hasEqualAst(final State state) {
        return hasEqualAst(state, true);
    }

    /**
     * Tests whether the student focus is structurally equal to the solution focus if {@code exact}, or contains it
     * otherwise.
     */
    public static State hasEqualAst(final State state, final boolean exact) {
        return hasEqualAst(state, hasEqualAstMessage, null, null, exact);
    }

    /**
     * Tests whether the student focus is structurally equal to the given snippet if {@code exact}, or contains it
     * otherwise. The snippet is parsed with the given start rule.
     */
    public static State hasEqualAst(
        final State state,
        final String code,
        final String startRule,
        final boolean exact
    ) {
        return hasEqualAst(state, hasEqualAstMessage, code, startRule, exact);
    }

    /**
     * Tests whether the student focus is structurally equal to the target if {@code exact}, or contains it otherwise.
     * <p>
     * The target is the parsed {@code code} if given, the solution focus otherwise. A snippet that doesn't parse makes
     * the check malformed.
     *
     * @param startRule The start rule to parse {@code code} with, or {@code null} for the dispatcher's default. Ignored
     *                  without {@code code}.
     */
    public static State hasEqualAst(
        final State state,
        final String message,
        final @Nullable String code,
        final @Nullable String startRule,
        final boolean exact
    ) {
        try (final var trace = new Trace(() -> (exact ? "Comparing" : "Searching") + " the student tree"
            + ((code == null) ? " against the solution" : (" for " + code)))) {
            trace.use();
            return Guard.requireAsts(
                state,
                "hasEqualAst",
                guarded -> compareAsts(guarded, message, code, startRule, exact)
            );
        }
    }

    private static State compareAsts(
        final State state,
        final String message,
        final @Nullable String code,
        final @Nullable String startRule,
        final boolean exact
    ) {
        final var dispatcher = requireDispatcher(state);
        final var studentAst = requireAst(state.studentAst());
        final var target = (code == null)
            ? requireAst(state.solutionAst())
            : parseSnippet(dispatcher, code, (startRule != null) ? startRule : dispatcher.defaultStartRule());
        final var matches = exact
            ? Asts.structurallyEqual(studentAst, target)
            : Asts.structurallyContains(studentAst, target);
        if (!matches) {
            final var expected = expectedText(state, dispatcher, code);
            final var extra = expected.isEmpty() ? "" : (" The checker expected to find `" + expected + "` in there.");
            final var filled = Templates.fill(message, Map.of("ast_path", state.astPath(), "extra", extra));
            throw state.reportFailure(filled.isEmpty() ? fallbackMessage : filled);
        }
        return state;
    }

    private static Ast parseSnippet(final AstDispatcher dispatcher, final String code, final String startRule) {
        final var parsed = dispatcher.parse(code, startRule);
        if (parsed instanceof Ast.ParseError error) {
            throw malformed("Can't parse " + code + " with start rule " + startRule + ": " + error.message());
        }
        return parsed;
    }

    private static String expectedText(final State state, final AstDispatcher dispatcher, final @Nullable String code) {
        if (code != null) {
            return code;
        }
        final var solutionAst = requireAst(state.solutionAst());
        if (solutionAst instanceof Ast.Scalar scalar) {
            return scalar.value();
        }
        return dispatcher.extractText(solutionAst, state.solutionCode());
    }

    /**
     * Tests whether both the student and the solution code parsed.
     * <p>
     * This is the one check that reports parse failures; the others skip silently when a tree didn't parse.
     */
    public static State hasParsedAst(final State state) {
        try (final var trace = new Trace("Checking that the code parsed")) {
            trace.use();
            if (Asts.isParseError(state.studentAst()) || Asts.isParseError(state.solutionAst())) {
                throw state.reportFailure(notParsedMessage);
            }
            return state;
        }
    }

    /**
     * Reports a failure describing the current state: the given label, the actions taken so far, the current path and
     * the focused student code. Never returns normally.
     * <p>
     * Meant to be dropped into a chain while writing it, to see where it stands.
     */
    public static State debug(final State state, final String label) {
        try (final var trace = new Trace(() -> "Debugging " + label)) {
            trace.use();
            final var builder = new StringBuilder(label);
            builder.append("\n\nHistory:\n").append(state.history());
            builder.append("\n\nFocus: ").append(state.astPath());
            builder.append("\n\nStudent code in focus:\n").append(focusedStudentText(state));
            throw state.reportFailure(builder.toString());
        }
    }

    private static String focusedStudentText(final State state) {
        final var focus = state.studentAst();
        final var dispatcher = state.dispatcher();
        if (focus == null || dispatcher == null || Asts.isParseError(focus)) {
            return state.studentCode();
        }
        return dispatcher.extractText(focus, state.studentCode());
    }

    private static AstDispatcher requireDispatcher(final State state) {
        final var dispatcher = state.dispatcher();
        if (dispatcher == null) {
            throw malformed("Trying to navigate trees without a dispatcher");
        }
        return dispatcher;
    }

    private static Ast requireAst(final @Nullable Ast ast) {
        assert ast != null : "Guarded check reached without a tree";
        return ast;
    }

    private static String orFallback(final @Nullable String message) {
        return (message != null) ? message : fallbackMessage;
    }

    private static UnhandledErrorError malformed(final String message) {
        return ConditionContext.error(new MalformedCheckCondition(message));
    }

    /**
     * The message used when a more specific one can't be produced.
     */
    public static final String fallbackMessage = "Your submission is incorrect. Try again!";

    public static final String checkNodeMissingMessage = "Could not find the {index}{node_name}.";

    public static final String checkFieldMissingMessage = "Could not find the {index}{field_name} of the {node_name}.";

    public static final String hasCodeMessage = "Check the {ast_path}. The checker expected to find {text}.";

    public static final String hasEqualAstMessage = "Check the {ast_path}.{extra}";

    public static final String notParsedMessage = "AST did not parse";
}
