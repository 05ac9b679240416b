// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.dispatch;

import java.util.List;
import java.util.Map;
import focuscheck.ast.Ast;
import focuscheck.util.UnreachableCodeReachedError;
import focuscheck.util.annotation.Nullable;

/**
 * A base {@link AstDispatcher} for grammars whose node types carry a priority.
 * <p>
 * Priorities bound node selection. Searching for a type descends only into nodes whose priority is lower than the
 * search priority, which defaults to the priority of the searched type itself. Giving statements a higher priority
 * than scripts, for instance, makes a search for statements stop at the top-level ones instead of also returning
 * subqueries; asking for a very high priority, like {@link #searchEverywhere}, searches the whole tree.
 * <p>
 * Subclasses supply the parser; descriptions come from a {@link Speaker}, and text is recovered from node spans.
 */
public abstract class PriorityDispatcher implements AstDispatcher {
    /**
     * Initializes a new dispatcher.
     *
     * @param priorities The priority of each node type. Unlisted types get {@link #defaultPriority}.
     * @param speaker    The speaker used to describe nodes in failure messages.
     */
    protected PriorityDispatcher(final Map<String, Integer> priorities, final Speaker speaker) {
        this.priorities = Map.copyOf(priorities);
        this.speaker = speaker;
    }

    /**
     * Returns the priority of the given node type.
     */
    public final int priorityOf(final String typeName) {
        return priorities.getOrDefault(typeName, defaultPriority);
    }

    @Override
    public final List<Ast.Node> select(final String typeName, final Ast tree, final @Nullable Integer priority) {
        final var searchPriority = (priority != null) ? priority : priorityOf(typeName);
        return NodeSelector.select(typeName, tree, searchPriority, this::priorityOf);
    }

    @Override
    public @Nullable String describe(
        final Ast focus,
        final String template,
        final @Nullable String field,
        final @Nullable Integer index
    ) {
        return speaker.describe(focus, template, field, index);
    }

    @Override
    public String extractText(final Ast focus, final String source) {
        if (focus instanceof Ast.Node node) {
            return node.span().extract(source);
        } else if (focus instanceof Ast.NodeList list) {
            final var nodes = list.nodes();
            if (nodes.isEmpty()) {
                return "";
            }
            return nodes.get(0).span().union(nodes.get(nodes.size() - 1).span()).extract(source);
        } else if (focus instanceof Ast.Scalar scalar) {
            return scalar.value();
        } else if (focus == Ast.Nothing.NOTHING || focus instanceof Ast.ParseError) {
            return "";
        }
        throw new UnreachableCodeReachedError("Unknown Ast variant " + focus.getClass().getName());
    }

    /**
     * Returns the speaker this dispatcher describes nodes with.
     */
    public final Speaker speaker() {
        return speaker;
    }

    /**
     * The priority of node types without an explicit one.
     */
    public static final int defaultPriority = 1;

    /**
     * A search priority high enough to descend into every node of any reasonable grammar.
     */
    public static final int searchEverywhere = 99;

    private final Map<String, Integer> priorities;
    private final Speaker speaker;
}
