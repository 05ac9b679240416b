// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;
import focuscheck.ast.Ast;

/**
 * Collects the nodes of one type found in a tree, descending only into nodes of lower priority than the search.
 * <p>
 * The traversal is pre-order: a node is examined before its fields, fields in declaration order, list entries in
 * order. A node is descended into iff the search priority is <em>strictly</em> greater than the node's priority; a
 * matching node is still descended into when that holds, so nested matches follow their enclosing match. The node at
 * which the search starts obeys the same rule.
 */
final class NodeSelector {
    private NodeSelector(final String typeName, final int priority, final ToIntFunction<String> priorityOf) {
        this.typeName = typeName;
        this.priority = priority;
        this.priorityOf = priorityOf;
    }

    static List<Ast.Node> select(
        final String typeName,
        final Ast tree,
        final int priority,
        final ToIntFunction<String> priorityOf
    ) {
        final var selector = new NodeSelector(typeName, priority, priorityOf);
        selector.visit(tree);
        return List.copyOf(selector.matches);
    }

    private void visit(final Ast ast) {
        if (ast instanceof Ast.Node node) {
            visitNode(node);
        } else if (ast instanceof Ast.NodeList list) {
            for (final var node : list.nodes()) {
                visitNode(node);
            }
        }
        // Scalars, nothing and parse errors have no nodes in them.
    }

    private void visitNode(final Ast.Node node) {
        if (node.typeName().equals(typeName)) {
            matches.add(node);
        }
        if (priority > priorityOf.applyAsInt(node.typeName())) {
            for (final var fieldName : node.fieldNames()) {
                final var value = node.field(fieldName);
                if (value != null) {
                    visit(value);
                }
            }
        }
    }

    private final String typeName;
    private final int priority;
    private final ToIntFunction<String> priorityOf;
    private final ArrayList<Ast.Node> matches = new ArrayList<>();
}
