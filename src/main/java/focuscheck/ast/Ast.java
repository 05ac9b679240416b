// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.ast;

import java.util.List;
import focuscheck.util.annotation.Nullable;

/**
 * Base type of everything a check can focus on: a syntax tree node, the value of one of its fields, or the marker of
 * a failed parse.
 * <p>
 * Ast objects are guaranteed to be immutable.
 */
public sealed interface Ast {
    /**
     * A syntax tree node, produced by a language-specific parser.
     * <p>
     * Implementations must be immutable. Equality between nodes is structural and is decided by
     * {@link Asts#structurallyEqual(Ast, Ast)}, not by {@link Object#equals(Object)}.
     */
    non-sealed interface Node extends Ast {
        /**
         * Retrieves the name of the grammar construct this node represents, such as {@code SelectStmt}.
         */
        String typeName();

        /**
         * Retrieves the names of this node's fields, in declaration order.
         */
        List<String> fieldNames();

        /**
         * Retrieves the value of the named field, or {@code null} if this node has no such field.
         * <p>
         * A field that exists but holds no value returns {@link Nothing#NOTHING}, never {@code null}. Fields never
         * hold {@link ParseError}s.
         */
        @Nullable Ast field(String name);

        /**
         * Retrieves the part of the source text this node was parsed from.
         */
        Span span();
    }

    /**
     * An ordered sequence of nodes held by a single field.
     */
    record NodeList(List<Node> nodes) implements Ast {
        public NodeList {
            nodes = List.copyOf(nodes);
        }

        /**
         * Returns the number of nodes in this list.
         */
        public int size() {
            return nodes.size();
        }
    }

    /**
     * A leaf value held by a field: an identifier, an operator, the text of a literal.
     */
    record Scalar(String value) implements Ast {
    }

    /**
     * The value of a field that exists but holds nothing, such as a missing optional clause.
     */
    enum Nothing implements Ast {
        NOTHING
    }

    /**
     * The result of a parse that failed. Carries a user-readable message and nothing the checks rely on.
     */
    record ParseError(String message) implements Ast {
    }
}
