// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.ast;

import focuscheck.util.UnreachableCodeReachedError;
import focuscheck.util.annotation.Nullable;

/**
 * A utility class containing common operations on {@link Ast} values.
 */
public final class Asts {
    private Asts() {
    }

    /**
     * Returns {@code true} iff the given value is the marker of a failed parse.
     */
    public static boolean isParseError(final @Nullable Ast ast) {
        return ast instanceof Ast.ParseError;
    }

    /**
     * Returns the node the given value represents, or {@code null} if it isn't a node.
     */
    public static Ast.@Nullable Node asNode(final Ast ast) {
        return (ast instanceof Ast.Node node) ? node : null;
    }

    /**
     * Returns the canonical structural representation of the given value.
     * <p>
     * Two values are structurally equal iff their canonical forms are equal. The form contains type names, field
     * names and scalar values, in field order and sequence order. Source spans, and therefore whitespace, comments and
     * anything else the grammar doesn't keep in the tree, never show up. A field holding {@link Ast.Nothing#NOTHING}
     * is printed, an absent field is not, so the two stay distinguishable.
     */
    public static String canonicalForm(final Ast ast) {
        final var printer = new CanonicalPrinter();
        printer.append(ast);
        return printer.builder.toString();
    }

    /**
     * Returns {@code true} iff both values have the same canonical form.
     */
    public static boolean structurallyEqual(final Ast left, final Ast right) {
        return canonicalForm(left).equals(canonicalForm(right));
    }

    /**
     * Returns {@code true} iff {@code part} is structurally equal to {@code whole} or to any value nested in it.
     * <p>
     * The canonical form of {@code part} has to occur within that of {@code whole} exactly where a nested value is
     * printed. A match straddling value boundaries, or starting in the middle of a type name or a scalar, doesn't
     * count.
     */
    public static boolean structurallyContains(final Ast whole, final Ast part) {
        final var printer = new CanonicalPrinter(canonicalForm(part));
        printer.append(whole);
        return printer.found;
    }

    /**
     * Returns a short description of the shape of the given value, for trace and error messages.
     */
    public static String describeShape(final @Nullable Ast ast) {
        if (ast == null) {
            return "no tree";
        } else if (ast instanceof Ast.Node node) {
            return node.typeName() + " node";
        } else if (ast instanceof Ast.NodeList list) {
            return "list of " + list.size() + " nodes";
        } else if (ast instanceof Ast.Scalar) {
            return "scalar";
        } else if (ast == Ast.Nothing.NOTHING) {
            return "nothing";
        } else if (ast instanceof Ast.ParseError) {
            return "parse error";
        }
        throw new UnreachableCodeReachedError("Unknown Ast variant " + ast.getClass().getName());
    }

    private static final class CanonicalPrinter {
        private CanonicalPrinter() {
            this(null);
        }

        private CanonicalPrinter(final @Nullable String sought) {
            this.sought = sought;
        }

        private void append(final Ast ast) {
            final var start = builder.length();
            appendValue(ast);
            if (sought != null && !found) {
                found = CharSequence.compare(builder.subSequence(start, builder.length()), sought) == 0;
            }
        }

        private void appendValue(final Ast ast) {
            if (ast instanceof Ast.Node node) {
                appendNode(node);
            } else if (ast instanceof Ast.NodeList list) {
                appendList(list);
            } else if (ast instanceof Ast.Scalar scalar) {
                appendScalar(scalar.value());
            } else if (ast == Ast.Nothing.NOTHING) {
                builder.append("nothing");
            } else if (ast instanceof Ast.ParseError) {
                builder.append("<parse error>");
            } else {
                throw new UnreachableCodeReachedError("Unknown Ast variant " + ast.getClass().getName());
            }
        }

        private void appendNode(final Ast.Node node) {
            builder.append(node.typeName()).append('(');
            var first = true;
            for (final var fieldName : node.fieldNames()) {
                final var value = node.field(fieldName);
                if (value == null) {
                    continue;
                }
                if (!first) {
                    builder.append(", ");
                }
                first = false;
                builder.append(fieldName).append('=');
                append(value);
            }
            builder.append(')');
        }

        private void appendList(final Ast.NodeList list) {
            builder.append('[');
            var first = true;
            for (final var node : list.nodes()) {
                if (!first) {
                    builder.append(", ");
                }
                first = false;
                append(node);
            }
            builder.append(']');
        }

        private void appendScalar(final String value) {
            final var escaped = value.replace("\\", "\\\\").replace("'", "\\'");
            builder.append('\'').append(escaped).append('\'');
        }

        private final StringBuilder builder = new StringBuilder();
        private final @Nullable String sought;
        private boolean found = false;
    }
}
