// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.dispatch;

import java.util.HashMap;
import java.util.Map;
import focuscheck.ast.Ast;
import focuscheck.util.Templates;
import focuscheck.util.annotation.Nullable;

/**
 * Turns node types and field names into the words used in failure messages, such as {@code SelectStmt} into
 * "SELECT statement" and {@code from_clause} into "FROM clause".
 */
public final class Speaker {
    /**
     * Initializes a new speaker with the given name tables.
     *
     * @param nodeNames  Human-readable names of node types, keyed by type name.
     * @param fieldNames Human-readable names of fields, keyed either by {@code Type.field} or by the bare field name.
     *                   The qualified key wins.
     */
    public Speaker(final Map<String, String> nodeNames, final Map<String, String> fieldNames) {
        this.nodeNames = Map.copyOf(nodeNames);
        this.fieldNames = Map.copyOf(fieldNames);
    }

    /**
     * Returns a speaker that uses type and field names as they are.
     */
    public static Speaker literal() {
        return literal;
    }

    /**
     * Fills the template with the description of the given focus.
     */
    public String describe(
        final Ast focus,
        final String template,
        final @Nullable String field,
        final @Nullable Integer index
    ) {
        final var values = new HashMap<String, String>();
        values.put("node_name", nodeName(focus));
        values.put("field_name", (field != null) ? fieldName(focus, field) : "");
        values.put("index", indexPhrase(field, index));
        return Templates.fill(template, values);
    }

    /**
     * Returns the human-readable name of the focus's node type, or "code" for anything that isn't a node.
     */
    public String nodeName(final Ast focus) {
        if (focus instanceof Ast.Node node) {
            return nodeNames.getOrDefault(node.typeName(), node.typeName());
        }
        return "code";
    }

    /**
     * Returns the human-readable name of the given field of the focus.
     */
    public String fieldName(final Ast focus, final String field) {
        if (focus instanceof Ast.Node node) {
            final var qualified = fieldNames.get(node.typeName() + '.' + field);
            if (qualified != null) {
                return qualified;
            }
        }
        return fieldNames.getOrDefault(field, field);
    }

    /**
     * Returns the English ordinal of the given strictly positive number: "first" to "tenth", then "11th", "21st"
     * and so on.
     */
    public static String ordinal(final int number) {
        if (number <= 0) {
            throw new IllegalArgumentException("Ordinals need strictly positive numbers, got " + number);
        }
        if (number <= spelledOrdinals.length) {
            return spelledOrdinals[number - 1];
        }
        final var lastTwo = number % 100;
        if (lastTwo >= 11 && lastTwo <= 13) {
            return number + "th";
        }
        return switch (number % 10) {
            case 1 -> number + "st";
            case 2 -> number + "nd";
            case 3 -> number + "rd";
            default -> number + "th";
        };
    }

    private static String indexPhrase(final @Nullable String field, final @Nullable Integer index) {
        if (index == null) {
            return "";
        }
        final var ordinal = ordinal(index + 1);
        return (field != null) ? (ordinal + " entry in the ") : (ordinal + " ");
    }

    private static final String[] spelledOrdinals = {
        "first", "second", "third", "fourth", "fifth", "sixth", "seventh", "eighth", "ninth", "tenth",
    };
    private static final Speaker literal = new Speaker(Map.of(), Map.of());

    private final Map<String, String> nodeNames;
    private final Map<String, String> fieldNames;
}
