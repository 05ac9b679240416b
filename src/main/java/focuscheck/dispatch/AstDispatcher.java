// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.dispatch;

import java.util.List;
import focuscheck.ast.Ast;
import focuscheck.util.annotation.Nullable;

/**
 * Everything the checks need from a language: a parser, a way to look nodes up by type, and a way to talk about nodes
 * in failure messages.
 * <p>
 * Implementations must be immutable, or at least safe to use from any number of chains at once.
 *
 * @see PriorityDispatcher
 */
public interface AstDispatcher {
    /**
     * Parses the given code, starting from the given grammar rule.
     *
     * @return The root node of the parsed tree, or an {@link Ast.ParseError} if the code doesn't parse. Never throws
     * for malformed code.
     */
    Ast parse(String code, String startRule);

    /**
     * Retrieves the start rule used to parse whole submissions.
     */
    String defaultStartRule();

    /**
     * Returns the nodes of the given type found at or below the given focus, in traversal order.
     *
     * @param priority How deep the search may go into nested constructs; higher values search deeper. {@code null}
     *                 selects the default for the searched type.
     */
    List<Ast.Node> select(String typeName, Ast tree, @Nullable Integer priority);

    /**
     * Fills the given message template with a description of the focus.
     * <p>
     * The placeholders {@code {node_name}}, {@code {field_name}} and {@code {index}} are understood. {@code index} is
     * zero-based and rendered as an ordinal phrase, such as "first " or "second entry in the ".
     *
     * @return The filled message, or {@code null} if this dispatcher can't describe the focus, in which case the
     * caller falls back to a generic message.
     */
    @Nullable String describe(Ast focus, String template, @Nullable String field, @Nullable Integer index);

    /**
     * Recovers the part of {@code source} the given focus was parsed from.
     */
    String extractText(Ast focus, String source);
}
