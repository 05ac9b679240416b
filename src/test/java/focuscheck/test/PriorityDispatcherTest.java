// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.test;

import java.util.List;
import focuscheck.ast.Ast;
import focuscheck.ast.Asts;
import focuscheck.dispatch.PriorityDispatcher;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class PriorityDispatcherTest {
    @Test
    void unlistedTypesGetDefaultPriority() {
        Assertions.assertThat(dispatcher.priorityOf("SelectStmt")).isEqualTo(1);
        Assertions.assertThat(dispatcher.priorityOf("Identifier")).isEqualTo(3);
        Assertions.assertThat(dispatcher.priorityOf("InsertStmt")).isEqualTo(PriorityDispatcher.defaultPriority);
    }

    @Test
    void statementSearchStopsAtTopLevel() {
        final var tree = parse("SELECT a FROM t WHERE a = (SELECT b FROM u); SELECT c FROM v");
        Assertions.assertThat(texts(dispatcher.select("SelectStmt", tree, null)))
            .containsExactly("SELECT a FROM t WHERE a = (SELECT b FROM u)", "SELECT c FROM v");
    }

    @Test
    void higherPriorityReachesSubqueries() {
        final var tree = parse("SELECT a FROM t WHERE a = (SELECT b FROM u); SELECT c FROM v");
        Assertions.assertThat(texts(dispatcher.select("SelectStmt", tree, PriorityDispatcher.searchEverywhere)))
            .containsExactly("SELECT a FROM t WHERE a = (SELECT b FROM u)", "SELECT b FROM u", "SELECT c FROM v");
    }

    @Test
    void nestedMatchesNeedPriorityAboveTheirType() {
        final var tree = parse("SELECT a FROM t WHERE x = 1 AND y = 2");
        Assertions.assertThat(texts(dispatcher.select("BinaryExpr", tree, null)))
            .containsExactly("x = 1 AND y = 2");
        Assertions.assertThat(texts(dispatcher.select("BinaryExpr", tree, 3)))
            .containsExactly("x = 1 AND y = 2", "x = 1", "y = 2");
    }

    @Test
    void matchesArePreOrder() {
        final var tree = parse("SELECT a, b + c FROM t WHERE d = (SELECT e FROM f)");
        Assertions.assertThat(texts(dispatcher.select("Identifier", tree, null)))
            .containsExactly("a", "b", "c", "t", "d", "e", "f");
    }

    @Test
    void searchStartsAtFocus() {
        final var tree = parse("SELECT a FROM t WHERE b = 1");
        final var select = dispatcher.select("SelectStmt", tree, null).get(0);
        final var where = select.field("where_clause");
        Assertions.assertThat(where).isNotNull();
        Assertions.assertThat(texts(dispatcher.select("Identifier", where, null))).containsExactly("b");
        final var targets = select.field("target_list");
        Assertions.assertThat(targets).isNotNull();
        Assertions.assertThat(texts(dispatcher.select("Identifier", targets, null))).containsExactly("a");
    }

    @Test
    void leavesHaveNoNodes() {
        Assertions.assertThat(dispatcher.select("Identifier", new Ast.Scalar("a"), null)).isEmpty();
        Assertions.assertThat(dispatcher.select("Identifier", Ast.Nothing.NOTHING, null)).isEmpty();
        Assertions.assertThat(dispatcher.select("Identifier", new Ast.ParseError("no"), null)).isEmpty();
    }

    @Test
    void extractsTextOfEveryShape() {
        final var tree = parse("SELECT a,  b FROM t");
        final var select = dispatcher.select("SelectStmt", tree, null).get(0);
        final var targets = select.field("target_list");
        Assertions.assertThat(targets).isNotNull();
        Assertions.assertThat(dispatcher.extractText(targets, code)).isEqualTo("a,  b");
        Assertions.assertThat(dispatcher.extractText(new Ast.NodeList(List.of()), code)).isEmpty();
        Assertions.assertThat(dispatcher.extractText(new Ast.Scalar("xyz"), code)).isEqualTo("xyz");
        Assertions.assertThat(dispatcher.extractText(Ast.Nothing.NOTHING, code)).isEmpty();
        Assertions.assertThat(dispatcher.extractText(new Ast.ParseError("no"), code)).isEmpty();
    }

    @Test
    void describesThroughSpeaker() {
        final var select = dispatcher.select("SelectStmt", parse("SELECT a"), null).get(0);
        Assertions.assertThat(dispatcher.describe(select, "{index}{node_name}", null, 0))
            .isEqualTo("first SELECT statement");
        Assertions.assertThat(dispatcher.speaker().nodeName(select)).isEqualTo("SELECT statement");
    }

    @Test
    void selectionIsStructurallyStable() {
        final var tree = parse("select A from T");
        final var again = parse("SELECT A FROM T");
        final var first = dispatcher.select("SelectStmt", tree, null).get(0);
        final var second = dispatcher.select("SelectStmt", again, null).get(0);
        Assertions.assertThat(Asts.structurallyEqual(first, second)).isTrue();
    }

    private Ast parse(final String source) {
        code = source;
        return dispatcher.parse(source, dispatcher.defaultStartRule());
    }

    private List<String> texts(final List<Ast.Node> nodes) {
        return nodes.stream().map(node -> dispatcher.extractText(node, code)).toList();
    }

    private final MiniSqlDispatcher dispatcher = new MiniSqlDispatcher();
    private String code = "";
}
