// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.test;

import focuscheck.ast.Ast;
import focuscheck.ast.Asts;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class MiniSqlParserTest {
    @Test
    void parsesSelectIntoTree() {
        final var tree = dispatcher.parse("SELECT a FROM b", "script");
        Assertions.assertThat(Asts.canonicalForm(tree)).isEqualTo(
            "Script(statements=[SelectStmt(target_list=[Identifier(name='a')], "
                + "from_clause=[Identifier(name='b')], where_clause=nothing)])");
    }

    @Test
    void missingClausesHoldNothing() {
        final var tree = dispatcher.parse("SELECT 1", "select");
        Assertions.assertThat(Asts.canonicalForm(tree)).isEqualTo(
            "SelectStmt(target_list=[Number(value='1')], from_clause=nothing, where_clause=nothing)");
    }

    @Test
    void keywordsAreCaseInsensitive() {
        final var upper = dispatcher.parse("SELECT a FROM b WHERE c = 1 AND d = 2", "script");
        final var lower = dispatcher.parse("select a from b where c = 1 and d = 2", "script");
        Assertions.assertThat(Asts.structurallyEqual(upper, lower)).isTrue();
    }

    @Test
    void whitespaceIsNotPartOfTree() {
        final var compact = dispatcher.parse("SELECT a,b FROM t WHERE x=1", "script");
        final var spread = dispatcher.parse("  SELECT a ,\n  b\nFROM   t\nWHERE x =   1  ;", "script");
        Assertions.assertThat(Asts.structurallyEqual(compact, spread)).isTrue();
    }

    @Test
    void respectsOperatorPrecedence() {
        final var tree = dispatcher.parse("a + b * c = d OR e", "expression");
        Assertions.assertThat(Asts.canonicalForm(tree)).isEqualTo(
            "BinaryExpr(left=BinaryExpr(left=BinaryExpr(left=Identifier(name='a'), op='+', "
                + "right=BinaryExpr(left=Identifier(name='b'), op='*', right=Identifier(name='c'))), "
                + "op='=', right=Identifier(name='d')), op='OR', right=Identifier(name='e'))");
    }

    @Test
    void parsesScalarSubqueries() {
        final var tree = dispatcher.parse("x = (SELECT max FROM t)", "expression");
        Assertions.assertThat(Asts.canonicalForm(tree)).isEqualTo(
            "BinaryExpr(left=Identifier(name='x'), op='=', right=SelectStmt(target_list=[Identifier(name='max')], "
                + "from_clause=[Identifier(name='t')], where_clause=nothing))");
    }

    @Test
    void unescapesStrings() {
        final var tree = dispatcher.parse("'it''s'", "expression");
        Assertions.assertThat(Asts.canonicalForm(tree)).isEqualTo("Str(value='it\\'s')");
    }

    @Test
    void spansCoverStatementText() {
        final var code = "  SELECT a FROM b ;  SELECT * FROM c WHERE d > 2.5";
        final var tree = (Ast.Node) dispatcher.parse(code, "script");
        final var statements = (Ast.NodeList) tree.field("statements");
        Assertions.assertThat(statements).isNotNull();
        Assertions.assertThat(statements.nodes())
            .extracting(node -> node.span().extract(code))
            .containsExactly("SELECT a FROM b", "SELECT * FROM c WHERE d > 2.5");
        Assertions.assertThat(tree.span().extract(code)).isEqualTo("SELECT a FROM b ;  SELECT * FROM c WHERE d > 2.5");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "SELECT",
        "SELECT a FROM",
        "SELECT a FROM b WHERE",
        "SELECT a b",
        "SELECT (a FROM b",
        "SELECT 'abc",
        "SELECT a FROM select",
        "FROM b",
        "SELECT a;;",
    })
    void malformedCodeIsParseError(final String code) {
        Assertions.assertThat(dispatcher.parse(code, "script")).isInstanceOf(Ast.ParseError.class);
    }

    @Test
    void parseErrorDescribesProblem() {
        final var tree = dispatcher.parse("SELECT a FROM", "script");
        Assertions.assertThat(tree).isInstanceOfSatisfying(
            Ast.ParseError.class,
            error -> Assertions.assertThat(error.message()).isEqualTo("Expected a name at offset 13")
        );
    }

    @Test
    void limitsNesting() {
        final var code = "SELECT " + "(".repeat(200) + "a" + ")".repeat(200);
        Assertions.assertThat(dispatcher.parse(code, "script")).isInstanceOfSatisfying(
            Ast.ParseError.class,
            error -> Assertions.assertThat(error.message()).startsWith("Recursion limit reached")
        );
    }

    @Test
    void rejectsUnknownStartRule() {
        Assertions.assertThatThrownBy(() -> dispatcher.parse("SELECT a", "statement"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private final MiniSqlDispatcher dispatcher = new MiniSqlDispatcher();
}
