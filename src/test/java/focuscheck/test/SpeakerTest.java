// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.test;

import java.util.Map;
import focuscheck.ast.Ast;
import focuscheck.dispatch.Speaker;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class SpeakerTest {
    @ParameterizedTest
    @CsvSource({
        "1, first",
        "2, second",
        "3, third",
        "10, tenth",
        "11, 11th",
        "12, 12th",
        "13, 13th",
        "21, 21st",
        "22, 22nd",
        "23, 23rd",
        "24, 24th",
        "101, 101st",
        "111, 111th",
        "112, 112th",
    })
    void spellsOrdinals(final int number, final String expected) {
        Assertions.assertThat(Speaker.ordinal(number)).isEqualTo(expected);
    }

    @Test
    void rejectsNonPositiveOrdinals() {
        Assertions.assertThatThrownBy(() -> Speaker.ordinal(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describesNodeSelection() {
        Assertions.assertThat(speaker.describe(select, "Could not find the {index}{node_name}.", null, 2))
            .isEqualTo("Could not find the third SELECT statement.");
        Assertions.assertThat(speaker.describe(select, "{index}{node_name}", null, null))
            .isEqualTo("SELECT statement");
    }

    @Test
    void describesFieldSelection() {
        Assertions.assertThat(speaker.describe(select, "{index}{field_name} of the {node_name}", "from_clause", null))
            .isEqualTo("FROM clause of the SELECT statement");
        Assertions.assertThat(speaker.describe(select, "{index}{field_name} of the {node_name}", "target_list", 0))
            .isEqualTo("first entry in the target list of the SELECT statement");
    }

    @Test
    void qualifiedFieldNamesWin() {
        final var insert = new MiniSqlNode.Builder("InsertStmt").build(0, 0);
        Assertions.assertThat(speaker.fieldName(select, "target_list")).isEqualTo("target list");
        Assertions.assertThat(speaker.fieldName(insert, "target_list")).isEqualTo("columns");
        Assertions.assertThat(speaker.fieldName(insert, "values")).isEqualTo("values");
    }

    @Test
    void nonNodesAreCode() {
        Assertions.assertThat(speaker.nodeName(new Ast.Scalar("a"))).isEqualTo("code");
        Assertions.assertThat(speaker.nodeName(Ast.Nothing.NOTHING)).isEqualTo("code");
    }

    @Test
    void literalSpeakerUsesRawNames() {
        Assertions.assertThat(Speaker.literal().describe(select, "{field_name} of {node_name}", "from_clause", null))
            .isEqualTo("from_clause of SelectStmt");
    }

    @Test
    void keepsUnknownPlaceholders() {
        Assertions.assertThat(speaker.describe(select, "{node_name} at {line}", null, null))
            .isEqualTo("SELECT statement at {line}");
    }

    private final Speaker speaker = new Speaker(
        Map.of("SelectStmt", "SELECT statement"),
        Map.of("SelectStmt.target_list", "target list", "target_list", "columns", "from_clause", "FROM clause")
    );
    private final Ast.Node select = new MiniSqlNode.Builder("SelectStmt").build(0, 0);
}
