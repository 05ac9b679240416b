// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.test;

import focuscheck.ast.Ast;
import focuscheck.check.Reporter;
import focuscheck.state.Action;
import focuscheck.state.State;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class StateTest {
    @Test
    void rootParsesBothSides() {
        final var root = State.root("SELECT a", "SELECT", dispatcher);
        Assertions.assertThat(root.studentAst()).isInstanceOf(Ast.Node.class);
        Assertions.assertThat(root.solutionAst()).isInstanceOf(Ast.ParseError.class);
        Assertions.assertThat(root.history().isEmpty()).isTrue();
        Assertions.assertThat(root.dispatcher()).isSameAs(dispatcher);
        Assertions.assertThat(root.reporter()).isSameAs(Reporter.signaling());
        Assertions.assertThat(root).hasToString("State[student=Script node, solution=parse error, depth=0]");
    }

    @Test
    void childKeepsSourcesAndExtendsHistory() {
        final var root = State.root("SELECT a", "SELECT b", dispatcher);
        final var action = new Action.SelectField("statements", null);
        final var child = root.toChild(Ast.Nothing.NOTHING, new Ast.Scalar("b"), action);
        Assertions.assertThat(child.studentCode()).isEqualTo("SELECT a");
        Assertions.assertThat(child.solutionCode()).isEqualTo("SELECT b");
        Assertions.assertThat(child.history()).containsExactly(action);
        Assertions.assertThat(child.dispatcher()).isSameAs(dispatcher);
        Assertions.assertThat(root.history()).isEmpty();
        Assertions.assertThat(root.studentAst()).isInstanceOf(Ast.Node.class);
    }

    @Test
    void stateWithoutParserHasNoTrees() {
        final var state = State.withoutParser("SELECT a", "SELECT b");
        Assertions.assertThat(state.studentAst()).isNull();
        Assertions.assertThat(state.solutionAst()).isNull();
        Assertions.assertThat(state.dispatcher()).isNull();
        Assertions.assertThat(state).hasToString("State[student=no tree, solution=no tree, depth=0]");
    }

    private final MiniSqlDispatcher dispatcher = new MiniSqlDispatcher();
}
