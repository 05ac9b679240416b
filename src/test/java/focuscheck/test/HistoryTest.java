// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.test;

import java.util.ArrayList;
import java.util.NoSuchElementException;
import focuscheck.state.Action;
import focuscheck.state.History;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

final class HistoryTest {
    @Test
    void emptyHistory() {
        final var history = History.empty();
        assertThat(history.isEmpty()).isTrue();
        assertThat(history.size()).isZero();
        assertThat(history).isEmpty();
        assertThat(history.previous()).isNull();
        assertThat(history).hasToString("(empty history)");
        assertThatThrownBy(history::last).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void appendingGrowsByOne() {
        final var parent = History.empty().appended(selectFrom);
        final var child = parent.appended(selectName);
        assertThat(child.size()).isEqualTo(parent.size() + 1);
        assertThat(child.last()).isEqualTo(selectName);
        assertThat(child.previous()).isSameAs(parent);
    }

    @Test
    void iteratesInBothDirections() {
        final var history = History.empty().appended(selectFrom).appended(selectName).appended(selectWhere);
        assertThat(history).containsExactly(selectFrom, selectName, selectWhere);
        final var newestFirst = new ArrayList<Action>();
        history.newestFirst().forEach(newestFirst::add);
        assertThat(newestFirst).containsExactly(selectWhere, selectName, selectFrom);
        assertThat(history.get(0)).isEqualTo(selectFrom);
        assertThat(history.get(2)).isEqualTo(selectWhere);
        assertThatThrownBy(() -> history.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void branchesShareTheirPrefix() {
        final var shared = History.empty().appended(selectFrom);
        final var left = shared.appended(selectName);
        final var right = shared.appended(selectWhere);
        assertThat(shared).containsExactly(selectFrom);
        assertThat(left).containsExactly(selectFrom, selectName);
        assertThat(right).containsExactly(selectFrom, selectWhere);
        assertThat(left.previous()).isSameAs(right.previous());
    }

    @Test
    void equalityIsByContents() {
        final var first = History.empty().appended(selectFrom).appended(selectName);
        final var second = History.empty().appended(new Action.SelectField("from_clause", null))
            .appended(new Action.SelectField("name", null));
        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(first.previous());
    }

    @Test
    void rendersNumberedLines() {
        final var history = History.empty().appended(selectFrom).appended(selectWhere);
        assertThat(history).hasToString("1. select field from_clause\n2. select field where_clause #0");
    }

    private final Action selectFrom = new Action.SelectField("from_clause", null);
    private final Action selectName = new Action.SelectField("name", null);
    private final Action selectWhere = new Action.SelectField("where_clause", 0);
}
