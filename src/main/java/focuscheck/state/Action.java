// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.state;

import focuscheck.ast.Ast;
import focuscheck.util.annotation.Nullable;

/**
 * One navigation step taken to reach a focus.
 * <p>
 * Actions only serve diagnostics, such as rendering "the FROM clause of the first SELECT statement". They are never
 * replayed to recompute a focus.
 */
public sealed interface Action {
    /**
     * Selection of the {@code index}-th node of type {@code typeName} below the previous focus.
     *
     * @param studentNode The student node the selection ended up on, used to describe the focus.
     */
    record SelectNode(String typeName, int index, Ast.Node studentNode) implements Action {
        @Override
        public String toString() {
            return "select node " + typeName + " #" + index;
        }
    }

    /**
     * Selection of the field {@code fieldName} of the previous focus, optionally narrowed to one entry of it.
     */
    record SelectField(String fieldName, @Nullable Integer index) implements Action {
        @Override
        public String toString() {
            return (index == null) ? ("select field " + fieldName) : ("select field " + fieldName + " #" + index);
        }
    }
}
