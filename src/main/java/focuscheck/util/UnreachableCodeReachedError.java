// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util;

import org.jetbrains.annotations.NotNull;

/**
 * Marks a bug in focuscheck itself, such as a tree value that is none of the {@link focuscheck.ast.Ast} variants.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
