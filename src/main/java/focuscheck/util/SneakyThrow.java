// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util;

import org.jetbrains.annotations.NotNull;

/**
 * Lets {@link focuscheck.util.condition.Unwind} pass through check steps, dispatchers and parsers, none of which
 * declare it.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} unchanged, without the compiler demanding a {@code throws} clause for it.
     * <p>
     * The return type lets callers write {@code throw SneakyThrow.doThrow(...)}; nothing is ever returned.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        SneakyThrow.<RuntimeException>rethrow(throwable);
        throw new UnreachableCodeReachedError("Throwable " + throwable + " was not thrown");
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void rethrow(final @NotNull Throwable throwable) throws E {
        throw (E) throwable;
    }
}
