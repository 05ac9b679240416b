// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Something a check wants the code running it to know about.
 * <p>
 * Checks never decide on their own whether a problem ends the run. They signal a condition through
 * {@link ConditionContext}, and whichever {@link Handler} is installed makes that call, while the signaling frame is
 * still on the stack.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * The message as shown to the person whose code is being checked, or to the check author for authoring errors.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * The message with any extra diagnostics a subclass carries appended. Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + "[" + message + "]";
    }

    private final @NotNull String message;
}
