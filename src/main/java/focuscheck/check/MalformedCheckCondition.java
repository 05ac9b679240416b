// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import java.util.List;
import focuscheck.util.Trace;
import focuscheck.util.condition.Condition;

/**
 * A condition type indicating that a check is malformed with respect to the solution, independently of any student
 * submission: a node or field the solution doesn't have, a tree that isn't there, a pattern that doesn't compile.
 * <p>
 * The operation trace active when the condition is created is kept and included in the detailed message.
 */
public final class MalformedCheckCondition extends Condition {
    /**
     * Initializes a new malformed check condition with the given message, for the author of the check.
     */
    public MalformedCheckCondition(final String message) {
        super(message);
        traces = Trace.snapshot();
    }

    @Override
    public String detailedMessage() {
        if (traces.isEmpty()) {
            return message();
        }
        final var builder = new StringBuilder(message());
        builder.append("\nOperation trace:");
        for (final var trace : traces) {
            builder.append("\n - ").append(trace);
        }
        return builder.toString();
    }

    /**
     * Retrieves the operation trace active when this condition was created, outermost operation first.
     */
    public List<String> traces() {
        return traces;
    }

    private final List<String> traces;
}
