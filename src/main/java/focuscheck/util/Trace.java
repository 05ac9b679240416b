// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util;

import java.util.ArrayList;
import java.util.List;
import focuscheck.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One step of the operation trace: a user-readable note such as "Selecting field from_clause", open for as long as
 * the step runs. Meant for try-with-resources.
 * <p>
 * Malformed checks copy the open steps into their condition, so the author of a broken check can see which step of
 * which chain went wrong. Traces belong to the thread that opened them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a step whose message is computed only if somebody reads the trace, and then only once.
     */
    public Trace(final MessageSupplier supplier) {
        pendingMessage = supplier;
        openSteps = threadSteps.get();
        openSteps.add(this);
    }

    /**
     * Opens a step with a fixed message.
     */
    public Trace(final String message) {
        this.message = message;
        openSteps = threadSteps.get();
        openSteps.add(this);
    }

    /**
     * The messages of the calling thread's open steps, innermost first.
     */
    public static Iterable<String> activeTraces() {
        final var steps = threadSteps.get();
        final var messages = new ArrayList<String>(steps.size());
        for (var i = steps.size() - 1; i >= 0; i -= 1) {
            messages.add(steps.get(i).message());
        }
        return messages;
    }

    /**
     * The messages of the calling thread's open steps, outermost first, as an immutable list that outlives the steps.
     */
    public static List<String> snapshot() {
        final var steps = threadSteps.get();
        final var messages = new ArrayList<String>(steps.size());
        for (final var step : steps) {
            messages.add(step.message());
        }
        return List.copyOf(messages);
    }

    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert openSteps == threadSteps.get() : "Trace closed outside of its thread";
        assert !openSteps.isEmpty() && openSteps.get(openSteps.size() - 1) == this
            : "Traces must be closed innermost first";
        openSteps.remove(openSteps.size() - 1);
    }

    private String message() {
        var result = message;
        if (result == null) {
            final var supplier = pendingMessage;
            assert supplier != null : "Trace has neither a message nor a supplier";
            result = supplier.get();
            message = result;
            pendingMessage = null;
        }
        return result;
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<List<Trace>> threadSteps = ThreadLocal.withInitial(ArrayList::new);

    private final List<Trace> openSteps;
    private @Nullable String message = null;
    private @Nullable MessageSupplier pendingMessage = null;
}
