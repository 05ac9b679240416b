// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

import java.util.ArrayList;
import java.util.List;
import focuscheck.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of installed {@link Handler}s and established {@link Restart} points.
 * <p>
 * Check chains install one handler and establish one restart point each, so the stacks are only as deep as the chains
 * are nested. The static methods always operate on the calling thread's registry; there is no way to reach another
 * thread's.
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the given condition to the installed handlers without demanding that any of them act on it.
     * <p>
     * Returns normally if every handler declines. Skipped checks are signaled this way, so that a chain may count them
     * and let the check carry on.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().offer(SignaledCondition.nonFatal(condition));
    }

    /**
     * Offers the given condition to the installed handlers, expecting one of them to unwind.
     * <p>
     * Failed and malformed checks are signaled this way. If no handler unwinds, {@link UnhandledErrorError} is thrown.
     * The declared return type exists only so that callers can write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().offer(SignaledCondition.fatal(condition));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Establishes a restart point named {@code restartName} and runs {@code callback} within it.
     * <p>
     * Returns whatever {@code callback} returns, or {@code null} if some handler unwound to the restart point. Unwinds
     * aimed at other restart points pass through.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var context = localContext();
        final var restart = context.establish(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (!unwind.isAimedAt(restart)) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            context.disestablish(restart);
        }
    }

    /**
     * Returns the calling thread's currently established restart points, the innermost first.
     * <p>
     * The returned list is a copy; it does not follow later changes.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var established = localContext().restartStack;
        final var result = new ArrayList<Restart>(established.size());
        for (var i = established.size() - 1; i >= 0; i -= 1) {
            result.add(established.get(i));
        }
        return List.copyOf(result);
    }

    static @NotNull ConditionContext localContext() {
        return threadContext.get();
    }

    void install(final @NotNull Handler handler) {
        handlerStack.add(handler);
    }

    void uninstall(final @NotNull Handler handler) {
        assert !handlerStack.isEmpty() && handlerStack.get(handlerStack.size() - 1) == handler
            : "Handlers must be uninstalled in reverse order of installation";
        handlerStack.remove(handlerStack.size() - 1);
    }

    private @NotNull Restart establish(final @NotNull String name) {
        final var restart = new Restart(name, this);
        restartStack.add(restart);
        return restart;
    }

    private void disestablish(final @NotNull Restart restart) {
        assert !restartStack.isEmpty() && restartStack.get(restartStack.size() - 1) == restart
            : "Restart points must be disestablished in reverse order";
        restartStack.remove(restartStack.size() - 1);
        restart.expire();
    }

    private void offer(final @NotNull SignaledCondition signaled) {
        // While a handler runs, only the handlers installed before it see conditions it signals.
        final var start = (runningHandler < 0) ? handlerStack.size() : runningHandler;
        for (var i = start - 1; i >= 0; i -= 1) {
            final var outer = runningHandler;
            runningHandler = i;
            try {
                handlerStack.get(i).handle(signaled);
            } finally {
                runningHandler = outer;
            }
        }
    }

    private final List<@NotNull Handler> handlerStack = new ArrayList<>();
    private final List<@NotNull Restart> restartStack = new ArrayList<>();
    private int runningHandler = -1;

    private static final ThreadLocal<@NotNull ConditionContext> threadContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
