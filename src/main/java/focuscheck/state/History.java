// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.state;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import focuscheck.util.annotation.Nullable;

/**
 * A persistent, append-only sequence of {@link Action}s.
 * <p>
 * Each non-empty history is a link pointing at the history it extends, so appending is constant time and never
 * touches the receiver: any number of histories may share a common prefix, which is what happens when several chains
 * of checks branch off the same state.
 * <p>
 * Iteration is chronological, oldest action first. {@link #newestFirst()} iterates the other way around without
 * copying.
 */
public final class History implements Iterable<Action> {
    private History(final @Nullable History previous, final @Nullable Action last, final int size) {
        this.previous = previous;
        this.last = last;
        this.size = size;
    }

    /**
     * Returns the empty history.
     */
    public static History empty() {
        return empty;
    }

    /**
     * Returns a new history consisting of this one followed by the given action.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public History appended(final Action action) {
        return new History(this, action, size + 1);
    }

    /**
     * Returns the number of actions in this history.
     * <p>
     * Complexity: constant time.
     */
    public int size() {
        return size;
    }

    /**
     * Returns {@code true} iff this history contains no actions.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the most recent action.
     *
     * @throws NoSuchElementException if this history is empty
     */
    public Action last() {
        final var action = last;
        if (action == null) {
            throw new NoSuchElementException("Empty history has no last action");
        }
        return action;
    }

    /**
     * Returns the history this one extends, or {@code null} if this history is empty.
     */
    public @Nullable History previous() {
        return previous;
    }

    /**
     * Returns the action at the given position, counting from the oldest action.
     * <p>
     * Complexity: linear in the distance from the newest action.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Action get(final int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for history of size " + size);
        }
        var history = this;
        for (int i = size - 1; i > index; i -= 1) {
            history = history.previous;
            assert history != null : "History links shorter than its size";
        }
        return history.last();
    }

    /**
     * Returns an iterable over the actions of this history, newest first.
     */
    public Iterable<Action> newestFirst() {
        return () -> new NewestFirstIterator(this);
    }

    /**
     * Returns a new iterator over the actions of this history, oldest first.
     * <p>
     * Complexity: linear time to create, constant time per element.
     */
    @Override
    public Iterator<Action> iterator() {
        final var actions = new Action[size];
        var index = size;
        for (final var action : newestFirst()) {
            index -= 1;
            actions[index] = action;
        }
        return Arrays.asList(actions).iterator();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof History other) || other.size != size) {
            return false;
        }
        final var mine = newestFirst().iterator();
        final var theirs = other.newestFirst().iterator();
        while (mine.hasNext()) {
            if (!mine.next().equals(theirs.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (final var action : this) {
            hash = 31 * hash + action.hashCode();
        }
        return hash;
    }

    /**
     * Returns the actions of this history, oldest first, one per line.
     */
    @Override
    public String toString() {
        if (isEmpty()) {
            return "(empty history)";
        }
        final var builder = new StringBuilder();
        var position = 1;
        for (final var action : this) {
            builder.append(position).append(". ").append(action).append('\n');
            position += 1;
        }
        builder.setLength(builder.length() - 1); // Drop the final line feed.
        return builder.toString();
    }

    private static final History empty = new History(null, null, 0);

    private final @Nullable History previous;
    private final @Nullable Action last;
    private final int size;

    private static final class NewestFirstIterator implements Iterator<Action> {
        private NewestFirstIterator(final History history) {
            current = history;
        }

        @Override
        public boolean hasNext() {
            return current.last != null;
        }

        @Override
        public Action next() {
            final var action = current.last;
            final var previous = current.previous;
            if (action == null || previous == null) {
                throw new NoSuchElementException("No more actions left");
            }
            current = previous;
            return action;
        }

        private History current;
    }
}
