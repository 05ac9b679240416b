// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.ast;

/**
 * A half-open range of character offsets into the source text a tree was parsed from.
 */
public record Span(int start, int stop) {
    public Span {
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + stop + ")");
        }
    }

    /**
     * Returns the part of {@code source} this span covers, clamped to the bounds of {@code source}.
     */
    public String extract(final String source) {
        final var length = source.length();
        return source.substring(Math.min(start, length), Math.min(stop, length));
    }

    /**
     * Returns the smallest span covering both this span and the given one.
     */
    public Span union(final Span other) {
        return new Span(Math.min(start, other.start), Math.max(stop, other.stop));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + stop + ")";
    }
}
