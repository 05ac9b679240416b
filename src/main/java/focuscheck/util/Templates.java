// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util;

import java.util.Map;

/**
 * Filling of message templates with named {@code {placeholder}}s.
 */
public final class Templates {
    private Templates() {
    }

    /**
     * Replaces each {@code {name}} in the template with the value mapped to {@code name}.
     * <p>
     * Placeholders without a value are left as they are, braces included. A placeholder is a brace-enclosed run of
     * letters, digits and underscores; any other brace is copied verbatim. Values are inserted literally and are never
     * scanned for placeholders themselves.
     */
    public static String fill(final String template, final Map<String, String> values) {
        final var builder = new StringBuilder(template.length() + initialSlack);
        final var length = template.length();
        int position = 0;
        while (position < length) {
            final var open = template.indexOf('{', position);
            if (open < 0) {
                break;
            }
            final var close = findPlaceholderEnd(template, open + 1);
            if (close < 0) {
                builder.append(template, position, open + 1);
                position = open + 1;
                continue;
            }
            final var value = values.get(template.substring(open + 1, close));
            builder.append(template, position, open);
            if (value != null) {
                builder.append(value);
            } else {
                builder.append(template, open, close + 1);
            }
            position = close + 1;
        }
        builder.append(template, position, length);
        return builder.toString();
    }

    private static int findPlaceholderEnd(final String template, final int nameStart) {
        final var length = template.length();
        for (int i = nameStart; i < length; i += 1) {
            final var ch = template.charAt(i);
            if (ch == '}') {
                return (i > nameStart) ? i : -1;
            }
            if (!(Character.isLetterOrDigit(ch) || ch == '_')) {
                return -1;
            }
        }
        return -1;
    }

    private static final int initialSlack = 32;
}
