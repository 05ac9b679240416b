// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.test;

import focuscheck.util.condition.Condition;

/**
 * A condition type indicating that the miniature SQL parser found a syntax error.
 */
final class MiniSqlSyntaxErrorCondition extends Condition {
    MiniSqlSyntaxErrorCondition(final String message, final int offset) {
        super(message + " at offset " + offset);
    }
}
