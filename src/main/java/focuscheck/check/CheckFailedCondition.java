// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.util.condition.Condition;

/**
 * A condition type indicating that the student submission doesn't pass a check. The message is meant for the
 * student.
 */
public final class CheckFailedCondition extends Condition {
    /**
     * Initializes a new check failure with the given student-facing message.
     */
    public CheckFailedCondition(final String message) {
        super(message);
    }
}
