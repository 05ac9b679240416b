// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.util.condition.ConditionContext;
import focuscheck.util.condition.UnhandledErrorError;

final class SignalingReporter implements Reporter {
    private SignalingReporter() {
    }

    @Override
    public UnhandledErrorError reportFailure(final String message) {
        return ConditionContext.error(new CheckFailedCondition(message));
    }

    @Override
    public String toString() {
        return "SignalingReporter";
    }

    static final SignalingReporter instance = new SignalingReporter();
}
