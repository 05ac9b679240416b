// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.check;

import focuscheck.state.State;

/**
 * One check in a chain: takes the current state and returns the state the next check starts from.
 */
@FunctionalInterface
public interface Step {
    State apply(State state);
}
