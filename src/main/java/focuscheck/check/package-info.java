// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The checks comparing a student submission against a solution, and the machinery running them.
 * <p>
 * Checks have three possible outcomes besides passing:
 * <ul>
 * <li>a <em>failure</em>, meaning the submission doesn't match the solution, reported through the state's
 * {@link focuscheck.check.Reporter} as a {@link focuscheck.check.CheckFailedCondition};
 * <li>a <em>skip</em>, when a tree the check needs didn't parse, signaled as a non-fatal
 * {@link focuscheck.check.CheckSkippedCondition};
 * <li>a <em>malformed check</em>, when the check doesn't fit the solution itself, signaled as a fatal
 * {@link focuscheck.check.MalformedCheckCondition} that nothing in this library handles.
 * </ul>
 */
@NonNullByDefault
package focuscheck.check;

import focuscheck.util.annotation.NonNullByDefault;
