// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Signaling and recovery for checks, after Common Lisp's conditions and restarts.
 * <p>
 * A failing check signals a fatal condition. The chain running it has installed a handler, which records the failure
 * and unwinds to the chain's restart point. Skipped checks are signaled non-fatally and merely counted. Conditions no
 * handler wants escape as {@link focuscheck.util.condition.UnhandledErrorError}.
 */
@NonNullByDefault
package focuscheck.util.condition;

import focuscheck.util.annotation.NonNullByDefault;
