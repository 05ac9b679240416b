// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The contract between the checks and a language-specific parser, and a reusable base implementation of it.
 */
@NonNullByDefault
package focuscheck.dispatch;

import focuscheck.util.annotation.NonNullByDefault;
