// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The immutable focus threaded through a chain of checks, and the navigation history behind it.
 */
@NonNullByDefault
package focuscheck.state;

import focuscheck.util.annotation.NonNullByDefault;
