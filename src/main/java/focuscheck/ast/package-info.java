// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Language-neutral representation of parsed syntax trees and the values their fields hold.
 */
@NonNullByDefault
package focuscheck.ast;

import focuscheck.util.annotation.NonNullByDefault;
