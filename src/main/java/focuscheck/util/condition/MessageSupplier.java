// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package focuscheck.util.condition;

/**
 * Produces a trace message on demand, for messages that quote code or describe nodes and are rarely read.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
