/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.session;

import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleSession;

/** Work that needs exclusive possession of a session.  The session must not escape the call. */
@FunctionalInterface
public interface SessionOperation<T> {
  T apply(ModuleSession session) throws ModuleException;
}
