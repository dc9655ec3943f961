/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import java.util.List;

/** Abstract handle on an opened PKCS#11 module.
 *
 * Implementations must tolerate calls from multiple threads for the slot-level
 * operations here.  Sessions returned by {@link #openSession(long)} are the
 * opposite: each must only ever be used by one thread at a time, which is what
 * {@link org.signal.hsmkeys.session.SessionPool} guarantees.
 */
public interface Pkcs11Module {

  /** C_Initialize.  Called once, before anything else. */
  void initialize() throws ModuleException;

  /** Slot IDs with a token present, in the order the module reports them. */
  List<Long> getSlotsWithTokens() throws ModuleException;

  TokenDescriptor getTokenInfo(long slotId) throws ModuleException;

  /** Opens a new serial read-write session on the given slot. */
  ModuleSession openSession(long slotId) throws ModuleException;
}
