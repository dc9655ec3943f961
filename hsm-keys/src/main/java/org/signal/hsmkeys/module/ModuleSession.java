/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import io.micronaut.core.annotation.Nullable;

/** An open read-write session on one slot.
 *
 * Not safe for concurrent use: a session runs one logical operation at a time,
 * and callers must only reach it through a {@link org.signal.hsmkeys.session.SessionPool}.
 */
public interface ModuleSession {

  /** The module-assigned session handle. */
  long getHandle();

  long getSlotId();

  /** C_Login as CKU_USER.  Login state is shared by every session on the token. */
  void login(char[] pin) throws ModuleException;

  /**
   * Finds objects of the given CKO_* class.  Null criteria are not part of the search template.
   *
   * @return handles of at most {@code maxObjects} matching objects
   */
  long[] findObjects(long objectClass, @Nullable byte[] id, @Nullable String label, int maxObjects)
      throws ModuleException;

  /** Reads the key attributes of an object; public key material is only filled in for CKO_PUBLIC_KEY objects. */
  KeyAttributes readKeyAttributes(long objectHandle) throws ModuleException;

  byte[] sign(long mechanism, long keyHandle, byte[] data) throws ModuleException;

  byte[] decrypt(long mechanism, long keyHandle, byte[] ciphertext) throws ModuleException;

  /** C_GenerateRandom.  May return fewer bytes than requested if the module runs short. */
  byte[] generateRandom(int length) throws ModuleException;
}
