/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.keys;

import jakarta.inject.Singleton;
import org.signal.hsmkeys.config.ModuleConfigurator;
import org.signal.hsmkeys.module.ModuleException;

/** Private key operations, each run on a session from the slot holding the key. */
@Singleton
public class KeyOperations {

  private final ModuleConfigurator configurator;

  public KeyOperations(final ModuleConfigurator configurator) {
    this.configurator = configurator;
  }

  /** C_SignInit and C_Sign with the given CKM_* mechanism. */
  public byte[] sign(final PrivateKeyHandle key, final long mechanism, final byte[] data) throws ModuleException {
    final ObjectReference reference = key.getReference();
    return configurator.getContext()
        .withSession(reference, session -> session.sign(mechanism, reference.getHandle(), data));
  }

  /** C_DecryptInit and C_Decrypt with the given CKM_* mechanism. */
  public byte[] decrypt(final PrivateKeyHandle key, final long mechanism, final byte[] ciphertext)
      throws ModuleException {
    final ObjectReference reference = key.getReference();
    return configurator.getContext()
        .withSession(reference, session -> session.decrypt(mechanism, reference.getHandle(), ciphertext));
  }
}
