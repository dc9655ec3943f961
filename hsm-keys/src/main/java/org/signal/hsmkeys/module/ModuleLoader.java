/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

/** Loads a PKCS#11 module from a shared library path. */
public interface ModuleLoader {

  /**
   * Loads, but does not initialize, the module at {@code path}.
   *
   * @throws ModuleException of kind {@link ModuleException.Kind#CANNOT_OPEN_MODULE} if the library can't be loaded
   */
  Pkcs11Module load(String path) throws ModuleException;
}
