/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import jakarta.inject.Singleton;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xipki.pkcs11.wrapper.PKCS11Module;

/** Loads native PKCS#11 libraries through the xipki wrapper. */
@Singleton
public class XipkiModuleLoader implements ModuleLoader {
  private static final Logger logger = LoggerFactory.getLogger(XipkiModuleLoader.class);

  @Override
  public Pkcs11Module load(final String path) throws ModuleException {
    logger.info("Loading PKCS#11 library {}", path);
    try {
      return new XipkiModule(PKCS11Module.getInstance(path));
    } catch (Exception | UnsatisfiedLinkError e) {
      throw new ModuleException(Kind.CANNOT_OPEN_MODULE, "could not open PKCS#11 library " + path, e);
    }
  }
}
