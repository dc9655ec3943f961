/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.keys;

import jakarta.inject.Singleton;
import org.signal.hsmkeys.config.ModuleConfigurator;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;

/** Random bytes from the configured token's generator. */
@Singleton
public class TokenRandom {

  private final ModuleConfigurator configurator;

  public TokenRandom(final ModuleConfigurator configurator) {
    this.configurator = configurator;
  }

  /**
   * @throws ModuleException {@link Kind#CANNOT_GET_RANDOM_DATA} if the token returns fewer than
   *   {@code length} bytes
   */
  public byte[] nextBytes(final int length) throws ModuleException {
    if (length < 0) {
      throw new IllegalArgumentException("negative length " + length);
    }
    final byte[] bytes = configurator.getContext().withSession(session -> session.generateRandom(length));
    if (bytes.length < length) {
      throw new ModuleException(Kind.CANNOT_GET_RANDOM_DATA,
          String.format("token returned %d of %d random bytes", bytes.length, length));
    }
    return bytes;
  }
}
