/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.keys;

import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKO_PRIVATE_KEY;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKO_PUBLIC_KEY;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.security.PublicKey;
import org.apache.commons.codec.binary.Hex;
import org.signal.hsmkeys.ModuleContext;
import org.signal.hsmkeys.config.ModuleConfigurator;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.signal.hsmkeys.module.ModuleSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up key pairs on the configured token by CKA_ID and/or CKA_LABEL.
 */
@Singleton
public class KeyFinder {
  private static final Logger logger = LoggerFactory.getLogger(KeyFinder.class);

  private final ModuleConfigurator configurator;

  public KeyFinder(final ModuleConfigurator configurator) {
    this.configurator = configurator;
  }

  /**
   * Finds the private key matching {@code id} and {@code label}, along with its public key.  A null
   * criterion is left out of the search, but at least one must be given.
   *
   * @throws ModuleException {@link Kind#KEY_NOT_FOUND} if either half of the pair is missing,
   *   {@link Kind#UNSUPPORTED_KEY_TYPE} if the public key can't be represented, or
   *   {@link Kind#NOT_CONFIGURED} before the module is configured
   */
  public PrivateKeyHandle findKeyPair(@Nullable final byte[] id, @Nullable final String label) throws ModuleException {
    if (id == null && label == null) {
      throw new IllegalArgumentException("a key id or label is required");
    }
    final ModuleContext context = configurator.getContext();
    final String description = describe(id, label);

    return context.withSession(session -> {
      final long privateHandle = findOne(session, CKO_PRIVATE_KEY, id, label, "private key " + description);
      final long publicHandle = findOne(session, CKO_PUBLIC_KEY, id, label, "public key " + description);
      final PublicKey publicKey = PublicKeyDecoder.decode(session.readKeyAttributes(publicHandle));

      logger.debug("Found {} as handle 0x{} on slot {}", description, Long.toHexString(privateHandle),
          session.getSlotId());
      return new PrivateKeyHandle(new ObjectReference(privateHandle, session.getSlotId()), publicKey);
    });
  }

  private static long findOne(final ModuleSession session, final long objectClass, @Nullable final byte[] id,
      @Nullable final String label, final String description) throws ModuleException {
    final long[] handles = session.findObjects(objectClass, id, label, 1);
    if (handles.length == 0) {
      throw new ModuleException(Kind.KEY_NOT_FOUND, "no " + description);
    }
    return handles[0];
  }

  private static String describe(@Nullable final byte[] id, @Nullable final String label) {
    return String.format("(id=%s, label=%s)", id == null ? null : Hex.encodeHexString(id), label);
  }
}
