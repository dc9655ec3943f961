/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_BASE;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_CLASS;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_EC_PARAMS;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_EC_POINT;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_ID;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_KEY_TYPE;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_LABEL;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_MODULUS;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_PRIME;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_PUBLIC_EXPONENT;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_SUBPRIME;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKA_VALUE;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_DSA;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_EC;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_RSA;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKO_PUBLIC_KEY;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKU_USER;

import io.micronaut.core.annotation.Nullable;
import java.math.BigInteger;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.xipki.pkcs11.wrapper.AttributeVector;
import org.xipki.pkcs11.wrapper.Mechanism;
import org.xipki.pkcs11.wrapper.PKCS11Exception;
import org.xipki.pkcs11.wrapper.Session;

/** A session opened through the xipki wrapper. */
class XipkiSession implements ModuleSession {

  private final long slotId;
  private final Session session;

  XipkiSession(final long slotId, final Session session) {
    this.slotId = slotId;
    this.session = session;
  }

  @Override
  public long getHandle() {
    return session.getSessionHandle();
  }

  @Override
  public long getSlotId() {
    return slotId;
  }

  @Override
  public void login(final char[] pin) throws ModuleException {
    try {
      session.login(CKU_USER, pin);
    } catch (PKCS11Exception e) {
      throw XipkiModule.moduleError("C_Login", e);
    }
  }

  @Override
  public long[] findObjects(final long objectClass, @Nullable final byte[] id, @Nullable final String label,
      final int maxObjects) throws ModuleException {
    final AttributeVector template = new AttributeVector().class_(objectClass);
    if (id != null) {
      template.id(id);
    }
    if (label != null) {
      template.label(label);
    }
    try {
      session.findObjectsInit(template);
      try {
        return session.findObjects(maxObjects);
      } finally {
        session.findObjectsFinal();
      }
    } catch (PKCS11Exception e) {
      throw XipkiModule.moduleError("C_FindObjects", e);
    }
  }

  @Override
  public KeyAttributes readKeyAttributes(final long objectHandle) throws ModuleException {
    try {
      final AttributeVector common = session.getAttrValues(objectHandle, CKA_CLASS, CKA_KEY_TYPE, CKA_ID, CKA_LABEL);
      if (common.class_() == null || common.keyType() == null) {
        throw new ModuleException(Kind.MODULE_ERROR,
            String.format("object 0x%x has no class or key type", objectHandle));
      }
      final long objectClass = common.class_();
      final long keyType = common.keyType();
      final KeyAttributes.Builder builder = KeyAttributes.builder(objectClass, keyType)
          .id(common.id())
          .label(common.label());

      if (objectClass != CKO_PUBLIC_KEY) {
        return builder.build();
      }
      if (keyType == CKK_RSA) {
        final AttributeVector rsa = session.getAttrValues(objectHandle, CKA_MODULUS, CKA_PUBLIC_EXPONENT);
        builder.rsa(rsa.modulus(), rsa.publicExponent());
      } else if (keyType == CKK_EC) {
        // CKA_EC_POINT comes back as the core point with any OCTET STRING wrapping removed
        final AttributeVector ec = session.getAttrValues(objectHandle, CKA_EC_PARAMS, CKA_EC_POINT);
        builder.ec(ec.ecParams(), ec.ecPoint());
      } else if (keyType == CKK_DSA) {
        final AttributeVector dsa = session.getAttrValues(objectHandle, CKA_PRIME, CKA_SUBPRIME, CKA_BASE, CKA_VALUE);
        final byte[] value = dsa.value();
        builder.dsa(dsa.prime(), dsa.subprime(), dsa.base(), value == null ? null : new BigInteger(1, value));
      }
      return builder.build();
    } catch (PKCS11Exception e) {
      throw XipkiModule.moduleError("C_GetAttributeValue", e);
    }
  }

  @Override
  public byte[] sign(final long mechanism, final long keyHandle, final byte[] data) throws ModuleException {
    try {
      session.signInit(new Mechanism(mechanism), keyHandle);
      return session.sign(data);
    } catch (PKCS11Exception e) {
      throw XipkiModule.moduleError("C_Sign", e);
    }
  }

  @Override
  public byte[] decrypt(final long mechanism, final long keyHandle, final byte[] ciphertext) throws ModuleException {
    try {
      session.decryptInit(new Mechanism(mechanism), keyHandle);
      return session.decrypt(ciphertext);
    } catch (PKCS11Exception e) {
      throw XipkiModule.moduleError("C_Decrypt", e);
    }
  }

  @Override
  public byte[] generateRandom(final int length) throws ModuleException {
    try {
      return session.generateRandom(length);
    } catch (PKCS11Exception e) {
      throw XipkiModule.moduleError("C_GenerateRandom", e);
    }
  }

  @Override
  public String toString() {
    return String.format("Session(slot=%d, handle=0x%x)", slotId, getHandle());
  }
}
