/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.keys;

import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_DSA;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_EC;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_RSA;

import java.io.IOException;
import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.DSAPublicKeySpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.KeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Arrays;
import org.signal.hsmkeys.module.KeyAttributes;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;

/** Turns the attributes of a CKO_PUBLIC_KEY object into a JCA {@link PublicKey}. */
class PublicKeyDecoder {

  private static final byte UNCOMPRESSED_POINT = 0x04;

  private PublicKeyDecoder() {}

  static PublicKey decode(final KeyAttributes attributes) throws ModuleException {
    final long keyType = attributes.getKeyType();
    try {
      if (keyType == CKK_RSA) {
        require(attributes.getModulus() != null && attributes.getPublicExponent() != null, attributes);
        return generate("RSA", new RSAPublicKeySpec(attributes.getModulus(), attributes.getPublicExponent()));
      } else if (keyType == CKK_EC) {
        require(attributes.getEcParams() != null && attributes.getEcPoint() != null, attributes);
        final AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
        parameters.init(attributes.getEcParams());
        final ECParameterSpec curve = parameters.getParameterSpec(ECParameterSpec.class);
        return generate("EC", new ECPublicKeySpec(decodePoint(attributes.getEcPoint(), curve), curve));
      } else if (keyType == CKK_DSA) {
        require(attributes.getValue() != null && attributes.getPrime() != null
            && attributes.getSubprime() != null && attributes.getBase() != null, attributes);
        return generate("DSA", new DSAPublicKeySpec(attributes.getValue(), attributes.getPrime(),
            attributes.getSubprime(), attributes.getBase()));
      }
    } catch (GeneralSecurityException | IOException e) {
      throw new ModuleException(Kind.UNSUPPORTED_KEY_TYPE, "can't decode " + attributes, e);
    }
    throw new ModuleException(Kind.UNSUPPORTED_KEY_TYPE, String.format("unsupported key type 0x%x", keyType));
  }

  private static PublicKey generate(final String algorithm, final KeySpec spec) throws GeneralSecurityException {
    return KeyFactory.getInstance(algorithm).generatePublic(spec);
  }

  private static void require(final boolean present, final KeyAttributes attributes) throws ModuleException {
    if (!present) {
      throw new ModuleException(Kind.UNSUPPORTED_KEY_TYPE, "missing public key attributes in " + attributes);
    }
  }

  /** Decodes a core CKA_EC_POINT.  Only uncompressed points are supported. */
  static ECPoint decodePoint(final byte[] point, final ECParameterSpec curve) throws ModuleException {
    final int fieldLength = (curve.getCurve().getField().getFieldSize() + 7) / 8;
    final int pointLength = 1 + 2 * fieldLength;

    if (point.length != pointLength || point[0] != UNCOMPRESSED_POINT) {
      throw new ModuleException(Kind.UNSUPPORTED_KEY_TYPE, "EC point is not an uncompressed point on the key's curve");
    }
    final BigInteger x = new BigInteger(1, Arrays.copyOfRange(point, 1, 1 + fieldLength));
    final BigInteger y = new BigInteger(1, Arrays.copyOfRange(point, 1 + fieldLength, pointLength));
    return new ECPoint(x, y);
  }
}
