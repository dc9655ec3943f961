/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import io.micronaut.core.annotation.Nullable;
import java.math.BigInteger;
import org.apache.commons.codec.binary.Hex;

/**
 * Attributes of a key object.  Which of the algorithm-specific values are set
 * depends on the object's CKK_* key type.
 */
public class KeyAttributes {

  private final long objectClass;
  private final long keyType;
  @Nullable private final byte[] id;
  @Nullable private final String label;

  // CKK_RSA
  @Nullable private final BigInteger modulus;
  @Nullable private final BigInteger publicExponent;

  // CKK_EC
  @Nullable private final byte[] ecParams;
  @Nullable private final byte[] ecPoint;

  // CKK_DSA
  @Nullable private final BigInteger prime;
  @Nullable private final BigInteger subprime;
  @Nullable private final BigInteger base;
  @Nullable private final BigInteger value;

  private KeyAttributes(final Builder builder) {
    this.objectClass = builder.objectClass;
    this.keyType = builder.keyType;
    this.id = builder.id;
    this.label = builder.label;
    this.modulus = builder.modulus;
    this.publicExponent = builder.publicExponent;
    this.ecParams = builder.ecParams;
    this.ecPoint = builder.ecPoint;
    this.prime = builder.prime;
    this.subprime = builder.subprime;
    this.base = builder.base;
    this.value = builder.value;
  }

  public static Builder builder(final long objectClass, final long keyType) {
    return new Builder(objectClass, keyType);
  }

  public long getObjectClass() {
    return objectClass;
  }

  public long getKeyType() {
    return keyType;
  }

  @Nullable
  public byte[] getId() {
    return id;
  }

  @Nullable
  public String getLabel() {
    return label;
  }

  @Nullable
  public BigInteger getModulus() {
    return modulus;
  }

  @Nullable
  public BigInteger getPublicExponent() {
    return publicExponent;
  }

  @Nullable
  public byte[] getEcParams() {
    return ecParams;
  }

  @Nullable
  public byte[] getEcPoint() {
    return ecPoint;
  }

  @Nullable
  public BigInteger getPrime() {
    return prime;
  }

  @Nullable
  public BigInteger getSubprime() {
    return subprime;
  }

  @Nullable
  public BigInteger getBase() {
    return base;
  }

  @Nullable
  public BigInteger getValue() {
    return value;
  }

  @Override
  public String toString() {
    return String.format("KeyAttributes(class=0x%x, type=0x%x, id=%s, label=%s)",
        objectClass, keyType, id == null ? null : Hex.encodeHexString(id), label);
  }

  public static class Builder {

    private final long objectClass;
    private final long keyType;
    private byte[] id;
    private String label;
    private BigInteger modulus;
    private BigInteger publicExponent;
    private byte[] ecParams;
    private byte[] ecPoint;
    private BigInteger prime;
    private BigInteger subprime;
    private BigInteger base;
    private BigInteger value;

    private Builder(final long objectClass, final long keyType) {
      this.objectClass = objectClass;
      this.keyType = keyType;
    }

    public Builder id(@Nullable final byte[] id) {
      this.id = id;
      return this;
    }

    public Builder label(@Nullable final String label) {
      this.label = label;
      return this;
    }

    public Builder rsa(final BigInteger modulus, final BigInteger publicExponent) {
      this.modulus = modulus;
      this.publicExponent = publicExponent;
      return this;
    }

    public Builder ec(final byte[] ecParams, final byte[] ecPoint) {
      this.ecParams = ecParams;
      this.ecPoint = ecPoint;
      return this;
    }

    public Builder dsa(final BigInteger prime, final BigInteger subprime, final BigInteger base,
        final BigInteger value) {
      this.prime = prime;
      this.subprime = subprime;
      this.base = base;
      this.value = value;
      return this;
    }

    public KeyAttributes build() {
      return new KeyAttributes(this);
    }
  }
}
