/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.keys;

import java.security.PublicKey;
import java.util.Objects;

/**
 * A private key held by the module, together with its public half.
 *
 * The public key is read once, when the handle is created, so that {@link #getPublic()} can't
 * fail: callers asking for the public part of a key have no way to handle a module error.
 */
public class PrivateKeyHandle {

  private final ObjectReference reference;
  private final PublicKey publicKey;

  public PrivateKeyHandle(final ObjectReference reference, final PublicKey publicKey) {
    this.reference = Objects.requireNonNull(reference, "reference");
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
  }

  public ObjectReference getReference() {
    return reference;
  }

  public PublicKey getPublic() {
    return publicKey;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null) return false;
    if (o == this) return true;
    if (!(o instanceof PrivateKeyHandle)) return false;
    PrivateKeyHandle other = (PrivateKeyHandle) o;
    return other.reference.equals(reference) && other.publicKey.equals(publicKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reference, publicKey);
  }

  @Override
  public String toString() {
    return String.format("PrivateKey(%s, %s)", reference, publicKey.getAlgorithm());
  }
}
