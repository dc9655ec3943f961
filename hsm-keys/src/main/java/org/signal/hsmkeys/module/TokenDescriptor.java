/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKF_LOGIN_REQUIRED;

import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/** Token metadata read from a slot (the parts of CK_TOKEN_INFO we care about). */
public class TokenDescriptor {

  private final String serialNumber;
  private final String label;
  private final long flags;

  /** PKCS#11 pads serial number and label with blanks; both are stored trimmed. */
  public TokenDescriptor(final String serialNumber, final String label, final long flags) {
    this.serialNumber = StringUtils.trimToEmpty(serialNumber);
    this.label = StringUtils.trimToEmpty(label);
    this.flags = flags;
  }

  public String getSerialNumber() {
    return serialNumber;
  }

  public String getLabel() {
    return label;
  }

  /** CKF_* token flags. */
  public long getFlags() {
    return flags;
  }

  public boolean isLoginRequired() {
    return (flags & CKF_LOGIN_REQUIRED) != 0;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null) return false;
    if (o == this) return true;
    if (!(o instanceof TokenDescriptor)) return false;
    TokenDescriptor other = (TokenDescriptor) o;
    return other.flags == flags && other.serialNumber.equals(serialNumber) && other.label.equals(label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(serialNumber, label, flags);
  }

  @Override
  public String toString() {
    return String.format("Token(serial=%s, label=%s, flags=0x%x)", serialNumber, label, flags);
  }
}
