/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys;

import org.signal.hsmkeys.module.TokenDescriptor;

/** The slot hosting a requested token, and that token's metadata. */
public class ResolvedToken {

  private final long slotId;
  private final TokenDescriptor token;

  public ResolvedToken(final long slotId, final TokenDescriptor token) {
    this.slotId = slotId;
    this.token = token;
  }

  public long getSlotId() {
    return slotId;
  }

  public TokenDescriptor getToken() {
    return token;
  }

  public long getFlags() {
    return token.getFlags();
  }

  public boolean isLoginRequired() {
    return token.isLoginRequired();
  }

  @Override
  public String toString() {
    return String.format("Slot %d: %s", slotId, token);
  }
}
