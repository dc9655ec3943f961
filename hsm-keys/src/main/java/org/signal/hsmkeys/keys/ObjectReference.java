/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.keys;

/**
 * Identifies an object held by the module: its handle plus the slot it lives on.  The slot is
 * what routes later operations to a session that can reach the object.  A reference never owns
 * a session.
 */
public class ObjectReference {

  private final long handle;
  private final long slot;

  public ObjectReference(final long handle, final long slot) {
    this.handle = handle;
    this.slot = slot;
  }

  public long getHandle() {
    return handle;
  }

  public long getSlot() {
    return slot;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null) return false;
    if (o == this) return true;
    if (!(o instanceof ObjectReference)) return false;
    ObjectReference other = (ObjectReference) o;
    return other.handle == handle && other.slot == slot;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(handle) * 31 + Long.hashCode(slot);
  }

  @Override
  public String toString() {
    return String.format("Object(slot=%d, handle=0x%x)", slot, handle);
  }
}
