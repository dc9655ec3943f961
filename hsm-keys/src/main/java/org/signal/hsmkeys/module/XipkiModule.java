/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.xipki.pkcs11.wrapper.PKCS11Exception;
import org.xipki.pkcs11.wrapper.PKCS11Module;
import org.xipki.pkcs11.wrapper.Session;
import org.xipki.pkcs11.wrapper.Slot;
import org.xipki.pkcs11.wrapper.TokenInfo;

/** A PKCS#11 module reached through the xipki wrapper. */
class XipkiModule implements Pkcs11Module {

  private final PKCS11Module module;

  // Slots seen in the last slot listing, by ID.
  private final Map<Long, Slot> slots = new ConcurrentHashMap<>();

  XipkiModule(final PKCS11Module module) {
    this.module = module;
  }

  @Override
  public void initialize() throws ModuleException {
    try {
      module.initialize();
    } catch (PKCS11Exception e) {
      throw new ModuleException(Kind.CANNOT_OPEN_MODULE, "C_Initialize failed", e, OptionalLong.of(e.getErrorCode()));
    }
  }

  @Override
  public List<Long> getSlotsWithTokens() throws ModuleException {
    final Slot[] slotList;
    try {
      slotList = module.getSlotList(true);
    } catch (PKCS11Exception e) {
      throw moduleError("C_GetSlotList", e);
    }
    final List<Long> ids = new ArrayList<>(slotList.length);
    for (Slot slot : slotList) {
      slots.put(slot.getSlotID(), slot);
      ids.add(slot.getSlotID());
    }
    return ids;
  }

  @Override
  public TokenDescriptor getTokenInfo(final long slotId) throws ModuleException {
    final Slot slot = slot(slotId);
    try {
      final TokenInfo info = slot.getToken().getTokenInfo();
      return new TokenDescriptor(info.getSerialNumber(), info.getLabel(), info.getFlags());
    } catch (PKCS11Exception e) {
      throw moduleError("C_GetTokenInfo", e);
    }
  }

  @Override
  public ModuleSession openSession(final long slotId) throws ModuleException {
    final Slot slot = slot(slotId);
    try {
      final Session session = slot.getToken().openSession(true);
      return new XipkiSession(slotId, session);
    } catch (PKCS11Exception e) {
      throw moduleError("C_OpenSession", e);
    }
  }

  private Slot slot(final long slotId) throws ModuleException {
    Slot slot = slots.get(slotId);
    if (slot == null) {
      getSlotsWithTokens();
      slot = slots.get(slotId);
    }
    if (slot == null) {
      throw new ModuleException(Kind.MODULE_ERROR, "no token present in slot " + slotId);
    }
    return slot;
  }

  static ModuleException moduleError(final String operation, final PKCS11Exception e) {
    return new ModuleException(Kind.MODULE_ERROR, operation + " failed", e, OptionalLong.of(e.getErrorCode()));
  }
}
