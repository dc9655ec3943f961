/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys;

import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKR_USER_ALREADY_LOGGED_IN;

import io.micronaut.core.annotation.Nullable;
import java.util.List;
import java.util.Map;
import org.signal.hsmkeys.config.ModuleConfig;
import org.signal.hsmkeys.keys.ObjectReference;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.signal.hsmkeys.module.ModuleLoader;
import org.signal.hsmkeys.module.ModuleSession;
import org.signal.hsmkeys.module.Pkcs11Module;
import org.signal.hsmkeys.session.SessionOperation;
import org.signal.hsmkeys.session.SessionPool;

/**
 * An opened, initialized module together with the session pool of the slot hosting the
 * configured token.
 *
 * The module and slots are fixed at construction; only the pools' sessions change afterwards,
 * so a context can be shared freely between threads.
 */
public class ModuleContext {

  private final Pkcs11Module module;
  private final long defaultSlot;
  private final Map<Long, SessionPool> pools;

  ModuleContext(final Pkcs11Module module, final long defaultSlot, final Map<Long, SessionPool> pools) {
    this.module = module;
    this.defaultSlot = defaultSlot;
    this.pools = Map.copyOf(pools);
  }

  /**
   * Opens and initializes the module named by {@code config}, finds the configured token, and logs
   * in to it if the token requires a login.
   */
  public static ModuleContext open(final ModuleLoader loader, final ModuleConfig config) throws ModuleException {
    final Pkcs11Module module = loader.load(config.getModulePath());
    try {
      module.initialize();
    } catch (ModuleException e) {
      if (e.getKind() != Kind.CANNOT_OPEN_MODULE) {
        throw new ModuleException(Kind.CANNOT_OPEN_MODULE, "could not initialize " + config.getModulePath(), e,
            e.getErrorCode());
      }
      throw e;
    }

    final List<Long> slots = module.getSlotsWithTokens();
    final ResolvedToken token = TokenResolver.resolve(module, slots, config.getTokenSerial(), config.getTokenLabel());

    final SessionPool pool = new SessionPool(module, token.getSlotId(), config.getMaxSessionsPerSlot());
    final ModuleContext context = new ModuleContext(module, token.getSlotId(), Map.of(token.getSlotId(), pool));

    if (token.isLoginRequired()) {
      try {
        context.withSession(session -> {
          login(session, config.getPin());
          return null;
        });
      } catch (ModuleException | RuntimeException e) {
        pool.removeMetrics();
        throw e;
      }
    }
    return context;
  }

  private static void login(final ModuleSession session, @Nullable final String pin) throws ModuleException {
    try {
      session.login(pin == null ? null : pin.toCharArray());
    } catch (ModuleException e) {
      // Login state belongs to the token, so an earlier login through any session counts.
      if (e.getErrorCode().orElse(-1) != CKR_USER_ALREADY_LOGGED_IN) {
        throw e;
      }
    }
  }

  public Pkcs11Module getModule() {
    return module;
  }

  /** The slot hosting the configured token. */
  public long getDefaultSlot() {
    return defaultSlot;
  }

  public SessionPool getSessionPool(final long slot) {
    final SessionPool pool = pools.get(slot);
    if (pool == null) {
      throw new IllegalArgumentException("no session pool for slot " + slot);
    }
    return pool;
  }

  /** Runs {@code operation} on a session borrowed from {@code slot}'s pool. */
  public <T> T withSession(final long slot, final SessionOperation<T> operation) throws ModuleException {
    return getSessionPool(slot).withSession(operation);
  }

  /** Runs {@code operation} on a session that can reach {@code object}. */
  public <T> T withSession(final ObjectReference object, final SessionOperation<T> operation) throws ModuleException {
    return withSession(object.getSlot(), operation);
  }

  /** Runs {@code operation} on a session borrowed from the default slot's pool. */
  public <T> T withSession(final SessionOperation<T> operation) throws ModuleException {
    return withSession(defaultSlot, operation);
  }

  @Override
  public String toString() {
    return String.format("ModuleContext(defaultSlot=%d, pools=%s)", defaultSlot, pools.values());
  }
}
