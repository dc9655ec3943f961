/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.session;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.signal.hsmkeys.module.ModuleSession;
import org.signal.hsmkeys.module.Pkcs11Module;

/**
 * SessionPool multiplexes callers onto the read-write sessions of one slot, with the
 * following guarantees:
 *   1) At most maxSessions sessions are ever opened on the slot
 *   2) A session is in the hands of at most one operation at a time
 *   3) A session taken for an operation goes back to the pool when the operation ends, however it ends
 *
 * Sessions are opened lazily and never closed, so the pool only grows.  A caller that finds every
 * session busy and the pool at its ceiling waits for a release; no ordering among waiters is promised.
 */
public class SessionPool {
  private final Pkcs11Module module;
  private final long slotId;
  private final int maxSessions;

  // One permit per session that may be in use.  Taking a permit entitles the holder to an idle
  // session or, if there is none, to open a new one.
  private final Semaphore permits;
  private final BlockingQueue<ModuleSession> idle;
  private final AtomicInteger opened = new AtomicInteger();

  private final Timer acquireTimer;
  private final List<Meter> meters;

  public SessionPool(final Pkcs11Module module, final long slotId, final int maxSessions) {
    Preconditions.checkArgument(maxSessions > 0, "maxSessions must be positive, got %s", maxSessions);
    this.module = module;
    this.slotId = slotId;
    this.maxSessions = maxSessions;
    this.permits = new Semaphore(maxSessions);
    this.idle = new ArrayBlockingQueue<>(maxSessions);

    final Tags tags = Tags.of("slot", Long.toString(slotId));
    final Gauge openGauge = Gauge.builder("SessionPool.openSessions", opened, AtomicInteger::get)
         .tags(tags)
         .register(Metrics.globalRegistry);
    final Gauge idleGauge = Gauge.builder("SessionPool.idleSessions", idle, BlockingQueue::size)
         .tags(tags)
         .register(Metrics.globalRegistry);
    final Gauge inUseGauge = Gauge.builder("SessionPool.sessionsInUse", this, SessionPool::getSessionsInUse)
         .tags(tags)
         .register(Metrics.globalRegistry);
    this.acquireTimer = Timer.builder("SessionPool.acquireWait")
         .tags(tags)
         .register(Metrics.globalRegistry);
    this.meters = List.of(openGauge, idleGauge, inUseGauge, acquireTimer);
  }

  public long getSlotId() {
    return slotId;
  }

  public int getMaxSessions() {
    return maxSessions;
  }

  /**
   * Runs {@code operation} with exclusive use of one of this slot's sessions.
   *
   * @throws ModuleException whatever the operation throws; a failure to open a new session; or
   *   {@link Kind#INTERRUPTED} if the thread is interrupted while waiting for a session
   */
  public <T> T withSession(final SessionOperation<T> operation) throws ModuleException {
    final ModuleSession session = acquire();
    try {
      return operation.apply(session);
    } finally {
      release(session);
    }
  }

  private ModuleSession acquire() throws ModuleException {
    final Timer.Sample sample = Timer.start(Metrics.globalRegistry);
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModuleException(Kind.INTERRUPTED, "interrupted waiting for a session on slot " + slotId, e);
    } finally {
      sample.stop(acquireTimer);
    }

    final ModuleSession session = idle.poll();
    if (session != null) {
      return session;
    }

    // Every opened session is held by another permit holder, so opening one more stays within maxSessions.
    try {
      final ModuleSession fresh = module.openSession(slotId);
      opened.incrementAndGet();
      return fresh;
    } catch (ModuleException | RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  private void release(final ModuleSession session) {
    // Can't fail: the queue has room for every session this pool may open.
    idle.add(session);
    permits.release();
  }

  /**
   * Removes this pool's meters from the global registry.  Meters are keyed by slot, so a pool that
   * is being discarded must do this before another pool for the same slot can report.
   */
  public void removeMetrics() {
    meters.forEach(Metrics.globalRegistry::remove);
  }

  /** Number of sessions opened so far.  Never decreases. */
  @VisibleForTesting
  public int getOpenedSessions() {
    return opened.get();
  }

  @VisibleForTesting
  public int getIdleSessions() {
    return idle.size();
  }

  @VisibleForTesting
  public int getSessionsInUse() {
    return maxSessions - permits.availablePermits();
  }

  @Override
  public String toString() {
    return String.format("SessionPool(slot=%d, opened=%d/%d, idle=%d)", slotId, opened.get(), maxSessions, idle.size());
  }
}
