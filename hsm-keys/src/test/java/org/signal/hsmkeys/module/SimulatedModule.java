/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_DSA;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_EC;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKK_RSA;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKO_PRIVATE_KEY;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKO_PUBLIC_KEY;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKR_GENERAL_ERROR;
import static org.xipki.pkcs11.wrapper.PKCS11Constants.CKR_SLOT_ID_INVALID;

import java.io.IOException;
import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.interfaces.DSAPublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.ECParameterSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.signal.hsmkeys.module.ModuleException.Kind;

/**
 * An in-memory PKCS#11 module whose keys are ordinary JCA keys.  Counts the calls tests care
 * about and records any concurrent use of a single session.
 */
public class SimulatedModule implements Pkcs11Module {

  /** A key object held by a simulated token. */
  static class StoredObject {
    final long handle;
    final KeyAttributes attributes;
    final PrivateKey privateKey;

    StoredObject(final long handle, final KeyAttributes attributes, final PrivateKey privateKey) {
      this.handle = handle;
      this.attributes = attributes;
      this.privateKey = privateKey;
    }
  }

  private final Map<Long, TokenDescriptor> tokens = new ConcurrentHashMap<>();
  private final Map<Long, List<StoredObject>> objects = new ConcurrentHashMap<>();
  private final Set<Long> unreadableTokens = ConcurrentHashMap.newKeySet();
  private final List<Long> slotOrder = new CopyOnWriteArrayList<>();
  private final AtomicLong nextHandle = new AtomicLong(0x100);

  private final AtomicInteger initializeCalls = new AtomicInteger();
  private final AtomicInteger openSessionCalls = new AtomicInteger();
  private final AtomicInteger loginCalls = new AtomicInteger();
  private final AtomicInteger concurrentUses = new AtomicInteger();
  private final AtomicInteger failingOpens = new AtomicInteger();
  private final AtomicBoolean loggedIn = new AtomicBoolean();
  private final AtomicInteger randomShortfall = new AtomicInteger();

  private volatile String pin = "1234";
  private volatile boolean failInitialize;

  public SimulatedModule addToken(final long slot, final String serial, final String label, final long flags) {
    // Blank-padded the way modules report them.
    tokens.put(slot, new TokenDescriptor(String.format("%-16s", serial), String.format("%-32s", label), flags));
    objects.putIfAbsent(slot, new CopyOnWriteArrayList<>());
    slotOrder.add(slot);
    return this;
  }

  public SimulatedModule withPin(final String pin) {
    this.pin = pin;
    return this;
  }

  /** Makes getTokenInfo fail for {@code slot}. */
  public SimulatedModule unreadableToken(final long slot) {
    unreadableTokens.add(slot);
    return this;
  }

  public SimulatedModule failInitialize() {
    this.failInitialize = true;
    return this;
  }

  /** Makes the next {@code count} session opens fail. */
  public void failNextOpens(final int count) {
    failingOpens.set(count);
  }

  /** Makes C_GenerateRandom return {@code shortfall} fewer bytes than asked for. */
  public void shortRandom(final int shortfall) {
    randomShortfall.set(shortfall);
  }

  /** Stores both halves of {@code keyPair} on {@code slot}, and returns the private key's handle. */
  public long addKeyPair(final long slot, final byte[] id, final String label, final KeyPair keyPair) {
    final List<StoredObject> stored = objects.get(slot);
    final long privateHandle = nextHandle.getAndIncrement();
    final long keyType = keyType(keyPair);
    stored.add(new StoredObject(privateHandle,
        KeyAttributes.builder(CKO_PRIVATE_KEY, keyType).id(id).label(label).build(),
        keyPair.getPrivate()));
    stored.add(new StoredObject(nextHandle.getAndIncrement(),
        publicAttributes(keyPair, id, label), null));
    return privateHandle;
  }

  /** Stores an object with the given attributes and no key material. */
  public void addObject(final long slot, final KeyAttributes attributes) {
    objects.get(slot).add(new StoredObject(nextHandle.getAndIncrement(), attributes, null));
  }

  @Override
  public void initialize() throws ModuleException {
    initializeCalls.incrementAndGet();
    if (failInitialize) {
      throw new ModuleException(Kind.CANNOT_OPEN_MODULE, "C_Initialize failed", null, OptionalLong.of(CKR_GENERAL_ERROR));
    }
  }

  @Override
  public List<Long> getSlotsWithTokens() {
    return new ArrayList<>(slotOrder);
  }

  @Override
  public TokenDescriptor getTokenInfo(final long slotId) throws ModuleException {
    if (unreadableTokens.contains(slotId)) {
      throw new ModuleException(Kind.MODULE_ERROR, "C_GetTokenInfo failed", null, OptionalLong.of(CKR_GENERAL_ERROR));
    }
    return token(slotId);
  }

  @Override
  public ModuleSession openSession(final long slotId) throws ModuleException {
    openSessionCalls.incrementAndGet();
    token(slotId);
    if (failingOpens.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new ModuleException(Kind.MODULE_ERROR, "C_OpenSession failed", null, OptionalLong.of(CKR_GENERAL_ERROR));
    }
    return new SimulatedSession(this, slotId, nextHandle.getAndIncrement());
  }

  private TokenDescriptor token(final long slotId) throws ModuleException {
    final TokenDescriptor token = tokens.get(slotId);
    if (token == null) {
      throw new ModuleException(Kind.MODULE_ERROR, "no slot " + slotId, null, OptionalLong.of(CKR_SLOT_ID_INVALID));
    }
    return token;
  }

  List<StoredObject> objects(final long slotId) {
    return objects.getOrDefault(slotId, List.of());
  }

  String getPin() {
    return pin;
  }

  AtomicBoolean loggedIn() {
    return loggedIn;
  }

  void recordLogin() {
    loginCalls.incrementAndGet();
  }

  void recordConcurrentUse() {
    concurrentUses.incrementAndGet();
  }

  int getRandomShortfall() {
    return randomShortfall.get();
  }

  public boolean isLoggedIn() {
    return loggedIn.get();
  }

  public int getInitializeCalls() {
    return initializeCalls.get();
  }

  public int getOpenSessionCalls() {
    return openSessionCalls.get();
  }

  public int getLoginCalls() {
    return loginCalls.get();
  }

  /** Times a session was entered while another thread was already using it. */
  public int getConcurrentUses() {
    return concurrentUses.get();
  }

  private static long keyType(final KeyPair keyPair) {
    switch (keyPair.getPublic().getAlgorithm()) {
      case "RSA":
        return CKK_RSA;
      case "EC":
        return CKK_EC;
      case "DSA":
        return CKK_DSA;
      default:
        throw new IllegalArgumentException("unsupported algorithm " + keyPair.getPublic().getAlgorithm());
    }
  }

  private static KeyAttributes publicAttributes(final KeyPair keyPair, final byte[] id, final String label) {
    final KeyAttributes.Builder builder = KeyAttributes.builder(CKO_PUBLIC_KEY, keyType(keyPair)).id(id).label(label);
    if (keyPair.getPublic() instanceof RSAPublicKey) {
      final RSAPublicKey rsa = (RSAPublicKey) keyPair.getPublic();
      builder.rsa(rsa.getModulus(), rsa.getPublicExponent());
    } else if (keyPair.getPublic() instanceof ECPublicKey) {
      final ECPublicKey ec = (ECPublicKey) keyPair.getPublic();
      builder.ec(encodeCurve(ec.getParams()), encodePoint(ec));
    } else if (keyPair.getPublic() instanceof DSAPublicKey) {
      final DSAPublicKey dsa = (DSAPublicKey) keyPair.getPublic();
      builder.dsa(dsa.getParams().getP(), dsa.getParams().getQ(), dsa.getParams().getG(), dsa.getY());
    }
    return builder.build();
  }

  private static byte[] encodeCurve(final ECParameterSpec curve) {
    try {
      final AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
      parameters.init(curve);
      return parameters.getEncoded();
    } catch (GeneralSecurityException | IOException e) {
      throw new AssertionError(e);
    }
  }

  private static byte[] encodePoint(final ECPublicKey key) {
    final int fieldLength = (key.getParams().getCurve().getField().getFieldSize() + 7) / 8;
    final byte[] point = new byte[1 + 2 * fieldLength];
    point[0] = 0x04;
    copyUnsigned(key.getW().getAffineX(), point, 1, fieldLength);
    copyUnsigned(key.getW().getAffineY(), point, 1 + fieldLength, fieldLength);
    return point;
  }

  private static void copyUnsigned(final BigInteger value, final byte[] out, final int offset, final int length) {
    final byte[] bytes = value.toByteArray();
    final int skip = bytes.length > length ? bytes.length - length : 0;
    System.arraycopy(bytes, skip, out, offset + length - (bytes.length - skip), bytes.length - skip);
  }
}
