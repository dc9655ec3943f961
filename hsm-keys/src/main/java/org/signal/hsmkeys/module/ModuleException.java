/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.module;

import java.util.OptionalLong;

/**
 * Failure reported by this codebase or by the underlying PKCS#11 module.
 *
 * The {@link Kind} says what went wrong; native failures additionally carry the module's CKR_* return value where
 * one is known.
 */
public class ModuleException extends Exception {

  public enum Kind {
    /** An operation needing configuration ran before any successful configuration. */
    NOT_CONFIGURED,
    /** The native library could not be loaded or initialized. */
    CANNOT_OPEN_MODULE,
    /** No slot holds a token with the requested serial number or label. */
    TOKEN_NOT_FOUND,
    /** No object matches the requested key identifier or label. */
    KEY_NOT_FOUND,
    /** The module returned fewer random bytes than requested. */
    CANNOT_GET_RANDOM_DATA,
    /** The module returned a key of a type this library can't represent. */
    UNSUPPORTED_KEY_TYPE,
    /** A module call failed; see the cause and error code. */
    MODULE_ERROR,
    /** The calling thread was interrupted while waiting for a session. */
    INTERRUPTED,
  }

  private final Kind kind;
  private final OptionalLong errorCode;

  public ModuleException(final Kind kind, final String msg) {
    this(kind, msg, null);
  }

  public ModuleException(final Kind kind, final String msg, final Throwable t) {
    this(kind, msg, t, OptionalLong.empty());
  }

  public ModuleException(final Kind kind, final String msg, final Throwable t, final OptionalLong errorCode) {
    super(msg, t);
    this.kind = kind;
    this.errorCode = errorCode;
  }

  public Kind getKind() {
    return kind;
  }

  /** The PKCS#11 CKR_* value reported by the module, if this failure came from a module call. */
  public OptionalLong getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    if (errorCode.isPresent()) {
      return String.format("%s[%s, CKR=0x%x]: %s", getClass().getSimpleName(), kind, errorCode.getAsLong(), getMessage());
    }
    return String.format("%s[%s]: %s", getClass().getSimpleName(), kind, getMessage());
  }
}
