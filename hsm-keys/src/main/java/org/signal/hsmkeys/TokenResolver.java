/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys;

import io.micronaut.core.annotation.Nullable;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.signal.hsmkeys.module.Pkcs11Module;

/** Finds the slot hosting a token, by serial number or label. */
public class TokenResolver {

  private TokenResolver() {}

  /**
   * Resolves the slot whose token matches {@code serial}, or failing that {@code label}.
   *
   * Slots are read one at a time in {@code slots} order.  A serial number match returns at once
   * and beats any label match; otherwise the first label match wins.  Once a label match can no
   * longer be beaten (no serial given) it returns at once too.  Empty criteria match nothing.
   *
   * @throws ModuleException the module's error if a token read before the answer is known fails, or
   *   {@link Kind#TOKEN_NOT_FOUND} if nothing matches
   */
  public static ResolvedToken resolve(final Pkcs11Module module, final List<Long> slots,
      @Nullable final String serial, @Nullable final String label) throws ModuleException {
    final boolean bySerial = StringUtils.isNotBlank(serial);
    final boolean byLabel = StringUtils.isNotBlank(label);

    ResolvedToken labelMatch = null;
    for (long slot : slots) {
      if (!bySerial && (labelMatch != null || !byLabel)) {
        break;
      }
      final ResolvedToken candidate = new ResolvedToken(slot, module.getTokenInfo(slot));
      if (bySerial && serial.equals(candidate.getToken().getSerialNumber())) {
        return candidate;
      }
      if (byLabel && labelMatch == null && label.equals(candidate.getToken().getLabel())) {
        labelMatch = candidate;
      }
    }
    if (labelMatch != null) {
      return labelMatch;
    }
    throw new ModuleException(Kind.TOKEN_NOT_FOUND,
        String.format("no token with serial '%s' or label '%s' in slots %s",
            StringUtils.defaultString(serial), StringUtils.defaultString(label), slots));
  }
}
