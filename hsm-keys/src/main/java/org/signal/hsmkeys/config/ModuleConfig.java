/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micronaut.core.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/**
 * Where the PKCS#11 module lives and which token on it to use.
 *
 * The token is found by serial number, or failing that by label, so at least one of the two
 * should be set.  The PIN is only needed for tokens that require a login.
 */
public class ModuleConfig {

  public static final int DEFAULT_MAX_SESSIONS_PER_SLOT = 1024;

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private final String modulePath;
  @Nullable private final String tokenSerial;
  @Nullable private final String tokenLabel;
  @Nullable private final String pin;
  private final int maxSessionsPerSlot;

  @JsonCreator
  public ModuleConfig(
      @JsonProperty("modulePath") @JsonAlias("path") final String modulePath,
      @JsonProperty("tokenSerial") @Nullable final String tokenSerial,
      @JsonProperty("tokenLabel") @Nullable final String tokenLabel,
      @JsonProperty("pin") @Nullable final String pin,
      @JsonProperty("maxSessionsPerSlot") @JsonAlias("maxTokenSession") @Nullable final Integer maxSessionsPerSlot) {
    if (StringUtils.isBlank(modulePath)) {
      throw new IllegalArgumentException("modulePath is required");
    }
    if (maxSessionsPerSlot != null && maxSessionsPerSlot <= 0) {
      throw new IllegalArgumentException("maxSessionsPerSlot must be positive, got " + maxSessionsPerSlot);
    }
    this.modulePath = modulePath;
    this.tokenSerial = tokenSerial;
    this.tokenLabel = tokenLabel;
    this.pin = pin;
    this.maxSessionsPerSlot = maxSessionsPerSlot == null ? DEFAULT_MAX_SESSIONS_PER_SLOT : maxSessionsPerSlot;
  }

  /** Reads a configuration from a JSON file. */
  public static ModuleConfig fromFile(final Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return MAPPER.readValue(in, ModuleConfig.class);
    }
  }

  public static ModuleConfig fromJson(final String json) throws IOException {
    return MAPPER.readValue(json, ModuleConfig.class);
  }

  public String getModulePath() {
    return modulePath;
  }

  @Nullable
  public String getTokenSerial() {
    return tokenSerial;
  }

  @Nullable
  public String getTokenLabel() {
    return tokenLabel;
  }

  @Nullable
  public String getPin() {
    return pin;
  }

  public int getMaxSessionsPerSlot() {
    return maxSessionsPerSlot;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null) return false;
    if (o == this) return true;
    if (!(o instanceof ModuleConfig)) return false;
    ModuleConfig other = (ModuleConfig) o;
    return other.modulePath.equals(modulePath)
        && Objects.equals(other.tokenSerial, tokenSerial)
        && Objects.equals(other.tokenLabel, tokenLabel)
        && Objects.equals(other.pin, pin)
        && other.maxSessionsPerSlot == maxSessionsPerSlot;
  }

  @Override
  public int hashCode() {
    return Objects.hash(modulePath, tokenSerial, tokenLabel, pin, maxSessionsPerSlot);
  }

  @Override
  public String toString() {
    return String.format("ModuleConfig(path=%s, serial=%s, label=%s, pin=%s, maxSessionsPerSlot=%d)",
        modulePath, tokenSerial, tokenLabel, pin == null ? null : "<redacted>", maxSessionsPerSlot);
  }
}
