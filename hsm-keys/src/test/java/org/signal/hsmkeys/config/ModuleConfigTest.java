/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ModuleConfigTest {

  @Test
  void testParse() throws Exception {
    final ModuleConfig config = ModuleConfig.fromJson("{"
        + "\"modulePath\": \"/opt/hsm/lib.so\","
        + "\"tokenSerial\": \"12345\","
        + "\"tokenLabel\": \"signing\","
        + "\"pin\": \"secret\","
        + "\"maxSessionsPerSlot\": 16"
        + "}");

    assertEquals("/opt/hsm/lib.so", config.getModulePath());
    assertEquals("12345", config.getTokenSerial());
    assertEquals("signing", config.getTokenLabel());
    assertEquals("secret", config.getPin());
    assertEquals(16, config.getMaxSessionsPerSlot());
  }

  @Test
  void testDefaults() throws Exception {
    final ModuleConfig config = ModuleConfig.fromJson("{\"modulePath\": \"/opt/hsm/lib.so\"}");
    assertNull(config.getTokenSerial());
    assertNull(config.getTokenLabel());
    assertNull(config.getPin());
    assertEquals(ModuleConfig.DEFAULT_MAX_SESSIONS_PER_SLOT, config.getMaxSessionsPerSlot());
  }

  @Test
  void testFieldNamesIgnoreCase() throws Exception {
    final ModuleConfig config =
        ModuleConfig.fromJson("{\"ModulePath\": \"/opt/hsm/lib.so\", \"TokenLabel\": \"signing\", \"PIN\": \"1\"}");
    assertEquals("/opt/hsm/lib.so", config.getModulePath());
    assertEquals("signing", config.getTokenLabel());
    assertEquals("1", config.getPin());
  }

  @Test
  void testAliasesAndUnknownFields() throws Exception {
    final ModuleConfig config = ModuleConfig.fromJson(
        "{\"path\": \"/opt/hsm/lib.so\", \"maxTokenSession\": 4, \"useGCMIVFromHSM\": true}");
    assertEquals("/opt/hsm/lib.so", config.getModulePath());
    assertEquals(4, config.getMaxSessionsPerSlot());
  }

  @Test
  void testInvalid() {
    assertThrows(IOException.class, () -> ModuleConfig.fromJson("{\"tokenLabel\": \"signing\"}"));
    assertThrows(IOException.class,
        () -> ModuleConfig.fromJson("{\"modulePath\": \"/opt/hsm/lib.so\", \"maxSessionsPerSlot\": 0}"));
    assertThrows(IOException.class, () -> ModuleConfig.fromJson("not json"));
    assertThrows(IllegalArgumentException.class, () -> new ModuleConfig(" ", null, "x", null, null));
    assertThrows(IllegalArgumentException.class, () -> new ModuleConfig("/lib.so", null, "x", null, -2));
  }

  @Test
  void testToStringRedactsPin() {
    final ModuleConfig config = new ModuleConfig("/lib.so", "1", "label", "super-secret-pin", 8);
    assertFalse(config.toString().contains("super-secret-pin"));
    assertTrue(config.toString().contains("label"));
  }
}
