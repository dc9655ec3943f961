/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.config;

import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import org.signal.hsmkeys.module.ModuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures the module at startup from the JSON file named by {@code pkcs11.config-path}
 * (or the {@code PKCS11_CONFIG_PATH} environment variable).  Startup fails if the file can't be
 * read or the module can't be configured from it.
 *
 * <p>Deployments migrating from crypto11 should set {@code PKCS11_CONFIG_PATH} where they used to
 * set {@code CRYPTO11_CONFIG_PATH}; the file format is the same.
 */
@Context
@Requires(property = ConfigBootstrap.CONFIG_PATH_PROPERTY, pattern = ".+")
class ConfigBootstrap {
  static final String CONFIG_PATH_PROPERTY = "pkcs11.config-path";

  private static final Logger logger = LoggerFactory.getLogger(ConfigBootstrap.class);

  private final ModuleConfigurator configurator;
  private final String configPath;

  ConfigBootstrap(
      final ModuleConfigurator configurator,
      @Value("${" + CONFIG_PATH_PROPERTY + "}") final String configPath) {
    this.configurator = configurator;
    this.configPath = configPath;
  }

  @PostConstruct
  void configure() throws IOException, ModuleException {
    try {
      configurator.configureFromFile(configPath);
    } catch (IOException | ModuleException e) {
      logger.error("Unable to configure module from {}", configPath, e);
      throw e;
    }
  }
}
