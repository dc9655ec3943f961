/*
 * Copyright 2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.hsmkeys.config;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.Path;
import org.signal.hsmkeys.ModuleContext;
import org.signal.hsmkeys.module.ModuleException;
import org.signal.hsmkeys.module.ModuleException.Kind;
import org.signal.hsmkeys.module.ModuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the process-wide module context.
 *
 * The first successful call to {@link #configure} wins: later calls leave the existing context in
 * place and return it, whatever configuration they pass.  A failed call leaves nothing behind, so
 * it may be retried.
 */
@Singleton
public class ModuleConfigurator {
  private static final Logger logger = LoggerFactory.getLogger(ModuleConfigurator.class);

  private final ModuleLoader loader;
  @Nullable private volatile ModuleContext context;

  public ModuleConfigurator(final ModuleLoader loader) {
    this.loader = loader;
  }

  /**
   * Opens the module and token described by {@code config}, unless a context is already configured.
   *
   * @return the configured context
   * @throws ModuleException {@link Kind#NOT_CONFIGURED} if {@code config} is null, otherwise
   *   whatever opening the module, finding the token or logging in failed with
   */
  public synchronized ModuleContext configure(@Nullable final ModuleConfig config) throws ModuleException {
    if (context != null) {
      logger.debug("Module already configured, ignoring {}", config);
      return context;
    }
    if (config == null) {
      throw new ModuleException(Kind.NOT_CONFIGURED, "no module configuration given");
    }
    try {
      context = ModuleContext.open(loader, config);
    } catch (ModuleException e) {
      logger.warn("Failed to configure module with {}", config, e);
      throw e;
    }
    logger.info("Configured {} on slot {}", config.getModulePath(), context.getDefaultSlot());
    return context;
  }

  /** Reads a JSON configuration from {@code path} and configures from it. */
  public ModuleContext configureFromFile(final String path) throws IOException, ModuleException {
    logger.info("Reading module configuration from {}", path);
    return configure(ModuleConfig.fromFile(Path.of(path)));
  }

  public boolean isConfigured() {
    return context != null;
  }

  /**
   * @throws ModuleException {@link Kind#NOT_CONFIGURED} if no configuration has succeeded yet
   */
  public ModuleContext getContext() throws ModuleException {
    final ModuleContext current = context;
    if (current == null) {
      throw new ModuleException(Kind.NOT_CONFIGURED, "module has not been configured");
    }
    return current;
  }
}
