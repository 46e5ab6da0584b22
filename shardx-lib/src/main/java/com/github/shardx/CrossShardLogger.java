// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.logging.Logger;

/// The single logger of the coordinator. Applications configure it through standard `java.util.logging`
/// configuration using the package name `com.github.shardx`.
public final class CrossShardLogger {
  public static final Logger LOGGER = Logger.getLogger(CrossShardLogger.class.getPackageName());

  private CrossShardLogger() {
  }
}
