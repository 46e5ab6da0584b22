// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import lombok.With;

import java.time.Duration;
import java.util.Properties;

/// Immutable settings of a coordinator. The coordinator setters swap in a modified copy so that a tick always sees
/// one consistent set of values.
///
/// `requiredConfirmations` and `maxRetries` are copied into each transaction when it is created or received, so
/// changing them only affects transactions that arrive afterwards.
///
/// @param timeout               A pending transaction with no status change for longer than this is timed out.
/// @param retryInterval         A pending transaction with no status change for longer than this is retried.
/// @param maxRetries            The retry ceiling per transaction.
/// @param requiredConfirmations Acknowledgements needed to complete a transaction.
/// @param cleanupInterval       The minimum time between two cleanup sweeps.
/// @param retention             How long completed transactions are kept.
/// @param batchSize             The most queue entries sent per queue per tick.
/// @param tickInterval          How often the [CrossShardDriver] calls [CrossShardCoordinator#process()].
@With
public record CrossShardConfig(
    Duration timeout,
    Duration retryInterval,
    int maxRetries,
    int requiredConfirmations,
    Duration cleanupInterval,
    Duration retention,
    int batchSize,
    Duration tickInterval
) {
  public static final String PREFIX = "shardx.crossshard.";

  public CrossShardConfig {
    requirePositive(timeout, "timeout");
    requirePositive(retryInterval, "retryInterval");
    requirePositive(cleanupInterval, "cleanupInterval");
    requirePositive(retention, "retention");
    requirePositive(tickInterval, "tickInterval");
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must not be negative");
    if (requiredConfirmations < 1) throw new IllegalArgumentException("requiredConfirmations must be at least 1");
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be at least 1");
  }

  /// Five minute timeout, thirty second retries up to five times, two confirmations, hourly cleanup of transactions
  /// completed more than seven days ago, ten sends per queue per tick, a tick every five seconds.
  public static CrossShardConfig defaults() {
    return new CrossShardConfig(
        Duration.ofSeconds(300),
        Duration.ofSeconds(30),
        5,
        2,
        Duration.ofSeconds(3600),
        Duration.ofDays(7),
        10,
        Duration.ofSeconds(5)
    );
  }

  /// Reads overrides of the defaults from the system properties. See [#fromProperties(Properties)].
  public static CrossShardConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /// Reads overrides of the defaults. Keys are prefixed with `shardx.crossshard.`: `timeoutSeconds`,
  /// `retryIntervalSeconds`, `maxRetries`, `requiredConfirmations`, `cleanupIntervalSeconds`, `retentionSeconds`,
  /// `batchSize` and `tickIntervalMillis`. Missing keys keep their default.
  public static CrossShardConfig fromProperties(Properties properties) {
    final var defaults = defaults();
    return new CrossShardConfig(
        seconds(properties, "timeoutSeconds", defaults.timeout()),
        seconds(properties, "retryIntervalSeconds", defaults.retryInterval()),
        integer(properties, "maxRetries", defaults.maxRetries()),
        integer(properties, "requiredConfirmations", defaults.requiredConfirmations()),
        seconds(properties, "cleanupIntervalSeconds", defaults.cleanupInterval()),
        seconds(properties, "retentionSeconds", defaults.retention()),
        integer(properties, "batchSize", defaults.batchSize()),
        Duration.ofMillis(longValue(properties, "tickIntervalMillis", defaults.tickInterval().toMillis()))
    );
  }

  private static Duration seconds(Properties properties, String key, Duration fallback) {
    return Duration.ofSeconds(longValue(properties, key, fallback.toSeconds()));
  }

  private static int integer(Properties properties, String key, int fallback) {
    return Math.toIntExact(longValue(properties, key, fallback));
  }

  private static long longValue(Properties properties, String key, long fallback) {
    final var value = properties.getProperty(PREFIX + key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number: " + value, e);
    }
  }

  private static void requirePositive(Duration duration, String name) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be a positive duration but was " + duration);
    }
  }
}
