// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// The lifecycle of a cross-shard transaction. The constants are declared lowest to highest priority.
///
/// The priority is a total order used by status reconciliation: a locally held status is only replaced by a status
/// reported by the peer shard when the reported status has a strictly higher priority. The exception is [#COMPLETED]
/// and [#FAILED] which are adopted as soon as they are reported.
///
/// ```
/// INITIALIZED -> SOURCE_COMMITTED -> TRANSMITTED -> TARGET_RECEIVED
///   -> TARGET_COMMITTED -> SOURCE_ACKNOWLEDGED -> COMPLETED
/// (any non-terminal) -> FAILED | TIMED_OUT | CANCELLED
/// ```
public enum CrossShardTransactionStatus {
  INITIALIZED,
  SOURCE_COMMITTED,
  TRANSMITTED,
  TARGET_RECEIVED,
  TARGET_COMMITTED,
  SOURCE_ACKNOWLEDGED,
  COMPLETED,
  FAILED,
  TIMED_OUT,
  CANCELLED;

  /// The explicit priority table. Peers compare these numbers so they must never be derived from `ordinal()`.
  public int priority() {
    return switch (this) {
      case INITIALIZED -> 1;
      case SOURCE_COMMITTED -> 2;
      case TRANSMITTED -> 3;
      case TARGET_RECEIVED -> 4;
      case TARGET_COMMITTED -> 5;
      case SOURCE_ACKNOWLEDGED -> 6;
      case COMPLETED -> 7;
      case FAILED -> 8;
      case TIMED_OUT -> 9;
      case CANCELLED -> 10;
    };
  }

  /// No further transitions occur from a terminal status.
  public boolean isTerminal() {
    return switch (this) {
      case COMPLETED, FAILED, TIMED_OUT, CANCELLED -> true;
      default -> false;
    };
  }

  /// Whether a status reported by the peer replaces this one during reconciliation.
  public boolean isSupersededBy(CrossShardTransactionStatus reported) {
    if (reported == COMPLETED || reported == FAILED) {
      return true;
    }
    return reported.priority() > priority();
  }

  /// A rough measure of how far along the handshake the transaction is.
  public double progress() {
    return switch (this) {
      case INITIALIZED -> 0.0;
      case SOURCE_COMMITTED -> 0.2;
      case TRANSMITTED -> 0.4;
      case TARGET_RECEIVED -> 0.5;
      case TARGET_COMMITTED -> 0.7;
      case SOURCE_ACKNOWLEDGED -> 0.9;
      case COMPLETED, FAILED, TIMED_OUT, CANCELLED -> 1.0;
    };
  }
}
