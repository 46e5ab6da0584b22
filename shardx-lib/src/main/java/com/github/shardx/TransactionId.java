// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import com.github.f4b6a3.uuid.UuidCreator;

/// The globally unique identifier of a cross-shard transaction. It travels on the wire as a plain string.
public record TransactionId(String value) {
  public TransactionId {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Transaction ID must not be blank");
    }
  }

  /// Creates a fresh id for a transaction that originates at the given shard. The time ordered epoch UUID (version 7)
  /// makes the id unique per origin shard and timestamp, and sorts ids created by one shard in creation order.
  public static TransactionId next(ShardId origin) {
    return new TransactionId(origin.id() + "-" + UuidCreator.getTimeOrderedEpoch());
  }

  @Override
  public String toString() {
    return value;
  }
}
