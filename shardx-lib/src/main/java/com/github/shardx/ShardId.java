// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// Identifies a shard partition of the ledger.
public record ShardId(String id) implements Comparable<ShardId> {
  public ShardId {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Shard ID must not be blank");
    }
  }

  @Override
  public int compareTo(ShardId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id;
  }
}
