// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.Objects;

/// What the shard registry knows about a shard.
///
/// @param id         The shard id.
/// @param name       A human readable name.
/// @param validators The number of validators in the shard.
/// @param height     The current block height of the shard.
/// @param status     Whether the shard is serving.
public record ShardInfo(ShardId id, String name, int validators, long height, Status status) {
  public enum Status {ACTIVE, INACTIVE, SYNCING}

  public ShardInfo {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    name = name == null ? id.id() : name;
  }

  public ShardInfo(ShardId id) {
    this(id, id.id(), 0, 0L, Status.ACTIVE);
  }
}
