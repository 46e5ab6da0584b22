// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.Optional;

/// The shard topology as seen by the coordinator. Implementations must be safe to call from any thread.
public interface ShardRegistry {

  boolean shardExists(ShardId shardId);

  Optional<ShardInfo> shardInfo(ShardId shardId);
}
