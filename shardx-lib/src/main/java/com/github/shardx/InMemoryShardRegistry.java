// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// A registry held in memory. Suitable for static topologies and tests.
public class InMemoryShardRegistry implements ShardRegistry {
  private final Map<ShardId, ShardInfo> shards = new ConcurrentHashMap<>();

  public InMemoryShardRegistry(ShardInfo... shards) {
    Arrays.stream(shards).forEach(this::register);
  }

  public static InMemoryShardRegistry of(String... shardIds) {
    final var registry = new InMemoryShardRegistry();
    Arrays.stream(shardIds).map(ShardId::new).map(ShardInfo::new).forEach(registry::register);
    return registry;
  }

  public void register(ShardInfo info) {
    shards.put(info.id(), info);
  }

  public void remove(ShardId shardId) {
    shards.remove(shardId);
  }

  @Override
  public boolean shardExists(ShardId shardId) {
    return shards.containsKey(shardId);
  }

  @Override
  public Optional<ShardInfo> shardInfo(ShardId shardId) {
    return Optional.ofNullable(shards.get(shardId));
  }
}
