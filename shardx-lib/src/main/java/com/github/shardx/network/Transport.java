// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.network;

import com.github.shardx.ShardId;

/// The coordinator is agnostic to how bytes reach the coordinator of another shard. This interface abstracts the
/// network layer. Delivery is best effort and at most once per call; the coordinator supplies its own retries.
///
/// Inbound bytes are handed to [com.github.shardx.CrossShardCoordinator#onBytes(byte[])] by whatever thread the
/// network layer uses.
@FunctionalInterface
public interface Transport {

  /// Send an encoded message to the coordinator of the given shard.
  ///
  /// @param to      The destination shard.
  /// @param message The message as encoded by [CrossShardMessagePickler].
  /// @throws RuntimeException when the message could not be handed to the network. The coordinator requeues.
  void send(ShardId to, byte[] message);
}
