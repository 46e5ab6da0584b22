// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The cross-shard transaction coordinator of a sharded ledger node.
///
/// A cross-shard transaction is created on its source shard, committed by the local consensus of the source shard,
/// relayed to the target shard, committed by the local consensus of the target shard and then acknowledged by both
/// sides. Each shard keeps its own copy of the [com.github.shardx.CrossShardTransaction] and moves it through the
/// [com.github.shardx.CrossShardTransactionStatus] lifecycle as messages arrive.
///
/// - [com.github.shardx.CrossShardNode] is the state machine. It is not thread safe and does no I/O.
/// - [com.github.shardx.CrossShardCoordinator] guards the node with a mutex and performs the I/O.
/// - [com.github.shardx.CrossShardDriver] ticks the coordinator to drain its queues and run the timeout, retry and
///   cleanup sweeps.
/// - [com.github.shardx.TransactionStore] is where the records live.
///
/// Messages can be lost, duplicated or reordered. Every handler is idempotent, lost messages are recovered by the
/// retry sweep and the status query, and a transaction that makes no progress is eventually timed out.
package com.github.shardx;
