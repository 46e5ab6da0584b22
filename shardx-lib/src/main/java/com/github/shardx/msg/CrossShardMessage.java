// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// The base interface of the six messages exchanged between the coordinators of two shards. Every message names the
/// transaction and the `(source, target)` shard pair of that transaction. The pair is the one fixed when the
/// transaction was created; it does not change with the direction the message travels in.
public sealed interface CrossShardMessage permits
    TransactionTransmit,
    TransactionReceived,
    TransactionCommit,
    TransactionAcknowledge,
    TransactionStatusQuery,
    TransactionStatusResponse {

  TransactionId transactionId();

  ShardId sourceShardId();

  ShardId targetShardId();
}
