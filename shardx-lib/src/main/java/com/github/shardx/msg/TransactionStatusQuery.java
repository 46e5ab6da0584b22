// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// Asks the peer shard for its view of the status of a transaction.
public record TransactionStatusQuery(TransactionId transactionId,
                                     ShardId sourceShardId,
                                     ShardId targetShardId) implements CrossShardMessage {
}
