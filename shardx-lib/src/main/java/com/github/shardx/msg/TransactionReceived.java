// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// Sent by the target to the source when it has seen a [TransactionTransmit]. Also re-sent on a duplicate transmit.
public record TransactionReceived(TransactionId transactionId,
                                  ShardId sourceShardId,
                                  ShardId targetShardId) implements CrossShardMessage {
}
