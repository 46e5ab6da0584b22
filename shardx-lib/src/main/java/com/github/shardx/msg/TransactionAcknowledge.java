// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// Sent by the source to the target once it knows the target committed, and by the target back to the source in
/// reply. Each one received counts towards the confirmations of the receiver.
public record TransactionAcknowledge(TransactionId transactionId,
                                     ShardId sourceShardId,
                                     ShardId targetShardId) implements CrossShardMessage {
}
