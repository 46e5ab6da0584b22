// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.CrossShardTransactionStatus;
import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// The answer to a [TransactionStatusQuery]. Also pushed unasked when a transaction fails or is cancelled.
public record TransactionStatusResponse(TransactionId transactionId,
                                        ShardId sourceShardId,
                                        ShardId targetShardId,
                                        CrossShardTransactionStatus status) implements CrossShardMessage {
}
