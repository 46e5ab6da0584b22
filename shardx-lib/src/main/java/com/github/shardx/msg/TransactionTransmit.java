// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.LedgerTransaction;
import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// Sent by the source to the target to relay the ledger transaction once it has been committed on the source.
public record TransactionTransmit(TransactionId transactionId,
                                  ShardId sourceShardId,
                                  ShardId targetShardId,
                                  LedgerTransaction transaction) implements CrossShardMessage {
}
