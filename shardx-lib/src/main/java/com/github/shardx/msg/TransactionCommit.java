// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import com.github.shardx.LedgerTransactionStatus;
import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;

/// Sent by the target to the source when its local consensus has finalised the relayed ledger transaction.
///
/// @param status The status the local consensus of the target gave the ledger transaction.
public record TransactionCommit(TransactionId transactionId,
                                ShardId sourceShardId,
                                ShardId targetShardId,
                                LedgerTransactionStatus status) implements CrossShardMessage {
}
