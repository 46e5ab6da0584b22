// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// The single-shard consensus engine that orders and validates a ledger transaction within the local shard.
///
/// The coordinator never calls this while holding its mutex. Submission may therefore block on network or disk.
/// When the engine finalises a transaction the coordinator received from another shard, the host application should
/// report it with [CrossShardCoordinator#onLocalCommit(TransactionId, LedgerTransactionStatus)].
@FunctionalInterface
public interface LocalConsensus {

  /// Submit the transaction for ordering within the local shard. Submitting the same transaction again after a
  /// retry must be harmless.
  ///
  /// @param transaction The ledger transaction to commit locally.
  /// @throws RuntimeException any failure. The coordinator leaves the cross-shard transaction where it was so that
  ///                          the retry sweep submits it again.
  void submitTransaction(LedgerTransaction transaction);
}
