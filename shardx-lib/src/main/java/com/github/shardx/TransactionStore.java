// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.List;
import java.util.Optional;

/// The transaction store is the storage layer of the coordinator. It holds two disjoint maps keyed by transaction id:
/// the *pending* transactions that are still moving through the handshake and the *completed* transactions that have
/// reached a terminal status.
///
/// A transaction must be in exactly one of the two maps at any time. [#complete(CrossShardTransaction)] must therefore
/// remove from pending and insert into completed as one atomic step. If the store cannot do that with a transaction it
/// must at least write the completed copy before deleting the pending copy so that a crash leaves a duplicate rather
/// than a lost record. [#find(TransactionId)] looks in pending first so a duplicate is resolved in favour of the
/// pending copy.
///
/// The store is only ever called by the [CrossShardNode] which runs under the mutex of the [CrossShardCoordinator].
/// Implementations need not be thread safe.
///
/// After every batch of mutations the coordinator calls [#sync()] before any message is sent to another shard. A
/// durable store should make its writes crash proof in that method. If `sync` throws the coordinator logs the failure
/// and the outbound messages of that batch are not sent. Retries send them again later.
public interface TransactionStore {

  /// Look up a transaction in pending then in completed.
  default Optional<CrossShardTransaction> find(TransactionId id) {
    final var pending = pending(id);
    return pending.isPresent() ? pending : completed(id);
  }

  Optional<CrossShardTransaction> pending(TransactionId id);

  Optional<CrossShardTransaction> completed(TransactionId id);

  /// Insert or replace a non-terminal transaction in the pending map.
  void putPending(CrossShardTransaction transaction);

  /// Atomically remove the transaction from pending and insert it into completed.
  ///
  /// @param transaction A transaction with a terminal status.
  void complete(CrossShardTransaction transaction);

  /// Delete a transaction from the completed map. Used by the cleanup sweep.
  void removeCompleted(TransactionId id);

  /// A snapshot of the pending transactions in no particular order.
  List<CrossShardTransaction> pendingTransactions();

  /// A snapshot of the completed transactions in no particular order.
  List<CrossShardTransaction> completedTransactions();

  /// Make all writes so far crash durable. A store held in memory does nothing.
  void sync();
}
