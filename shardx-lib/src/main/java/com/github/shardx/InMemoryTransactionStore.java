// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// A [TransactionStore] that forgets everything when the process exits.
public class InMemoryTransactionStore implements TransactionStore {
  private final Map<TransactionId, CrossShardTransaction> pending = new LinkedHashMap<>();
  private final Map<TransactionId, CrossShardTransaction> completed = new LinkedHashMap<>();

  @Override
  public Optional<CrossShardTransaction> pending(TransactionId id) {
    return Optional.ofNullable(pending.get(id));
  }

  @Override
  public Optional<CrossShardTransaction> completed(TransactionId id) {
    return Optional.ofNullable(completed.get(id));
  }

  @Override
  public void putPending(CrossShardTransaction transaction) {
    if (transaction.status().isTerminal()) {
      throw new IllegalArgumentException("Terminal transaction cannot be pending: " + transaction.id());
    }
    pending.put(transaction.id(), transaction);
  }

  @Override
  public void complete(CrossShardTransaction transaction) {
    if (!transaction.status().isTerminal()) {
      throw new IllegalArgumentException("Only a terminal transaction can be completed: " + transaction.id());
    }
    completed.put(transaction.id(), transaction);
    pending.remove(transaction.id());
  }

  @Override
  public void removeCompleted(TransactionId id) {
    completed.remove(id);
  }

  @Override
  public List<CrossShardTransaction> pendingTransactions() {
    return new ArrayList<>(pending.values());
  }

  @Override
  public List<CrossShardTransaction> completedTransactions() {
    return new ArrayList<>(completed.values());
  }

  @Override
  public void sync() {
    // nothing to flush
  }
}
