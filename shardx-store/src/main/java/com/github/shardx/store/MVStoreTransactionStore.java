// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.store;

import com.github.shardx.CrossShardTransaction;
import com.github.shardx.CrossShardTransactionPickler;
import com.github.shardx.Pickler;
import com.github.shardx.TransactionId;
import com.github.shardx.TransactionStore;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// A [TransactionStore] on an H2 MVStore. The pending and completed transactions are two maps of pickled records keyed
/// by transaction id. Writes become durable when the coordinator calls [#sync()] which commits the store.
///
/// The store must be opened with auto commit disabled so that moving a transaction from pending to completed is only
/// ever committed as a whole. Use [#open(String)] or [#inMemory()] or pass a store built the same way.
public class MVStoreTransactionStore implements TransactionStore, AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(MVStoreTransactionStore.class.getName());

  static final String PENDING = "com.github.shardx.store#pending";
  static final String COMPLETED = "com.github.shardx.store#completed";

  private final MVStore store;
  private final MVMap<String, byte[]> pending;
  private final MVMap<String, byte[]> completed;
  private final Pickler<CrossShardTransaction> pickler;

  public MVStoreTransactionStore(MVStore store) {
    this(store, CrossShardTransactionPickler.instance);
  }

  public MVStoreTransactionStore(MVStore store, Pickler<CrossShardTransaction> pickler) {
    this.store = store;
    this.pickler = pickler;
    this.pending = store.openMap(PENDING);
    this.completed = store.openMap(COMPLETED);
    repair();
  }

  /// Open or create a store file.
  public static MVStoreTransactionStore open(String fileName) {
    return new MVStoreTransactionStore(new MVStore.Builder()
        .fileName(fileName)
        .autoCommitDisabled()
        .open());
  }

  public static MVStoreTransactionStore inMemory() {
    return new MVStoreTransactionStore(new MVStore.Builder()
        .autoCommitDisabled()
        .open());
  }

  /// A store written by a process that did not commit in step may hold a record in both maps. The completed copy
  /// wins as a terminal status is never left.
  private void repair() {
    final var duplicates = pending.keySet().stream().filter(completed::containsKey).toList();
    if (!duplicates.isEmpty()) {
      LOGGER.warning(() -> "Removing " + duplicates.size() + " pending records that are already completed: "
          + duplicates);
      duplicates.forEach(pending::remove);
      store.commit();
    }
  }

  @Override
  public Optional<CrossShardTransaction> pending(TransactionId id) {
    return Optional.ofNullable(pending.get(id.value())).map(pickler::deserialize);
  }

  @Override
  public Optional<CrossShardTransaction> completed(TransactionId id) {
    return Optional.ofNullable(completed.get(id.value())).map(pickler::deserialize);
  }

  @Override
  public void putPending(CrossShardTransaction transaction) {
    if (transaction.status().isTerminal()) {
      throw new IllegalArgumentException("Terminal transaction cannot be pending: " + transaction.id());
    }
    pending.put(transaction.id().value(), pickler.serialize(transaction));
  }

  @Override
  public void complete(CrossShardTransaction transaction) {
    if (!transaction.status().isTerminal()) {
      throw new IllegalArgumentException("Only a terminal transaction can be completed: " + transaction.id());
    }
    final var key = transaction.id().value();
    completed.put(key, pickler.serialize(transaction));
    pending.remove(key);
  }

  @Override
  public void removeCompleted(TransactionId id) {
    completed.remove(id.value());
  }

  @Override
  public List<CrossShardTransaction> pendingTransactions() {
    return pending.values().stream().map(pickler::deserialize).toList();
  }

  @Override
  public List<CrossShardTransaction> completedTransactions() {
    return completed.values().stream().map(pickler::deserialize).toList();
  }

  @Override
  public void sync() {
    store.commit();
  }

  @Override
  public void close() {
    store.close();
  }
}
