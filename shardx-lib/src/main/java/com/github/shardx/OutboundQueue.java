// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// A FIFO of transaction ids awaiting an outbound send. There is one for `TransactionTransmit` and one for
/// `TransactionAcknowledge`. An id appears at most once. Not thread safe; guarded by the coordinator mutex.
public class OutboundQueue {
  private final String name;
  private final Deque<TransactionId> ids = new ArrayDeque<>();
  private final Set<TransactionId> members = new HashSet<>();

  public OutboundQueue(String name) {
    this.name = name;
  }

  /// Append to the back unless already queued.
  ///
  /// @return true if the id was added.
  public boolean enqueue(TransactionId id) {
    if (!members.add(id)) {
      return false;
    }
    ids.addLast(id);
    return true;
  }

  /// Push an id back to the front after a failed send so that order is preserved.
  public void requeueFront(TransactionId id) {
    if (members.add(id)) {
      ids.addFirst(id);
    }
  }

  /// Remove up to `limit` ids from the front.
  public List<TransactionId> poll(int limit) {
    final var batch = new ArrayList<TransactionId>(Math.min(limit, ids.size()));
    while (batch.size() < limit && !ids.isEmpty()) {
      final var id = ids.pollFirst();
      members.remove(id);
      batch.add(id);
    }
    return batch;
  }

  /// Remove an id wherever it is queued.
  ///
  /// @return true if it was queued.
  public boolean remove(TransactionId id) {
    if (!members.remove(id)) {
      return false;
    }
    ids.remove(id);
    return true;
  }

  public boolean contains(TransactionId id) {
    return members.contains(id);
  }

  public int size() {
    return ids.size();
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }

  public List<TransactionId> snapshot() {
    return List.copyOf(ids);
  }

  @Override
  public String toString() {
    return "OutboundQueue[" + name + ", size=" + ids.size() + "]";
  }
}
