// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import com.github.shardx.msg.CrossShardMessage;

import java.util.ArrayList;
import java.util.List;

/// The effects of a transition of the [CrossShardNode]. The node never does I/O itself. The [CrossShardCoordinator]
/// releases its mutex, sends the messages in order and then submits the ledger transactions to the local consensus.
///
/// @param messages    A possibly empty list of messages to send to other shards.
/// @param submissions A possibly empty list of ledger transactions to submit to the local consensus.
public record NodeResult(List<Outbound> messages, List<LedgerTransaction> submissions) {

  /// A message addressed to the coordinator of another shard.
  public record Outbound(ShardId to, CrossShardMessage message) {
  }

  public NodeResult {
    messages = List.copyOf(messages);
    submissions = List.copyOf(submissions);
  }

  static NodeResult noResult() {
    return new NodeResult(List.of(), List.of());
  }

  static NodeResult send(ShardId to, CrossShardMessage message) {
    return new NodeResult(List.of(new Outbound(to, message)), List.of());
  }

  static NodeResult submit(LedgerTransaction transaction) {
    return new NodeResult(List.of(), List.of(transaction));
  }

  NodeResult and(NodeResult other) {
    if (other.isEmpty()) {
      return this;
    }
    final var combinedMessages = new ArrayList<>(messages);
    combinedMessages.addAll(other.messages);
    final var combinedSubmissions = new ArrayList<>(submissions);
    combinedSubmissions.addAll(other.submissions);
    return new NodeResult(combinedMessages, combinedSubmissions);
  }

  public boolean isEmpty() {
    return messages.isEmpty() && submissions.isEmpty();
  }
}
