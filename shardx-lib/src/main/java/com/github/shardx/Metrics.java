// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// A fire and forget counter sink. Implementations must not throw and must be safe to call from any thread.
@FunctionalInterface
public interface Metrics {
  String CREATED = "cross_shard_transactions_created";
  String SOURCE_COMMITTED = "cross_shard_transactions_source_committed";
  String TRANSMITTED = "cross_shard_transactions_transmitted";
  String RECEIVED = "cross_shard_transactions_received";
  String TARGET_RECEIVED = "cross_shard_transactions_target_received";
  String TARGET_COMMITTED = "cross_shard_transactions_target_committed";
  String SOURCE_ACKNOWLEDGED = "cross_shard_transactions_source_acknowledged";
  String COMPLETED = "cross_shard_transactions_completed";
  String FAILED = "cross_shard_transactions_failed";
  String CANCELLED = "cross_shard_transactions_cancelled";
  String TIMED_OUT = "cross_shard_transactions_timed_out";
  String RETRIED = "cross_shard_transactions_retried";
  String MESSAGES_SENT = "cross_shard_messages_sent";

  Metrics NOOP = name -> {
  };

  void increment(String name);
}
