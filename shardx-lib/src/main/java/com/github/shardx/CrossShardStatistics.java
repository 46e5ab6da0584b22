// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/// A point in time summary of the transactions known to one coordinator.
///
/// @param pending               Transactions still moving through the handshake.
/// @param completed             Transactions that finished with [CrossShardTransactionStatus#COMPLETED].
/// @param failed                Transactions that finished with [CrossShardTransactionStatus#FAILED].
/// @param timedOut              Transactions that finished with [CrossShardTransactionStatus#TIMED_OUT].
/// @param cancelled             Transactions that finished with [CrossShardTransactionStatus#CANCELLED].
/// @param averageCompletionTime The mean time from creation to completion of the completed transactions.
/// @param bySourceShard         Pending and finished transactions counted by source shard.
/// @param byTargetShard         Pending and finished transactions counted by target shard.
public record CrossShardStatistics(
    long pending,
    long completed,
    long failed,
    long timedOut,
    long cancelled,
    Optional<Duration> averageCompletionTime,
    Map<ShardId, Long> bySourceShard,
    Map<ShardId, Long> byTargetShard
) {
  public CrossShardStatistics {
    bySourceShard = Map.copyOf(bySourceShard);
    byTargetShard = Map.copyOf(byTargetShard);
  }

  public long total() {
    return pending + completed + failed + timedOut + cancelled;
  }

  static CrossShardStatistics of(Collection<CrossShardTransaction> pending,
                                 Collection<CrossShardTransaction> finished) {
    long completed = 0, failed = 0, timedOut = 0, cancelled = 0;
    long completionNanos = 0;
    for (var tx : finished) {
      switch (tx.status()) {
        case COMPLETED -> {
          completed++;
          completionNanos += tx.completedAt()
              .map(done -> Duration.between(tx.createdAt(), done).toNanos())
              .orElse(0L);
        }
        case FAILED -> failed++;
        case TIMED_OUT -> timedOut++;
        case CANCELLED -> cancelled++;
        default -> {
          // only terminal transactions are finished
        }
      }
    }
    final Optional<Duration> average = completed == 0
        ? Optional.empty()
        : Optional.of(Duration.ofNanos(completionNanos / completed));
    final var bySource = new TreeMap<ShardId, Long>();
    final var byTarget = new TreeMap<ShardId, Long>();
    Stream.concat(pending.stream(), finished.stream()).forEach(tx -> {
      bySource.merge(tx.sourceShardId(), 1L, Long::sum);
      byTarget.merge(tx.targetShardId(), 1L, Long::sum);
    });
    return new CrossShardStatistics(pending.size(), completed, failed, timedOut, cancelled, average, bySource,
        byTarget);
  }
}
