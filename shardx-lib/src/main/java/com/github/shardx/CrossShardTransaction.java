// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A cross-shard transaction as held by one coordinator. Both the source and the target shard hold their own copy.
/// The record is immutable; every transition made by the [CrossShardNode] replaces it in the [TransactionStore].
///
/// @param id                    The globally unique id shared by both shards.
/// @param payload               The ledger transaction being relayed.
/// @param sourceShardId         The shard that created the transaction.
/// @param targetShardId         The shard the transaction is relayed to. Never equal to the source.
/// @param status                The current status.
/// @param createdAt             When this copy was created.
/// @param updatedAt             When the status last changed. Timeouts and retries are measured from this.
/// @param completedAt           Present only once the status is terminal.
/// @param confirmations         The acknowledgements recorded so far. Never exceeds `requiredConfirmations`.
/// @param requiredConfirmations The acknowledgements needed to complete.
/// @param retryCount            How many times the retry sweep has re-driven this transaction.
/// @param maxRetries            The ceiling for `retryCount`.
/// @param metadata              Free form diagnostics such as failure reasons.
public record CrossShardTransaction(
    TransactionId id,
    LedgerTransaction payload,
    ShardId sourceShardId,
    ShardId targetShardId,
    CrossShardTransactionStatus status,
    Instant createdAt,
    Instant updatedAt,
    Optional<Instant> completedAt,
    int confirmations,
    int requiredConfirmations,
    int retryCount,
    int maxRetries,
    Map<String, String> metadata
) {
  public static final String ERROR_KEY = "error";
  public static final String CANCEL_REASON_KEY = "cancel_reason";

  public CrossShardTransaction {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(payload, "payload cannot be null");
    Objects.requireNonNull(sourceShardId, "sourceShardId cannot be null");
    Objects.requireNonNull(targetShardId, "targetShardId cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    Objects.requireNonNull(createdAt, "createdAt cannot be null");
    Objects.requireNonNull(updatedAt, "updatedAt cannot be null");
    Objects.requireNonNull(completedAt, "completedAt cannot be null use Optional.empty()");
    if (sourceShardId.equals(targetShardId)) {
      throw new IllegalArgumentException("Source and target shard must differ: " + sourceShardId);
    }
    if (confirmations < 0 || confirmations > requiredConfirmations) {
      throw new IllegalArgumentException("confirmations " + confirmations + " outside 0.." + requiredConfirmations);
    }
    if (retryCount < 0 || retryCount > maxRetries) {
      throw new IllegalArgumentException("retryCount " + retryCount + " outside 0.." + maxRetries);
    }
    metadata = Map.copyOf(metadata);
  }

  /// A freshly created or freshly received transaction with no confirmations and no retries.
  public static CrossShardTransaction create(TransactionId id,
                                             LedgerTransaction payload,
                                             ShardId sourceShardId,
                                             ShardId targetShardId,
                                             CrossShardTransactionStatus status,
                                             Instant now,
                                             CrossShardConfig config) {
    return new CrossShardTransaction(id, payload, sourceShardId, targetShardId, status, now, now, Optional.empty(),
        0, config.requiredConfirmations(), 0, config.maxRetries(), Map.of());
  }

  public Role roleOf(ShardId localShard) {
    if (localShard.equals(sourceShardId)) {
      return Role.SOURCE;
    }
    if (localShard.equals(targetShardId)) {
      return Role.TARGET;
    }
    throw new CrossShardException(CrossShardException.Kind.INVALID_STATE,
        "Current shard (" + localShard + ") is neither source nor target of " + id);
  }

  /// The shard at the other end of the handshake from the point of view of the local shard.
  public ShardId peerOf(ShardId localShard) {
    return roleOf(localShard) == Role.SOURCE ? targetShardId : sourceShardId;
  }

  public boolean matches(ShardId source, ShardId target) {
    return sourceShardId.equals(source) && targetShardId.equals(target);
  }

  public CrossShardTransaction withStatus(CrossShardTransactionStatus newStatus, Instant now) {
    return new CrossShardTransaction(id, payload, sourceShardId, targetShardId, newStatus, createdAt, now,
        newStatus.isTerminal() ? Optional.of(now) : completedAt,
        confirmations, requiredConfirmations, retryCount, maxRetries, metadata);
  }

  public CrossShardTransaction withPayload(LedgerTransaction newPayload) {
    return new CrossShardTransaction(id, newPayload, sourceShardId, targetShardId, status, createdAt, updatedAt,
        completedAt, confirmations, requiredConfirmations, retryCount, maxRetries, metadata);
  }

  /// Records one acknowledgement. The count saturates at the requirement.
  public CrossShardTransaction withConfirmation() {
    final var next = Math.min(confirmations + 1, requiredConfirmations);
    return new CrossShardTransaction(id, payload, sourceShardId, targetShardId, status, createdAt, updatedAt,
        completedAt, next, requiredConfirmations, retryCount, maxRetries, metadata);
  }

  public CrossShardTransaction withAllConfirmations() {
    return new CrossShardTransaction(id, payload, sourceShardId, targetShardId, status, createdAt, updatedAt,
        completedAt, requiredConfirmations, requiredConfirmations, retryCount, maxRetries, metadata);
  }

  public CrossShardTransaction withRetry() {
    return new CrossShardTransaction(id, payload, sourceShardId, targetShardId, status, createdAt, updatedAt,
        completedAt, confirmations, requiredConfirmations, retryCount + 1, maxRetries, metadata);
  }

  public CrossShardTransaction withMetadata(String key, String value) {
    final var copy = new HashMap<>(metadata);
    copy.put(key, value);
    return new CrossShardTransaction(id, payload, sourceShardId, targetShardId, status, createdAt, updatedAt,
        completedAt, confirmations, requiredConfirmations, retryCount, maxRetries, copy);
  }

  public boolean isConfirmed() {
    return confirmations >= requiredConfirmations;
  }

  public boolean canRetry() {
    return retryCount < maxRetries;
  }
}
