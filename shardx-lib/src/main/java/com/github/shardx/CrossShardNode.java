// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import com.github.shardx.msg.CrossShardMessage;
import com.github.shardx.msg.MessageType;
import com.github.shardx.msg.TransactionAcknowledge;
import com.github.shardx.msg.TransactionCommit;
import com.github.shardx.msg.TransactionReceived;
import com.github.shardx.msg.TransactionStatusQuery;
import com.github.shardx.msg.TransactionStatusResponse;
import com.github.shardx.msg.TransactionTransmit;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.github.shardx.CrossShardLogger.LOGGER;
import static com.github.shardx.CrossShardTransactionStatus.*;

/// The cross-shard handshake state machine of one shard. It owns the [TransactionStore] and the two
/// [OutboundQueue]s. This class is not thread safe and must only be used via the [CrossShardCoordinator] which guards
/// it with a mutex.
///
/// Transitions never perform I/O. They update the store and return a [NodeResult] holding the messages to send and the
/// ledger transactions to submit to the local consensus, which the coordinator performs after releasing its mutex.
///
/// Every handler is idempotent. A message that arrives for a transaction whose status has already moved past the
/// point the message is about is ignored. A message that arrives for a transaction that is already in the completed map
/// is ignored with two exceptions: status queries are answered, and a duplicate acknowledgement received by the target
/// is answered with another acknowledgement so that a source whose reply was lost can complete.
///
/// Confirmations are counted per side. When either side handles the acknowledgement that closes the handshake it
/// records two confirmations, one for each side's acknowledgement, capped at the required number. With the default of
/// two both sides complete on that acknowledgement. A required number above two is never reached, so such
/// transactions stay in [CrossShardTransactionStatus#SOURCE_ACKNOWLEDGED] or
/// [CrossShardTransactionStatus#TARGET_COMMITTED] until the timeout sweep reaps them.
public class CrossShardNode {
  final ShardId localShard;
  final TransactionStore store;
  final ShardRegistry registry;
  final Metrics metrics;
  final Clock clock;
  CrossShardConfig config;

  final OutboundQueue transmitQueue = new OutboundQueue("transmit");
  final OutboundQueue acknowledgeQueue = new OutboundQueue("acknowledge");
  /// Initialized transactions whose payload is being submitted to the local consensus. Not persisted.
  final Set<TransactionId> submitting = new HashSet<>();

  Instant lastCleanup;

  public CrossShardNode(ShardId localShard,
                        CrossShardConfig config,
                        TransactionStore store,
                        ShardRegistry registry,
                        Metrics metrics,
                        Clock clock) {
    this.localShard = localShard;
    this.config = config;
    this.store = store;
    this.registry = registry;
    this.metrics = metrics;
    this.clock = clock;
    this.lastCleanup = clock.instant();
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Local operations
  // ---------------------------------------------------------------------------------------------------------------

  /// Create a transaction with this shard as its source and queue it for transmission.
  ///
  /// @throws CrossShardException `INVALID_INPUT` if the target is this shard or is unknown to the registry.
  public TransactionId createTransaction(LedgerTransaction payload, ShardId targetShardId) {
    if (localShard.equals(targetShardId)) {
      throw new CrossShardException(CrossShardException.Kind.INVALID_INPUT,
          "Source and target shard cannot be the same: " + targetShardId);
    }
    if (!registry.shardExists(targetShardId)) {
      throw new CrossShardException(CrossShardException.Kind.INVALID_INPUT,
          "Target shard does not exist: " + targetShardId);
    }
    final var id = TransactionId.next(localShard);
    final var tx = CrossShardTransaction.create(id, payload, localShard, targetShardId, INITIALIZED, clock.instant(),
        config);
    store.putPending(tx);
    transmitQueue.enqueue(id);
    metrics.increment(Metrics.CREATED);
    LOGGER.fine(() -> localShard + " created " + id + " to " + targetShardId);
    return id;
  }

  /// The first step of a transmission. Checks the transaction may be transmitted and returns a snapshot of it. When the
  /// snapshot is [CrossShardTransactionStatus#INITIALIZED] the coordinator submits the payload to the local consensus
  /// and then calls [#onSourceCommitted(TransactionId)] or [#onSubmissionFailed(TransactionId)]. Until then the
  /// transaction is marked as submitting and any other transmission of it is refused.
  ///
  /// @param retransmit whether a [CrossShardTransactionStatus#TRANSMITTED] transaction may be sent again. This is
  ///                   only the case for ids drained from the transmit queue.
  /// @throws CrossShardException `NOT_FOUND` for an unknown id, `INVALID_STATE` if the transaction is past transmission
  ///                             or its payload is being submitted to the local consensus.
  public CrossShardTransaction beginTransmit(TransactionId id, boolean retransmit) {
    final var tx = store.find(id).orElseThrow(() -> CrossShardException.notFound(id));
    if (tx.roleOf(localShard) != Role.SOURCE) {
      throw CrossShardException.invalidState(tx, "transmit from the target shard");
    }
    if (submitting.contains(id)) {
      throw CrossShardException.invalidState(tx, "transmit while its local commit is in flight");
    }
    final var status = tx.status();
    if (status == INITIALIZED || status == SOURCE_COMMITTED || (retransmit && status == TRANSMITTED)) {
      transmitQueue.remove(id);
      if (status == INITIALIZED) {
        submitting.add(id);
      }
      return tx;
    }
    throw CrossShardException.invalidState(tx, "transmit");
  }

  /// The local consensus refused the payload. The transaction stays initialized.
  public void onSubmissionFailed(TransactionId id) {
    submitting.remove(id);
  }

  /// The local consensus has accepted the payload, or it had already done so. The transaction is marked transmitted
  /// before the transmit message is returned so that a reply can never overtake the transition. If the send then fails
  /// the transmit queue or the retry sweep sends it again.
  public NodeResult onSourceCommitted(TransactionId id) {
    submitting.remove(id);
    var tx = pendingOrThrow(id);
    final var now = clock.instant();
    if (tx.status() == INITIALIZED) {
      tx = tx.withStatus(SOURCE_COMMITTED, now);
      metrics.increment(Metrics.SOURCE_COMMITTED);
      LOGGER.fine(() -> localShard + " source committed " + id);
    }
    if (tx.status() == SOURCE_COMMITTED) {
      tx = tx.withStatus(TRANSMITTED, now);
      store.putPending(tx);
      metrics.increment(Metrics.TRANSMITTED);
      final var target = tx.targetShardId();
      LOGGER.fine(() -> localShard + " transmitting " + id + " to " + target);
    } else if (tx.status() != TRANSMITTED) {
      throw CrossShardException.invalidState(tx, "transmit");
    }
    return NodeResult.send(tx.targetShardId(),
        new TransactionTransmit(tx.id(), tx.sourceShardId(), tx.targetShardId(), tx.payload()));
  }

  /// The local consensus of the target shard has finalised a received payload. The payload status is recorded and the
  /// commit is reported to the source. Repeated calls are ignored.
  ///
  /// @throws CrossShardException `NOT_FOUND` for an unknown id, `INVALID_STATE` if this shard is the source.
  public NodeResult onLocalCommit(TransactionId id, LedgerTransactionStatus status) {
    final var found = store.find(id).orElseThrow(() -> CrossShardException.notFound(id));
    if (found.roleOf(localShard) != Role.TARGET) {
      throw CrossShardException.invalidState(found, "record a target commit on the source shard");
    }
    return commitOnTarget(found, status);
  }

  /// Mark a pending transaction as failed and tell the peer.
  public NodeResult failTransaction(TransactionId id, String reason) {
    return abort(id, FAILED, CrossShardTransaction.ERROR_KEY, reason, Metrics.FAILED);
  }

  /// Mark a pending transaction as cancelled and tell the peer.
  public NodeResult cancelTransaction(TransactionId id, String reason) {
    return abort(id, CANCELLED, CrossShardTransaction.CANCEL_REASON_KEY, reason, Metrics.CANCELLED);
  }

  private NodeResult abort(TransactionId id,
                           CrossShardTransactionStatus status,
                           String metadataKey,
                           String reason,
                           String counter) {
    final var found = store.find(id).orElseThrow(() -> CrossShardException.notFound(id));
    if (found.status().isTerminal()) {
      throw CrossShardException.invalidState(found, "abort");
    }
    final var tx = found
        .withMetadata(metadataKey, reason == null ? "" : reason)
        .withStatus(status, clock.instant());
    store.complete(tx);
    metrics.increment(counter);
    LOGGER.info(() -> localShard + " " + status + " " + id + ": " + reason);
    return NodeResult.send(tx.peerOf(localShard),
        new TransactionStatusResponse(tx.id(), tx.sourceShardId(), tx.targetShardId(), status));
  }

  /// Ask the peer shard for its status of the transaction.
  public NodeResult queryStatus(TransactionId id) {
    final var tx = store.find(id).orElseThrow(() -> CrossShardException.notFound(id));
    return NodeResult.send(tx.peerOf(localShard),
        new TransactionStatusQuery(tx.id(), tx.sourceShardId(), tx.targetShardId()));
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Inbound messages
  // ---------------------------------------------------------------------------------------------------------------

  /// Route an inbound message to its handler.
  public NodeResult handle(CrossShardMessage msg) {
    LOGGER.finer(() -> localShard + " <~ " + msg);
    return switch (MessageType.of(msg)) {
      case TRANSMIT -> receiveTransaction((TransactionTransmit) msg);
      case RECEIVED -> onReceivedAck((TransactionReceived) msg);
      case COMMIT -> onCommit((TransactionCommit) msg);
      case ACKNOWLEDGE -> onAcknowledge((TransactionAcknowledge) msg);
      case STATUS_QUERY -> onStatusQuery((TransactionStatusQuery) msg);
      case STATUS_RESPONSE -> onStatusResponse((TransactionStatusResponse) msg);
    };
  }

  NodeResult receiveTransaction(TransactionTransmit msg) {
    if (!localShard.equals(msg.targetShardId())) {
      throw new CrossShardException(CrossShardException.Kind.INVALID_INPUT,
          "Transaction " + msg.transactionId() + " is addressed to " + msg.targetShardId() + " not " + localShard);
    }
    final var known = store.find(msg.transactionId());
    if (known.isPresent()) {
      final var tx = known.get();
      requireSamePair(tx, msg);
      LOGGER.finer(() -> localShard + " duplicate transmit of " + tx.id() + " in status " + tx.status());
      if (tx.status().isTerminal()) {
        return NodeResult.noResult();
      }
      return NodeResult.send(tx.sourceShardId(), received(tx));
    }
    final var tx = CrossShardTransaction.create(msg.transactionId(), msg.transaction(), msg.sourceShardId(),
        msg.targetShardId(), TARGET_RECEIVED, clock.instant(), config);
    store.putPending(tx);
    metrics.increment(Metrics.RECEIVED);
    metrics.increment(Metrics.TARGET_RECEIVED);
    LOGGER.fine(() -> localShard + " received " + tx.id() + " from " + tx.sourceShardId());
    return NodeResult.send(tx.sourceShardId(), received(tx)).and(NodeResult.submit(tx.payload()));
  }

  NodeResult onReceivedAck(TransactionReceived msg) {
    final var pending = pendingFor(msg);
    if (pending.isEmpty()) {
      return NodeResult.noResult();
    }
    final var tx = pending.get();
    if (tx.roleOf(localShard) == Role.SOURCE && tx.status() == TRANSMITTED) {
      store.putPending(tx.withStatus(TARGET_RECEIVED, clock.instant()));
      metrics.increment(Metrics.TARGET_RECEIVED);
      LOGGER.fine(() -> localShard + " target received " + tx.id());
    } else {
      ignored(msg, tx);
    }
    return NodeResult.noResult();
  }

  NodeResult onCommit(TransactionCommit msg) {
    final var pending = pendingFor(msg);
    if (pending.isEmpty()) {
      return NodeResult.noResult();
    }
    final var tx = pending.get();
    if (tx.roleOf(localShard) == Role.TARGET) {
      return commitOnTarget(tx, msg.status());
    }
    if (tx.status() == TARGET_RECEIVED) {
      store.putPending(tx.withStatus(TARGET_COMMITTED, clock.instant()));
      acknowledgeQueue.enqueue(tx.id());
      metrics.increment(Metrics.TARGET_COMMITTED);
      LOGGER.fine(() -> localShard + " target committed " + tx.id() + " with " + msg.status());
    } else {
      ignored(msg, tx);
    }
    return NodeResult.noResult();
  }

  private NodeResult commitOnTarget(CrossShardTransaction tx, LedgerTransactionStatus status) {
    if (tx.status() != TARGET_RECEIVED) {
      LOGGER.finer(() -> localShard + " ignoring commit of " + tx.id() + " in status " + tx.status());
      return NodeResult.noResult();
    }
    final var committed = tx
        .withPayload(tx.payload().withStatus(status))
        .withStatus(TARGET_COMMITTED, clock.instant());
    store.putPending(committed);
    metrics.increment(Metrics.TARGET_COMMITTED);
    LOGGER.fine(() -> localShard + " committed " + tx.id() + " locally with " + status);
    return NodeResult.send(committed.sourceShardId(), commit(committed));
  }

  NodeResult onAcknowledge(TransactionAcknowledge msg) {
    final var id = msg.transactionId();
    final var pending = store.pending(id);
    if (pending.isEmpty()) {
      final var completed = store.completed(id).orElseThrow(() -> CrossShardException.notFound(id));
      requireSamePair(completed, msg);
      if (completed.status() == COMPLETED && completed.roleOf(localShard) == Role.TARGET) {
        LOGGER.finer(() -> localShard + " re-acknowledging completed " + id);
        return NodeResult.send(completed.sourceShardId(), acknowledge(completed));
      }
      return NodeResult.noResult();
    }
    final var tx = pending.get();
    requireSamePair(tx, msg);
    if (tx.status() != TARGET_COMMITTED) {
      ignored(msg, tx);
      return NodeResult.noResult();
    }
    final var now = clock.instant();
    // one confirmation for the acknowledgement of each side of the handshake
    final var confirmed = tx.withConfirmation().withConfirmation();
    final var role = tx.roleOf(localShard);
    final NodeResult result;
    final CrossShardTransaction next;
    if (role == Role.SOURCE) {
      metrics.increment(Metrics.SOURCE_ACKNOWLEDGED);
      next = confirmed.withStatus(SOURCE_ACKNOWLEDGED, now);
      result = NodeResult.noResult();
    } else {
      next = confirmed;
      result = NodeResult.send(tx.sourceShardId(), acknowledge(tx));
    }
    if (next.isConfirmed()) {
      store.complete(next.withStatus(COMPLETED, now));
      metrics.increment(Metrics.COMPLETED);
      LOGGER.fine(() -> localShard + " completed " + id + " as " + role);
    } else {
      store.putPending(next);
      LOGGER.fine(() -> localShard + " acknowledged " + id + " with " + next.confirmations() + "/"
          + next.requiredConfirmations() + " confirmations");
    }
    return result;
  }

  NodeResult onStatusQuery(TransactionStatusQuery msg) {
    final var id = msg.transactionId();
    final var tx = store.find(id).orElseThrow(() -> CrossShardException.notFound(id));
    requireSamePair(tx, msg);
    return NodeResult.send(tx.peerOf(localShard),
        new TransactionStatusResponse(tx.id(), tx.sourceShardId(), tx.targetShardId(), tx.status()));
  }

  NodeResult onStatusResponse(TransactionStatusResponse msg) {
    final var pending = pendingFor(msg);
    if (pending.isEmpty()) {
      return NodeResult.noResult();
    }
    final var tx = pending.get();
    final var reported = msg.status();
    if (!tx.status().isSupersededBy(reported)) {
      ignored(msg, tx);
      return NodeResult.noResult();
    }
    final var now = clock.instant();
    LOGGER.fine(() -> localShard + " reconciling " + tx.id() + " from " + tx.status() + " to " + reported);
    if (reported.isTerminal()) {
      final var adopted = reported == COMPLETED ? tx.withAllConfirmations() : tx;
      store.complete(adopted.withStatus(reported, now));
      metrics.increment(terminalCounter(reported));
    } else {
      store.putPending(tx.withStatus(reported, now));
      if (reported == TARGET_COMMITTED && tx.roleOf(localShard) == Role.SOURCE) {
        acknowledgeQueue.enqueue(tx.id());
      }
    }
    return NodeResult.noResult();
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Driver sweeps
  // ---------------------------------------------------------------------------------------------------------------

  public List<TransactionId> pollTransmitQueue() {
    return transmitQueue.poll(config.batchSize());
  }

  public List<TransactionId> pollAcknowledgeQueue() {
    return acknowledgeQueue.poll(config.batchSize());
  }

  /// Put back ids that were polled but not sent. They go to the front in their original order.
  public void requeueTransmit(List<TransactionId> ids) {
    requeue(transmitQueue, ids);
  }

  public void requeueAcknowledge(List<TransactionId> ids) {
    requeue(acknowledgeQueue, ids);
  }

  private static void requeue(OutboundQueue queue, List<TransactionId> ids) {
    for (int i = ids.size() - 1; i >= 0; i--) {
      queue.requeueFront(ids.get(i));
    }
  }

  /// The message that a queued acknowledgement stands for. The source acknowledges the commit of the target. The target
  /// has nothing to acknowledge yet so it repeats its commit which is what the source is waiting for.
  ///
  /// @throws CrossShardException when the transaction is no longer waiting for an acknowledgement.
  public NodeResult beginAcknowledge(TransactionId id) {
    final var tx = store.pending(id).orElseThrow(() -> CrossShardException.notFound(id));
    if (tx.status() != TARGET_COMMITTED) {
      throw CrossShardException.invalidState(tx, "acknowledge");
    }
    if (tx.roleOf(localShard) == Role.SOURCE) {
      return NodeResult.send(tx.targetShardId(), acknowledge(tx));
    }
    return NodeResult.send(tx.sourceShardId(), commit(tx));
  }

  /// Time out every pending transaction whose status has not changed for longer than the timeout.
  ///
  /// @return the transactions that were timed out.
  public List<CrossShardTransaction> timeoutSweep() {
    final var now = clock.instant();
    final var timeout = config.timeout();
    final var timedOut = new ArrayList<CrossShardTransaction>();
    for (var tx : store.pendingTransactions()) {
      if (!tx.status().isTerminal() && Duration.between(tx.updatedAt(), now).compareTo(timeout) > 0) {
        final var expired = tx.withStatus(TIMED_OUT, now);
        store.complete(expired);
        metrics.increment(Metrics.TIMED_OUT);
        timedOut.add(expired);
        LOGGER.warning(() -> localShard + " timed out " + tx.id() + " in status " + tx.status());
      }
    }
    return timedOut;
  }

  /// Re-drive every pending transaction whose status has not changed for longer than the retry interval and that has
  /// retries left. Transactions that have used up their retries are left for the timeout sweep. The retry does not
  /// count as a status change.
  ///
  /// @return the ledger transactions to resubmit to the local consensus.
  public NodeResult retrySweep() {
    final var now = clock.instant();
    final var interval = config.retryInterval();
    var result = NodeResult.noResult();
    for (var tx : store.pendingTransactions()) {
      if (tx.status().isTerminal()
          || Duration.between(tx.updatedAt(), now).compareTo(interval) <= 0
          || !tx.canRetry()) {
        continue;
      }
      final var retried = tx.withRetry();
      store.putPending(retried);
      switch (retried.status()) {
        case INITIALIZED, SOURCE_COMMITTED, TRANSMITTED -> transmitQueue.enqueue(retried.id());
        case TARGET_RECEIVED -> {
          if (retried.roleOf(localShard) == Role.TARGET) {
            result = result.and(NodeResult.submit(retried.payload()));
          }
        }
        case TARGET_COMMITTED -> acknowledgeQueue.enqueue(retried.id());
        default -> {
          // nothing to re-drive
        }
      }
      metrics.increment(Metrics.RETRIED);
      LOGGER.fine(() -> localShard + " retry " + retried.retryCount() + "/" + retried.maxRetries() + " of "
          + retried.id() + " in status " + retried.status());
    }
    return result;
  }

  /// At most once per cleanup interval delete the completed transactions that completed longer ago than the retention.
  ///
  /// @return how many were deleted.
  public int cleanupSweep() {
    final var now = clock.instant();
    if (Duration.between(lastCleanup, now).compareTo(config.cleanupInterval()) < 0) {
      return 0;
    }
    final var retention = config.retention();
    int removed = 0;
    for (var tx : store.completedTransactions()) {
      final var completedAt = tx.completedAt();
      if (completedAt.isPresent() && Duration.between(completedAt.get(), now).compareTo(retention) > 0) {
        store.removeCompleted(tx.id());
        removed++;
      }
    }
    lastCleanup = now;
    final var count = removed;
    LOGGER.fine(() -> localShard + " cleanup removed " + count + " completed transactions");
    return removed;
  }

  public void sync() {
    store.sync();
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------------------------------------------

  public Optional<CrossShardTransaction> getTransaction(TransactionId id) {
    return store.find(id);
  }

  public List<CrossShardTransaction> getPendingTransactions() {
    return store.pendingTransactions();
  }

  public List<CrossShardTransaction> getCompletedTransactions() {
    return store.completedTransactions();
  }

  public List<CrossShardTransaction> getPendingSourceTransactions() {
    return store.pendingTransactions().stream()
        .filter(tx -> tx.sourceShardId().equals(localShard))
        .toList();
  }

  public List<CrossShardTransaction> getPendingTargetTransactions() {
    return store.pendingTransactions().stream()
        .filter(tx -> tx.targetShardId().equals(localShard))
        .toList();
  }

  public List<CrossShardTransaction> getTransactionsByStatus(CrossShardTransactionStatus status) {
    final Collection<CrossShardTransaction> source = status.isTerminal()
        ? store.completedTransactions()
        : store.pendingTransactions();
    return source.stream().filter(tx -> tx.status() == status).toList();
  }

  public double progress(TransactionId id) {
    return store.find(id).orElseThrow(() -> CrossShardException.notFound(id)).status().progress();
  }

  /// The time from creation to completion. Empty while the transaction is pending.
  public Optional<Duration> duration(TransactionId id) {
    final var tx = store.find(id).orElseThrow(() -> CrossShardException.notFound(id));
    return tx.completedAt().map(done -> Duration.between(tx.createdAt(), done));
  }

  public CrossShardStatistics statistics() {
    return CrossShardStatistics.of(store.pendingTransactions(), store.completedTransactions());
  }

  public ShardId localShard() {
    return localShard;
  }

  public CrossShardConfig config() {
    return config;
  }

  public void setConfig(CrossShardConfig config) {
    this.config = config;
  }

  @TestOnly
  public OutboundQueue transmitQueue() {
    return transmitQueue;
  }

  @TestOnly
  public OutboundQueue acknowledgeQueue() {
    return acknowledgeQueue;
  }

  // ---------------------------------------------------------------------------------------------------------------

  private CrossShardTransaction pendingOrThrow(TransactionId id) {
    final var pending = store.pending(id);
    if (pending.isPresent()) {
      return pending.get();
    }
    throw store.completed(id)
        .map(tx -> CrossShardException.invalidState(tx, "transmit"))
        .orElseGet(() -> CrossShardException.notFound(id));
  }

  /// The pending record a message is about. Empty if the record has already completed.
  ///
  /// @throws CrossShardException `NOT_FOUND` for an unknown id and `INVALID_INPUT` for a shard pair mismatch.
  private Optional<CrossShardTransaction> pendingFor(CrossShardMessage msg) {
    final var id = msg.transactionId();
    final var pending = store.pending(id);
    if (pending.isPresent()) {
      requireSamePair(pending.get(), msg);
      return pending;
    }
    final var completed = store.completed(id).orElseThrow(() -> CrossShardException.notFound(id));
    requireSamePair(completed, msg);
    LOGGER.finer(() -> localShard + " ignoring " + MessageType.of(msg) + " for completed " + id);
    return Optional.empty();
  }

  private static void requireSamePair(CrossShardTransaction tx, CrossShardMessage msg) {
    if (!tx.matches(msg.sourceShardId(), msg.targetShardId())) {
      throw new CrossShardException(CrossShardException.Kind.INVALID_INPUT,
          "Shard mismatch for " + tx.id() + ": message " + msg.sourceShardId() + "->" + msg.targetShardId()
              + " but transaction " + tx.sourceShardId() + "->" + tx.targetShardId());
    }
  }

  private void ignored(CrossShardMessage msg, CrossShardTransaction tx) {
    LOGGER.finer(() -> localShard + " ignoring " + MessageType.of(msg) + " for " + tx.id() + " in status "
        + tx.status());
  }

  private static String terminalCounter(CrossShardTransactionStatus status) {
    return switch (status) {
      case COMPLETED -> Metrics.COMPLETED;
      case FAILED -> Metrics.FAILED;
      case TIMED_OUT -> Metrics.TIMED_OUT;
      case CANCELLED -> Metrics.CANCELLED;
      default -> throw new IllegalArgumentException("Not a terminal status: " + status);
    };
  }

  private static TransactionReceived received(CrossShardTransaction tx) {
    return new TransactionReceived(tx.id(), tx.sourceShardId(), tx.targetShardId());
  }

  private static TransactionCommit commit(CrossShardTransaction tx) {
    return new TransactionCommit(tx.id(), tx.sourceShardId(), tx.targetShardId(), tx.payload().status());
  }

  private static TransactionAcknowledge acknowledge(CrossShardTransaction tx) {
    return new TransactionAcknowledge(tx.id(), tx.sourceShardId(), tx.targetShardId());
  }
}
