// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import com.github.shardx.msg.CrossShardMessage;
import com.github.shardx.network.CrossShardMessagePickler;
import com.github.shardx.network.Transport;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;

import static com.github.shardx.CrossShardLogger.LOGGER;

/// Manages thread safety and coordinates between the transport, the [CrossShardNode] state machine and the local
/// consensus. Inbound messages arrive on network threads while the [CrossShardDriver] calls [#process()] on its own
/// thread. Both go through this class which ensures:
///
/// - Single threaded access to the node and its [TransactionStore] via a fair mutex.
/// - The store is synced before any message produced by a transition is sent.
/// - No network send and no local consensus submission happens while the mutex is held.
///
/// Methods called by the host application throw [CrossShardException] and let the exceptions of the collaborators
/// propagate. Inbound bytes handed to [#onBytes(byte[])] and the periodic [#process()] never throw; failures are logged
/// and the retry and timeout sweeps recover.
public class CrossShardCoordinator {
  final CrossShardNode node;
  final ShardRegistry registry;
  final LocalConsensus consensus;
  final Transport transport;
  final Metrics metrics;

  /// The Semaphore acts as a fair non-reentrant mutex.
  private final Semaphore mutex = new Semaphore(1, true);

  public CrossShardCoordinator(ShardId localShard,
                               CrossShardConfig config,
                               TransactionStore store,
                               ShardRegistry registry,
                               LocalConsensus consensus,
                               Transport transport,
                               Metrics metrics,
                               Clock clock) {
    this.node = new CrossShardNode(localShard, config, store, registry, metrics, clock);
    this.registry = registry;
    this.consensus = consensus;
    this.transport = transport;
    this.metrics = metrics;
  }

  /// An in memory coordinator with the default configuration and no metrics.
  public CrossShardCoordinator(ShardId localShard,
                               ShardRegistry registry,
                               LocalConsensus consensus,
                               Transport transport) {
    this(localShard, CrossShardConfig.defaults(), new InMemoryTransactionStore(), registry, consensus, transport,
        Metrics.NOOP, Clock.systemUTC());
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Produced API
  // ---------------------------------------------------------------------------------------------------------------

  /// Create a cross-shard transaction from this shard to the target shard. It is queued and sent by the next
  /// [#process()] unless [#transmit(TransactionId)] is called first.
  ///
  /// @throws CrossShardException `INVALID_INPUT` if the target is this shard or unknown. No record is created.
  public TransactionId createTransaction(LedgerTransaction payload, ShardId targetShardId) {
    return underMutex(() -> node.createTransaction(payload, targetShardId));
  }

  /// Commit the payload locally if that has not been done yet and send it to the target shard. The id is taken off the
  /// transmit queue so that the driver does not send it a second time.
  ///
  /// @throws CrossShardException `NOT_FOUND` for an unknown id, `INVALID_STATE` unless the transaction is initialized
  ///                             or source committed or while another thread is committing it, `NOT_FOUND` if the
  ///                             target shard left the registry.
  /// @throws RuntimeException    whatever the local consensus or the transport throws. The id is queued again for the
  ///                             next tick. A failed commit leaves the transaction initialized and a failed send leaves
  ///                             it transmitted.
  public void transmit(TransactionId id) {
    final var snapshot = underMutex(() -> node.beginTransmit(id, false));
    try {
      commitAndSend(snapshot);
    } catch (RuntimeException e) {
      underMutex(() -> {
        node.requeueTransmit(List.of(id));
        return null;
      });
      throw e;
    }
  }

  /// Submit the payload of an initialized snapshot to the local consensus then send the transmit message. The
  /// transaction is marked transmitted before the send is attempted.
  private void commitAndSend(CrossShardTransaction snapshot) {
    final var id = snapshot.id();
    if (snapshot.status() == CrossShardTransactionStatus.INITIALIZED) {
      try {
        consensus.submitTransaction(snapshot.payload());
      } catch (RuntimeException e) {
        underMutex(() -> {
          node.onSubmissionFailed(id);
          return null;
        });
        throw e;
      }
    }
    send(underMutex(() -> node.onSourceCommitted(id)).messages());
  }

  /// The upcall from the local consensus when it has finalised a ledger transaction received from another shard.
  ///
  /// @throws CrossShardException `NOT_FOUND` for an unknown id, `INVALID_STATE` if this shard is the source.
  public void onLocalCommit(TransactionId id, LedgerTransactionStatus status) {
    final var result = underMutex(() -> node.onLocalCommit(id, status));
    apply(result);
  }

  /// Handle a decoded message synchronously. Errors propagate to the caller.
  public void handleMessage(CrossShardMessage msg) {
    final var result = underMutex(() -> node.handle(msg));
    apply(result);
  }

  /// Handle bytes that arrived from the transport. Messages that cannot be decoded or handled are logged and dropped.
  /// The protocol is idempotent and backed by retries so dropping is safe.
  public void onBytes(byte[] bytes) {
    final CrossShardMessage msg;
    try {
      msg = CrossShardMessagePickler.unpickle(bytes);
    } catch (CrossShardException e) {
      LOGGER.warning(() -> localShard() + " dropping undecodable message: " + e.getMessage());
      return;
    }
    try {
      handleMessage(msg);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, localShard() + " dropping " + msg + " due to " + e, e);
    }
  }

  /// Fail a pending transaction and notify the peer shard on a best effort basis.
  public void failTransaction(TransactionId id, String reason) {
    notifyPeer(underMutex(() -> node.failTransaction(id, reason)));
  }

  /// Cancel a pending transaction and notify the peer shard on a best effort basis.
  public void cancelTransaction(TransactionId id, String reason) {
    notifyPeer(underMutex(() -> node.cancelTransaction(id, reason)));
  }

  /// Ask the peer shard for its view of a transaction. The answer is merged when it arrives and never moves the local
  /// status backwards.
  public void queryStatus(TransactionId id) {
    send(underMutex(() -> node.queryStatus(id)).messages());
  }

  public Optional<CrossShardTransaction> getTransaction(TransactionId id) {
    return underMutex(() -> node.getTransaction(id));
  }

  public List<CrossShardTransaction> getPendingTransactions() {
    return underMutex(node::getPendingTransactions);
  }

  public List<CrossShardTransaction> getCompletedTransactions() {
    return underMutex(node::getCompletedTransactions);
  }

  public List<CrossShardTransaction> getPendingSourceTransactions() {
    return underMutex(node::getPendingSourceTransactions);
  }

  public List<CrossShardTransaction> getPendingTargetTransactions() {
    return underMutex(node::getPendingTargetTransactions);
  }

  public List<CrossShardTransaction> getTransactionsByStatus(CrossShardTransactionStatus status) {
    return underMutex(() -> node.getTransactionsByStatus(status));
  }

  public double progress(TransactionId id) {
    return underMutex(() -> node.progress(id));
  }

  public Optional<Duration> duration(TransactionId id) {
    return underMutex(() -> node.duration(id));
  }

  public CrossShardStatistics statistics() {
    return underMutex(node::statistics);
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Driver
  // ---------------------------------------------------------------------------------------------------------------

  /// One tick of the driver. Runs the transmit, acknowledge, timeout, retry and cleanup sweeps in that order. Never
  /// throws.
  public void process() {
    sweep("transmit", this::transmitSweep);
    sweep("acknowledge", this::acknowledgeSweep);
    sweep("timeout", () -> underMutex(node::timeoutSweep));
    sweep("retry", this::retrySweep);
    sweep("cleanup", () -> underMutex(node::cleanupSweep));
  }

  private void sweep(String name, Runnable sweep) {
    try {
      sweep.run();
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, localShard() + " " + name + " sweep failed: " + e, e);
    }
  }

  void transmitSweep() {
    final var batch = underMutex(node::pollTransmitQueue);
    for (int i = 0; i < batch.size(); i++) {
      final var id = batch.get(i);
      final CrossShardTransaction snapshot;
      try {
        snapshot = underMutex(() -> node.beginTransmit(id, true));
      } catch (CrossShardException e) {
        LOGGER.fine(() -> localShard() + " dropping " + id + " from the transmit queue: " + e.getMessage());
        continue;
      }
      try {
        commitAndSend(snapshot);
      } catch (RuntimeException e) {
        final var unsent = batch.subList(i, batch.size());
        LOGGER.warning(() -> localShard() + " transmit of " + id + " failed, requeued " + unsent.size() + ": " + e);
        underMutex(() -> {
          node.requeueTransmit(unsent);
          return null;
        });
        return;
      }
    }
  }

  void acknowledgeSweep() {
    final var batch = underMutex(node::pollAcknowledgeQueue);
    for (int i = 0; i < batch.size(); i++) {
      final var id = batch.get(i);
      final NodeResult result;
      try {
        result = underMutex(() -> node.beginAcknowledge(id));
      } catch (CrossShardException e) {
        LOGGER.fine(() -> localShard() + " dropping " + id + " from the acknowledge queue: " + e.getMessage());
        continue;
      }
      try {
        send(result.messages());
      } catch (RuntimeException e) {
        final var unsent = batch.subList(i, batch.size());
        LOGGER.warning(() -> localShard() + " acknowledge of " + id + " failed, requeued " + unsent.size() + ": " + e);
        underMutex(() -> {
          node.requeueAcknowledge(unsent);
          return null;
        });
        return;
      }
    }
  }

  void retrySweep() {
    final var result = underMutex(node::retrySweep);
    for (var payload : result.submissions()) {
      try {
        consensus.submitTransaction(payload);
      } catch (RuntimeException e) {
        LOGGER.log(Level.WARNING, localShard() + " resubmission of " + payload.id() + " failed: " + e, e);
      }
    }
  }

  // ---------------------------------------------------------------------------------------------------------------
  // Configuration
  // ---------------------------------------------------------------------------------------------------------------

  public CrossShardConfig config() {
    return underMutex(node::config);
  }

  public void setConfig(CrossShardConfig config) {
    underMutex(() -> {
      node.setConfig(config);
      return null;
    });
  }

  public void setTimeout(Duration timeout) {
    reconfigure(config -> config.withTimeout(timeout));
  }

  public void setRetryInterval(Duration retryInterval) {
    reconfigure(config -> config.withRetryInterval(retryInterval));
  }

  public void setMaxRetries(int maxRetries) {
    reconfigure(config -> config.withMaxRetries(maxRetries));
  }

  /// Only transactions created or received afterwards use the new value. Each side counts two confirmations per
  /// acknowledgement round so a value above two is never reached and such transactions end up timed out.
  public void setRequiredConfirmations(int requiredConfirmations) {
    reconfigure(config -> config.withRequiredConfirmations(requiredConfirmations));
  }

  public void setCleanupInterval(Duration cleanupInterval) {
    reconfigure(config -> config.withCleanupInterval(cleanupInterval));
  }

  /// @throws CrossShardException `INVALID_INPUT` if the modified configuration is invalid.
  private void reconfigure(UnaryOperator<CrossShardConfig> change) {
    underMutex(() -> {
      final CrossShardConfig changed;
      try {
        changed = change.apply(node.config());
      } catch (IllegalArgumentException e) {
        throw new CrossShardException(CrossShardException.Kind.INVALID_INPUT, e.getMessage(), e);
      }
      node.setConfig(changed);
      return null;
    });
  }

  public ShardId localShard() {
    return node.localShard();
  }

  @TestOnly
  public CrossShardNode node() {
    return node;
  }

  // ---------------------------------------------------------------------------------------------------------------

  private void apply(NodeResult result) {
    send(result.messages());
    result.submissions().forEach(consensus::submitTransaction);
  }

  private void notifyPeer(NodeResult result) {
    try {
      send(result.messages());
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, localShard() + " could not notify peer: " + e, e);
    }
  }

  private void send(List<NodeResult.Outbound> messages) {
    messages.forEach(this::send);
  }

  private void send(NodeResult.Outbound outbound) {
    final var to = outbound.to();
    if (registry.shardInfo(to).isEmpty()) {
      throw new CrossShardException(CrossShardException.Kind.NOT_FOUND, "Shard not found: " + to);
    }
    final var bytes = CrossShardMessagePickler.pickle(outbound.message());
    LOGGER.finer(() -> localShard() + " ~> " + to + " " + outbound.message());
    transport.send(to, bytes);
    metrics.increment(Metrics.MESSAGES_SENT);
  }

  /// Run the action holding the mutex then sync the store before releasing it.
  private <T> T underMutex(Supplier<T> action) {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(node.localShard() + " interrupted waiting for the coordinator mutex", e);
    }
    try {
      final var result = action.get();
      node.sync();
      return result;
    } finally {
      mutex.release();
    }
  }
}
