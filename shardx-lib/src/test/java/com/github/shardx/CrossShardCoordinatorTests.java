// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import com.github.shardx.msg.TransactionAcknowledge;
import com.github.shardx.msg.TransactionCommit;
import com.github.shardx.msg.TransactionReceived;
import com.github.shardx.msg.TransactionStatusQuery;
import com.github.shardx.msg.TransactionStatusResponse;
import com.github.shardx.msg.TransactionTransmit;
import com.github.shardx.network.CrossShardMessagePickler;
import com.github.shardx.network.Transport;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.shardx.CrossShardSimulation.SHARD_1;
import static com.github.shardx.CrossShardSimulation.SHARD_2;
import static com.github.shardx.CrossShardSimulation.payload;
import static com.github.shardx.CrossShardTransactionStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CrossShardCoordinatorTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  private static CrossShardTransaction get(CrossShardCoordinator coordinator, TransactionId id) {
    return coordinator.getTransaction(id).orElseThrow();
  }

  private static void assertKind(CrossShardException.Kind kind, ThrowableAssert.ThrowingCallable call) {
    assertThatThrownBy(call)
        .isInstanceOfSatisfying(CrossShardException.class, e -> assertThat(e.kind()).isEqualTo(kind));
  }

  @Test
  public void happyPathCompletesOnBothShards() {
    final var sim = new CrossShardSimulation();

    // create
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    assertThat(get(sim.shard1, id).status()).isEqualTo(INITIALIZED);
    assertThat(id.value()).startsWith("shard-1-");

    // transmit commits locally first
    sim.shard1.transmit(id);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
    assertThat(sim.consensus1.submitted).extracting(LedgerTransaction::id).containsExactly("tx-1");
    assertThat(sim.shard1.node().transmitQueue().contains(id)).isFalse();

    // received round trip
    sim.network.deliverAll();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_RECEIVED);
    assertThat(get(sim.shard2, id).status()).isEqualTo(TARGET_RECEIVED);
    assertThat(sim.consensus2.submitted).extracting(LedgerTransaction::id).containsExactly("tx-1");

    // target commits and tells the source
    sim.shard2.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED);
    assertThat(get(sim.shard2, id).status()).isEqualTo(TARGET_COMMITTED);
    assertThat(get(sim.shard2, id).payload().status()).isEqualTo(LedgerTransactionStatus.CONFIRMED);
    sim.network.deliverAll();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_COMMITTED);
    assertThat(sim.shard1.node().acknowledgeQueue().contains(id)).isTrue();

    // acknowledge round
    sim.shard1.process();
    sim.network.deliverAll();

    for (var coordinator : new CrossShardCoordinator[]{sim.shard1, sim.shard2}) {
      final var tx = get(coordinator, id);
      assertThat(tx.status()).isEqualTo(COMPLETED);
      assertThat(tx.confirmations()).isEqualTo(tx.requiredConfirmations()).isEqualTo(2);
      assertThat(tx.completedAt()).isPresent();
      assertThat(coordinator.getPendingTransactions()).isEmpty();
      assertThat(coordinator.getCompletedTransactions()).extracting(CrossShardTransaction::id).containsExactly(id);
    }

    assertThat(sim.metrics1.count(Metrics.CREATED)).isEqualTo(1);
    assertThat(sim.metrics1.count(Metrics.SOURCE_COMMITTED)).isEqualTo(1);
    assertThat(sim.metrics1.count(Metrics.TRANSMITTED)).isEqualTo(1);
    assertThat(sim.metrics1.count(Metrics.TARGET_RECEIVED)).isEqualTo(1);
    assertThat(sim.metrics1.count(Metrics.TARGET_COMMITTED)).isEqualTo(1);
    assertThat(sim.metrics1.count(Metrics.SOURCE_ACKNOWLEDGED)).isEqualTo(1);
    assertThat(sim.metrics1.count(Metrics.COMPLETED)).isEqualTo(1);
    assertThat(sim.metrics2.count(Metrics.RECEIVED)).isEqualTo(1);
    assertThat(sim.metrics2.count(Metrics.COMPLETED)).isEqualTo(1);
    // transmit and acknowledge from the source, received, commit and acknowledge from the target
    assertThat(sim.metrics1.count(Metrics.MESSAGES_SENT)).isEqualTo(2);
    assertThat(sim.metrics2.count(Metrics.MESSAGES_SENT)).isEqualTo(3);
  }

  @Test
  public void createToUnknownShardIsRejectedWithoutRecord() {
    final var sim = new CrossShardSimulation();

    assertKind(CrossShardException.Kind.INVALID_INPUT,
        () -> sim.shard1.createTransaction(payload("tx-1"), new ShardId("shard-9")));

    assertThat(sim.shard1.getPendingTransactions()).isEmpty();
    assertThat(sim.shard1.node().transmitQueue().isEmpty()).isTrue();
    assertThat(sim.metrics1.count(Metrics.CREATED)).isZero();
  }

  @Test
  public void createToSelfIsRejectedWithoutRecord() {
    final var sim = new CrossShardSimulation();

    assertKind(CrossShardException.Kind.INVALID_INPUT, () -> sim.shard1.createTransaction(payload("tx-1"), SHARD_1));

    assertThat(sim.shard1.getPendingTransactions()).isEmpty();
  }

  @Test
  public void transmittedWithoutReplyTimesOut() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.clear();

    sim.clock.advance(Duration.ofSeconds(300));
    sim.shard1.process();
    assertThat(get(sim.shard1, id).status()).isNotEqualTo(TIMED_OUT);

    sim.clock.advance(Duration.ofSeconds(1));
    sim.shard1.process();

    final var tx = get(sim.shard1, id);
    assertThat(tx.status()).isEqualTo(TIMED_OUT);
    assertThat(tx.completedAt()).contains(sim.clock.instant());
    assertThat(sim.shard1.getPendingTransactions()).isEmpty();
    assertThat(sim.metrics1.count(Metrics.TIMED_OUT)).isEqualTo(1);
  }

  @Test
  public void stuckTargetCommittedIsRetriedOntoAcknowledgeQueue() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.deliverAll();
    sim.shard2.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED);
    sim.network.deliverAll();
    // the acknowledge is sent and lost
    sim.shard1.process();
    sim.network.clear();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_COMMITTED);
    assertThat(sim.shard1.node().acknowledgeQueue().isEmpty()).isTrue();

    sim.clock.advance(Duration.ofSeconds(31));
    sim.shard1.process();

    final var tx = get(sim.shard1, id);
    assertThat(tx.status()).isEqualTo(TARGET_COMMITTED);
    assertThat(tx.retryCount()).isEqualTo(1);
    assertThat(sim.shard1.node().acknowledgeQueue().contains(id)).isTrue();
    assertThat(sim.metrics1.count(Metrics.RETRIED)).isEqualTo(1);

    // the next tick sends it and the handshake finishes
    sim.shard1.process();
    sim.network.deliverAll();
    assertThat(get(sim.shard1, id).status()).isEqualTo(COMPLETED);
    assertThat(get(sim.shard2, id).status()).isEqualTo(COMPLETED);
  }

  @Test
  public void retriesStopAtTheCeilingAndTimeoutReaps() {
    final var sim = new CrossShardSimulation(CrossShardConfig.defaults().withMaxRetries(2));
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.clear();

    sim.clock.advance(Duration.ofSeconds(31));
    for (int i = 0; i < 5; i++) {
      sim.shard1.process();
      sim.network.clear();
      sim.clock.advance(Duration.ofSeconds(10));
    }
    assertThat(get(sim.shard1, id).retryCount()).isEqualTo(2);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);

    sim.clock.advance(Duration.ofSeconds(300));
    sim.shard1.process();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TIMED_OUT);
  }

  @Test
  public void transmitFailureOfConsensusLeavesInitialized() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.consensus1.failing = true;

    assertThatThrownBy(() -> sim.shard1.transmit(id))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("consensus unavailable");
    assertThat(get(sim.shard1, id).status()).isEqualTo(INITIALIZED);
    assertThat(sim.network.sent).isEmpty();
    assertThat(sim.shard1.node().transmitQueue().snapshot()).containsExactly(id);

    sim.consensus1.failing = false;
    sim.shard1.transmit(id);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
  }

  @Test
  public void transmitFailureOfTransportRequeuesWithoutRecommitting() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.network.failing = true;

    assertThatThrownBy(() -> sim.shard1.transmit(id)).isInstanceOf(IllegalStateException.class);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
    assertThat(sim.shard1.node().transmitQueue().snapshot()).containsExactly(id);

    // the queued entry is attempted, fails and goes back to the front
    sim.shard1.process();
    assertThat(sim.shard1.node().transmitQueue().snapshot()).containsExactly(id);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
    // the payload is not committed a second time
    assertThat(sim.consensus1.submitted).hasSize(1);

    sim.network.failing = false;
    sim.shard1.process();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
    assertThat(sim.shard1.node().transmitQueue().isEmpty()).isTrue();
  }

  @Test
  public void transmitRacingTheDriverCommitsOnce() throws InterruptedException {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    final var entered = new CountDownLatch(1);
    final var release = new CountDownLatch(1);
    sim.consensus1.beforeSubmit = () -> {
      entered.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    };
    final var failure = new AtomicReference<Throwable>();
    final var caller = new Thread(() -> {
      try {
        sim.shard1.transmit(id);
      } catch (Throwable t) {
        failure.set(t);
      }
    }, "transmit-caller");
    caller.start();
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
    sim.consensus1.beforeSubmit = () -> {
    };

    // while the caller is blocked in the local consensus neither the driver nor a second caller commits again
    assertThat(sim.shard1.node().transmitQueue().contains(id)).isFalse();
    sim.shard1.process();
    assertKind(CrossShardException.Kind.INVALID_STATE, () -> sim.shard1.transmit(id));
    sim.shard1.node().transmitQueue().enqueue(id);
    sim.shard1.process();
    assertThat(sim.shard1.node().transmitQueue().isEmpty()).isTrue();
    assertThat(sim.consensus1.submitted).isEmpty();

    release.countDown();
    caller.join(TimeUnit.SECONDS.toMillis(5));
    assertThat(caller.isAlive()).isFalse();
    assertThat(failure.get()).isNull();

    assertThat(sim.consensus1.submitted).hasSize(1);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
    assertThat(sim.network.sentOfType(TransactionTransmit.class)).hasSize(1);
    assertThat(sim.metrics1.count(Metrics.SOURCE_COMMITTED)).isEqualTo(1);
  }

  /// Delivers each message on the calling thread before the send returns.
  static class SynchronousTransport implements Transport {
    final Map<ShardId, CrossShardCoordinator> coordinators = new HashMap<>();

    @Override
    public void send(ShardId to, byte[] message) {
      coordinators.get(to).onBytes(message);
    }
  }

  @Test
  public void synchronousTransportCompletesWithoutRetries() {
    final var clock = new MutableClock();
    final var registry = InMemoryShardRegistry.of("shard-1", "shard-2");
    final var transport = new SynchronousTransport();
    final var consensus1 = new FakeConsensus();
    final var consensus2 = new FakeConsensus();
    final var shard1 = new CrossShardCoordinator(SHARD_1, CrossShardConfig.defaults(), new InMemoryTransactionStore(),
        registry, consensus1, transport, Metrics.NOOP, clock);
    final var shard2 = new CrossShardCoordinator(SHARD_2, CrossShardConfig.defaults(), new InMemoryTransactionStore(),
        registry, consensus2, transport, Metrics.NOOP, clock);
    transport.coordinators.put(SHARD_1, shard1);
    transport.coordinators.put(SHARD_2, shard2);

    final var id = shard1.createTransaction(payload("tx-1"), SHARD_2);
    shard1.transmit(id);
    // the reply was handled before transmit returned
    assertThat(get(shard1, id).status()).isEqualTo(TARGET_RECEIVED);
    assertThat(get(shard2, id).status()).isEqualTo(TARGET_RECEIVED);

    shard2.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED);
    assertThat(get(shard1, id).status()).isEqualTo(TARGET_COMMITTED);
    shard1.process();

    assertThat(get(shard1, id).status()).isEqualTo(COMPLETED);
    assertThat(get(shard2, id).status()).isEqualTo(COMPLETED);
    assertThat(get(shard1, id).retryCount()).isZero();
    assertThat(consensus1.submitted).hasSize(1);
    assertThat(consensus2.submitted).hasSize(1);
  }

  @Test
  public void failedSendRequeuesTheUnsentRemainderInOrder() {
    final var sim = new CrossShardSimulation();
    final var a = sim.shard1.createTransaction(payload("a"), SHARD_2);
    final var b = sim.shard1.createTransaction(payload("b"), SHARD_2);
    final var c = sim.shard1.createTransaction(payload("c"), SHARD_2);
    sim.network.failing = true;

    sim.shard1.process();

    assertThat(sim.shard1.node().transmitQueue().snapshot()).containsExactly(a, b, c);
    assertThat(get(sim.shard1, a).status()).isEqualTo(TRANSMITTED);
    assertThat(sim.consensus1.submitted).extracting(LedgerTransaction::id).containsExactly("a");
    assertThat(get(sim.shard1, b).status()).isEqualTo(INITIALIZED);
    assertThat(get(sim.shard1, c).status()).isEqualTo(INITIALIZED);
  }

  @Test
  public void drainIsBoundedByBatchSize() {
    final var sim = new CrossShardSimulation(CrossShardConfig.defaults().withBatchSize(2));
    final var a = sim.shard1.createTransaction(payload("a"), SHARD_2);
    final var b = sim.shard1.createTransaction(payload("b"), SHARD_2);
    final var c = sim.shard1.createTransaction(payload("c"), SHARD_2);

    sim.shard1.process();

    assertThat(get(sim.shard1, a).status()).isEqualTo(TRANSMITTED);
    assertThat(get(sim.shard1, b).status()).isEqualTo(TRANSMITTED);
    assertThat(get(sim.shard1, c).status()).isEqualTo(INITIALIZED);
    assertThat(sim.shard1.node().transmitQueue().snapshot()).containsExactly(c);
  }

  @Test
  public void transmitIsOnlyAllowedBeforeTheTargetHasIt() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);

    assertKind(CrossShardException.Kind.INVALID_STATE, () -> sim.shard1.transmit(id));

    assertKind(CrossShardException.Kind.NOT_FOUND, () -> sim.shard1.transmit(new TransactionId("nope")));
  }

  @Test
  public void lostReceivedIsRepairedByRetransmission() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.network.drop = msg -> msg instanceof TransactionReceived;
    sim.shard1.process();
    sim.network.deliverAll();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);
    assertThat(get(sim.shard2, id).status()).isEqualTo(TARGET_RECEIVED);

    sim.network.drop = msg -> false;
    sim.clock.advance(Duration.ofSeconds(31));
    sim.shard1.process(); // retry queues the retransmission
    sim.shard1.process(); // and the drain sends it
    sim.network.deliverAll();

    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_RECEIVED);
    // the duplicate did not reach the local consensus of the target again
    assertThat(sim.consensus2.submitted).hasSize(1);
    assertThat(sim.network.sentOfType(TransactionTransmit.class)).hasSize(2);
  }

  @Test
  public void lostCommitIsRepeatedByTheTargetRetry() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.deliverAll();
    sim.network.drop = msg -> msg instanceof TransactionCommit;
    sim.shard2.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED);
    sim.network.deliverAll();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_RECEIVED);

    sim.network.drop = msg -> false;
    sim.clock.advance(Duration.ofSeconds(31));
    sim.shard2.process(); // retry queues on the acknowledge queue of the target
    sim.shard2.process(); // which repeats the commit
    sim.network.deliverAll();

    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_COMMITTED);
  }

  @Test
  public void lostAcknowledgeReplyIsRepairedByTheSourceRetry() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.deliverAll();
    sim.shard2.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED);
    sim.network.deliverAll();
    sim.network.drop = msg -> msg instanceof TransactionAcknowledge && msg.transactionId().equals(id)
        && sim.shard2.getCompletedTransactions().size() == 1 && sim.network.dropped == 0;
    sim.shard1.process();
    sim.network.deliverAll();
    assertThat(get(sim.shard2, id).status()).isEqualTo(COMPLETED);
    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_COMMITTED);

    sim.clock.advance(Duration.ofSeconds(31));
    sim.shard1.process();
    sim.shard1.process();
    sim.network.deliverAll();

    assertThat(get(sim.shard1, id).status()).isEqualTo(COMPLETED);
    assertThat(get(sim.shard1, id).confirmations()).isEqualTo(2);
    assertThat(sim.metrics2.count(Metrics.COMPLETED)).isEqualTo(1);
  }

  @Test
  public void targetRetryResubmitsToLocalConsensus() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.deliverAll();
    assertThat(sim.consensus2.submitted).hasSize(1);

    sim.clock.advance(Duration.ofSeconds(31));
    sim.shard2.process();

    assertThat(sim.consensus2.submitted).hasSize(2);
    assertThat(get(sim.shard2, id).retryCount()).isEqualTo(1);
    // the source does not resubmit while waiting for the commit of the target
    assertThat(sim.consensus1.submitted).hasSize(1);
  }

  @Test
  public void resubmissionFailureIsLoggedNotThrown() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.deliverAll();
    sim.consensus2.failing = true;

    sim.clock.advance(Duration.ofSeconds(31));
    sim.shard2.process();

    assertThat(get(sim.shard2, id).retryCount()).isEqualTo(1);
    assertThat(get(sim.shard2, id).status()).isEqualTo(TARGET_RECEIVED);
  }

  @Test
  public void statusQueryAnswersFromPendingThenCompleted() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.deliverAll();

    sim.shard2.queryStatus(id);
    sim.network.deliverAll();

    assertThat(sim.network.sentOfType(TransactionStatusQuery.class)).hasSize(1);
    final var responses = sim.network.sentOfType(TransactionStatusResponse.class);
    assertThat(responses).hasSize(1);
    assertThat(((TransactionStatusResponse) responses.get(0)).status()).isEqualTo(TARGET_RECEIVED);

    assertKind(CrossShardException.Kind.NOT_FOUND, () -> sim.shard1.handleMessage(
        new TransactionStatusQuery(new TransactionId("unknown"), SHARD_1, SHARD_2)));
  }

  @Test
  public void reconciliationAdoptsTheMoreAdvancedStatus() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.shard1.transmit(id);
    sim.network.drop = msg -> !(msg instanceof TransactionTransmit);
    sim.network.deliverAll();
    sim.shard2.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED);
    sim.network.deliverAll();
    assertThat(get(sim.shard1, id).status()).isEqualTo(TRANSMITTED);

    sim.network.drop = msg -> false;
    sim.shard1.queryStatus(id);
    sim.network.deliverAll();

    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_COMMITTED);
    assertThat(sim.shard1.node().acknowledgeQueue().contains(id)).isTrue();

    // a stale report never moves it back
    sim.shard1.handleMessage(new TransactionStatusResponse(id, SHARD_1, SHARD_2, TARGET_RECEIVED));
    assertThat(get(sim.shard1, id).status()).isEqualTo(TARGET_COMMITTED);
  }

  @Test
  public void reportedCompletionIsAdoptedImmediately() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);

    sim.shard1.handleMessage(new TransactionStatusResponse(id, SHARD_1, SHARD_2, COMPLETED));

    final var tx = get(sim.shard1, id);
    assertThat(tx.status()).isEqualTo(COMPLETED);
    assertThat(tx.isConfirmed()).isTrue();
    assertThat(tx.completedAt()).isPresent();
    assertThat(sim.shard1.getPendingTransactions()).isEmpty();
  }

  @Test
  public void failAndCancelNotifyThePeer() {
    final var sim = new CrossShardSimulation();
    final var failed = sim.shard1.createTransaction(payload("f"), SHARD_2);
    final var cancelled = sim.shard1.createTransaction(payload("c"), SHARD_2);
    sim.shard1.transmit(failed);
    sim.shard1.transmit(cancelled);
    sim.network.deliverAll();

    sim.shard1.failTransaction(failed, "insufficient funds");
    sim.shard2.cancelTransaction(cancelled, "operator request");
    sim.network.deliverAll();

    assertThat(get(sim.shard1, failed).status()).isEqualTo(FAILED);
    assertThat(get(sim.shard1, failed).metadata()).containsEntry(CrossShardTransaction.ERROR_KEY, "insufficient funds");
    assertThat(get(sim.shard2, failed).status()).isEqualTo(FAILED);

    assertThat(get(sim.shard2, cancelled).status()).isEqualTo(CANCELLED);
    assertThat(get(sim.shard2, cancelled).metadata())
        .containsEntry(CrossShardTransaction.CANCEL_REASON_KEY, "operator request");
    assertThat(get(sim.shard1, cancelled).status()).isEqualTo(CANCELLED);

    assertKind(CrossShardException.Kind.INVALID_STATE, () -> sim.shard1.cancelTransaction(failed, "too late"));
  }

  @Test
  public void failIsKeptLocallyWhenThePeerCannotBeReached() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    sim.network.failing = true;

    sim.shard1.failTransaction(id, "broken");

    assertThat(get(sim.shard1, id).status()).isEqualTo(FAILED);
  }

  @Test
  public void shardPairMismatchIsInvalidInput() {
    final var sim = new CrossShardSimulation();
    sim.registry.register(new ShardInfo(new ShardId("shard-3")));
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);

    assertKind(CrossShardException.Kind.INVALID_INPUT, () -> sim.shard1.handleMessage(
        new TransactionReceived(id, SHARD_1, new ShardId("shard-3"))));

    assertKind(CrossShardException.Kind.INVALID_INPUT, () -> sim.shard1.handleMessage(
        new TransactionTransmit(new TransactionId("other"), SHARD_2, new ShardId("shard-3"), payload("x"))));
  }

  @Test
  public void onlyTheTargetRecordsALocalCommit() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);

    assertKind(CrossShardException.Kind.INVALID_STATE,
        () -> sim.shard1.onLocalCommit(id, LedgerTransactionStatus.CONFIRMED));
  }

  @Test
  public void undecodableBytesAreDropped() {
    final var sim = new CrossShardSimulation();
    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);

    sim.shard1.onBytes(new byte[]{99, 1, 2});
    sim.shard1.onBytes(new byte[0]);
    // decodes but is about an unknown transaction
    sim.shard1.onBytes(CrossShardMessagePickler.pickle(
        new TransactionAcknowledge(new TransactionId("unknown"), SHARD_1, SHARD_2)));

    assertThat(get(sim.shard1, id).status()).isEqualTo(INITIALIZED);
  }

  @Test
  public void cleanupRemovesOnlyExpiredCompletedTransactions() {
    final var sim = new CrossShardSimulation();
    final var old = sim.happyPath("old");
    sim.clock.advance(Duration.ofDays(6));
    final var recent = sim.happyPath("recent");

    sim.clock.advance(Duration.ofDays(1).plusSeconds(1));
    sim.shard1.process();

    assertThat(sim.shard1.getTransaction(old)).isEmpty();
    assertThat(sim.shard1.getTransaction(recent)).isPresent();
  }

  @Test
  public void cleanupRunsAtMostOncePerInterval() {
    final var sim = new CrossShardSimulation();
    sim.clock.advance(Duration.ofHours(2));
    // the sweep runs now and the next one is due in an hour
    sim.shard1.process();
    final var id = sim.happyPath("tx-1");

    sim.clock.advance(Duration.ofDays(7).plusSeconds(1));
    sim.shard1.setCleanupInterval(Duration.ofDays(30));
    sim.shard1.process();
    assertThat(sim.shard1.getTransaction(id)).isPresent();

    sim.shard1.setCleanupInterval(Duration.ofHours(1));
    sim.shard1.process();
    assertThat(sim.shard1.getTransaction(id)).isEmpty();
  }

  @Test
  public void queriesProgressDurationAndStatistics() {
    final var sim = new CrossShardSimulation();
    final var done = sim.shard1.createTransaction(payload("done"), SHARD_2);
    sim.shard1.transmit(done);
    sim.network.deliverAll();
    sim.clock.advance(Duration.ofSeconds(4));
    sim.shard2.onLocalCommit(done, LedgerTransactionStatus.CONFIRMED);
    sim.network.deliverAll();
    sim.shard1.process();
    sim.network.deliverAll();
    final var waiting = sim.shard1.createTransaction(payload("waiting"), SHARD_2);
    final var inbound = sim.shard2.createTransaction(payload("inbound"), SHARD_1);
    sim.shard2.transmit(inbound);
    sim.network.deliverAll();

    assertThat(sim.shard1.progress(done)).isEqualTo(1.0);
    assertThat(sim.shard1.progress(waiting)).isEqualTo(0.0);
    assertThat(sim.shard1.progress(inbound)).isEqualTo(0.5);
    assertThat(sim.shard1.duration(done)).contains(Duration.ofSeconds(4));
    assertThat(sim.shard1.duration(waiting)).isEmpty();

    assertThat(sim.shard1.getPendingSourceTransactions()).extracting(CrossShardTransaction::id)
        .containsExactly(waiting);
    assertThat(sim.shard1.getPendingTargetTransactions()).extracting(CrossShardTransaction::id)
        .containsExactly(inbound);
    assertThat(sim.shard1.getTransactionsByStatus(COMPLETED)).extracting(CrossShardTransaction::id)
        .containsExactly(done);
    assertThat(sim.shard1.getTransactionsByStatus(TARGET_RECEIVED)).extracting(CrossShardTransaction::id)
        .containsExactly(inbound);

    final var stats = sim.shard1.statistics();
    assertThat(stats.pending()).isEqualTo(2);
    assertThat(stats.completed()).isEqualTo(1);
    assertThat(stats.total()).isEqualTo(3);
    assertThat(stats.averageCompletionTime()).contains(Duration.ofSeconds(4));
    assertThat(stats.bySourceShard()).containsEntry(SHARD_1, 2L).containsEntry(SHARD_2, 1L);
    assertThat(stats.byTargetShard()).containsEntry(SHARD_2, 2L).containsEntry(SHARD_1, 1L);

    assertThatThrownBy(() -> sim.shard1.progress(new TransactionId("unknown")))
        .isInstanceOf(CrossShardException.class);
  }

  @Test
  public void settersSwapTheConfiguration() {
    final var sim = new CrossShardSimulation();

    sim.shard1.setTimeout(Duration.ofSeconds(60));
    sim.shard1.setRetryInterval(Duration.ofSeconds(5));
    sim.shard1.setMaxRetries(9);
    sim.shard1.setRequiredConfirmations(1);
    sim.shard1.setCleanupInterval(Duration.ofMinutes(5));

    final var config = sim.shard1.config();
    assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.retryInterval()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.maxRetries()).isEqualTo(9);
    assertThat(config.requiredConfirmations()).isEqualTo(1);
    assertThat(config.cleanupInterval()).isEqualTo(Duration.ofMinutes(5));

    final var id = sim.shard1.createTransaction(payload("tx-1"), SHARD_2);
    assertThat(get(sim.shard1, id).maxRetries()).isEqualTo(9);
    assertThat(get(sim.shard1, id).requiredConfirmations()).isEqualTo(1);

    assertKind(CrossShardException.Kind.INVALID_INPUT, () -> sim.shard1.setMaxRetries(-1));
    assertKind(CrossShardException.Kind.INVALID_INPUT, () -> sim.shard1.setRequiredConfirmations(0));
    assertKind(CrossShardException.Kind.INVALID_INPUT, () -> sim.shard1.setTimeout(Duration.ZERO));
    assertThat(sim.shard1.config()).isEqualTo(config);
  }
}
