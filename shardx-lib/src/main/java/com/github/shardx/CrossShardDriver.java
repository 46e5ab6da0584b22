// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.shardx.CrossShardLogger.LOGGER;

/// Calls [CrossShardCoordinator#process()] at a fixed delay on a single daemon thread. Close it to stop the ticks.
public class CrossShardDriver implements AutoCloseable {
  private final CrossShardCoordinator coordinator;
  private final Duration tickInterval;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private ScheduledFuture<?> ticks;

  public CrossShardDriver(CrossShardCoordinator coordinator) {
    this(coordinator, coordinator.config().tickInterval());
  }

  public CrossShardDriver(CrossShardCoordinator coordinator, Duration tickInterval) {
    this.coordinator = coordinator;
    this.tickInterval = tickInterval;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
      final var thread = new Thread(runnable, "cross-shard-driver-" + coordinator.localShard());
      thread.setDaemon(true);
      return thread;
    });
  }

  public synchronized CrossShardDriver start() {
    if (running.compareAndSet(false, true)) {
      LOGGER.info(() -> coordinator.localShard() + " starting cross-shard driver every " + tickInterval);
      final var millis = tickInterval.toMillis();
      ticks = scheduler.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    }
    return this;
  }

  private void tick() {
    try {
      coordinator.process();
    } catch (RuntimeException e) {
      // an escaping exception would cancel all later ticks
      LOGGER.log(Level.SEVERE, coordinator.localShard() + " cross-shard tick failed: " + e, e);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  @Override
  public synchronized void close() {
    if (running.getAndSet(false) && ticks != null) {
      ticks.cancel(false);
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(tickInterval.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
    LOGGER.info(() -> coordinator.localShard() + " stopped cross-shard driver");
  }
}
