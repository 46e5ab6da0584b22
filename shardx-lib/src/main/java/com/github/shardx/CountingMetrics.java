// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/// Keeps the counters in memory so that a host application can expose them however it likes.
public class CountingMetrics implements Metrics {
  private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();

  @Override
  public void increment(String name) {
    counters.computeIfAbsent(name, k -> new LongAdder()).increment();
  }

  public long count(String name) {
    final var adder = counters.get(name);
    return adder == null ? 0L : adder.sum();
  }

  public Map<String, Long> snapshot() {
    final var result = new TreeMap<String, Long>();
    counters.forEach((name, adder) -> result.put(name, adder.sum()));
    return result;
  }
}
