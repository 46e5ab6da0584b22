// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// Converts a value to and from bytes. Failures are reported as [CrossShardException] of kind
/// [CrossShardException.Kind#SERIALIZATION].
public interface Pickler<T> {
  byte[] serialize(T value);

  T deserialize(byte[] bytes);
}
