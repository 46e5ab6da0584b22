// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// The part the local shard plays in a cross-shard transaction. Several handlers behave differently per role.
public enum Role {
  /// The shard that created the transaction and transmits it.
  SOURCE,
  /// The shard that receives the transaction and commits it second.
  TARGET
}
