// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// The status of the embedded ledger transaction as reported by a local consensus engine.
public enum LedgerTransactionStatus {
  PENDING,
  CONFIRMED,
  REJECTED
}
