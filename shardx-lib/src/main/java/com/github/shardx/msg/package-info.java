// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The protocol messages exchanged between the cross-shard coordinators of two shards.
///
/// A happy path runs as follows where `S` is the source shard and `T` the target shard:
///
/// ```
/// S -> T  TransactionTransmit
/// T -> S  TransactionReceived
/// T -> S  TransactionCommit        (once local consensus on T has finalised the payload)
/// S -> T  TransactionAcknowledge
/// T -> S  TransactionAcknowledge
/// ```
///
/// `TransactionStatusQuery` and `TransactionStatusResponse` repair state when a message is lost.
package com.github.shardx.msg;
