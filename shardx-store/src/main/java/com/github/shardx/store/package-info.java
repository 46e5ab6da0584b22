// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// A durable [com.github.shardx.TransactionStore] on the H2 MVStore embedded key value store.
package com.github.shardx.store;
