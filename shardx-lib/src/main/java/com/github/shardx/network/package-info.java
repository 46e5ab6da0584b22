// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The boundary between the coordinator and the network: the [com.github.shardx.network.Transport] it sends through
/// and the binary codec of the protocol messages.
package com.github.shardx.network;
