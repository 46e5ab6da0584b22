// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.zip.CRC32;

/// The ledger transaction relayed between shards. The coordinator treats it as opaque: it is submitted to the
/// [LocalConsensus] of each shard and, on the target shard, has its status overwritten when the commit is recorded.
///
/// @param id        The ledger transaction id. This is not the cross-shard transaction id.
/// @param parentIds References to earlier ledger transactions.
/// @param timestamp The ledger timestamp of the transaction.
/// @param data      The application encoded body such as a transfer.
/// @param signature The signature over the body. It is not verified here.
/// @param status    The status as last reported by a local consensus engine.
public record LedgerTransaction(
    String id,
    List<String> parentIds,
    long timestamp,
    byte[] data,
    byte[] signature,
    LedgerTransactionStatus status
) {
  public LedgerTransaction {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    parentIds = List.copyOf(parentIds);
    data = data == null ? new byte[0] : data;
    signature = signature == null ? new byte[0] : signature;
  }

  public LedgerTransaction(String id, byte[] data) {
    this(id, List.of(), System.currentTimeMillis(), data, new byte[0], LedgerTransactionStatus.PENDING);
  }

  public LedgerTransaction withStatus(LedgerTransactionStatus newStatus) {
    return new LedgerTransaction(id, parentIds, timestamp, data, signature, newStatus);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LedgerTransaction that)) {
      return false;
    }
    return timestamp == that.timestamp
        && id.equals(that.id)
        && parentIds.equals(that.parentIds)
        && Arrays.equals(data, that.data)
        && Arrays.equals(signature, that.signature)
        && status == that.status;
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, parentIds, timestamp, status);
    result = 31 * result + Arrays.hashCode(data);
    return 31 * result + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    CRC32 crc32 = new CRC32();
    crc32.update(data);
    return String.format("LedgerTransaction[id='%s', parents=%d, status=%s, data=byte[%d]:CRC32=%d]",
        id, parentIds.size(), status, data.length, crc32.getValue());
  }
}
