// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

/// The error raised by the coordinator. The [Kind] tells the caller whether retrying could ever help.
/// Errors raised by the collaborators (local consensus, transport) are not wrapped and propagate as thrown.
public class CrossShardException extends RuntimeException {

  public enum Kind {
    /// Unknown transaction id or shard id.
    NOT_FOUND,
    /// Shard id mismatch, self targeted transaction or malformed request.
    INVALID_INPUT,
    /// The operation is not permitted from the current status of the transaction.
    INVALID_STATE,
    /// A wire message or a stored record could not be decoded.
    SERIALIZATION
  }

  private final Kind kind;

  public CrossShardException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public CrossShardException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  static CrossShardException notFound(TransactionId id) {
    return new CrossShardException(Kind.NOT_FOUND, "Cross-shard transaction not found: " + id);
  }

  static CrossShardException invalidState(CrossShardTransaction tx, String operation) {
    return new CrossShardException(Kind.INVALID_STATE,
        "Cannot " + operation + " transaction " + tx.id() + " in status " + tx.status());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
  }
}
