// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/// Pickles whole [CrossShardTransaction] records for a durable [TransactionStore]. The static helpers are shared with
/// the wire codec so that the ledger transaction has one encoding.
///
/// Strings are an `int` byte length followed by UTF-8. Byte arrays are an `int` length followed by the bytes. Every
/// length is checked against the bytes remaining so that corrupt input fails fast instead of allocating.
public class CrossShardTransactionPickler implements Pickler<CrossShardTransaction> {
  public static final CrossShardTransactionPickler instance = new CrossShardTransactionPickler();

  protected CrossShardTransactionPickler() {
  }

  @Override
  public byte[] serialize(CrossShardTransaction transaction) {
    try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(bytes)) {
      write(transaction, dos);
      dos.flush();
      return bytes.toByteArray();
    } catch (IOException e) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION,
          "Failed to pickle transaction " + transaction.id(), e);
    }
  }

  @Override
  public CrossShardTransaction deserialize(byte[] pickled) {
    try (ByteArrayInputStream bis = new ByteArrayInputStream(pickled);
         DataInputStream dis = new DataInputStream(bis)) {
      final var transaction = readCrossShardTransaction(dis);
      requireFullyRead(dis);
      return transaction;
    } catch (IOException e) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Malformed transaction record: " + e, e);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Invalid transaction record: " + e, e);
    }
  }

  public static void write(CrossShardTransaction t, DataOutputStream dos) throws IOException {
    writeString(t.id().value(), dos);
    write(t.payload(), dos);
    writeString(t.sourceShardId().id(), dos);
    writeString(t.targetShardId().id(), dos);
    write(t.status(), dos);
    write(t.createdAt(), dos);
    write(t.updatedAt(), dos);
    dos.writeBoolean(t.completedAt().isPresent());
    if (t.completedAt().isPresent()) {
      write(t.completedAt().get(), dos);
    }
    dos.writeInt(t.confirmations());
    dos.writeInt(t.requiredConfirmations());
    dos.writeInt(t.retryCount());
    dos.writeInt(t.maxRetries());
    // sorted so that equal records pickle to equal bytes
    final var metadata = new TreeMap<>(t.metadata());
    dos.writeInt(metadata.size());
    for (var entry : metadata.entrySet()) {
      writeString(entry.getKey(), dos);
      writeString(entry.getValue(), dos);
    }
  }

  public static CrossShardTransaction readCrossShardTransaction(DataInputStream dis) throws IOException {
    final var id = new TransactionId(readString(dis));
    final var payload = readLedgerTransaction(dis);
    final var source = new ShardId(readString(dis));
    final var target = new ShardId(readString(dis));
    final var status = readCrossShardStatus(dis);
    final var createdAt = readInstant(dis);
    final var updatedAt = readInstant(dis);
    final Optional<Instant> completedAt = dis.readBoolean() ? Optional.of(readInstant(dis)) : Optional.empty();
    final var confirmations = dis.readInt();
    final var requiredConfirmations = dis.readInt();
    final var retryCount = dis.readInt();
    final var maxRetries = dis.readInt();
    final var size = readCount(dis, 8);
    final Map<String, String> metadata = new HashMap<>();
    for (int i = 0; i < size; i++) {
      metadata.put(readString(dis), readString(dis));
    }
    return new CrossShardTransaction(id, payload, source, target, status, createdAt, updatedAt, completedAt,
        confirmations, requiredConfirmations, retryCount, maxRetries, metadata);
  }

  public static void write(LedgerTransaction tx, DataOutputStream dos) throws IOException {
    writeString(tx.id(), dos);
    dos.writeInt(tx.parentIds().size());
    for (var parent : tx.parentIds()) {
      writeString(parent, dos);
    }
    dos.writeLong(tx.timestamp());
    writeBytes(tx.data(), dos);
    writeBytes(tx.signature(), dos);
    write(tx.status(), dos);
  }

  public static LedgerTransaction readLedgerTransaction(DataInputStream dis) throws IOException {
    final var id = readString(dis);
    final var parentCount = readCount(dis, 4);
    final var parents = new ArrayList<String>(parentCount);
    for (int i = 0; i < parentCount; i++) {
      parents.add(readString(dis));
    }
    final var timestamp = dis.readLong();
    final var data = readBytes(dis);
    final var signature = readBytes(dis);
    final var status = readLedgerStatus(dis);
    return new LedgerTransaction(id, parents, timestamp, data, signature, status);
  }

  public static void write(LedgerTransactionStatus status, DataOutputStream dos) throws IOException {
    dos.writeByte(status.ordinal());
  }

  public static LedgerTransactionStatus readLedgerStatus(DataInputStream dis) throws IOException {
    final var ordinal = dis.readUnsignedByte();
    final var values = LedgerTransactionStatus.values();
    if (ordinal >= values.length) {
      throw new IOException("Unknown ledger transaction status: " + ordinal);
    }
    return values[ordinal];
  }

  /// The cross-shard status travels as its priority which is the stable part of its definition.
  public static void write(CrossShardTransactionStatus status, DataOutputStream dos) throws IOException {
    dos.writeByte(status.priority());
  }

  public static CrossShardTransactionStatus readCrossShardStatus(DataInputStream dis) throws IOException {
    final var priority = dis.readUnsignedByte();
    for (var status : CrossShardTransactionStatus.values()) {
      if (status.priority() == priority) {
        return status;
      }
    }
    throw new IOException("Unknown cross-shard transaction status: " + priority);
  }

  public static void writeString(String value, DataOutputStream dos) throws IOException {
    writeBytes(value.getBytes(StandardCharsets.UTF_8), dos);
  }

  /// @throws CharacterCodingException if the bytes are not well formed UTF-8.
  public static String readString(DataInputStream dis) throws IOException {
    return StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(readBytes(dis)))
        .toString();
  }

  public static void writeBytes(byte[] bytes, DataOutputStream dos) throws IOException {
    dos.writeInt(bytes.length);
    dos.write(bytes);
  }

  public static byte[] readBytes(DataInputStream dis) throws IOException {
    final var length = readCount(dis, 1);
    final var bytes = new byte[length];
    dis.readFully(bytes);
    return bytes;
  }

  /// Reads an `int` count of items each at least `minItemSize` bytes long and rejects it if the input is too short.
  static int readCount(DataInputStream dis, int minItemSize) throws IOException {
    final var count = dis.readInt();
    if (count < 0 || (long) count * minItemSize > dis.available()) {
      throw new IOException("Invalid length " + count + " with " + dis.available() + " bytes remaining");
    }
    return count;
  }

  public static void requireFullyRead(DataInputStream dis) throws IOException {
    final var remaining = dis.available();
    if (remaining != 0) {
      throw new IOException(remaining + " trailing bytes");
    }
  }

  static void write(Instant instant, DataOutputStream dos) throws IOException {
    dos.writeLong(instant.getEpochSecond());
    dos.writeInt(instant.getNano());
  }

  static Instant readInstant(DataInputStream dis) throws IOException {
    final var seconds = dis.readLong();
    final var nanos = dis.readInt();
    try {
      return Instant.ofEpochSecond(seconds, nanos);
    } catch (DateTimeException e) {
      throw new IOException("Invalid instant " + seconds + "." + nanos, e);
    }
  }
}
