// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.network;

import com.github.shardx.CrossShardException;
import com.github.shardx.Pickler;
import com.github.shardx.ShardId;
import com.github.shardx.TransactionId;
import com.github.shardx.msg.CrossShardMessage;
import com.github.shardx.msg.MessageType;
import com.github.shardx.msg.TransactionAcknowledge;
import com.github.shardx.msg.TransactionCommit;
import com.github.shardx.msg.TransactionReceived;
import com.github.shardx.msg.TransactionStatusQuery;
import com.github.shardx.msg.TransactionStatusResponse;
import com.github.shardx.msg.TransactionTransmit;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

import static com.github.shardx.CrossShardTransactionPickler.readCrossShardStatus;
import static com.github.shardx.CrossShardTransactionPickler.readLedgerStatus;
import static com.github.shardx.CrossShardTransactionPickler.readLedgerTransaction;
import static com.github.shardx.CrossShardTransactionPickler.readString;
import static com.github.shardx.CrossShardTransactionPickler.requireFullyRead;
import static com.github.shardx.CrossShardTransactionPickler.write;
import static com.github.shardx.CrossShardTransactionPickler.writeString;

/// The wire codec of the cross-shard protocol. It is stateless.
///
/// ```
/// tag(1) transactionId(string) sourceShardId(string) targetShardId(string) body
/// ```
///
/// The tag is [MessageType#tag()]. The body is the ledger transaction for a transmit, the ledger status byte for a
/// commit, the cross-shard status priority byte for a status response and empty otherwise. Any input that does not
/// decode to exactly one message, including trailing bytes, raises a [CrossShardException] of kind
/// [CrossShardException.Kind#SERIALIZATION].
public class CrossShardMessagePickler implements Pickler<CrossShardMessage> {
  public static final CrossShardMessagePickler instance = new CrossShardMessagePickler();

  protected CrossShardMessagePickler() {
  }

  @Override
  public byte[] serialize(CrossShardMessage msg) {
    return pickle(msg);
  }

  @Override
  public CrossShardMessage deserialize(byte[] bytes) {
    return unpickle(bytes);
  }

  public static byte[] pickle(CrossShardMessage msg) {
    try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(bytes)) {
      final var type = MessageType.of(msg);
      dos.writeByte(type.tag());
      writeString(msg.transactionId().value(), dos);
      writeString(msg.sourceShardId().id(), dos);
      writeString(msg.targetShardId().id(), dos);
      switch (type) {
        case TRANSMIT -> write(((TransactionTransmit) msg).transaction(), dos);
        case COMMIT -> write(((TransactionCommit) msg).status(), dos);
        case STATUS_RESPONSE -> write(((TransactionStatusResponse) msg).status(), dos);
        case RECEIVED, ACKNOWLEDGE, STATUS_QUERY -> {
          // header only
        }
      }
      dos.flush();
      return bytes.toByteArray();
    } catch (IOException e) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Failed to pickle " + msg, e);
    }
  }

  public static CrossShardMessage unpickle(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Empty message");
    }
    try (ByteArrayInputStream bis = new ByteArrayInputStream(bytes);
         DataInputStream dis = new DataInputStream(bis)) {
      final byte tag = dis.readByte();
      final var type = MessageType.fromTag(tag).orElseThrow(() ->
          new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Unknown message tag: " + tag));
      final var id = new TransactionId(readString(dis));
      final var source = new ShardId(readString(dis));
      final var target = new ShardId(readString(dis));
      final CrossShardMessage msg = switch (type) {
        case TRANSMIT -> new TransactionTransmit(id, source, target, readLedgerTransaction(dis));
        case RECEIVED -> new TransactionReceived(id, source, target);
        case COMMIT -> new TransactionCommit(id, source, target, readLedgerStatus(dis));
        case ACKNOWLEDGE -> new TransactionAcknowledge(id, source, target);
        case STATUS_QUERY -> new TransactionStatusQuery(id, source, target);
        case STATUS_RESPONSE -> new TransactionStatusResponse(id, source, target, readCrossShardStatus(dis));
      };
      requireFullyRead(dis);
      return msg;
    } catch (IOException e) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Malformed message: " + e, e);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new CrossShardException(CrossShardException.Kind.SERIALIZATION, "Invalid message: " + e, e);
    }
  }
}
