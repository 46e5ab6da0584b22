// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.shardx.msg;

import java.util.Arrays;
import java.util.Optional;

/// The wire tag of each message. The tag values are part of the protocol and must never be renumbered.
public enum MessageType {
  TRANSMIT((byte) 1),
  RECEIVED((byte) 2),
  COMMIT((byte) 3),
  ACKNOWLEDGE((byte) 4),
  STATUS_QUERY((byte) 5),
  STATUS_RESPONSE((byte) 6);

  private final byte tag;

  MessageType(byte tag) {
    this.tag = tag;
  }

  public byte tag() {
    return tag;
  }

  public static MessageType of(CrossShardMessage msg) {
    if (msg instanceof TransactionTransmit) {
      return TRANSMIT;
    } else if (msg instanceof TransactionReceived) {
      return RECEIVED;
    } else if (msg instanceof TransactionCommit) {
      return COMMIT;
    } else if (msg instanceof TransactionAcknowledge) {
      return ACKNOWLEDGE;
    } else if (msg instanceof TransactionStatusQuery) {
      return STATUS_QUERY;
    } else if (msg instanceof TransactionStatusResponse) {
      return STATUS_RESPONSE;
    }
    throw new IllegalArgumentException("Unknown message type: " + msg.getClass());
  }

  public static Optional<MessageType> fromTag(byte tag) {
    return Arrays.stream(values()).filter(t -> t.tag == tag).findFirst();
  }
}
