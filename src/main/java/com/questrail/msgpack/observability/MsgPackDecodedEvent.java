package com.questrail.msgpack.observability;

import com.questrail.msgpack.model.MsgPackType;

import java.time.Instant;

/**
 * Record describing a successfully decoded buffer.
 */
public record MsgPackDecodedEvent(
    Instant timestamp,
    MsgPackType type,
    int bytesConsumed
) {
}
