package com.questrail.msgpack.observability;

import com.questrail.msgpack.codec.DecodeError;
import com.questrail.msgpack.codec.MsgPackDecodeException;

import java.time.Instant;

/**
 * Record representing input rejected by the MessagePack decoder.
 */
public record MsgPackDecodeFailureEvent(
    Instant timestamp,
    int bufferLength,
    MsgPackDecodeException cause
) {
    public DecodeError error() {
        return cause.error();
    }

    public int offset() {
        return cause.offset();
    }
}
