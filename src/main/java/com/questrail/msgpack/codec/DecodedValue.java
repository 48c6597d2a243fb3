package com.questrail.msgpack.codec;

import com.questrail.msgpack.model.MsgPackValue;

import java.util.Objects;

/**
 * Result of a prefix decode: the first value in a buffer and the number of
 * bytes its encoding occupies.
 */
public record DecodedValue(MsgPackValue value, int length)
{
    public DecodedValue {
        Objects.requireNonNull(value, "value");
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive (was " + length + ")");
        }
    }
}
