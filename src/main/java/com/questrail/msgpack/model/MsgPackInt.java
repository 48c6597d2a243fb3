package com.questrail.msgpack.model;

/**
 * A signed 64-bit integer.
 *
 * <p>
 * All MessagePack integer families (fixint, uint8-64, int8-64) decode into this
 * single type. The wire width is not retained; the encoder re-derives the
 * narrowest family from the value itself.
 * </p>
 */
public record MsgPackInt(long value) implements MsgPackValue {

    @Override
    public MsgPackType type() {
        return MsgPackType.INT;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
