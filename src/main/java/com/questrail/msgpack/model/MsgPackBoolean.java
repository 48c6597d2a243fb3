package com.questrail.msgpack.model;

public record MsgPackBoolean(boolean value) implements MsgPackValue {

    public static final MsgPackBoolean TRUE = new MsgPackBoolean(true);
    public static final MsgPackBoolean FALSE = new MsgPackBoolean(false);

    public static MsgPackBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public MsgPackType type() {
        return MsgPackType.BOOLEAN;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
