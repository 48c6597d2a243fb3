package com.questrail.msgpack.model;

/**
 * The absence of a value. There is exactly one instance.
 */
public enum MsgPackNil implements MsgPackValue {
    INSTANCE;

    @Override
    public MsgPackType type() {
        return MsgPackType.NIL;
    }

    @Override
    public String toString() {
        return "nil";
    }
}
