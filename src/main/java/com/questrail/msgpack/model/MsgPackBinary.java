package com.questrail.msgpack.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Opaque binary payload.
 *
 * Immutability is enforced via defensive copying.
 */
public final class MsgPackBinary implements MsgPackValue {

    private final byte[] bytes;

    public MsgPackBinary(byte[] bytes) {
        this.bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Number of payload bytes.
     */
    public int length() {
        return bytes.length;
    }

    @Override
    public MsgPackType type() {
        return MsgPackType.BINARY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MsgPackBinary that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "bin:" + HexFormat.of().formatHex(bytes);
    }
}
