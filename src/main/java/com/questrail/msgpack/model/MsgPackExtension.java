package com.questrail.msgpack.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Application-defined extension payload.
 *
 * <p>
 * The type id is a signed byte. Negative ids are reserved by the MessagePack
 * format for predefined types (e.g. {@code -1} for timestamps), but the
 * codec treats every id and payload as opaque and does not interpret them.
 * </p>
 */
public final class MsgPackExtension implements MsgPackValue {

    private final byte typeId;
    private final byte[] data;

    public MsgPackExtension(byte typeId, byte[] data) {
        this.typeId = typeId;
        this.data = (data == null) ? new byte[0] : data.clone();
    }

    public byte typeId() {
        return typeId;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] data() {
        return data.clone();
    }

    /**
     * Number of payload bytes.
     */
    public int length() {
        return data.length;
    }

    @Override
    public MsgPackType type() {
        return MsgPackType.EXTENSION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MsgPackExtension that)) return false;
        return typeId == that.typeId && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Byte.hashCode(typeId) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ext:" + typeId + ":" + HexFormat.of().formatHex(data);
    }
}
