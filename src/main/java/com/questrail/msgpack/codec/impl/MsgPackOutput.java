package com.questrail.msgpack.codec.impl;

import java.util.Arrays;

/**
 * Growable big-endian byte sink used by {@link DefaultMsgPackEncoder}.
 *
 * <p>Not thread-safe; one instance per encode call.</p>
 */
final class MsgPackOutput
{
    private byte[] buffer;
    private int size;

    MsgPackOutput(int initialCapacity)
    {
        this.buffer = new byte[Math.max(initialCapacity, 16)];
    }

    void writeByte(int b)
    {
        ensureCapacity(1);
        buffer[size++] = (byte) b;
    }

    void writeShort(int v)
    {
        ensureCapacity(2);
        buffer[size++] = (byte) (v >>> 8);
        buffer[size++] = (byte) v;
    }

    void writeInt(int v)
    {
        ensureCapacity(4);
        buffer[size++] = (byte) (v >>> 24);
        buffer[size++] = (byte) (v >>> 16);
        buffer[size++] = (byte) (v >>> 8);
        buffer[size++] = (byte) v;
    }

    void writeLong(long v)
    {
        ensureCapacity(8);
        for (int shift = 56; shift >= 0; shift -= 8) {
            buffer[size++] = (byte) (v >>> shift);
        }
    }

    void writeBytes(byte[] bytes)
    {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
    }

    byte[] toByteArray()
    {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(int extra)
    {
        final int required = size + extra;
        if (required < 0) {
            throw new OutOfMemoryError("Encoded MessagePack exceeds maximum array size");
        }
        if (required > buffer.length) {
            int grown = buffer.length << 1;
            if (grown < required) {
                grown = required;
            }
            buffer = Arrays.copyOf(buffer, grown);
        }
    }
}
