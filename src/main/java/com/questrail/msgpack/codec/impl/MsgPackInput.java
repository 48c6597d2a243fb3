package com.questrail.msgpack.codec.impl;

import com.questrail.msgpack.codec.DecodeError;
import com.questrail.msgpack.codec.MsgPackDecodeException;

import java.util.Arrays;

/**
 * Bounds-checked big-endian read cursor over {@code buffer[position, limit)}.
 *
 * <p>Every read first verifies that enough bytes remain and otherwise fails
 * with {@link DecodeError#UNEXPECTED_END}, reporting the absolute offset at
 * which the missing bytes were expected. The cursor never reads past
 * {@code limit}.</p>
 */
final class MsgPackInput
{
    private final byte[] buffer;
    private final int limit;
    private int position;

    MsgPackInput(byte[] buffer, int position, int limit)
    {
        this.buffer = buffer;
        this.position = position;
        this.limit = limit;
    }

    int position()
    {
        return position;
    }

    int remaining()
    {
        return limit - position;
    }

    byte[] buffer()
    {
        return buffer;
    }

    /**
     * Reads the next byte as an unsigned value (0..255).
     */
    int readUint8()
    {
        require(1);
        return buffer[position++] & 0xFF;
    }

    byte readInt8()
    {
        require(1);
        return buffer[position++];
    }

    int readUint16()
    {
        require(2);
        final int v = ((buffer[position] & 0xFF) << 8)
                |  (buffer[position + 1] & 0xFF);
        position += 2;
        return v;
    }

    short readInt16()
    {
        return (short) readUint16();
    }

    int readInt32()
    {
        require(4);
        final int v = ((buffer[position] & 0xFF) << 24)
                | ((buffer[position + 1] & 0xFF) << 16)
                | ((buffer[position + 2] & 0xFF) << 8)
                |  (buffer[position + 3] & 0xFF);
        position += 4;
        return v;
    }

    long readUint32()
    {
        return readInt32() & 0xFFFF_FFFFL;
    }

    long readInt64()
    {
        require(8);
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (buffer[position + i] & 0xFF);
        }
        position += 8;
        return v;
    }

    /**
     * Narrows a declared wire length to an {@code int}, failing if the buffer
     * cannot hold that many further bytes.
     */
    int requireLength(long declared)
    {
        if (declared > remaining()) {
            throw unexpectedEnd(declared);
        }
        return (int) declared;
    }

    byte[] readBytes(int length)
    {
        require(length);
        final byte[] out = Arrays.copyOfRange(buffer, position, position + length);
        position += length;
        return out;
    }

    void skip(int length)
    {
        require(length);
        position += length;
    }

    private void require(long needed)
    {
        if (needed > remaining()) {
            throw unexpectedEnd(needed);
        }
    }

    MsgPackDecodeException unexpectedEnd(long needed)
    {
        return new MsgPackDecodeException(
                DecodeError.UNEXPECTED_END,
                position,
                "needed " + needed + " more bytes but only " + remaining() + " remain");
    }
}
