package com.questrail.msgpack.codec.impl;

import com.questrail.msgpack.codec.MsgPackEncoder;
import com.questrail.msgpack.config.MsgPackCodecConfig;
import com.questrail.msgpack.model.*;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.questrail.msgpack.codec.impl.MsgPackFormat.*;

/**
 * DefaultMsgPackEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MsgPackEncoder}.
 *
 * <p>Size-class selection, per variant:</p>
 * <ul>
 *   <li>Int: positive/negative fixint, then uint 8/16/32/64 for non-negative
 *       values or int 8/16/32/64 for negative values, narrowest first</li>
 *   <li>Float: float32 when {@link MsgPackCodecConfig#compactFloats()} is set
 *       and the narrowing is bit-exact, float64 otherwise</li>
 *   <li>String: fixstr up to 31 bytes, then str 8/16/32</li>
 *   <li>Binary: bin 8/16/32 (there is no inline form)</li>
 *   <li>Array, Map: fix form up to 15 entries, then 16/32-bit counts</li>
 *   <li>Extension: fixext for payloads of exactly 1, 2, 4, 8 or 16 bytes,
 *       ext 8/16/32 otherwise</li>
 * </ul>
 *
 * <p>Stateless apart from its configuration; safe for concurrent use.
 * Recursion follows the value tree, whose depth is bounded only by the
 * caller.</p>
 */
public final class DefaultMsgPackEncoder implements MsgPackEncoder
{
    private final MsgPackCodecConfig config;

    public DefaultMsgPackEncoder()
    {
        this(MsgPackCodecConfig.defaults());
    }

    public DefaultMsgPackEncoder(MsgPackCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public byte[] encode(MsgPackValue value)
    {
        Objects.requireNonNull(value, "value");

        final MsgPackOutput out = new MsgPackOutput(64);
        write(value, out);
        return out.toByteArray();
    }

    private void write(MsgPackValue value, MsgPackOutput out)
    {
        if (value instanceof MsgPackNil) {
            out.writeByte(NIL);
        }
        else if (value instanceof MsgPackBoolean b) {
            out.writeByte(b.value() ? TRUE : FALSE);
        }
        else if (value instanceof MsgPackInt i) {
            writeInt(i.value(), out);
        }
        else if (value instanceof MsgPackFloat f) {
            writeFloat(f.value(), out);
        }
        else if (value instanceof MsgPackString s) {
            writeString(s.value(), out);
        }
        else if (value instanceof MsgPackBinary b) {
            writeBinary(b.bytes(), out);
        }
        else if (value instanceof MsgPackArray a) {
            writeArrayHeader(a.size(), out);
            for (MsgPackValue element : a.elements()) {
                write(element, out);
            }
        }
        else if (value instanceof MsgPackMap m) {
            writeMapHeader(m.size(), out);
            for (MapElement element : m.elements()) {
                write(element.key(), out);
                write(element.value(), out);
            }
        }
        else if (value instanceof MsgPackExtension e) {
            writeExtension(e.typeId(), e.data(), out);
        }
        else {
            // Unreachable while MsgPackValue stays sealed.
            throw new IllegalArgumentException("Unsupported MsgPackValue type: " + value.getClass());
        }
    }

    // ========================================================================
    // Scalars
    // ========================================================================

    private static void writeInt(long v, MsgPackOutput out)
    {
        if (v >= 0) {
            if (v <= POSITIVE_FIXINT_MAX) {
                out.writeByte((int) v);
            }
            else if (v <= UINT8_MAX) {
                out.writeByte(UINT8);
                out.writeByte((int) v);
            }
            else if (v <= UINT16_MAX) {
                out.writeByte(UINT16);
                out.writeShort((int) v);
            }
            else if (v <= UINT32_MAX) {
                out.writeByte(UINT32);
                out.writeInt((int) v);
            }
            else {
                out.writeByte(UINT64);
                out.writeLong(v);
            }
            return;
        }

        if (v >= NEGATIVE_FIXINT_MIN_VALUE) {
            // 111xxxxx: the low byte of the two's complement value is the tag.
            out.writeByte((int) v);
        }
        else if (v >= Byte.MIN_VALUE) {
            out.writeByte(INT8);
            out.writeByte((int) v);
        }
        else if (v >= Short.MIN_VALUE) {
            out.writeByte(INT16);
            out.writeShort((int) v);
        }
        else if (v >= Integer.MIN_VALUE) {
            out.writeByte(INT32);
            out.writeInt((int) v);
        }
        else {
            out.writeByte(INT64);
            out.writeLong(v);
        }
    }

    private void writeFloat(double v, MsgPackOutput out)
    {
        if (config.compactFloats()) {
            final float narrowed = (float) v;
            if (Double.doubleToRawLongBits(narrowed) == Double.doubleToRawLongBits(v)) {
                out.writeByte(FLOAT32);
                out.writeInt(Float.floatToRawIntBits(narrowed));
                return;
            }
        }
        out.writeByte(FLOAT64);
        out.writeLong(Double.doubleToRawLongBits(v));
    }

    // ========================================================================
    // Length-prefixed payloads
    // ========================================================================

    private static void writeString(String s, MsgPackOutput out)
    {
        // MsgPackString guarantees there are no unpaired surrogates, so this
        // conversion is exact.
        final byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        final int length = utf8.length;

        if (length <= FIXSTR_MAX_LENGTH) {
            out.writeByte(FIXSTR_PREFIX | length);
        }
        else if (length <= UINT8_MAX) {
            out.writeByte(STR8);
            out.writeByte(length);
        }
        else if (length <= UINT16_MAX) {
            out.writeByte(STR16);
            out.writeShort(length);
        }
        else {
            out.writeByte(STR32);
            out.writeInt(length);
        }
        out.writeBytes(utf8);
    }

    private static void writeBinary(byte[] bytes, MsgPackOutput out)
    {
        final int length = bytes.length;

        if (length <= UINT8_MAX) {
            out.writeByte(BIN8);
            out.writeByte(length);
        }
        else if (length <= UINT16_MAX) {
            out.writeByte(BIN16);
            out.writeShort(length);
        }
        else {
            out.writeByte(BIN32);
            out.writeInt(length);
        }
        out.writeBytes(bytes);
    }

    private static void writeExtension(byte typeId, byte[] data, MsgPackOutput out)
    {
        final int length = data.length;

        switch (length) {
            case 1 -> out.writeByte(FIXEXT1);
            case 2 -> out.writeByte(FIXEXT2);
            case 4 -> out.writeByte(FIXEXT4);
            case 8 -> out.writeByte(FIXEXT8);
            case 16 -> out.writeByte(FIXEXT16);
            default -> {
                if (length <= UINT8_MAX) {
                    out.writeByte(EXT8);
                    out.writeByte(length);
                }
                else if (length <= UINT16_MAX) {
                    out.writeByte(EXT16);
                    out.writeShort(length);
                }
                else {
                    out.writeByte(EXT32);
                    out.writeInt(length);
                }
            }
        }

        out.writeByte(typeId);
        out.writeBytes(data);
    }

    // ========================================================================
    // Container headers
    // ========================================================================

    private static void writeArrayHeader(int count, MsgPackOutput out)
    {
        if (count <= FIXARRAY_MAX_SIZE) {
            out.writeByte(FIXARRAY_PREFIX | count);
        }
        else if (count <= UINT16_MAX) {
            out.writeByte(ARRAY16);
            out.writeShort(count);
        }
        else {
            out.writeByte(ARRAY32);
            out.writeInt(count);
        }
    }

    private static void writeMapHeader(int count, MsgPackOutput out)
    {
        if (count <= FIXMAP_MAX_SIZE) {
            out.writeByte(FIXMAP_PREFIX | count);
        }
        else if (count <= UINT16_MAX) {
            out.writeByte(MAP16);
            out.writeShort(count);
        }
        else {
            out.writeByte(MAP32);
            out.writeInt(count);
        }
    }
}
