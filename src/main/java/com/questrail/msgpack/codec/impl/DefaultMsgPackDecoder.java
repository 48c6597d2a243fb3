package com.questrail.msgpack.codec.impl;

import com.questrail.msgpack.codec.DecodeError;
import com.questrail.msgpack.codec.DecodedValue;
import com.questrail.msgpack.codec.MsgPackDecodeException;
import com.questrail.msgpack.codec.MsgPackDecoder;
import com.questrail.msgpack.config.MsgPackCodecConfig;
import com.questrail.msgpack.model.*;
import com.questrail.msgpack.observability.MsgPackDecodeFailureEvent;
import com.questrail.msgpack.observability.MsgPackDecodedEvent;
import com.questrail.msgpack.observability.MsgPackObservabilitySink;
import com.questrail.msgpack.observability.NullObservabilitySink;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.msgpack.codec.impl.MsgPackFormat.*;

/**
 * DefaultMsgPackDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MsgPackDecoder}.
 *
 * <p>Each decode step performs, in order:</p>
 * <ol>
 *   <li>Read one tag byte (fails with {@code UNEXPECTED_END} on an exhausted buffer)</li>
 *   <li>Classify the tag into its MessagePack family ({@code UNKNOWN_TAG} for {@code 0xC1})</li>
 *   <li>Read the fixed-width value or the 0/1/2/4-byte length field the tag implies</li>
 *   <li>Check the declared payload, or element count, against the remaining bytes</li>
 *   <li>Recurse for container elements, each consuming its own sub-range in turn</li>
 * </ol>
 *
 * <p><strong>Policy decisions:</strong></p>
 * <ul>
 *   <li>Trailing bytes after a complete top-level value are rejected with
 *       {@code TRAILING_DATA} by {@link #decode(byte[], int, int)}; use
 *       {@link #decodeFirst(byte[], int)} to parse a prefix.</li>
 *   <li>uint64 values above {@link Long#MAX_VALUE} are rejected with
 *       {@code INTEGER_OVERFLOW} rather than wrapped.</li>
 *   <li>Container nesting beyond {@link MsgPackCodecConfig#maxDepth()} is
 *       rejected with {@code DEPTH_EXCEEDED}.</li>
 * </ul>
 *
 * <p>Stateless apart from its configuration and sink; safe for concurrent use
 * provided the sink is.</p>
 */
public final class DefaultMsgPackDecoder implements MsgPackDecoder
{
    private final MsgPackCodecConfig config;
    private final MsgPackObservabilitySink sink;

    public DefaultMsgPackDecoder()
    {
        this(MsgPackCodecConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultMsgPackDecoder(MsgPackCodecConfig config)
    {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public DefaultMsgPackDecoder(MsgPackCodecConfig config, MsgPackObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public MsgPackValue decode(byte[] buffer, int offset, int length)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromIndexSize(offset, length, buffer.length);

        try {
            final MsgPackInput in = new MsgPackInput(buffer, offset, offset + length);
            final MsgPackValue value = new Session(in).readValue(0);

            if (in.remaining() > 0) {
                throw new MsgPackDecodeException(
                        DecodeError.TRAILING_DATA,
                        in.position(),
                        in.remaining() + " bytes remain after the top-level value");
            }

            sink.onDecoded(new MsgPackDecodedEvent(Instant.now(), value.type(), length));
            return value;
        }
        catch (MsgPackDecodeException e) {
            sink.onDecodeFailure(new MsgPackDecodeFailureEvent(Instant.now(), length, e));
            throw e;
        }
    }

    @Override
    public DecodedValue decodeFirst(byte[] buffer, int offset)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromToIndex(offset, buffer.length, buffer.length);

        final int available = buffer.length - offset;
        try {
            final MsgPackInput in = new MsgPackInput(buffer, offset, buffer.length);
            final MsgPackValue value = new Session(in).readValue(0);
            final int consumed = in.position() - offset;

            sink.onDecoded(new MsgPackDecodedEvent(Instant.now(), value.type(), consumed));
            return new DecodedValue(value, consumed);
        }
        catch (MsgPackDecodeException e) {
            sink.onDecodeFailure(new MsgPackDecodeFailureEvent(Instant.now(), available, e));
            throw e;
        }
    }

    @Override
    public Optional<MsgPackValue> tryDecode(byte[] buffer)
    {
        try {
            return Optional.of(decode(buffer));
        }
        catch (MsgPackDecodeException e) {
            // Already reported to the sink by decode().
            return Optional.empty();
        }
    }

    /**
     * State of one decode call: the read cursor and a UTF-8 decoder, neither
     * of which may be shared between threads.
     */
    private final class Session
    {
        private final MsgPackInput in;
        private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        Session(MsgPackInput in)
        {
            this.in = in;
        }

        /**
         * @param depth number of containers enclosing the value about to be read
         */
        MsgPackValue readValue(int depth)
        {
            final int start = in.position();
            final int tag = in.readUint8();

            // Ranges first: fixint, fixmap, fixarray, fixstr.
            if (tag <= POSITIVE_FIXINT_MAX) {
                return new MsgPackInt(tag);
            }
            if (tag >= NEGATIVE_FIXINT_MIN) {
                return new MsgPackInt((byte) tag);
            }
            if (tag <= FIXMAP_MAX) {
                return readMap(tag & 0x0F, depth, start);
            }
            if (tag <= FIXARRAY_MAX) {
                return readArray(tag & 0x0F, depth, start);
            }
            if (tag <= FIXSTR_MAX) {
                return readString(tag & 0x1F);
            }

            return switch (tag) {
                case NIL -> MsgPackNil.INSTANCE;
                case FALSE -> MsgPackBoolean.FALSE;
                case TRUE -> MsgPackBoolean.TRUE;

                case BIN8 -> readBinary(in.readUint8());
                case BIN16 -> readBinary(in.readUint16());
                case BIN32 -> readBinary(in.readUint32());

                case EXT8 -> readExtension(in.readUint8());
                case EXT16 -> readExtension(in.readUint16());
                case EXT32 -> readExtension(in.readUint32());

                case FLOAT32 -> new MsgPackFloat(Float.intBitsToFloat(in.readInt32()));
                case FLOAT64 -> new MsgPackFloat(Double.longBitsToDouble(in.readInt64()));

                case UINT8 -> new MsgPackInt(in.readUint8());
                case UINT16 -> new MsgPackInt(in.readUint16());
                case UINT32 -> new MsgPackInt(in.readUint32());
                case UINT64 -> readUint64(start);

                case INT8 -> new MsgPackInt(in.readInt8());
                case INT16 -> new MsgPackInt(in.readInt16());
                case INT32 -> new MsgPackInt(in.readInt32());
                case INT64 -> new MsgPackInt(in.readInt64());

                case FIXEXT1 -> readExtension(1);
                case FIXEXT2 -> readExtension(2);
                case FIXEXT4 -> readExtension(4);
                case FIXEXT8 -> readExtension(8);
                case FIXEXT16 -> readExtension(16);

                case STR8 -> readString(in.readUint8());
                case STR16 -> readString(in.readUint16());
                case STR32 -> readString(in.readUint32());

                case ARRAY16 -> readArray(in.readUint16(), depth, start);
                case ARRAY32 -> readArray(in.readUint32(), depth, start);

                case MAP16 -> readMap(in.readUint16(), depth, start);
                case MAP32 -> readMap(in.readUint32(), depth, start);

                default -> throw new MsgPackDecodeException(
                        DecodeError.UNKNOWN_TAG,
                        start,
                        String.format("tag byte 0x%02X is not a MessagePack type", tag));
            };
        }

        private MsgPackInt readUint64(int start)
        {
            final long raw = in.readInt64();
            if (raw < 0) {
                throw new MsgPackDecodeException(
                        DecodeError.INTEGER_OVERFLOW,
                        start,
                        "uint64 " + Long.toUnsignedString(raw) + " exceeds the signed 64-bit range");
            }
            return new MsgPackInt(raw);
        }

        private MsgPackString readString(long declared)
        {
            final int length = in.requireLength(declared);
            final int payloadStart = in.position();
            try {
                final String text = utf8.decode(ByteBuffer.wrap(in.buffer(), payloadStart, length)).toString();
                in.skip(length);
                return new MsgPackString(text);
            }
            catch (CharacterCodingException e) {
                throw new MsgPackDecodeException(
                        DecodeError.INVALID_STRING,
                        payloadStart,
                        "string payload of " + length + " bytes is not valid UTF-8",
                        e);
            }
        }

        private MsgPackBinary readBinary(long declared)
        {
            final int length = in.requireLength(declared);
            return new MsgPackBinary(in.readBytes(length));
        }

        private MsgPackExtension readExtension(long declared)
        {
            // Wire order is [length][type][data]; the length (if any) is already consumed.
            final byte typeId = in.readInt8();
            final int length = in.requireLength(declared);
            return new MsgPackExtension(typeId, in.readBytes(length));
        }

        private MsgPackArray readArray(long count, int depth, int start)
        {
            final int childDepth = enter(depth, start);

            // Every element occupies at least one byte.
            if (count > in.remaining()) {
                throw in.unexpectedEnd(count);
            }

            final List<MsgPackValue> elements = new ArrayList<>((int) count);
            for (long i = 0; i < count; i++) {
                elements.add(readValue(childDepth));
            }
            return new MsgPackArray(elements);
        }

        private MsgPackMap readMap(long count, int depth, int start)
        {
            final int childDepth = enter(depth, start);

            // Every key and every value occupies at least one byte.
            if (count * 2 > in.remaining()) {
                throw in.unexpectedEnd(count * 2);
            }

            final List<MapElement> elements = new ArrayList<>((int) count);
            for (long i = 0; i < count; i++) {
                final MsgPackValue key = readValue(childDepth);
                final MsgPackValue value = readValue(childDepth);
                elements.add(new MapElement(key, value));
            }
            return new MsgPackMap(elements);
        }

        private int enter(int depth, int start)
        {
            final int childDepth = depth + 1;
            if (childDepth > config.maxDepth()) {
                throw new MsgPackDecodeException(
                        DecodeError.DEPTH_EXCEEDED,
                        start,
                        "container nesting exceeds the limit of " + config.maxDepth());
            }
            return childDepth;
        }
    }
}
