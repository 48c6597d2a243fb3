package com.questrail.msgpack;

import com.questrail.msgpack.codec.DecodeError;
import com.questrail.msgpack.codec.MsgPackDecodeException;
import com.questrail.msgpack.model.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Semantic round-trip tests.
 *
 * These tests prove:
 *   MsgPackValue -> bytes -> MsgPackValue
 * yields a value equal to the original, and that no strict prefix of an
 * encoding is accepted.
 */
final class MsgPackRoundTripTest
{
    private static MsgPackValue document()
    {
        return MsgPackMap.of(
                new MapElement(new MsgPackString("name"), new MsgPackString("station-7 ✓")),
                new MapElement(new MsgPackString("enabled"), MsgPackBoolean.TRUE),
                new MapElement(new MsgPackString("missing"), MsgPackNil.INSTANCE),
                new MapElement(new MsgPackString("readings"), MsgPackArray.of(
                        new MsgPackInt(-1),
                        new MsgPackInt(300),
                        new MsgPackInt(Long.MIN_VALUE),
                        new MsgPackFloat(0.25),
                        new MsgPackFloat(1.32))),
                new MapElement(new MsgPackInt(7), new MsgPackBinary(new byte[] { 0x00, (byte) 0xFF })),
                new MapElement(MsgPackArray.of(MsgPackBoolean.FALSE),
                        new MsgPackExtension((byte) 2, new byte[] { 0x32, 0x4A, 0x67, 0x11 })),
                new MapElement(new MsgPackString("empty"), MsgPackMap.EMPTY));
    }

    @Test
    void compositeDocumentRoundTrip()
    {
        MsgPackValue original = document();

        MsgPackValue decoded = MsgPack.parse(MsgPack.encode(original));

        assertEquals(original, decoded);
        assertEquals(original.toString(), decoded.toString());
    }

    @Test
    void integerBoundariesRoundTrip()
    {
        long[] samples = {
                0, 1, 127, 128, 255, 256, 65535, 65536, 0xFFFF_FFFFL, 0x1_0000_0000L, Long.MAX_VALUE,
                -1, -32, -33, -128, -129, -32768, -32769, Integer.MIN_VALUE, Integer.MIN_VALUE - 1L, Long.MIN_VALUE
        };

        for (long sample : samples) {
            MsgPackValue original = new MsgPackInt(sample);
            assertEquals(original, MsgPack.parse(MsgPack.encode(original)), () -> "int " + sample);
        }
    }

    @Test
    void specialFloatsRoundTripBitExactly()
    {
        double[] samples = {
                0.0, -0.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY,
                Double.MIN_VALUE, Double.MAX_VALUE, 0.1, 1.5
        };

        for (double sample : samples) {
            double decoded = MsgPack.parse(MsgPack.encode(new MsgPackFloat(sample))).asFloat();
            assertEquals(Double.doubleToLongBits(sample), Double.doubleToLongBits(decoded), () -> "float " + sample);
        }
    }

    @Test
    void mapOrderAndDuplicateKeysSurvive()
    {
        MsgPackMap original = MsgPackMap.of(
                new MapElement(new MsgPackString("z"), new MsgPackInt(1)),
                new MapElement(new MsgPackString("a"), new MsgPackInt(2)),
                new MapElement(new MsgPackString("z"), new MsgPackInt(3)));

        MsgPackMap decoded = (MsgPackMap) MsgPack.parse(MsgPack.encode(original));

        assertEquals(original.elements(), decoded.elements());
        assertEquals(new MsgPackInt(1), decoded.get(new MsgPackString("z")).orElseThrow());
    }

    @Test
    void emptyValuesRoundTrip()
    {
        for (MsgPackValue original : List.of(
                MsgPackArray.EMPTY,
                MsgPackMap.EMPTY,
                new MsgPackString(""),
                new MsgPackBinary(new byte[0]),
                new MsgPackExtension((byte) 0, new byte[0]))) {
            assertEquals(original, MsgPack.parse(MsgPack.encode(original)), original::toString);
        }
    }

    @Test
    void extensionUsesFixedWidthForm()
    {
        MsgPackExtension original = new MsgPackExtension((byte) 2, new byte[] { 0x32, 0x4A, 0x67, 0x11 });

        byte[] bytes = MsgPack.encode(original);

        assertArrayEquals(new byte[] { (byte) 0xD6, 0x02, 0x32, 0x4A, 0x67, 0x11 }, bytes);
        assertEquals(original, MsgPack.parse(bytes));
    }

    @Test
    void knownDocumentEncodesToKnownBytes()
    {
        MsgPackValue original = MsgPackMap.of(
                new MapElement(new MsgPackString("compact"), MsgPackBoolean.TRUE),
                new MapElement(new MsgPackString("schema"), MsgPackArray.of(
                        new MsgPackInt(1), new MsgPackInt(2), new MsgPackFloat(1.32))));

        byte[] expected = {
                (byte) 0x82,
                (byte) 0xA7, 'c', 'o', 'm', 'p', 'a', 'c', 't', (byte) 0xC3,
                (byte) 0xA6, 's', 'c', 'h', 'e', 'm', 'a',
                (byte) 0x93, 0x01, 0x02,
                (byte) 0xCB, 0x3F, (byte) 0xF5, 0x1E, (byte) 0xB8, 0x51, (byte) 0xEB, (byte) 0x85, 0x1F
        };

        assertArrayEquals(expected, MsgPack.encode(original));
        assertEquals(original, MsgPack.parse(expected));
    }

    @Test
    void everyStrictPrefixIsUnexpectedEnd()
    {
        byte[] full = MsgPack.encode(document());

        for (int length = 0; length < full.length; length++) {
            byte[] prefix = Arrays.copyOf(full, length);
            final int n = length;

            MsgPackDecodeException e = assertThrows(MsgPackDecodeException.class, () -> MsgPack.parse(prefix),
                    () -> "prefix of " + n + " bytes");
            assertEquals(DecodeError.UNEXPECTED_END, e.error(), () -> "prefix of " + n + " bytes");
            assertTrue(e.offset() <= n);
        }
    }
}
