package com.questrail.msgpack.codec.impl;

/**
 * MsgPackFormat
 * -----------------------------------------------------------------------------
 * Tag byte assignments of the MessagePack format.
 *
 * <table>
 * <tr><th>Tag</th><th>Family</th><th>Payload</th></tr>
 * <tr><td><code>00..7F</code></td><td>positive fixint</td><td>value in low 7 bits</td></tr>
 * <tr><td><code>80..8F</code></td><td>fixmap</td><td>pair count in low 4 bits</td></tr>
 * <tr><td><code>90..9F</code></td><td>fixarray</td><td>element count in low 4 bits</td></tr>
 * <tr><td><code>A0..BF</code></td><td>fixstr</td><td>byte length in low 5 bits</td></tr>
 * <tr><td><code>C0</code></td><td>nil</td><td></td></tr>
 * <tr><td><code>C1</code></td><td><em>never used</em></td><td></td></tr>
 * <tr><td><code>C2, C3</code></td><td>false, true</td><td></td></tr>
 * <tr><td><code>C4..C6</code></td><td>bin 8/16/32</td><td>length, bytes</td></tr>
 * <tr><td><code>C7..C9</code></td><td>ext 8/16/32</td><td>length, type, bytes</td></tr>
 * <tr><td><code>CA, CB</code></td><td>float 32/64</td><td>IEEE 754, big-endian</td></tr>
 * <tr><td><code>CC..CF</code></td><td>uint 8/16/32/64</td><td>big-endian</td></tr>
 * <tr><td><code>D0..D3</code></td><td>int 8/16/32/64</td><td>big-endian two's complement</td></tr>
 * <tr><td><code>D4..D8</code></td><td>fixext 1/2/4/8/16</td><td>type, bytes</td></tr>
 * <tr><td><code>D9..DB</code></td><td>str 8/16/32</td><td>length, UTF-8 bytes</td></tr>
 * <tr><td><code>DC, DD</code></td><td>array 16/32</td><td>count, elements</td></tr>
 * <tr><td><code>DE, DF</code></td><td>map 16/32</td><td>count, key/value pairs</td></tr>
 * <tr><td><code>E0..FF</code></td><td>negative fixint</td><td>value -32..-1</td></tr>
 * </table>
 *
 * <p>All multi-byte lengths and values are big-endian.</p>
 */
final class MsgPackFormat
{
    static final int POSITIVE_FIXINT_MAX = 0x7F;

    static final int FIXMAP_PREFIX = 0x80;
    static final int FIXMAP_MAX = 0x8F;

    static final int FIXARRAY_PREFIX = 0x90;
    static final int FIXARRAY_MAX = 0x9F;

    static final int FIXSTR_PREFIX = 0xA0;
    static final int FIXSTR_MAX = 0xBF;

    static final int NIL = 0xC0;
    static final int FALSE = 0xC2;
    static final int TRUE = 0xC3;

    static final int BIN8 = 0xC4;
    static final int BIN16 = 0xC5;
    static final int BIN32 = 0xC6;

    static final int EXT8 = 0xC7;
    static final int EXT16 = 0xC8;
    static final int EXT32 = 0xC9;

    static final int FLOAT32 = 0xCA;
    static final int FLOAT64 = 0xCB;

    static final int UINT8 = 0xCC;
    static final int UINT16 = 0xCD;
    static final int UINT32 = 0xCE;
    static final int UINT64 = 0xCF;

    static final int INT8 = 0xD0;
    static final int INT16 = 0xD1;
    static final int INT32 = 0xD2;
    static final int INT64 = 0xD3;

    static final int FIXEXT1 = 0xD4;
    static final int FIXEXT2 = 0xD5;
    static final int FIXEXT4 = 0xD6;
    static final int FIXEXT8 = 0xD7;
    static final int FIXEXT16 = 0xD8;

    static final int STR8 = 0xD9;
    static final int STR16 = 0xDA;
    static final int STR32 = 0xDB;

    static final int ARRAY16 = 0xDC;
    static final int ARRAY32 = 0xDD;

    static final int MAP16 = 0xDE;
    static final int MAP32 = 0xDF;

    static final int NEGATIVE_FIXINT_MIN = 0xE0;

    /** Largest count/length that fits in the low bits of a fix-family tag. */
    static final int FIXMAP_MAX_SIZE = 15;
    static final int FIXARRAY_MAX_SIZE = 15;
    static final int FIXSTR_MAX_LENGTH = 31;

    static final long NEGATIVE_FIXINT_MIN_VALUE = -32L;

    static final int UINT8_MAX = 0xFF;
    static final int UINT16_MAX = 0xFFFF;
    static final long UINT32_MAX = 0xFFFF_FFFFL;

    private MsgPackFormat() {}
}
