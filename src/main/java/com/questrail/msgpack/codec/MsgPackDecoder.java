package com.questrail.msgpack.codec;

import com.questrail.msgpack.model.MsgPackValue;

import java.util.Optional;

/**
 * MsgPackDecoder
 * -----------------------------------------------------------------------------
 * Reconstructs {@link MsgPackValue} trees from MessagePack bytes.
 *
 * <p>The decoder operates on complete, addressable buffers. It is responsible
 * for:</p>
 * <ul>
 *   <li>Classifying tag bytes into MessagePack families</li>
 *   <li>Bounds-checking every declared length against the buffer</li>
 *   <li>Validating UTF-8 string payloads</li>
 *   <li>Bounding container nesting depth</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for accumulating partial
 * input across calls. A buffer that ends early is rejected with
 * {@link DecodeError#UNEXPECTED_END}.</p>
 */
public interface MsgPackDecoder
{
    /**
     * Decode a buffer that holds exactly one value.
     *
     * @throws MsgPackDecodeException if the buffer is malformed or holds
     *         trailing bytes after the value
     */
    default MsgPackValue decode(byte[] buffer)
    {
        return decode(buffer, 0, buffer.length);
    }

    /**
     * Decode the slice {@code buffer[offset, offset + length)}, which must hold
     * exactly one value. Error offsets are absolute indices into {@code buffer}.
     *
     * @throws MsgPackDecodeException if the slice is malformed or holds
     *         trailing bytes after the value
     */
    MsgPackValue decode(byte[] buffer, int offset, int length);

    /**
     * Decode the first value starting at {@code offset}. Bytes after that value
     * are left untouched and are not an error.
     *
     * @return the value and the number of bytes it occupied
     * @throws MsgPackDecodeException if no complete, well-formed value starts
     *         at {@code offset}
     */
    DecodedValue decodeFirst(byte[] buffer, int offset);

    /**
     * Attempt to decode a buffer that holds exactly one value.
     *
     * @return the decoded value, or {@link Optional#empty()} if the buffer is
     *         malformed
     */
    Optional<MsgPackValue> tryDecode(byte[] buffer);
}
