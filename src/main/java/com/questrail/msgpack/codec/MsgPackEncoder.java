package com.questrail.msgpack.codec;

import com.questrail.msgpack.model.MsgPackValue;

/**
 * MsgPackEncoder
 * -----------------------------------------------------------------------------
 * Serializes a {@link MsgPackValue} tree into MessagePack bytes.
 *
 * <p>Encoding is total: every representable value has a valid encoding, so
 * there is no failure outcome. Integers, strings, binaries, containers and
 * extensions are written with the narrowest MessagePack family that holds
 * them.</p>
 */
public interface MsgPackEncoder
{
    /**
     * Encode {@code value}, recursing into containers.
     *
     * @param value the value tree to encode
     * @return a newly allocated byte array holding exactly one encoded value
     */
    byte[] encode(MsgPackValue value);
}
