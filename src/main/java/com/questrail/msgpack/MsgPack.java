package com.questrail.msgpack;

import com.questrail.msgpack.codec.MsgPackDecodeException;
import com.questrail.msgpack.codec.MsgPackDecoder;
import com.questrail.msgpack.codec.MsgPackEncoder;
import com.questrail.msgpack.codec.impl.DefaultMsgPackDecoder;
import com.questrail.msgpack.codec.impl.DefaultMsgPackEncoder;
import com.questrail.msgpack.model.MsgPackValue;

/**
 * Entry point for one-off encoding and decoding with the default configuration.
 *
 * <pre>
 *   byte[] bytes = MsgPack.encode(value);
 *   MsgPackValue decoded = MsgPack.parse(bytes);
 * </pre>
 *
 * <p>Callers that need a different depth limit, float policy or an
 * observability sink construct {@link DefaultMsgPackEncoder} and
 * {@link DefaultMsgPackDecoder} directly.</p>
 */
public final class MsgPack
{
    private static final MsgPackEncoder ENCODER = new DefaultMsgPackEncoder();
    private static final MsgPackDecoder DECODER = new DefaultMsgPackDecoder();

    private MsgPack() {}

    public static byte[] encode(MsgPackValue value)
    {
        return ENCODER.encode(value);
    }

    /**
     * Decode a buffer holding exactly one MessagePack value.
     *
     * @throws MsgPackDecodeException if the buffer is malformed or has trailing bytes
     */
    public static MsgPackValue parse(byte[] buffer)
    {
        return DECODER.decode(buffer);
    }
}
