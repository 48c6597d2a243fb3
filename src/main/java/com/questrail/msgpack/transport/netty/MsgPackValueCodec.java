package com.questrail.msgpack.transport.netty;

import com.questrail.msgpack.codec.MsgPackDecoder;
import com.questrail.msgpack.codec.MsgPackEncoder;
import com.questrail.msgpack.model.MsgPackValue;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MsgPackValueCodec
 * =============================================================================
 * Netty handler that converts between {@link ByteBuf} messages and
 * {@link MsgPackValue} trees.
 *
 * <h2>Framing assumption</h2>
 * Each inbound {@link ByteBuf} must hold exactly one complete MessagePack
 * value: a datagram payload, or the output of a frame decoder such as
 * {@code LengthFieldBasedFrameDecoder}. This handler never accumulates bytes
 * across reads.
 *
 * <h2>Failure policy</h2>
 * Inbound buffers that fail to decode are dropped. The rejection is reported
 * to the decoder's observability sink; nothing is propagated down the
 * pipeline.
 *
 * <p>Inbound buffers are copied into {@code byte[]} before decoding and are
 * released by the superclass.</p>
 */
public final class MsgPackValueCodec extends MessageToMessageCodec<ByteBuf, MsgPackValue>
{
    private final MsgPackEncoder encoder;
    private final MsgPackDecoder decoder;

    public MsgPackValueCodec(MsgPackEncoder encoder, MsgPackDecoder decoder)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, MsgPackValue value, List<Object> out)
    {
        out.add(Unpooled.wrappedBuffer(encoder.encode(value)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf buf, List<Object> out)
    {
        final byte[] bytes = ByteBufUtil.getBytes(buf);
        final Optional<MsgPackValue> value = decoder.tryDecode(bytes);
        value.ifPresent(out::add);
    }
}
