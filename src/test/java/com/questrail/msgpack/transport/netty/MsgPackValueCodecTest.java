package com.questrail.msgpack.transport.netty;

import com.questrail.msgpack.codec.DecodeError;
import com.questrail.msgpack.codec.impl.DefaultMsgPackDecoder;
import com.questrail.msgpack.codec.impl.DefaultMsgPackEncoder;
import com.questrail.msgpack.config.MsgPackCodecConfig;
import com.questrail.msgpack.model.*;
import com.questrail.msgpack.observability.RecordingObservabilitySink;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MsgPackValueCodecTest
{
    private RecordingObservabilitySink sink;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp()
    {
        sink = new RecordingObservabilitySink();
        channel = new EmbeddedChannel(new MsgPackValueCodec(
                new DefaultMsgPackEncoder(),
                new DefaultMsgPackDecoder(MsgPackCodecConfig.defaults(), sink)));
    }

    @AfterEach
    void tearDown()
    {
        channel.finishAndReleaseAll();
    }

    @Test
    void outboundValueIsWrittenAsEncodedBytes()
    {
        MsgPackValue value = MsgPackArray.of(new MsgPackInt(1), new MsgPackString("a"));

        assertTrue(channel.writeOutbound(value));

        ByteBuf out = channel.readOutbound();
        try {
            assertArrayEquals(new byte[] { (byte) 0x92, 0x01, (byte) 0xA1, 0x61 }, ByteBufUtil.getBytes(out));
        }
        finally {
            out.release();
        }
    }

    @Test
    void inboundBufferIsDecodedAndReleased()
    {
        ByteBuf in = Unpooled.wrappedBuffer(new byte[] { (byte) 0x81, (byte) 0xA1, 0x6B, (byte) 0xC3 });

        assertTrue(channel.writeInbound(in));

        MsgPackValue decoded = channel.readInbound();
        assertEquals(MsgPackMap.of(new MapElement(new MsgPackString("k"), MsgPackBoolean.TRUE)), decoded);
        assertEquals(0, in.refCnt());
        assertEquals(1, sink.getDecoded().size());
    }

    @Test
    void malformedInboundBufferIsDroppedAndReported()
    {
        ByteBuf in = Unpooled.wrappedBuffer(new byte[] { (byte) 0xC1 });

        assertFalse(channel.writeInbound(in));

        assertNull(channel.readInbound());
        assertEquals(0, in.refCnt());
        assertEquals(1, sink.getFailures().size());
        assertEquals(DecodeError.UNKNOWN_TAG, sink.getFailures().get(0).error());
        assertTrue(channel.isActive());
    }

    @Test
    void trailingBytesInFrameAreRejected()
    {
        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { (byte) 0xC0, (byte) 0xC0 })));

        assertEquals(DecodeError.TRAILING_DATA, sink.getFailures().get(0).error());
    }
}
