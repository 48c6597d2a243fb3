package com.questrail.msgpack.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MsgPackObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMsgPackObservabilitySink implements MsgPackObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMsgPackObservabilitySink.class);

    @Override
    public void onDecoded(MsgPackDecodedEvent event) {
        log.debug("MsgPack decoded {} ({} bytes)", event.type().displayName(), event.bytesConsumed());
    }

    @Override
    public void onDecodeFailure(MsgPackDecodeFailureEvent event) {
        log.warn("MsgPack input rejected: {} at byte {} of {}",
            event.error(), event.offset(), event.bufferLength());
        log.debug("MsgPack decode failure detail", event.cause());
    }
}
