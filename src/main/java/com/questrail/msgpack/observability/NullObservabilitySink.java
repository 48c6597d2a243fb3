package com.questrail.msgpack.observability;

/**
 * No-op implementation of MsgPackObservabilitySink.
 */
public final class NullObservabilitySink implements MsgPackObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDecoded(MsgPackDecodedEvent event) {}

    @Override
    public void onDecodeFailure(MsgPackDecodeFailureEvent event) {}
}
