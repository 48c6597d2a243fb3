package com.questrail.msgpack.observability;

/**
 * Receives MessagePack codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface MsgPackObservabilitySink {
    /**
     * Called after a buffer has been decoded successfully.
     * @param event the decode details
     */
    void onDecoded(MsgPackDecodedEvent event);

    /**
     * Called when a buffer is rejected as malformed.
     * @param event the failure details
     */
    void onDecodeFailure(MsgPackDecodeFailureEvent event);
}
