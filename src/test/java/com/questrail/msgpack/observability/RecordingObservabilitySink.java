package com.questrail.msgpack.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements MsgPackObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onDecoded(MsgPackDecodedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDecodeFailure(MsgPackDecodeFailureEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<MsgPackDecodeFailureEvent> getFailures() {
        return events.stream()
            .filter(e -> e instanceof MsgPackDecodeFailureEvent)
            .map(e -> (MsgPackDecodeFailureEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<MsgPackDecodedEvent> getDecoded() {
        return events.stream()
            .filter(e -> e instanceof MsgPackDecodedEvent)
            .map(e -> (MsgPackDecodedEvent) e)
            .collect(Collectors.toList());
    }
}
