package com.questrail.msgpack.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered sequence of values. Elements may be of any variant.
 */
public record MsgPackArray(List<MsgPackValue> elements) implements MsgPackValue {

    public static final MsgPackArray EMPTY = new MsgPackArray(List.of());

    public MsgPackArray {
        // List.copyOf rejects null elements.
        elements = List.copyOf(elements);
    }

    public static MsgPackArray of(MsgPackValue... elements) {
        return new MsgPackArray(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public MsgPackType type() {
        return MsgPackType.ARRAY;
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
