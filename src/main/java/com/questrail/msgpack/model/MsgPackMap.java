package com.questrail.msgpack.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered sequence of key/value pairs.
 *
 * <p>
 * Pairs are kept exactly as given: not sorted, not deduplicated. Two maps are
 * equal only if they hold equal pairs in the same order.
 * </p>
 */
public record MsgPackMap(List<MapElement> elements) implements MsgPackValue {

    public static final MsgPackMap EMPTY = new MsgPackMap(List.of());

    public MsgPackMap {
        elements = List.copyOf(elements);
    }

    public static MsgPackMap of(MapElement... elements) {
        return new MsgPackMap(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    /**
     * Returns the value of the first pair whose key equals {@code key}.
     */
    public Optional<MsgPackValue> get(MsgPackValue key) {
        for (MapElement e : elements) {
            if (e.key().equals(key)) {
                return Optional.of(e.value());
            }
        }
        return Optional.empty();
    }

    @Override
    public MsgPackType type() {
        return MsgPackType.MAP;
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
