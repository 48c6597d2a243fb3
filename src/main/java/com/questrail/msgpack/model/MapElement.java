package com.questrail.msgpack.model;

import java.util.Objects;

/**
 * A single key/value pair of a {@link MsgPackMap}. Keys are unconstrained values.
 */
public record MapElement(MsgPackValue key, MsgPackValue value) {

    public MapElement {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return key + ": " + value;
    }
}
