package com.questrail.msgpack.model;

import java.util.Locale;

/**
 * The closed set of shapes a {@link MsgPackValue} can take.
 */
public enum MsgPackType {
    NIL,
    BOOLEAN,
    INT,
    FLOAT,
    STRING,
    BINARY,
    ARRAY,
    MAP,
    EXTENSION;

    /**
     * Lower-case name used in diagnostics, e.g. {@code "string"}.
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
