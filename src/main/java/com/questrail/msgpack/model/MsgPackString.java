package com.questrail.msgpack.model;

import java.util.Objects;

/**
 * UTF-8 text.
 *
 * <p>
 * Java strings may hold unpaired UTF-16 surrogates, which have no UTF-8 form.
 * Such strings are rejected here so that every {@code MsgPackString} has an
 * exact wire encoding.
 * </p>
 */
public record MsgPackString(String value) implements MsgPackValue {

    public MsgPackString {
        Objects.requireNonNull(value, "value");
        int bad = firstUnpairedSurrogate(value);
        if (bad >= 0) {
            throw new IllegalArgumentException(
                    "String contains an unpaired surrogate at index " + bad
                            + " and cannot be represented as UTF-8");
        }
    }

    @Override
    public MsgPackType type() {
        return MsgPackType.STRING;
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }

    private static int firstUnpairedSurrogate(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                    i++;
                    continue;
                }
                return i;
            }
            if (Character.isLowSurrogate(c)) {
                return i;
            }
        }
        return -1;
    }
}
