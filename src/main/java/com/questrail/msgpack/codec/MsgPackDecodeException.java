package com.questrail.msgpack.codec;

import java.util.Objects;

/**
 * Indicates that a byte buffer could not be decoded into a
 * {@link com.questrail.msgpack.model.MsgPackValue}.
 *
 * <p>The failure is classified by {@link #error()} and located by
 * {@link #offset()}, the absolute index into the caller's buffer at which the
 * problem was detected. No partially decoded value is ever exposed.</p>
 */
public final class MsgPackDecodeException extends RuntimeException
{
    private final DecodeError error;
    private final int offset;

    public MsgPackDecodeException(DecodeError error, int offset, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
        this.offset = offset;
    }

    public MsgPackDecodeException(DecodeError error, int offset, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
        this.offset = offset;
    }

    public DecodeError error() {
        return error;
    }

    /**
     * Absolute byte offset at which the failure was detected.
     */
    public int offset() {
        return offset;
    }

    @Override
    public String getMessage() {
        return "MsgPack parse error at byte " + offset + " (" + error + "): " + super.getMessage();
    }
}
