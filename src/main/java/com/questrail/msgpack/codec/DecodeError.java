package com.questrail.msgpack.codec;

/**
 * Classification of MessagePack decode failures.
 */
public enum DecodeError
{
    /** The buffer ends before a tag's declared payload is complete. */
    UNEXPECTED_END,

    /** The tag byte does not belong to any MessagePack family ({@code 0xC1}). */
    UNKNOWN_TAG,

    /** A string payload is not well-formed UTF-8. */
    INVALID_STRING,

    /** Bytes remain after a complete top-level value. */
    TRAILING_DATA,

    /** Containers are nested deeper than the configured limit. */
    DEPTH_EXCEEDED,

    /** A uint64 value exceeds {@link Long#MAX_VALUE} and has no signed 64-bit form. */
    INTEGER_OVERFLOW
}
