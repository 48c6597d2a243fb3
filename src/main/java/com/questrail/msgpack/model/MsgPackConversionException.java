package com.questrail.msgpack.model;

/**
 * Thrown by the {@code as*} accessors of {@link MsgPackValue} when the value is
 * not of the requested variant.
 *
 * <p>The original value is retained and can be taken back with {@link #recover()}.</p>
 */
public final class MsgPackConversionException extends RuntimeException
{
    private final transient MsgPackValue original;
    private final MsgPackType attempted;

    public MsgPackConversionException(MsgPackValue original, MsgPackType attempted) {
        super("MsgPack conversion error: cannot use "
                + original.type().displayName() + " as " + attempted.displayName());
        this.original = original;
        this.attempted = attempted;
    }

    /**
     * Returns the value the conversion was attempted on.
     */
    public MsgPackValue recover() {
        return original;
    }

    public MsgPackType attempted() {
        return attempted;
    }
}
