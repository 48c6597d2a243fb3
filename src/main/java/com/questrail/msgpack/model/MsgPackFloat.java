package com.questrail.msgpack.model;

/**
 * A 64-bit IEEE 754 floating point number.
 *
 * <p>
 * float32 values on the wire are widened into this type without loss.
 * Equality follows {@link Double#compare(double, double)}: {@code NaN} equals
 * {@code NaN}, and {@code 0.0} is distinct from {@code -0.0}.
 * </p>
 */
public record MsgPackFloat(double value) implements MsgPackValue {

    @Override
    public MsgPackType type() {
        return MsgPackType.FLOAT;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
