package com.questrail.msgpack.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Dynamically typed representation of any MessagePack-encodable value.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code MsgPackValue} is the in-memory form of a MessagePack message whose
 * shape is not known ahead of time. It is produced by the decoder, consumed
 * by the encoder, and inspected by callers through the {@code is*} / {@code as*}
 * accessors declared here.
 * </p>
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>Leaves: {@link MsgPackNil}, {@link MsgPackBoolean}, {@link MsgPackInt},
 *       {@link MsgPackFloat}, {@link MsgPackString}, {@link MsgPackBinary},
 *       {@link MsgPackExtension}</li>
 *   <li>Containers: {@link MsgPackArray}, {@link MsgPackMap}</li>
 * </ul>
 *
 * <p>
 * Every variant is immutable. Containers own their children exclusively, so a
 * value tree is always finite and acyclic. Equality is structural: two values
 * are equal iff their variants match and their payloads are recursively equal.
 * Map equality is order-sensitive.
 * </p>
 *
 * <p>
 * This type has no knowledge of the wire format. Tag bytes, size classes and
 * byte order live exclusively in the codec layer.
 * </p>
 */
public sealed interface MsgPackValue
        permits MsgPackNil, MsgPackBoolean, MsgPackInt, MsgPackFloat, MsgPackString,
                MsgPackBinary, MsgPackArray, MsgPackMap, MsgPackExtension {

    /**
     * Returns the variant of this value.
     */
    MsgPackType type();

    default boolean isNil() {
        return type() == MsgPackType.NIL;
    }

    default boolean isBoolean() {
        return type() == MsgPackType.BOOLEAN;
    }

    default boolean isInt() {
        return type() == MsgPackType.INT;
    }

    default boolean isFloat() {
        return type() == MsgPackType.FLOAT;
    }

    default boolean isString() {
        return type() == MsgPackType.STRING;
    }

    default boolean isBinary() {
        return type() == MsgPackType.BINARY;
    }

    default boolean isArray() {
        return type() == MsgPackType.ARRAY;
    }

    default boolean isMap() {
        return type() == MsgPackType.MAP;
    }

    default boolean isExtension() {
        return type() == MsgPackType.EXTENSION;
    }

    /**
     * @throws MsgPackConversionException if this is not a {@link MsgPackBoolean}
     */
    default boolean asBoolean() {
        if (this instanceof MsgPackBoolean b) {
            return b.value();
        }
        throw new MsgPackConversionException(this, MsgPackType.BOOLEAN);
    }

    /**
     * @throws MsgPackConversionException if this is not a {@link MsgPackInt}
     */
    default long asInt() {
        if (this instanceof MsgPackInt i) {
            return i.value();
        }
        throw new MsgPackConversionException(this, MsgPackType.INT);
    }

    /**
     * @throws MsgPackConversionException if this is not a {@link MsgPackFloat}
     */
    default double asFloat() {
        if (this instanceof MsgPackFloat f) {
            return f.value();
        }
        throw new MsgPackConversionException(this, MsgPackType.FLOAT);
    }

    /**
     * @throws MsgPackConversionException if this is not a {@link MsgPackString}
     */
    default String asString() {
        if (this instanceof MsgPackString s) {
            return s.value();
        }
        throw new MsgPackConversionException(this, MsgPackType.STRING);
    }

    /**
     * Returns a fresh copy of the binary payload.
     *
     * @throws MsgPackConversionException if this is not a {@link MsgPackBinary}
     */
    default byte[] asBinary() {
        if (this instanceof MsgPackBinary b) {
            return b.bytes();
        }
        throw new MsgPackConversionException(this, MsgPackType.BINARY);
    }

    /**
     * Returns the elements as a new, mutable list owned by the caller.
     *
     * @throws MsgPackConversionException if this is not a {@link MsgPackArray}
     */
    default List<MsgPackValue> asArray() {
        if (this instanceof MsgPackArray a) {
            return new ArrayList<>(a.elements());
        }
        throw new MsgPackConversionException(this, MsgPackType.ARRAY);
    }

    /**
     * Returns the pairs, in stored order, as a new, mutable list owned by the caller.
     *
     * @throws MsgPackConversionException if this is not a {@link MsgPackMap}
     */
    default List<MapElement> asMap() {
        if (this instanceof MsgPackMap m) {
            return new ArrayList<>(m.elements());
        }
        throw new MsgPackConversionException(this, MsgPackType.MAP);
    }

    /**
     * @throws MsgPackConversionException if this is not a {@link MsgPackExtension}
     */
    default MsgPackExtension asExtension() {
        if (this instanceof MsgPackExtension e) {
            return e;
        }
        throw new MsgPackConversionException(this, MsgPackType.EXTENSION);
    }
}
