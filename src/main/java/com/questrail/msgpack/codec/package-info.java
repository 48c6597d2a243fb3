/**
 * MessagePack Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> between
 * {@link com.questrail.msgpack.model.MsgPackValue} trees and MessagePack wire
 * bytes, following the MessagePack format:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.msgpack.codec.MsgPackEncoder}: value to bytes, total</li>
 *   <li>{@link com.questrail.msgpack.codec.MsgPackDecoder}: bytes to value, fallible</li>
 *   <li>{@link com.questrail.msgpack.codec.MsgPackDecodeException}: the typed
 *       failure outcome, classified by {@link com.questrail.msgpack.codec.DecodeError}</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   MsgPackValue
 *        → MsgPackEncoder      (type tag + size class selection)
 *            → byte[]
 *                → MsgPackDecoder   (tag classification, bounds checks, UTF-8)
 *                    → MsgPackValue
 * </pre>
 *
 * <p>Both directions are synchronous pure transformations with no shared
 * mutable state. Implementations may be shared freely across threads.</p>
 */
package com.questrail.msgpack.codec;
