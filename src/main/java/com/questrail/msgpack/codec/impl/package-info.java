/**
 * MessagePack Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>Concrete encoder and decoder for the MessagePack format. The tag byte
 * table lives in {@code MsgPackFormat}; bounds-checked reads in
 * {@code MsgPackInput}; big-endian writes in {@code MsgPackOutput}.</p>
 *
 * <pre>
 *   byte[] buffer
 *        → MsgPackInput            (cursor, bounds checks)
 *        → DefaultMsgPackDecoder   (tag classification, recursion, UTF-8, depth)
 *        → MsgPackValue
 *        → DefaultMsgPackEncoder   (size-class minimization)
 *        → MsgPackOutput
 *        → byte[]
 * </pre>
 *
 * <p>Any failure while decoding surfaces as a
 * {@link com.questrail.msgpack.codec.MsgPackDecodeException}; no partially
 * decoded value escapes this package.</p>
 */
package com.questrail.msgpack.codec.impl;
