// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * Encodes individual CBOR data items and container framing to a sink.
 * <p>
 * The streaming writers in {@code com.amazon.cbor.stream} only decide
 * <em>when</em> each of these methods is called; the bytes written are
 * entirely up to the encoder. An encoder never inspects or buffers the
 * container structure it is asked to frame.
 * <p>
 * <b>Implementations are not expected to be safe for use by multiple
 * threads.</b>
 */
public interface PrimitiveEncoder extends Flushable, Closeable
{
    /**
     * Writes one complete data item. Compound Java values (lists, maps)
     * are written in full.
     *
     * @throws CborEncodingException if the value cannot be represented.
     */
    void encode(Object value) throws IOException;

    /**
     * Writes the header of a definite-length container.
     *
     * @param length the number of elements, or key/value pairs for a map;
     * must not be negative.
     */
    void encodeLength(ContainerType type, long length) throws IOException;

    /**
     * Writes the start marker of an indefinite-length container.
     */
    void encodeIndefinite(ContainerType type) throws IOException;

    /**
     * Writes the break token that closes the innermost indefinite-length
     * container.
     */
    void encodeBreak() throws IOException;
}
