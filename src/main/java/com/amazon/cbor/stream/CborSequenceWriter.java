// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.CborWriterException;
import com.amazon.cbor.Length;
import java.io.IOException;

/**
 * Writes a sequence of data items: either the top level of a stream or the
 * elements of an array.
 * <p>
 * Each of the container methods writes the container's header immediately
 * and returns a writer for its contents, which must be closed before
 * anything else is written to this writer:
 * <pre>
 * try (CborArrayWriter array = writer.array(3)) {
 *     array.write(1);
 *     try (CborArrayWriter inner = array.array()) {
 *         inner.write("a");
 *     }
 *     array.write(true);
 * }
 * </pre>
 *
 * @see CborWriter
 * @see CborArrayWriter
 */
public interface CborSequenceWriter
{
    /**
     * Writes a single, complete data item.
     *
     * @throws CborWriterException if this writer cannot accept another item.
     */
    void write(Object value) throws IOException;

    /**
     * Starts an indefinite-length array.
     */
    CborArrayWriter array() throws IOException;

    /**
     * Starts an array that must receive exactly {@code length} elements.
     *
     * @throws IllegalArgumentException if {@code length} is negative; nothing
     * is written in that case.
     */
    CborArrayWriter array(long length) throws IOException;

    /**
     * Starts an array of the given length.
     */
    CborArrayWriter array(Length length) throws IOException;

    /**
     * Starts an indefinite-length map.
     */
    CborMapWriter map() throws IOException;

    /**
     * Starts a map that must receive exactly {@code length} key/value pairs.
     *
     * @throws IllegalArgumentException if {@code length} is negative; nothing
     * is written in that case.
     */
    CborMapWriter map(long length) throws IOException;

    /**
     * Starts a map of the given length.
     */
    CborMapWriter map(Length length) throws IOException;
}
