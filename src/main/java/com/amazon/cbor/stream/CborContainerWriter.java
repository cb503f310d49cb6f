// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.CborWriterException;
import com.amazon.cbor.ContainerType;
import com.amazon.cbor.Length;
import java.io.Closeable;
import java.io.IOException;

/**
 * A writer bound to one open container. Closing it ends the container.
 */
public interface CborContainerWriter extends Closeable
{
    ContainerType getContainerType();

    Length getLength();

    /**
     * @return the number of elements (pairs, for maps) still required before
     * this container may be closed, or -1 if its length is indefinite.
     */
    long getRemainingCapacity();

    /**
     * @return the number of containers enclosing this one; 0 for a
     * container written at the top level.
     */
    int getDepth();

    boolean isClosed();

    /**
     * Ends the container. Indefinite-length containers are terminated with a
     * break token. Definite-length containers must have received exactly the
     * declared number of items; nothing is written for them.
     * Containers nested in it that are still open are closed along with it.
     * <p>
     * Closing an already closed writer has no effect.
     *
     * @throws CborWriterException if the container is short of items, or if
     * a container nested in it was still open.
     */
    @Override
    void close() throws IOException;
}
