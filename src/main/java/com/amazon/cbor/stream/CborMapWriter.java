// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.ContainerType;
import com.amazon.cbor.Length;
import java.io.IOException;

/**
 * Writes the key/value pairs of an open map. Each pair is one unit of the
 * map's capacity; the key is written first, followed by the value, with no
 * delimiter between pairs.
 * <p>
 * Keys are written in exactly the order given. This writer neither sorts
 * them nor checks them for duplicates.
 */
public final class CborMapWriter implements CborContainerWriter
{
    private final ContainerScope scope;

    /*package*/ CborMapWriter(ContainerScope scope)
    {
        this.scope = scope;
    }

    /**
     * Writes one key/value pair.
     */
    public void write(Object key, Object value) throws IOException
    {
        scope.commit();
        scope.encoder().encode(key);
        scope.encoder().encode(value);
    }

    /**
     * Writes {@code key} and starts an indefinite-length array as its value.
     */
    public CborArrayWriter array(Object key) throws IOException
    {
        return array(key, Length.indefinite());
    }

    public CborArrayWriter array(Object key, long length) throws IOException
    {
        return array(key, Length.definite(length));
    }

    public CborArrayWriter array(Object key, Length length) throws IOException
    {
        ContainerScope.checkLength(length);
        scope.commit();
        scope.encoder().encode(key);
        return new CborArrayWriter(scope.openChild(ContainerType.ARRAY, length));
    }

    /**
     * Writes {@code key} and starts an indefinite-length map as its value.
     */
    public CborMapWriter map(Object key) throws IOException
    {
        return map(key, Length.indefinite());
    }

    public CborMapWriter map(Object key, long length) throws IOException
    {
        return map(key, Length.definite(length));
    }

    public CborMapWriter map(Object key, Length length) throws IOException
    {
        ContainerScope.checkLength(length);
        scope.commit();
        scope.encoder().encode(key);
        return new CborMapWriter(scope.openChild(ContainerType.MAP, length));
    }

    public ContainerType getContainerType()
    {
        return ContainerType.MAP;
    }

    public Length getLength()
    {
        return scope.length();
    }

    public long getRemainingCapacity()
    {
        return scope.remainingCapacity();
    }

    public int getDepth()
    {
        return scope.depth() - 1;
    }

    public boolean isClosed()
    {
        return scope.state() == ContainerScope.State.CLOSED;
    }

    public void close() throws IOException
    {
        scope.exit();
    }

    @Override
    public String toString()
    {
        return "CborMapWriter" + scope;
    }
}
