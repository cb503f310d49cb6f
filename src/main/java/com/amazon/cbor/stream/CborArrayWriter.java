// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.ContainerType;
import com.amazon.cbor.Length;
import java.io.IOException;

/**
 * Writes the elements of an open array. For definite-length arrays every
 * {@link #write(Object)} and every nested container counts as one element,
 * and exceeding the declared count fails before anything is written.
 * <p>
 * Instances are obtained from {@link CborSequenceWriter#array()} and its
 * overloads, or {@link CborMapWriter#array(Object)}.
 */
public final class CborArrayWriter implements CborSequenceWriter, CborContainerWriter
{
    private final ContainerScope scope;

    /*package*/ CborArrayWriter(ContainerScope scope)
    {
        this.scope = scope;
    }

    public void write(Object value) throws IOException
    {
        scope.commit();
        scope.encoder().encode(value);
    }

    public CborArrayWriter array() throws IOException
    {
        return array(Length.indefinite());
    }

    public CborArrayWriter array(long length) throws IOException
    {
        return array(Length.definite(length));
    }

    public CborArrayWriter array(Length length) throws IOException
    {
        ContainerScope.checkLength(length);
        scope.commit();
        return new CborArrayWriter(scope.openChild(ContainerType.ARRAY, length));
    }

    public CborMapWriter map() throws IOException
    {
        return map(Length.indefinite());
    }

    public CborMapWriter map(long length) throws IOException
    {
        return map(Length.definite(length));
    }

    public CborMapWriter map(Length length) throws IOException
    {
        ContainerScope.checkLength(length);
        scope.commit();
        return new CborMapWriter(scope.openChild(ContainerType.MAP, length));
    }

    public ContainerType getContainerType()
    {
        return ContainerType.ARRAY;
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
        return "CborArrayWriter" + scope;
    }
}
