// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

import java.util.Objects;

/**
 * A semantic tag (major type 6) wrapped around a single data item.
 */
public final class CborTag
{
    private final long tag;
    private final Object value;

    /**
     * @param tag the tag number, treated as unsigned 64-bit.
     * @param value the tagged item; may be null.
     */
    public CborTag(long tag, Object value)
    {
        this.tag = tag;
        this.value = value;
    }

    public long getTag()
    {
        return tag;
    }

    public Object getValue()
    {
        return value;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof CborTag))
        {
            return false;
        }
        CborTag that = (CborTag) other;
        return tag == that.tag && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(tag) * 31 + Objects.hashCode(value);
    }

    @Override
    public String toString()
    {
        return Long.toUnsignedString(tag) + "(" + value + ")";
    }
}
