// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

/**
 * A CBOR simple value (major type 7) other than the ones that map onto
 * Java values directly ({@code false}, {@code true} and {@code null}).
 */
public final class CborSimpleValue
{
    /** Simple value 23, CBOR's {@code undefined}. */
    public static final CborSimpleValue UNDEFINED = new CborSimpleValue(23);

    private final int value;

    private CborSimpleValue(int value)
    {
        this.value = value;
    }

    /**
     * @param value 0 through 19, 23, or 32 through 255. Values 20-22 are
     * reserved for booleans and null, and 24-31 are not valid simple values.
     * @throws IllegalArgumentException if {@code value} is not assignable.
     */
    public static CborSimpleValue of(int value)
    {
        if (value == 23)
        {
            return UNDEFINED;
        }
        if (value < 0 || value > 255 || (value >= 20 && value <= 31))
        {
            throw new IllegalArgumentException("Invalid CBOR simple value: " + value);
        }
        return new CborSimpleValue(value);
    }

    public int getValue()
    {
        return value;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof CborSimpleValue && ((CborSimpleValue) other).value == value;
    }

    @Override
    public int hashCode()
    {
        return value;
    }

    @Override
    public String toString()
    {
        return "simple(" + value + ")";
    }
}
