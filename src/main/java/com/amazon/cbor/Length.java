// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

import java.math.BigInteger;

/**
 * The declared size of a CBOR container: either a definite count of
 * elements (or key/value pairs, for maps) announced in the container's
 * header, or indefinite, in which case the container is closed by a break
 * token.
 * <p>
 * Instances are immutable.
 */
public final class Length
{
    private static final Length INDEFINITE = new Length(-1);

    private static final Length[] SMALL = new Length[24];
    static
    {
        for (int i = 0; i < SMALL.length; i++)
        {
            SMALL[i] = new Length(i);
        }
    }

    /** -1 when indefinite. */
    private final long count;

    private Length(long count)
    {
        this.count = count;
    }

    /**
     * @return the length of a container terminated by a break token.
     */
    public static Length indefinite()
    {
        return INDEFINITE;
    }

    /**
     * @param count the number of elements (or pairs) the container will hold.
     * @throws IllegalArgumentException if {@code count} is negative.
     */
    public static Length definite(long count)
    {
        if (count < 0)
        {
            throw new IllegalArgumentException(
                "Length must be a non-negative integer or indefinite, got " + count);
        }
        if (count < SMALL.length)
        {
            return SMALL[(int) count];
        }
        return new Length(count);
    }

    /**
     * Converts an optional integral count into a length.
     *
     * @param count null for an indefinite length; otherwise an integral,
     * non-negative number that fits in a {@code long}.
     * @throws IllegalArgumentException if {@code count} is negative, too
     * large, or not of an integral type. Integral-valued floating point
     * numbers such as {@code 3.0} are rejected too.
     */
    public static Length of(Number count)
    {
        if (count == null)
        {
            return INDEFINITE;
        }
        if (count instanceof Long || count instanceof Integer
            || count instanceof Short || count instanceof Byte)
        {
            return definite(count.longValue());
        }
        if (count instanceof BigInteger)
        {
            BigInteger big = (BigInteger) count;
            if (big.bitLength() > 63)
            {
                throw new IllegalArgumentException(
                    "Length must be a non-negative integer or indefinite, got " + big);
            }
            return definite(big.longValue());
        }
        throw new IllegalArgumentException(
            "Length must be a non-negative integer or indefinite, got "
                + count.getClass().getSimpleName() + " " + count);
    }

    public boolean isIndefinite()
    {
        return count < 0;
    }

    /**
     * @return the declared count.
     * @throws IllegalStateException if this length is indefinite.
     */
    public long getCount()
    {
        if (count < 0)
        {
            throw new IllegalStateException("Indefinite lengths have no count");
        }
        return count;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Length && ((Length) other).count == count;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(count);
    }

    @Override
    public String toString()
    {
        return count < 0 ? "indefinite" : "definite(" + count + ")";
    }
}
