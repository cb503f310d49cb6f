// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

/**
 * The two kinds of CBOR data item that hold other data items.
 */
public enum ContainerType
{
    /** Major type 4; holds a sequence of data items. */
    ARRAY(4),
    /** Major type 5; holds a flat sequence of alternating keys and values. */
    MAP(5);

    private final int majorType;

    private ContainerType(int majorType)
    {
        this.majorType = majorType;
    }

    /**
     * @return the CBOR major type number, 0 through 7.
     */
    public int getMajorType()
    {
        return majorType;
    }
}
