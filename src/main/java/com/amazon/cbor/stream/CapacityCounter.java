// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.CborWriterException;
import com.amazon.cbor.ContainerType;

/**
 * Remaining number of commits a definite-length container may accept.
 * Never negative.
 */
/*package*/ final class CapacityCounter
{
    private final ContainerType type;
    private final long declared;
    private long remaining;

    CapacityCounter(ContainerType type, long declared)
    {
        this.type = type;
        this.declared = declared;
        this.remaining = declared;
    }

    /**
     * Consumes one slot.
     * @throws CborWriterException if no slot is left; the counter is unchanged.
     */
    void commit()
    {
        if (remaining == 0)
        {
            throw CborWriterException.capacityExceeded(type, declared);
        }
        remaining--;
    }

    long remaining()
    {
        return remaining;
    }

    long declared()
    {
        return declared;
    }

    @Override
    public String toString()
    {
        return remaining + "/" + declared;
    }
}
