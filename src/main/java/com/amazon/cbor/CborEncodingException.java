// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

/**
 * Signals that a value handed to a {@link PrimitiveEncoder} has no CBOR
 * representation known to that encoder.
 */
public class CborEncodingException extends CborException
{
    private static final long serialVersionUID = 1L;

    private final Class<?> valueType;

    public CborEncodingException(String message, Class<?> valueType)
    {
        super(message);
        this.valueType = valueType;
    }

    /**
     * @return the class of the rejected value; null if the value itself was
     * acceptable but out of range.
     */
    public Class<?> getValueType()
    {
        return valueType;
    }
}
