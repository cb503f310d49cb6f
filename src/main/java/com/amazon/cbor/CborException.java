// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

/**
 * Base class for exceptions thrown throughout this library.
 */
public class CborException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public CborException(String message)
    {
        super(message);
    }
}
