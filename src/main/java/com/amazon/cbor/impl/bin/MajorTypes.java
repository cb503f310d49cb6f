// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.impl.bin;

/**
 * Utility class holding CBOR major types, additional-information values and
 * the fixed initial bytes of RFC 8949.
 */
public final class MajorTypes {
    private MajorTypes() {}

    public static final int UNSIGNED_INTEGER = 0;
    public static final int NEGATIVE_INTEGER = 1;
    public static final int BYTE_STRING = 2;
    public static final int TEXT_STRING = 3;
    public static final int ARRAY = 4;
    public static final int MAP = 5;
    public static final int TAG = 6;
    public static final int SIMPLE_OR_FLOAT = 7;

    // Additional information (low five bits of the initial byte).
    // 0x00-0x17 hold the argument directly.
    public static final int ONE_BYTE_ARGUMENT = 24;
    public static final int TWO_BYTE_ARGUMENT = 25;
    public static final int FOUR_BYTE_ARGUMENT = 26;
    public static final int EIGHT_BYTE_ARGUMENT = 27;
    // 28-30 Reserved
    public static final int INDEFINITE = 31;

    public static final byte FALSE = (byte) 0xF4;
    public static final byte TRUE = (byte) 0xF5;
    public static final byte NULL = (byte) 0xF6;
    public static final byte SIMPLE_VALUE_ONE_BYTE = (byte) 0xF8;
    public static final byte FLOAT_32 = (byte) 0xFA;
    public static final byte FLOAT_64 = (byte) 0xFB;
    public static final byte BREAK = (byte) 0xFF;

    public static final long TAG_DATE_TIME_STRING = 0;
    public static final long TAG_EPOCH_DATE_TIME = 1;
    public static final long TAG_POSITIVE_BIGNUM = 2;
    public static final long TAG_NEGATIVE_BIGNUM = 3;
    public static final long TAG_DECIMAL_FRACTION = 4;
    public static final long TAG_UUID = 37;

    /**
     * @return the initial byte for the given major type and additional information.
     */
    public static byte initialByte(int majorType, int additionalInformation) {
        return (byte) ((majorType << 5) | additionalInformation);
    }
}
