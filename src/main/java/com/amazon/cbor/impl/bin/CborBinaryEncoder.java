// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.impl.bin;

import com.amazon.cbor.CborEncodingException;
import com.amazon.cbor.CborSimpleValue;
import com.amazon.cbor.CborTag;
import com.amazon.cbor.ContainerType;
import com.amazon.cbor.PrimitiveEncoder;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.amazon.cbor.impl.bin.MajorTypes.*;
import static java.lang.Double.doubleToRawLongBits;
import static java.lang.Float.floatToRawIntBits;

/**
 * Writes RFC 8949 encoded data items to an {@link OutputStream}.
 * <p>
 * Java collections, arrays and maps are written as definite-length
 * containers in their iteration order; no canonical ordering is applied.
 * Callers that need indefinite-length or incrementally produced containers
 * should use the streaming writers instead.
 */
public class CborBinaryEncoder implements PrimitiveEncoder {

    private final OutputStream out;
    private final boolean datetimeAsTimestamp;
    private final boolean closeOutputStream;
    private final byte[] scratch = new byte[9];
    private boolean closed;

    /**
     * @param out the sink; must not be null.
     * @param datetimeAsTimestamp whether date/times are written as tag 1
     * epoch seconds rather than tag 0 strings.
     * @param closeOutputStream whether {@link #close()} closes {@code out}.
     */
    public CborBinaryEncoder(OutputStream out, boolean datetimeAsTimestamp, boolean closeOutputStream) {
        if (out == null) {
            throw new IllegalArgumentException("Cannot construct an encoder with a null OutputStream.");
        }
        this.out = out;
        this.datetimeAsTimestamp = datetimeAsTimestamp;
        this.closeOutputStream = closeOutputStream;
    }

    public CborBinaryEncoder(OutputStream out) {
        this(out, false, true);
    }

    /**
     * Encodes the head of a data item into a new array.
     *
     * @param majorType 0 through 7.
     * @param length the argument, treated as unsigned 64-bit.
     * @return the one to nine bytes of the head.
     */
    public static byte[] encodeLength(int majorType, long length) {
        byte[] head = new byte[9];
        int size = writeHead(head, majorType, length);
        byte[] result = new byte[size];
        System.arraycopy(head, 0, result, 0, size);
        return result;
    }

    /**
     * Writes the head into {@code dest}, which must have room for nine bytes.
     * @return the number of bytes written.
     */
    static int writeHead(byte[] dest, int majorType, long argument) {
        if (Long.compareUnsigned(argument, ONE_BYTE_ARGUMENT) < 0) {
            dest[0] = initialByte(majorType, (int) argument);
            return 1;
        }
        if (Long.compareUnsigned(argument, 0xFFL) <= 0) {
            dest[0] = initialByte(majorType, ONE_BYTE_ARGUMENT);
            dest[1] = (byte) argument;
            return 2;
        }
        if (Long.compareUnsigned(argument, 0xFFFFL) <= 0) {
            dest[0] = initialByte(majorType, TWO_BYTE_ARGUMENT);
            writeBigEndian(dest, 1, argument, 2);
            return 3;
        }
        if (Long.compareUnsigned(argument, 0xFFFFFFFFL) <= 0) {
            dest[0] = initialByte(majorType, FOUR_BYTE_ARGUMENT);
            writeBigEndian(dest, 1, argument, 4);
            return 5;
        }
        dest[0] = initialByte(majorType, EIGHT_BYTE_ARGUMENT);
        writeBigEndian(dest, 1, argument, 8);
        return 9;
    }

    private static void writeBigEndian(byte[] dest, int offset, long value, int numBytes) {
        for (int i = numBytes - 1; i >= 0; i--) {
            dest[offset + i] = (byte) value;
            value >>>= 8;
        }
    }

    private void writeHead(int majorType, long argument) throws IOException {
        int size = writeHead(scratch, majorType, argument);
        out.write(scratch, 0, size);
    }

    @Override
    public void encodeLength(ContainerType type, long length) throws IOException {
        if (length < 0) {
            throw new IllegalArgumentException("Container length must not be negative: " + length);
        }
        writeHead(type.getMajorType(), length);
    }

    @Override
    public void encodeIndefinite(ContainerType type) throws IOException {
        out.write(initialByte(type.getMajorType(), INDEFINITE));
    }

    @Override
    public void encodeBreak() throws IOException {
        out.write(BREAK);
    }

    @Override
    public void encode(Object value) throws IOException {
        if (value == null) {
            out.write(NULL);
        } else if (value instanceof Boolean) {
            out.write((Boolean) value ? TRUE : FALSE);
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            writeInteger(((Number) value).longValue());
        } else if (value instanceof BigInteger) {
            writeBigInteger((BigInteger) value);
        } else if (value instanceof Double) {
            writeDouble((Double) value);
        } else if (value instanceof Float) {
            writeFloat((Float) value);
        } else if (value instanceof BigDecimal) {
            writeDecimalFraction((BigDecimal) value);
        } else if (value instanceof String) {
            writeText((String) value);
        } else if (value instanceof Character) {
            writeText(value.toString());
        } else if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            writeHead(BYTE_STRING, bytes.length);
            out.write(bytes);
        } else if (value instanceof CborSimpleValue) {
            writeSimpleValue(((CborSimpleValue) value).getValue());
        } else if (value instanceof CborTag) {
            CborTag tag = (CborTag) value;
            writeHead(TAG, tag.getTag());
            encode(tag.getValue());
        } else if (value instanceof UUID) {
            writeUuid((UUID) value);
        } else if (value instanceof Instant) {
            writeInstant((Instant) value, null);
        } else if (value instanceof OffsetDateTime) {
            OffsetDateTime dateTime = (OffsetDateTime) value;
            writeInstant(dateTime.toInstant(), dateTime);
        } else if (value instanceof Optional) {
            encode(((Optional<?>) value).orElse(null));
        } else if (value instanceof Collection) {
            Collection<?> elements = (Collection<?>) value;
            writeHead(ARRAY, elements.size());
            for (Object element : elements) {
                encode(element);
            }
        } else if (value instanceof Object[]) {
            Object[] elements = (Object[]) value;
            writeHead(ARRAY, elements.length);
            for (Object element : elements) {
                encode(element);
            }
        } else if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            writeHead(MAP, map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                encode(entry.getKey());
                encode(entry.getValue());
            }
        } else {
            throw new CborEncodingException(
                "Cannot encode value of type " + value.getClass().getName(), value.getClass());
        }
    }

    private void writeInteger(long value) throws IOException {
        if (value >= 0) {
            writeHead(UNSIGNED_INTEGER, value);
        } else {
            // -1 - value, which cannot overflow
            writeHead(NEGATIVE_INTEGER, ~value);
        }
    }

    private void writeBigInteger(BigInteger value) throws IOException {
        boolean negative = value.signum() < 0;
        BigInteger magnitude = negative ? value.not() : value;
        if (magnitude.bitLength() <= 64) {
            writeHead(negative ? NEGATIVE_INTEGER : UNSIGNED_INTEGER, magnitude.longValue());
            return;
        }
        writeHead(TAG, negative ? TAG_NEGATIVE_BIGNUM : TAG_POSITIVE_BIGNUM);
        byte[] bytes = magnitude.toByteArray();
        // toByteArray() is two's complement; drop the sign byte.
        int offset = bytes[0] == 0 ? 1 : 0;
        writeHead(BYTE_STRING, bytes.length - offset);
        out.write(bytes, offset, bytes.length - offset);
    }

    private void writeDouble(double value) throws IOException {
        scratch[0] = FLOAT_64;
        writeBigEndian(scratch, 1, doubleToRawLongBits(value), 8);
        out.write(scratch, 0, 9);
    }

    private void writeFloat(float value) throws IOException {
        scratch[0] = FLOAT_32;
        writeBigEndian(scratch, 1, floatToRawIntBits(value), 4);
        out.write(scratch, 0, 5);
    }

    private void writeDecimalFraction(BigDecimal value) throws IOException {
        writeHead(TAG, TAG_DECIMAL_FRACTION);
        writeHead(ARRAY, 2);
        writeInteger(-(long) value.scale());
        writeBigInteger(value.unscaledValue());
    }

    private void writeText(String value) throws IOException {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        writeHead(TEXT_STRING, utf8.length);
        out.write(utf8);
    }

    private void writeSimpleValue(int value) throws IOException {
        if (value < ONE_BYTE_ARGUMENT) {
            out.write(initialByte(SIMPLE_OR_FLOAT, value));
        } else {
            scratch[0] = SIMPLE_VALUE_ONE_BYTE;
            scratch[1] = (byte) value;
            out.write(scratch, 0, 2);
        }
    }

    private void writeUuid(UUID value) throws IOException {
        writeHead(TAG, TAG_UUID);
        writeHead(BYTE_STRING, 16);
        byte[] bytes = new byte[16];
        writeBigEndian(bytes, 0, value.getMostSignificantBits(), 8);
        writeBigEndian(bytes, 8, value.getLeastSignificantBits(), 8);
        out.write(bytes);
    }

    /**
     * @param original the zoned value the instant came from, used to keep
     * its offset in the string form; null to render in UTC.
     */
    private void writeInstant(Instant instant, OffsetDateTime original) throws IOException {
        if (datetimeAsTimestamp) {
            writeHead(TAG, TAG_EPOCH_DATE_TIME);
            if (instant.getNano() == 0) {
                writeInteger(instant.getEpochSecond());
            } else {
                writeDouble(instant.getEpochSecond() + instant.getNano() / 1e9);
            }
        } else {
            writeHead(TAG, TAG_DATE_TIME_STRING);
            writeText(original == null
                ? DateTimeFormatter.ISO_INSTANT.format(instant)
                : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(original));
        }
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (closeOutputStream) {
            out.close();
        } else {
            out.flush();
        }
    }
}
