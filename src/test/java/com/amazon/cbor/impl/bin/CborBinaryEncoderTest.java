// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.impl.bin;

import com.amazon.cbor.CborEncodingException;
import com.amazon.cbor.CborSimpleValue;
import com.amazon.cbor.CborTag;
import com.amazon.cbor.ContainerType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.amazon.cbor.TestUtils.byteArrayToHex;
import static com.amazon.cbor.TestUtils.normalizeHex;
import static com.amazon.cbor.TestUtils.textStringHex;

public class CborBinaryEncoderTest {

    private ByteArrayOutputStream out;
    private CborBinaryEncoder encoder;

    @BeforeEach
    public void setup() {
        out = new ByteArrayOutputStream();
        encoder = new CborBinaryEncoder(out);
    }

    /**
     * Checks that encoding the value writes exactly the expected bytes. The
     * expected bytes may be given with or without spaces between octets.
     */
    private void assertEncoding(String expectedBytes, Object value) throws IOException {
        encoder.encode(value);
        Assertions.assertEquals(normalizeHex(expectedBytes), byteArrayToHex(out.toByteArray()));
    }

    @ParameterizedTest
    @CsvSource({
            "                   0, 00",
            "                   1, 01",
            "                  10, 0A",
            "                  23, 17",
            "                  24, 18 18",
            "                  25, 18 19",
            "                 100, 18 64",
            "                 255, 18 FF",
            "                 256, 19 01 00",
            "                1000, 19 03 E8",
            "               65535, 19 FF FF",
            "               65536, 1A 00 01 00 00",
            "             1000000, 1A 00 0F 42 40",
            "          4294967295, 1A FF FF FF FF",
            "          4294967296, 1B 00 00 00 01 00 00 00 00",
            "       1000000000000, 1B 00 00 00 E8 D4 A5 10 00",
            " 9223372036854775807, 1B 7F FF FF FF FF FF FF FF",
            "                  -1, 20",
            "                 -10, 29",
            "                 -24, 37",
            "                 -25, 38 18",
            "                -100, 38 63",
            "                -1000, 39 03 E7",
            "-9223372036854775808, 3B 7F FF FF FF FF FF FF FF",
    })
    public void testEncodeLong(long value, String expectedBytes) throws IOException {
        assertEncoding(expectedBytes, value);
    }

    @Test
    public void testEncodeNarrowIntegers() throws IOException {
        encoder.encode((byte) -1);
        encoder.encode((short) 500);
        encoder.encode(100000);
        Assertions.assertEquals(normalizeHex("20 19 01 F4 1A 00 01 86 A0"), byteArrayToHex(out.toByteArray()));
    }

    @ParameterizedTest
    @CsvSource({
            "  18446744073709551615, 1B FF FF FF FF FF FF FF FF",
            "  18446744073709551616, C2 49 01 00 00 00 00 00 00 00 00",
            " -18446744073709551616, 3B FF FF FF FF FF FF FF FF",
            " -18446744073709551617, C3 49 01 00 00 00 00 00 00 00 00",
            "                    42, 18 2A",
            "                    -1, 20",
    })
    public void testEncodeBigInteger(String value, String expectedBytes) throws IOException {
        assertEncoding(expectedBytes, new BigInteger(value));
    }

    @ParameterizedTest
    @CsvSource({
            "      1.1, FB 3F F1 99 99 99 99 99 9A",
            "   1.0e300, FB 7E 37 E4 3C 88 00 75 9C",
            "     -4.1, FB C0 10 66 66 66 66 66 66",
            "      0.0, FB 00 00 00 00 00 00 00 00",
            " Infinity, FB 7F F0 00 00 00 00 00 00",
    })
    public void testEncodeDouble(double value, String expectedBytes) throws IOException {
        assertEncoding(expectedBytes, value);
    }

    @ParameterizedTest
    @CsvSource({
            " 100000.0, FA 47 C3 50 00",
            "      1.5, FA 3F C0 00 00",
    })
    public void testEncodeFloat(float value, String expectedBytes) throws IOException {
        assertEncoding(expectedBytes, value);
    }

    @Test
    public void testEncodeDecimalFraction() throws IOException {
        // 4([-2, 27315])
        assertEncoding("C4 82 21 19 6A B3", new BigDecimal("273.15"));
    }

    @Test
    public void testEncodeBooleansAndNull() throws IOException {
        encoder.encode(false);
        encoder.encode(true);
        encoder.encode(null);
        encoder.encode(CborSimpleValue.UNDEFINED);
        Assertions.assertEquals("F4 F5 F6 F7", byteArrayToHex(out.toByteArray()));
    }

    @ParameterizedTest
    @CsvSource({
            "  0, E0",
            " 16, F0",
            " 19, F3",
            " 32, F8 20",
            "255, F8 FF",
    })
    public void testEncodeSimpleValue(int value, String expectedBytes) throws IOException {
        assertEncoding(expectedBytes, CborSimpleValue.of(value));
    }

    @Test
    public void testInvalidSimpleValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CborSimpleValue.of(20));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CborSimpleValue.of(24));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CborSimpleValue.of(256));
        Assertions.assertSame(CborSimpleValue.UNDEFINED, CborSimpleValue.of(23));
    }

    @ParameterizedTest
    @CsvSource({
            "'', 60",
            "a, 61 61",
            "IETF, 64 49 45 54 46",
            "ü, 62 C3 BC",
            "水, 63 E6 B0 B4",
            "\"\\, 62 22 5C",
    })
    public void testEncodeText(String value, String expectedBytes) throws IOException {
        assertEncoding(expectedBytes, value);
    }

    @Test
    public void testEncodeCharacter() throws IOException {
        assertEncoding("61 7A", 'z');
    }

    @Test
    public void testEncodeLongText() throws IOException {
        String text = "this text string is longer than twenty-three bytes";
        assertEncoding(textStringHex(text), text);
    }

    @Test
    public void testEncodeByteStrings() throws IOException {
        encoder.encode(new byte[0]);
        encoder.encode(new byte[] { 1, 2, 3, 4 });
        Assertions.assertEquals("40 44 01 02 03 04", byteArrayToHex(out.toByteArray()));
    }

    @Test
    public void testEncodeTag() throws IOException {
        assertEncoding("D8 20 76 68 74 74 70 3A 2F 2F 77 77 77 2E 65 78 61 6D 70 6C 65 2E 63 6F 6D",
            new CborTag(32, "http://www.example.com"));
    }

    @Test
    public void testEncodeUuid() throws IOException {
        assertEncoding("D8 25 50 5E AF FA C8 B5 1E 48 05 81 27 7F DC C7 84 2F AF",
            UUID.fromString("5eaffac8-b51e-4805-8127-7fdcc7842faf"));
    }

    @Test
    public void testEncodeInstantAsString() throws IOException {
        assertEncoding("C0 " + textStringHex("2013-03-21T20:04:00Z"), Instant.parse("2013-03-21T20:04:00Z"));
    }

    @Test
    public void testEncodeOffsetDateTimeKeepsOffset() throws IOException {
        OffsetDateTime dateTime = OffsetDateTime.of(2013, 3, 21, 21, 4, 0, 0, ZoneOffset.ofHours(1));
        assertEncoding("C0 " + textStringHex("2013-03-21T21:04:00+01:00"), dateTime);
    }

    @Test
    public void testEncodeInstantAsTimestamp() throws IOException {
        encoder = new CborBinaryEncoder(out, true, true);
        encoder.encode(Instant.parse("2013-03-21T20:04:00Z"));
        encoder.encode(Instant.parse("2013-03-21T20:04:00.500Z"));
        Assertions.assertEquals(
            normalizeHex("C1 1A 51 4B 67 B0 C1 FB 41 D4 52 D9 EC 20 00 00"),
            byteArrayToHex(out.toByteArray())
        );
    }

    @Test
    public void testEncodeOptional() throws IOException {
        encoder.encode(Optional.empty());
        encoder.encode(Optional.of(1));
        Assertions.assertEquals("F6 01", byteArrayToHex(out.toByteArray()));
    }

    @Test
    public void testEncodeCollections() throws IOException {
        encoder.encode(Collections.emptyList());
        encoder.encode(Arrays.asList(1, Arrays.asList(2, 3), new Object[] { 4, 5 }));
        Assertions.assertEquals("80 83 01 82 02 03 82 04 05", byteArrayToHex(out.toByteArray()));
    }

    @Test
    public void testEncodeLongArrayUsesOneByteLength() throws IOException {
        List<Integer> values = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            values.add(i);
        }
        assertEncoding(
            "98 19 01 02 03 04 05 06 07 08 09 0A 0B 0C 0D 0E 0F 10 11 12 13 14 15 16 17 18 18 18 19",
            values
        );
    }

    @Test
    public void testEncodeMapKeepsIterationOrder() throws IOException {
        Map<Object, Object> map = new LinkedHashMap<>();
        map.put("b", Arrays.asList(2, 3));
        map.put("a", 1);
        assertEncoding("A2 61 62 82 02 03 61 61 01", map);
    }

    @Test
    public void testEncodeUnsupportedType() {
        CborEncodingException e = Assertions.assertThrows(CborEncodingException.class, () -> encoder.encode(new Object()));
        Assertions.assertEquals(Object.class, e.getValueType());
        Assertions.assertEquals(0, out.size());
    }

    @ParameterizedTest
    @CsvSource({
            "  ARRAY,          0, 80",
            "  ARRAY,          3, 83",
            "  ARRAY,         24, 98 18",
            "    MAP,          1, A1",
            "    MAP,        256, B9 01 00",
            "    MAP, 4294967296, BB 00 00 00 01 00 00 00 00",
    })
    public void testEncodeContainerLength(ContainerType type, long length, String expectedBytes) throws IOException {
        encoder.encodeLength(type, length);
        Assertions.assertEquals(normalizeHex(expectedBytes), byteArrayToHex(out.toByteArray()));
        Assertions.assertEquals(normalizeHex(expectedBytes),
            byteArrayToHex(CborBinaryEncoder.encodeLength(type.getMajorType(), length)));
    }

    @Test
    public void testEncodeNegativeContainerLength() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> encoder.encodeLength(ContainerType.ARRAY, -1));
        Assertions.assertEquals(0, out.size());
    }

    @Test
    public void testEncodeIndefiniteAndBreak() throws IOException {
        encoder.encodeIndefinite(ContainerType.ARRAY);
        encoder.encodeIndefinite(ContainerType.MAP);
        encoder.encodeBreak();
        encoder.encodeBreak();
        Assertions.assertEquals("9F BF FF FF", byteArrayToHex(out.toByteArray()));
    }

    @Test
    public void testCloseWithoutClosingStream() throws IOException {
        final boolean[] closed = { false };
        ByteArrayOutputStream stream = new ByteArrayOutputStream() {
            @Override
            public void close() {
                closed[0] = true;
            }
        };
        new CborBinaryEncoder(stream, false, false).close();
        Assertions.assertFalse(closed[0]);
        new CborBinaryEncoder(stream, false, true).close();
        Assertions.assertTrue(closed[0]);
    }

    @Test
    public void testNullStreamIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CborBinaryEncoder(null));
    }
}
