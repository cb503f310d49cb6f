// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.cbor.CborWriterException;
import com.amazon.cbor.CborWriterException.Reason;
import com.amazon.cbor.ContainerType;
import com.amazon.cbor.Length;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CborMapWriterTest
{
    private RecordingEncoder encoder;
    private CborWriter writer;

    @BeforeEach
    public void setup()
    {
        encoder = new RecordingEncoder();
        writer = new CborWriter(encoder);
    }

    @Test
    public void testPairsKeepSubmissionOrder() throws IOException
    {
        try (CborMapWriter map = writer.map(3))
        {
            map.write("b", 2);
            map.write("a", 1);
            map.write("b", 3);
        }
        encoder.assertEvents(
            "header(MAP,3)",
            "encode(b)", "encode(2)",
            "encode(a)", "encode(1)",
            "encode(b)", "encode(3)");
    }

    @Test
    public void testIndefiniteMap() throws IOException
    {
        try (CborMapWriter map = writer.map())
        {
            assertEquals(-1, map.getRemainingCapacity());
            map.write("a", 1);
            map.write("b", 2);
        }
        encoder.assertEvents("start(MAP)", "encode(a)", "encode(1)", "encode(b)", "encode(2)", "break");
    }

    @Test
    public void testEmptyDefiniteMap() throws IOException
    {
        writer.map(0).close();
        encoder.assertEvents("header(MAP,0)");
    }

    @Test
    public void testCapacityCountsPairs() throws IOException
    {
        CborMapWriter map = writer.map(1);
        assertEquals(1, map.getRemainingCapacity());
        map.write("a", 1);
        assertEquals(0, map.getRemainingCapacity());

        CborWriterException e = assertThrows(CborWriterException.class, () -> map.write("b", 2));
        assertEquals(Reason.CAPACITY_EXCEEDED, e.getReason());
        assertThat(e.getMessage(), containsString("pair"));
        assertThrows(CborWriterException.class, () -> map.array("c"));
        assertThrows(CborWriterException.class, () -> map.map("d", 0));
        map.close();

        // the rejected keys never reached the encoder
        encoder.assertEvents("header(MAP,1)", "encode(a)", "encode(1)");
    }

    @Test
    public void testClosingShortMapFails() throws IOException
    {
        CborMapWriter map = writer.map(2);
        map.write("a", 1);
        CborWriterException e = assertThrows(CborWriterException.class, map::close);
        assertEquals(Reason.INSUFFICIENT_ELEMENTS, e.getReason());
        assertThat(e.getMessage(), containsString("1 pair(s) missing"));
        assertTrue(map.isClosed());
    }

    @Test
    public void testNestedContainersUnderKeys() throws IOException
    {
        try (CborMapWriter map = writer.map(2))
        {
            try (CborArrayWriter values = map.array("list", 2))
            {
                values.write(1);
                values.write(2);
            }
            try (CborMapWriter inner = map.map("inner"))
            {
                inner.write("c", 3);
            }
            assertEquals(0, map.getRemainingCapacity());
        }
        encoder.assertEvents(
            "header(MAP,2)",
            "encode(list)", "header(ARRAY,2)", "encode(1)", "encode(2)",
            "encode(inner)", "start(MAP)", "encode(c)", "encode(3)", "break");
    }

    @Test
    public void testKeyIsWrittenBeforeNestedHeader() throws IOException
    {
        try (CborMapWriter map = writer.map())
        {
            try (CborArrayWriter array = map.array(7, Length.definite(1)))
            {
                encoder.assertEvents("start(MAP)", "encode(7)", "header(ARRAY,1)");
                array.write(true);
            }
            try (CborMapWriter inner = map.map(8, 0))
            {
                assertEquals(ContainerType.MAP, inner.getContainerType());
            }
        }
        encoder.assertEvents(
            "start(MAP)",
            "encode(7)", "header(ARRAY,1)", "encode(true)",
            "encode(8)", "header(MAP,0)",
            "break");
    }

    @Test
    public void testInvalidNestedLengthWritesNoKey() throws IOException
    {
        try (CborMapWriter map = writer.map(1))
        {
            assertThrows(IllegalArgumentException.class, () -> map.array("k", -1));
            assertThrows(IllegalArgumentException.class, () -> map.map("k", (Length) null));
            assertEquals(1, map.getRemainingCapacity());
            map.write("k", "v");
        }
        encoder.assertEvents("header(MAP,1)", "encode(k)", "encode(v)");
    }

    @Test
    public void testWriteAfterCloseFails() throws IOException
    {
        CborMapWriter map = writer.map();
        map.close();
        CborWriterException e = assertThrows(CborWriterException.class, () -> map.write("a", 1));
        assertEquals(Reason.WRITER_CLOSED, e.getReason());
        assertThrows(CborWriterException.class, () -> map.map("b"));
        encoder.assertEvents("start(MAP)", "break");
    }
}
