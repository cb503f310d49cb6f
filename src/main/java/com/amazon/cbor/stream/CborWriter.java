// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.CborWriterException;
import com.amazon.cbor.ContainerType;
import com.amazon.cbor.Length;
import com.amazon.cbor.PrimitiveEncoder;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * Entry point for streaming CBOR output. Writes any number of independent
 * top-level data items, each of which may be a scalar, a complete Java
 * value, or a container built incrementally through the writers returned by
 * {@link #array()} and {@link #map()}.
 * <p>
 * Nested containers are written as soon as they are produced and are never
 * held in memory. Definite-length containers are checked to receive exactly
 * the declared number of items:
 * <pre>
 * try (CborWriter writer = new CborWriter(encoder)) {
 *     try (CborMapWriter map = writer.map(2)) {
 *         map.write("id", 17);
 *         try (CborArrayWriter tags = map.array("tags")) {
 *             for (String label : labels) {
 *                 tags.write(label);
 *             }
 *         }
 *     }
 * }
 * </pre>
 * If the body of a try-with-resources block fails, the container is still
 * closed; a failure from closing it is attached to the original exception
 * as suppressed. After any failure the output is incomplete and should be
 * discarded.
 * <p>
 * <b>Instances of this class are not safe for use by multiple threads.</b>
 *
 * @see com.amazon.cbor.system.CborWriterBuilder
 */
public final class CborWriter implements CborSequenceWriter, Flushable, Closeable
{
    private final PrimitiveEncoder encoder;
    private final ContainerScope root;

    /**
     * @param encoder receives every encoding call; closed along with this
     * writer.
     */
    public CborWriter(PrimitiveEncoder encoder)
    {
        this(encoder, false);
    }

    /**
     * @param autoFlush whether to flush the encoder after every complete
     * top-level data item.
     */
    public CborWriter(PrimitiveEncoder encoder, boolean autoFlush)
    {
        if (encoder == null)
        {
            throw new IllegalArgumentException("Cannot construct a writer with a null encoder.");
        }
        this.encoder = encoder;
        this.root = ContainerScope.root(encoder, autoFlush);
    }

    public void write(Object value) throws IOException
    {
        root.checkWritable();
        encoder.encode(value);
        root.valueCompleted();
    }

    public CborArrayWriter array() throws IOException
    {
        return array(Length.indefinite());
    }

    public CborArrayWriter array(long length) throws IOException
    {
        return array(Length.definite(length));
    }

    public CborArrayWriter array(Length length) throws IOException
    {
        ContainerScope.checkLength(length);
        return new CborArrayWriter(root.openChild(ContainerType.ARRAY, length));
    }

    public CborMapWriter map() throws IOException
    {
        return map(Length.indefinite());
    }

    public CborMapWriter map(long length) throws IOException
    {
        return map(Length.definite(length));
    }

    public CborMapWriter map(Length length) throws IOException
    {
        ContainerScope.checkLength(length);
        return new CborMapWriter(root.openChild(ContainerType.MAP, length));
    }

    /**
     * @return true if a container is open, i.e. the next value written will
     * not be a top-level value.
     */
    public boolean isInContainer()
    {
        return root.innermost() != root;
    }

    /**
     * @return the number of containers currently open.
     */
    public int getDepth()
    {
        return root.innermost().depth();
    }

    public boolean isClosed()
    {
        return root.state() == ContainerScope.State.CLOSED;
    }

    public void flush() throws IOException
    {
        encoder.flush();
    }

    /**
     * Verifies that every container has been closed and flushes the encoder.
     * More top-level values may be written afterwards.
     *
     * @throws CborWriterException if a container is still open.
     */
    public void finish() throws IOException
    {
        if (isClosed())
        {
            return;
        }
        ContainerScope innermost = root.innermost();
        if (innermost != root)
        {
            throw CborWriterException.nestedContainerOpen(innermost.type());
        }
        encoder.flush();
    }

    /**
     * Finishes the stream and closes the encoder. The encoder is closed even
     * if a container was left open, in which case the
     * {@link CborWriterException} from {@link #finish()} is rethrown
     * afterwards. Any further use of this writer or the writers it produced
     * fails.
     */
    public void close() throws IOException
    {
        if (isClosed())
        {
            return;
        }
        Exception pending = null;
        try
        {
            finish();
        }
        catch (RuntimeException | IOException e)
        {
            pending = e;
            throw e;
        }
        finally
        {
            root.abandon();
            try
            {
                encoder.close();
            }
            catch (IOException e)
            {
                if (pending == null)
                {
                    throw e;
                }
                pending.addSuppressed(e);
            }
        }
    }
}
