// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.system;

import com.amazon.cbor.PrimitiveEncoder;
import com.amazon.cbor.impl.bin.CborBinaryEncoder;
import com.amazon.cbor.stream.CborWriter;
import java.io.BufferedOutputStream;
import java.io.OutputStream;

/**
 * The builder for creating {@link CborWriter}s and the
 * {@link PrimitiveEncoder}s underneath them.
 * <p>
 * Builders may be configured once and reused to construct multiple
 * objects.
 * <p>
 * <b>Instances of this class are not safe for use by multiple threads
 * unless they are {@linkplain #immutable() immutable}.</b>
 * <p>
 * The most general and correct approach is to use the {@link #standard()}
 * builder:
 * <pre>
 *     CborWriter w = CborWriterBuilder.standard().withAutoFlushEnabled(true).build(out);
 * </pre>
 * Configuration properties follow the standard JavaBeans idiom in order to be
 * friendly to dependency injection systems. They also provide alternative
 * mutation methods that enable a more fluid style.
 */
public class CborWriterBuilder
{
    public static final int DEFAULT_BUFFER_SIZE = 8192;
    // Room for the largest data item head plus some payload.
    public static final int MINIMUM_BUFFER_SIZE = 16;
    public static final int MAXIMUM_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private boolean autoFlushEnabled;
    private boolean closeOutputStream = true;
    private boolean datetimeAsTimestamp;

    /**
     * @return a new mutable builder.
     */
    public static CborWriterBuilder standard()
    {
        return new CborWriterBuilder.Mutable();
    }

    private CborWriterBuilder()
    {
    }

    private CborWriterBuilder(CborWriterBuilder that)
    {
        this.bufferSize          = that.bufferSize;
        this.autoFlushEnabled    = that.autoFlushEnabled;
        this.closeOutputStream   = that.closeOutputStream;
        this.datetimeAsTimestamp = that.datetimeAsTimestamp;
    }


    //=========================================================================

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public final CborWriterBuilder copy()
    {
        return new Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this instance, if immutable;
     * otherwise an immutable copy of this instance.
     */
    public CborWriterBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public CborWriterBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================

    /**
     * Gets the size of the buffer between the encoder and the output
     * stream.
     *
     * @see #setBufferSize(int)
     * @see #withBufferSize(int)
     */
    public int getBufferSize()
    {
        return bufferSize;
    }

    /**
     * Sets the size of the buffer between the encoder and the output
     * stream.
     *
     * @param size the buffer size in bytes. If unset, the default of 8192
     * bytes is used.
     *
     * @throws IllegalArgumentException if the size is out of range.
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setBufferSize(int size)
    {
        mutationCheck();
        if (size < MINIMUM_BUFFER_SIZE || size > MAXIMUM_BUFFER_SIZE)
        {
            throw new IllegalArgumentException(
                String.format("Buffer size must be between %d and %d bytes.", MINIMUM_BUFFER_SIZE, MAXIMUM_BUFFER_SIZE)
            );
        }
        bufferSize = size;
    }

    /**
     * Declares the size of the buffer between the encoder and the output
     * stream, returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public final CborWriterBuilder withBufferSize(int size)
    {
        CborWriterBuilder b = mutable();
        b.setBufferSize(size);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Gets whether built writers flush after each complete top-level data
     * item. By default, this property is false.
     */
    public boolean isAutoFlushEnabled()
    {
        return autoFlushEnabled;
    }

    /**
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setAutoFlushEnabled(boolean autoFlushEnabled)
    {
        mutationCheck();
        this.autoFlushEnabled = autoFlushEnabled;
    }

    /**
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public final CborWriterBuilder withAutoFlushEnabled(boolean autoFlushEnabled)
    {
        CborWriterBuilder b = mutable();
        b.setAutoFlushEnabled(autoFlushEnabled);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Gets whether closing a built writer closes the output stream it
     * writes to. By default, this property is true.
     */
    public boolean isCloseOutputStream()
    {
        return closeOutputStream;
    }

    /**
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setCloseOutputStream(boolean closeOutputStream)
    {
        mutationCheck();
        this.closeOutputStream = closeOutputStream;
    }

    /**
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public final CborWriterBuilder withCloseOutputStream(boolean closeOutputStream)
    {
        CborWriterBuilder b = mutable();
        b.setCloseOutputStream(closeOutputStream);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Gets whether date/time values are written as tag 1 epoch-based
     * timestamps instead of tag 0 date/time strings. By default, this
     * property is false.
     */
    public boolean isDatetimeAsTimestamp()
    {
        return datetimeAsTimestamp;
    }

    /**
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setDatetimeAsTimestamp(boolean datetimeAsTimestamp)
    {
        mutationCheck();
        this.datetimeAsTimestamp = datetimeAsTimestamp;
    }

    /**
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public final CborWriterBuilder withDatetimeAsTimestamp(boolean datetimeAsTimestamp)
    {
        CborWriterBuilder b = mutable();
        b.setDatetimeAsTimestamp(datetimeAsTimestamp);
        return b;
    }


    //=========================================================================

    /**
     * Builds a new encoder based on this builder's configuration
     * properties.
     *
     * @param out the stream that will receive CBOR data.
     * Must not be null.
     *
     * @return a new {@link PrimitiveEncoder} instance; not {@code null}.
     */
    public PrimitiveEncoder buildEncoder(OutputStream out)
    {
        if (out == null)
        {
            throw new IllegalArgumentException("Cannot construct an encoder with a null OutputStream.");
        }
        return new CborBinaryEncoder(
            new BufferedOutputStream(out, bufferSize),
            datetimeAsTimestamp,
            closeOutputStream
        );
    }

    /**
     * Builds a new writer based on this builder's configuration
     * properties.
     *
     * @param out the stream that will receive CBOR data.
     * Must not be null.
     *
     * @return a new {@link CborWriter} instance; not {@code null}.
     */
    public CborWriter build(OutputStream out)
    {
        return new CborWriter(buildEncoder(out), autoFlushEnabled);
    }


    //=========================================================================

    private static final class Mutable extends CborWriterBuilder
    {
        private Mutable() { }

        private Mutable(CborWriterBuilder that)
        {
            super(that);
        }

        @Override
        public CborWriterBuilder immutable()
        {
            return new CborWriterBuilder(this);
        }

        @Override
        public CborWriterBuilder mutable()
        {
            return this;
        }

        @Override
        protected void mutationCheck()
        {
        }
    }
}
