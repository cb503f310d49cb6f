// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor.stream;

import com.amazon.cbor.CborWriterException;
import com.amazon.cbor.ContainerType;
import com.amazon.cbor.Length;
import com.amazon.cbor.PrimitiveEncoder;
import java.io.IOException;

/**
 * Lifecycle of one open container: emits its header on {@link #enter()},
 * tracks remaining capacity while it is open, and emits the break token or
 * validates the element count on {@link #exit()}.
 * <p>
 * A root scope stands for the top level of the stream. It has no header,
 * no capacity and is never exited; it only tracks the nested container
 * currently open beneath it.
 * <p>
 * The writer classes hold a scope and delegate to it; the scope knows
 * nothing about the shape of the values being written.
 */
/*package*/ final class ContainerScope
{
    /*package*/ enum State
    {
        UNOPENED,
        OPEN,
        CLOSED,
    }

    private final PrimitiveEncoder encoder;
    private final ContainerScope parent;
    private final ContainerType type;
    private final Length length;
    /** Null unless the length is definite. */
    private final CapacityCounter capacity;
    /** Only meaningful for a root scope. */
    private final boolean autoFlush;

    private State state;
    private ContainerScope openChild;

    private ContainerScope(PrimitiveEncoder encoder,
                           ContainerScope parent,
                           ContainerType type,
                           Length length,
                           boolean autoFlush)
    {
        this.encoder = encoder;
        this.parent = parent;
        this.type = type;
        this.length = length;
        this.capacity = length.isIndefinite() ? null : new CapacityCounter(type, length.getCount());
        this.autoFlush = autoFlush;
        this.state = State.UNOPENED;
    }

    /**
     * @return an open scope for the top level of a stream.
     */
    static ContainerScope root(PrimitiveEncoder encoder, boolean autoFlush)
    {
        ContainerScope root = new ContainerScope(encoder, null, null, Length.indefinite(), autoFlush);
        root.state = State.OPEN;
        return root;
    }

    /**
     * Rejects a missing length before any slot is committed for it.
     */
    static void checkLength(Length length)
    {
        if (length == null)
        {
            throw new IllegalArgumentException("Length must not be null; use Length.indefinite()");
        }
    }

    PrimitiveEncoder encoder()
    {
        return encoder;
    }

    ContainerType type()
    {
        return type;
    }

    Length length()
    {
        return length;
    }

    State state()
    {
        return state;
    }

    boolean isRoot()
    {
        return parent == null;
    }

    /**
     * @return -1 when unbounded.
     */
    long remainingCapacity()
    {
        return capacity == null ? -1 : capacity.remaining();
    }

    /**
     * @return the number of containers enclosing this one; 0 for the root.
     */
    int depth()
    {
        int depth = 0;
        for (ContainerScope s = parent; s != null; s = s.parent)
        {
            depth++;
        }
        return depth;
    }

    /**
     * @return the innermost scope open beneath this one, or this scope if
     * nothing is open beneath it.
     */
    ContainerScope innermost()
    {
        ContainerScope s = this;
        while (s.openChild != null)
        {
            s = s.openChild;
        }
        return s;
    }

    /**
     * Verifies that a value may be written directly into this scope.
     */
    void checkWritable()
    {
        if (state == State.CLOSED)
        {
            throw CborWriterException.writerClosed();
        }
        if (state != State.OPEN)
        {
            throw new IllegalStateException("Container has not been opened: " + this);
        }
        if (openChild != null)
        {
            throw CborWriterException.nestedContainerOpen(openChild.type);
        }
    }

    /**
     * Consumes one slot for an element or key/value pair, before anything
     * for it reaches the sink.
     */
    void commit()
    {
        checkWritable();
        if (capacity != null)
        {
            capacity.commit();
        }
    }

    /**
     * Opens a nested container in the slot most recently committed, writing
     * its header.
     */
    ContainerScope openChild(ContainerType childType, Length childLength) throws IOException
    {
        checkWritable();
        ContainerScope child = new ContainerScope(encoder, this, childType, childLength, false);
        child.enter();
        openChild = child;
        return child;
    }

    private void enter() throws IOException
    {
        if (length.isIndefinite())
        {
            encoder.encodeIndefinite(type);
        }
        else
        {
            encoder.encodeLength(type, length.getCount());
        }
        state = State.OPEN;
    }

    /**
     * Closes this scope. Indefinite-length containers always get their break
     * token; definite-length containers are checked for missing elements.
     * Nested containers left open are closed first, innermost first, each
     * indefinite one getting its break token.
     * Calling this on a closed scope does nothing.
     *
     * @throws CborWriterException if a nested container was still open, or
     * if a definite-length container is short of elements. This scope is
     * closed in both cases.
     */
    void exit() throws IOException
    {
        if (state == State.CLOSED)
        {
            return;
        }
        if (isRoot())
        {
            throw new IllegalStateException("The top level cannot be exited");
        }
        ContainerType leftOpen = openChild == null ? null : openChild.type;
        closeOpenDescendants();

        state = State.CLOSED;
        parent.openChild = null;

        if (capacity == null)
        {
            encoder.encodeBreak();
        }
        if (leftOpen != null)
        {
            throw CborWriterException.nestedContainerOpen(leftOpen);
        }
        if (capacity != null && capacity.remaining() > 0)
        {
            throw CborWriterException.insufficientElements(type, capacity.declared(), capacity.remaining());
        }
        parent.valueCompleted();
    }

    private void closeOpenDescendants() throws IOException
    {
        ContainerScope s = innermost();
        while (s != this)
        {
            ContainerScope p = s.parent;
            s.state = State.CLOSED;
            p.openChild = null;
            if (s.capacity == null)
            {
                encoder.encodeBreak();
            }
            s = p;
        }
    }

    /**
     * Called after a complete value has been written directly into this
     * scope.
     */
    void valueCompleted() throws IOException
    {
        if (autoFlush && isRoot())
        {
            encoder.flush();
        }
    }

    /**
     * Closes this scope and every scope still open beneath it, without
     * writing anything.
     */
    void abandon()
    {
        for (ContainerScope s = this; s != null; s = s.openChild)
        {
            s.state = State.CLOSED;
        }
    }

    @Override
    public String toString()
    {
        if (isRoot())
        {
            return "(Scope TOP " + state + ")";
        }
        return "(Scope " + type + " " + length + " " + state
            + (capacity == null ? "" : " remaining:" + capacity.remaining()) + ")";
    }
}
