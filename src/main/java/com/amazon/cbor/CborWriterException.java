// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.cbor;

/**
 * Thrown when a streaming writer is driven in a way that would produce
 * malformed CBOR: too many or too few items in a definite-length container,
 * writes after a container was closed, or writes to a container while one of
 * its nested containers is still open.
 * <p>
 * These errors indicate misuse of the writer rather than a transient
 * condition. The underlying sink has usually been partially written and
 * should be discarded.
 */
public class CborWriterException extends CborException
{
    private static final long serialVersionUID = 1L;

    public enum Reason
    {
        CAPACITY_EXCEEDED("capacity exceeded"),
        INSUFFICIENT_ELEMENTS("insufficient elements"),
        WRITER_CLOSED("writer is closed"),
        NESTED_CONTAINER_OPEN("nested container is still open");

        private final String description;

        private Reason(String description)
        {
            this.description = description;
        }

        public String getDescription()
        {
            return description;
        }
    }

    private final Reason reason;

    public CborWriterException(Reason reason, String detail)
    {
        super(detail == null ? reason.getDescription() : reason.getDescription() + ": " + detail);
        this.reason = reason;
    }

    public Reason getReason()
    {
        return reason;
    }

    public static CborWriterException capacityExceeded(ContainerType type, long declared)
    {
        return new CborWriterException(Reason.CAPACITY_EXCEEDED,
            type + " of length " + declared + " cannot accept another "
                + (type == ContainerType.MAP ? "pair" : "element"));
    }

    public static CborWriterException insufficientElements(ContainerType type, long declared, long remaining)
    {
        return new CborWriterException(Reason.INSUFFICIENT_ELEMENTS,
            type + " of length " + declared + " closed with " + remaining + " "
                + (type == ContainerType.MAP ? "pair(s)" : "element(s)") + " missing");
    }

    public static CborWriterException writerClosed()
    {
        return new CborWriterException(Reason.WRITER_CLOSED, null);
    }

    public static CborWriterException nestedContainerOpen(ContainerType nested)
    {
        return new CborWriterException(Reason.NESTED_CONTAINER_OPEN,
            "close the nested " + nested + " first");
    }
}
