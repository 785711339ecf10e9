package com.questrail.p2p.transport;

import com.questrail.p2p.api.MessagingException;

/**
 * Raised to the sender when an encoded package exceeds the transport's
 * maximum package size. Nothing is written when this is thrown.
 */
public final class PackageTooLargeException extends MessagingException
{
    private final int size;
    private final int maxSize;

    public PackageTooLargeException(int size, int maxSize) {
        super("Encoded package is " + size + " bytes, maximum is " + maxSize);
        this.size = size;
        this.maxSize = maxSize;
    }

    public int size() {
        return size;
    }

    public int maxSize() {
        return maxSize;
    }
}
