package com.questrail.p2p.codec;

import com.questrail.p2p.api.MessagingException;

/**
 * Indicates that bytes received from a peer could not be turned back into a
 * package or a typed payload.
 *
 * This typically reflects:
 * <ul>
 *   <li>Corrupt or truncated compressed data</li>
 *   <li>A structurally invalid package document</li>
 *   <li>A payload that does not match the type the receiver expects</li>
 * </ul>
 *
 * On the receive path this is never fatal: the package is dropped and reported.
 */
public final class DecodeException extends MessagingException
{
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
