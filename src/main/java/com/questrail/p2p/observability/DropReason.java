package com.questrail.p2p.observability;

/**
 * Why an inbound package was discarded.
 */
public enum DropReason {
    /** Bytes did not decompress or decode into a package, or a payload did not bind. */
    DECODE_FAILED,
    /** Frame exceeded the transport's maximum package size, or was truncated. */
    OVERSIZED,
    /** No handler registered for the package's topic and type. */
    UNKNOWN_HANDLER,
    /** Response for a session that is not (or no longer) pending. */
    UNKNOWN_SESSION,
    /** Second response for a session that was already resolved. */
    DUPLICATE_RESPONSE,
    /** The handler threw. */
    HANDLER_FAILED,
    /** An after-receive hook threw. */
    HOOK_FAILED,
    /** A package arrived before a processor was installed. */
    NOT_LISTENING
}
