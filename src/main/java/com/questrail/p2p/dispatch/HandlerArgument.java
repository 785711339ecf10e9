package com.questrail.p2p.dispatch;

/**
 * Value a handler may ask to receive, in the position its {@link ArgumentShape} declares.
 */
public enum HandlerArgument {
    /** The decoded payload, or {@code null} when the package carried none. */
    PAYLOAD,
    /** The logical sender, i.e. the peer's advertised address. */
    SENDER,
    /** The receiving side's view of the session the package belongs to. */
    SESSION
}
