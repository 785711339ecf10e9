package com.questrail.p2p.session;

/**
 * Lifecycle stage of a request/response session.
 *
 * <pre>
 *   REQUEST → RESPONSE → CONSUMED
 *   INACTIVE                        (fire-and-forget, terminal from creation)
 * </pre>
 *
 * Only {@link #REQUEST}, {@link #RESPONSE} and {@link #INACTIVE} ever travel
 * on the wire; {@link #CONSUMED} is local bookkeeping.
 */
public enum SessionStage
{
    REQUEST,
    RESPONSE,
    CONSUMED,
    INACTIVE;

    public boolean isTerminal() {
        return this == CONSUMED || this == INACTIVE;
    }

    /**
     * Returns the stage that follows this one.
     *
     * @throws InvalidSessionStateException if this stage is terminal
     */
    public SessionStage next() {
        return switch (this) {
            case REQUEST -> RESPONSE;
            case RESPONSE -> CONSUMED;
            case CONSUMED, INACTIVE -> throw new InvalidSessionStateException(
                    "Stage " + this + " is terminal and cannot advance");
        };
    }
}
