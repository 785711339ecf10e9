package com.questrail.p2p.session;

/**
 * Session
 * -----------------------------------------------------------------------------
 * Correlation token joining an outbound request to its eventual response.
 *
 * <h2>Stage invariant</h2>
 * The stage only moves forward, {@code REQUEST → RESPONSE → CONSUMED}, or is
 * {@code INACTIVE} from creation. {@code CONSUMED} and {@code INACTIVE} are
 * terminal: {@link #processLifecycle()} on them throws
 * {@link InvalidSessionStateException} and leaves the stage unchanged.
 *
 * <p>Instances are shared between the caller awaiting a response and the
 * thread that resolves it, so stage access is synchronized.</p>
 */
public final class Session
{
    private final int id;
    private SessionStage stage;

    Session(int id, SessionStage stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage must not be null");
        }
        this.id = id;
        this.stage = stage;
    }

    /**
     * A fresh request session, as created by the requesting side.
     */
    public static Session request(int id) {
        return new Session(id, SessionStage.REQUEST);
    }

    public static Session inactive(int id) {
        return new Session(id, SessionStage.INACTIVE);
    }

    /**
     * Rebuilds the receiving side's view of a session from wire metadata.
     *
     * @throws InvalidSessionStateException for {@link SessionStage#CONSUMED}, which never travels
     */
    public static Session fromWire(int id, SessionStage stage) {
        if (stage == SessionStage.CONSUMED) {
            throw new InvalidSessionStateException("Session " + id + " arrived in stage CONSUMED");
        }
        return new Session(id, stage);
    }

    public int id() {
        return id;
    }

    public synchronized SessionStage stage() {
        return stage;
    }

    /**
     * Advances to the next stage.
     *
     * @return the new stage
     * @throws InvalidSessionStateException if the session is CONSUMED or INACTIVE
     */
    public synchronized SessionStage processLifecycle() {
        if (stage == SessionStage.CONSUMED) {
            throw new InvalidSessionStateException("Session " + id + " is consumed; unable to switch stage");
        }
        if (stage == SessionStage.INACTIVE) {
            throw new InvalidSessionStateException("Session " + id + " is inactive; unable to switch stage");
        }
        stage = stage.next();
        return stage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "Session[id=" + id + ", stage=" + stage() + "]";
    }
}
