package com.questrail.p2p.session;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Correlation slot for one outstanding request.
 *
 * <p>Created together with its {@link Session}, filled at most once when the
 * correlated response arrives, and removed by {@link SessionManager} when read
 * or timed out. Each slot carries its own future, so waiting on one session
 * never contends with another.</p>
 */
public final class PendingResponse
{
    private final Session session;
    private final Class<?> expectedType;
    private final CompletableFuture<byte[]> payload = new CompletableFuture<>();

    PendingResponse(Session session, Class<?> expectedType) {
        this.session = Objects.requireNonNull(session, "session");
        this.expectedType = Objects.requireNonNull(expectedType, "expectedType");
    }

    public int sessionId() {
        return session.id();
    }

    public Session session() {
        return session;
    }

    public Class<?> expectedType() {
        return expectedType;
    }

    public boolean isResolved() {
        return payload.isDone();
    }

    /**
     * @return {@code true} if this call filled the slot, {@code false} if it was already filled
     */
    boolean complete(byte[] bytes) {
        return payload.complete(bytes == null ? new byte[0] : bytes.clone());
    }

    CompletableFuture<byte[]> future() {
        return payload;
    }

    @Override
    public String toString() {
        return "PendingResponse[session=" + session.id() +
                ", expectedType=" + expectedType.getSimpleName() +
                ", resolved=" + isResolved() + "]";
    }
}
