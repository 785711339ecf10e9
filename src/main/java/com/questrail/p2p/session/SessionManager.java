package com.questrail.p2p.session;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.observability.DropReason;
import com.questrail.p2p.observability.NodeObservabilitySink;
import com.questrail.p2p.observability.PackageDroppedEvent;
import com.questrail.p2p.observability.Slf4jNodeObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntSupplier;

/**
 * SessionManager
 * =============================================================================
 * Allocates session ids and owns the pending-response table that joins an
 * outbound request with its inbound response.
 *
 * <h2>Correlation without polling</h2>
 * Every pending slot carries its own future. A caller in
 * {@link #awaitResponse(int, Duration)} parks on that future only; the receive
 * path calls {@link #resolve(int, byte[], Address)}, which completes it and
 * returns immediately. The receive loop therefore never blocks on correlation,
 * however many requests are outstanding.
 *
 * <h2>Eviction</h2>
 * A slot is removed when its response has been read, when the wait times out,
 * or on explicit {@link #evict(int)}. A response arriving for a removed slot is
 * reported as {@link DropReason#UNKNOWN_SESSION} and dropped; it never
 * resurrects the slot.
 *
 * <h2>Thread safety</h2>
 * The table is a {@link ConcurrentHashMap}; insertion is put-if-absent, so
 * session creation and slot registration are atomic with respect to id
 * collisions.
 */
public final class SessionManager
{
    private final ConcurrentMap<Integer, PendingResponse> pending = new ConcurrentHashMap<>();
    private final IntSupplier idSource;
    private final NodeObservabilitySink sink;

    public SessionManager() {
        this(new Slf4jNodeObservabilitySink());
    }

    public SessionManager(NodeObservabilitySink sink) {
        this(sink, () -> ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE));
    }

    /**
     * @param idSource source of candidate session ids; regenerated on collision
     */
    public SessionManager(NodeObservabilitySink sink, IntSupplier idSource) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.idSource = Objects.requireNonNull(idSource, "idSource");
    }

    // ---------------------------------------------------------------------
    // Session creation
    // ---------------------------------------------------------------------

    /**
     * Creates a REQUEST session whose id is not currently pending.
     */
    public Session createSession() {
        return Session.request(nextFreeId());
    }

    /**
     * Creates an INACTIVE session for fire-and-forget sends.
     */
    public Session createInactiveSession() {
        return Session.inactive(nextFreeId());
    }

    /**
     * Inserts a correlation slot for {@code session}.
     *
     * @throws InvalidSessionStateException if the session is not in REQUEST stage
     * @throws IllegalStateException if a slot with the same id already exists
     */
    public PendingResponse registerPending(Session session, Class<?> expectedType) {
        Objects.requireNonNull(session, "session");
        if (session.stage() != SessionStage.REQUEST) {
            throw new InvalidSessionStateException(
                    "Only REQUEST sessions can await a response (session " + session.id() + " is " + session.stage() + ")");
        }

        PendingResponse slot = new PendingResponse(session, expectedType);
        if (pending.putIfAbsent(session.id(), slot) != null) {
            throw new IllegalStateException("Session " + session.id() + " is already pending");
        }
        return slot;
    }

    /**
     * Creates a REQUEST session and registers its slot in one step.
     */
    public PendingResponse openRequest(Class<?> expectedType) {
        Objects.requireNonNull(expectedType, "expectedType");
        while (true) {
            PendingResponse slot = new PendingResponse(Session.request(idSource.getAsInt()), expectedType);
            if (pending.putIfAbsent(slot.sessionId(), slot) == null) {
                return slot;
            }
        }
    }

    // ---------------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------------

    public boolean resolve(int sessionId, byte[] payload) {
        return resolve(sessionId, payload, null);
    }

    /**
     * Fills the slot for {@code sessionId} and advances its session to RESPONSE.
     *
     * <p>Never throws for unknown or already-resolved sessions: a response may
     * legitimately race a local timeout. Both cases are reported and ignored.</p>
     *
     * @param from responding peer, for diagnostics only; may be null
     * @return {@code true} if this call resolved the slot
     */
    public boolean resolve(int sessionId, byte[] payload, Address from) {
        return resolve(pending.get(sessionId), sessionId, payload, from);
    }

    // Visible for tests.
    boolean resolve(PendingResponse slot, int sessionId, byte[] payload, Address from) {
        if (slot == null) {
            reportUnknown(sessionId, from);
            return false;
        }

        synchronized (slot) {
            // Evicted after the lookup: cancellation also marks the future done.
            if (slot.future().isCancelled() || pending.get(sessionId) != slot) {
                reportUnknown(sessionId, from);
                return false;
            }
            if (slot.isResolved()) {
                sink.onPackageDropped(new PackageDroppedEvent(
                        Instant.now(), DropReason.DUPLICATE_RESPONSE, from,
                        "session " + sessionId + " already resolved", null));
                return false;
            }
            slot.session().processLifecycle();
            return slot.complete(payload);
        }
    }

    // ---------------------------------------------------------------------
    // Waiting
    // ---------------------------------------------------------------------

    /**
     * Parks the calling thread until the slot is filled or {@code timeout} elapses.
     * The slot is evicted on every exit path.
     *
     * @return the response payload bytes (possibly empty)
     * @throws ResponseTimeoutException if no response arrived in time, or the wait was interrupted
     * @throws UnknownSessionException if no slot exists for {@code sessionId}, or it was evicted meanwhile
     */
    public byte[] awaitResponse(int sessionId, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        PendingResponse slot = pending.get(sessionId);
        if (slot == null) {
            throw new UnknownSessionException(sessionId);
        }

        try {
            byte[] bytes = slot.future().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            slot.session().processLifecycle();
            return bytes;
        } catch (TimeoutException e) {
            throw new ResponseTimeoutException(sessionId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResponseTimeoutException(sessionId, timeout, e);
        } catch (CancellationException e) {
            throw new UnknownSessionException(sessionId);
        } catch (ExecutionException e) {
            // Slots are only ever completed normally or cancelled.
            throw new IllegalStateException("Pending response for session " + sessionId + " failed", e.getCause());
        } finally {
            pending.remove(sessionId, slot);
        }
    }

    // ---------------------------------------------------------------------
    // Housekeeping
    // ---------------------------------------------------------------------

    /**
     * Removes the slot for {@code sessionId}; a thread waiting on it is released
     * with {@link UnknownSessionException}.
     *
     * @return {@code true} if a slot was removed
     */
    public boolean evict(int sessionId) {
        PendingResponse slot = pending.remove(sessionId);
        if (slot == null) {
            return false;
        }
        slot.future().cancel(false);
        return true;
    }

    private void reportUnknown(int sessionId, Address from) {
        sink.onPackageDropped(new PackageDroppedEvent(
                Instant.now(), DropReason.UNKNOWN_SESSION, from,
                "unknown session " + sessionId, null));
    }

    public boolean isPending(int sessionId) {
        return pending.containsKey(sessionId);
    }

    public int pendingCount() {
        return pending.size();
    }

    private int nextFreeId() {
        int id = idSource.getAsInt();
        while (pending.containsKey(id)) {
            id = idSource.getAsInt();
        }
        return id;
    }
}
