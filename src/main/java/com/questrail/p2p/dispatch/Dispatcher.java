package com.questrail.p2p.dispatch;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.api.Message;
import com.questrail.p2p.codec.DecodeException;
import com.questrail.p2p.codec.PayloadCodec;
import com.questrail.p2p.model.Package;
import com.questrail.p2p.model.PackageMetadata;
import com.questrail.p2p.observability.DropReason;
import com.questrail.p2p.observability.NodeErrorEvent;
import com.questrail.p2p.observability.NodeObservabilitySink;
import com.questrail.p2p.observability.PackageDroppedEvent;
import com.questrail.p2p.session.Session;
import com.questrail.p2p.session.SessionManager;
import com.questrail.p2p.session.SessionStage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatcher
 * =============================================================================
 * Routes decoded inbound packages either to the {@link SessionManager} (responses)
 * or to a registered handler (requests and one-way messages).
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   Package (RESPONSE)          → SessionManager.resolve(...)       → no reply
 *   Package (REQUEST/INACTIVE)  → HandlerRegistry.lookup(...)
 *                                   → argument binding (per shape)
 *                                       → handler, on the handler executor
 *                                           → reply Message (REQUEST only)
 * </pre>
 *
 * <h2>Threading</h2>
 * {@link #dispatch(Package, Address)} is called on a transport receive loop and
 * never runs user code there. Handlers are invoked on the injected executor;
 * the returned stage completes on that executor.
 *
 * <h2>Failure policy</h2>
 * Nothing thrown by a handler, or by payload decoding, escapes. Each failure is
 * reported as a {@link PackageDroppedEvent} and the stage completes empty, so
 * the requester eventually times out.
 */
public final class Dispatcher
{
    // Session id given to one-way packages whose sender attached none. Never allocated.
    static final int NO_SESSION_ID = -1;

    private final HandlerRegistry registry;
    private final SessionManager sessions;
    private final PayloadCodec payloadCodec;
    private final Executor handlerExecutor;
    private final NodeObservabilitySink sink;

    public Dispatcher(HandlerRegistry registry,
                      SessionManager sessions,
                      PayloadCodec payloadCodec,
                      Executor handlerExecutor,
                      NodeObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @param pkg    decoded inbound package
     * @param sender logical (advertised) address of the peer
     * @return the reply to send back, if any
     */
    public CompletionStage<Optional<Message>> dispatch(Package pkg, Address sender) {
        Objects.requireNonNull(pkg, "pkg");
        PackageMetadata metadata = pkg.metadata();

        if (metadata.stage() == SessionStage.RESPONSE) {
            sessions.resolve(metadata.sessionId(), pkg.message().payload(), sender);
            return noReply();
        }

        Optional<HandlerEntry> found = registry.lookup(pkg.topic(), pkg.type());
        if (found.isEmpty()) {
            drop(DropReason.UNKNOWN_HANDLER, sender, "no handler for " + pkg.topic() + "/" + pkg.type(), null);
            return noReply();
        }
        HandlerEntry entry = found.get();

        Session session = sessionOf(metadata);

        final Object[] args;
        try {
            args = bindArguments(entry, pkg, sender, session);
        } catch (DecodeException e) {
            drop(DropReason.DECODE_FAILED, sender,
                    "payload of " + pkg.topic() + "/" + pkg.type() + " is not a " + entry.payloadType().getSimpleName(), e);
            return noReply();
        }

        try {
            return CompletableFuture.supplyAsync(() -> invoke(entry, args, session, sender), handlerExecutor);
        } catch (RejectedExecutionException e) {
            sink.onError(new NodeErrorEvent(Instant.now(),
                    "Handler executor rejected " + pkg.topic() + "/" + pkg.type(), e));
            return noReply();
        }
    }

    private Optional<Message> invoke(HandlerEntry entry, Object[] args, Session session, Address sender) {
        final Object result;
        try {
            result = entry.handler().handle(args);
        } catch (Exception e) {
            drop(DropReason.HANDLER_FAILED, sender,
                    "handler for " + entry.topic() + "/" + entry.type() + " threw", e);
            return Optional.empty();
        }

        if (result == null || session.stage() != SessionStage.REQUEST) {
            // One-way packages discard the return value; a null result means "no reply".
            return Optional.empty();
        }

        session.processLifecycle();
        return Optional.of(new Message(entry.topic(), entry.type(), result));
    }

    private Object[] bindArguments(HandlerEntry entry, Package pkg, Address sender, Session session) {
        List<HandlerArgument> shape = entry.shape().arguments();
        Object[] args = new Object[shape.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = switch (shape.get(i)) {
                case PAYLOAD -> payloadCodec.decodePayload(pkg.message().payload(), entry.payloadType());
                case SENDER -> sender;
                case SESSION -> session;
            };
        }
        return args;
    }

    private static Session sessionOf(PackageMetadata metadata) {
        int id = metadata.hasSession() ? metadata.sessionId() : NO_SESSION_ID;
        return Session.fromWire(id, metadata.stage());
    }

    private void drop(DropReason reason, Address sender, String detail, Throwable cause) {
        sink.onPackageDropped(new PackageDroppedEvent(Instant.now(), reason, sender, detail, cause));
    }

    private static CompletionStage<Optional<Message>> noReply() {
        return CompletableFuture.completedFuture(Optional.empty());
    }
}
