package com.questrail.p2p.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.p2p.api.Address;
import com.questrail.p2p.api.Message;
import com.questrail.p2p.api.Node;
import com.questrail.p2p.codec.PackageCodec;
import com.questrail.p2p.codec.PayloadCodec;
import com.questrail.p2p.codec.impl.JacksonDeflatePackageCodec;
import com.questrail.p2p.codec.impl.JacksonPayloadCodec;
import com.questrail.p2p.codec.impl.ObjectMappers;
import com.questrail.p2p.config.NodeConfig;
import com.questrail.p2p.dispatch.ArgumentShape;
import com.questrail.p2p.dispatch.Dispatcher;
import com.questrail.p2p.dispatch.HandlerBinding;
import com.questrail.p2p.dispatch.HandlerRegistry;
import com.questrail.p2p.dispatch.MessageHandler;
import com.questrail.p2p.identity.PeerDirectory;
import com.questrail.p2p.model.Package;
import com.questrail.p2p.model.PackageMetadata;
import com.questrail.p2p.model.SerializedMessage;
import com.questrail.p2p.observability.NodeErrorEvent;
import com.questrail.p2p.observability.NodeObservabilitySink;
import com.questrail.p2p.observability.Slf4jNodeObservabilitySink;
import com.questrail.p2p.session.PendingResponse;
import com.questrail.p2p.session.Session;
import com.questrail.p2p.session.SessionManager;
import com.questrail.p2p.transport.PackageHook;
import com.questrail.p2p.transport.PackageHooks;
import com.questrail.p2p.transport.Transport;
import com.questrail.p2p.transport.TransportContext;
import com.questrail.p2p.transport.TransportException;
import com.questrail.p2p.transport.TransportFactory;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * MessagingNode
 * =============================================================================
 * Composition root and lifecycle owner for one messaging node.
 *
 * <p>Wires codecs, the peer directory, the session manager, the handler
 * registry and dispatcher, hooks and the transport binding chosen by
 * {@link NodeConfig#transportKind()}. Owns the handler executor, a cached pool
 * of daemon threads on which handlers run and replies are written.</p>
 */
public final class MessagingNode implements Node
{
    private static final Duration EXECUTOR_SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final NodeConfig config;
    private final NodeObservabilitySink sink;
    private final PayloadCodec payloadCodec;
    private final SessionManager sessions;
    private final PackageHooks hooks;
    private final HandlerRegistry registry;
    private final ExecutorService handlerExecutor;
    private final Dispatcher dispatcher;
    private final Transport transport;

    private final AtomicBoolean listening = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private MessagingNode(Builder b) {
        this.config = b.config;
        this.sink = b.observabilitySink;

        ObjectMapper mapper = b.objectMapper;
        this.payloadCodec = new JacksonPayloadCodec(mapper);
        PackageCodec packageCodec = new JacksonDeflatePackageCodec(mapper, config.maxInflatedSize());

        this.sessions = b.sessionIdSource != null
                ? new SessionManager(sink, b.sessionIdSource)
                : new SessionManager(sink);
        this.hooks = new PackageHooks();
        this.registry = new HandlerRegistry();
        this.handlerExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("p2p-handler", true));
        this.dispatcher = new Dispatcher(registry, sessions, payloadCodec, handlerExecutor, sink);

        TransportContext context = new TransportContext(
                packageCodec, payloadCodec, new PeerDirectory(), hooks, sink, handlerExecutor);
        this.transport = Objects.requireNonNull(b.transportFactory.create(config, context), "transport");
    }

    // ---------------------------------------------------------------------
    // Sending
    // ---------------------------------------------------------------------

    @Override
    public void send(Address to, Message message) {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(message, "message");
        requireListening();

        Session session = sessions.createInactiveSession();
        SerializedMessage serialized = payloadCodec.serialize(message);
        Package pkg = new Package(serialized, PackageMetadata.inactive(transport.advertisedPort(), session.id()));

        try {
            transport.send(to, pkg);
        } catch (TransportException e) {
            sink.onError(new NodeErrorEvent(Instant.now(),
                    "Unable to deliver " + message.topic() + "/" + message.type() + " to " + to, e));
        }
    }

    @Override
    public <T> T sendAndReceive(Address to, Message message, Class<T> responseType) {
        return sendAndReceive(to, message, responseType, config.responseTimeout());
    }

    @Override
    public <T> T sendAndReceive(Address to, Message message, Class<T> responseType, Duration timeout) {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(responseType, "responseType");
        Objects.requireNonNull(timeout, "timeout");
        requireListening();

        SerializedMessage serialized = payloadCodec.serialize(message);
        PendingResponse slot = sessions.openRequest(responseType);
        int sessionId = slot.sessionId();

        try {
            transport.send(to, new Package(serialized, PackageMetadata.request(transport.advertisedPort(), sessionId)));
        } catch (TransportException e) {
            // The request may never arrive; the caller learns about it through the timeout.
            sink.onError(new NodeErrorEvent(Instant.now(),
                    "Unable to deliver request " + message.topic() + "/" + message.type()
                            + " (session " + sessionId + ") to " + to, e));
        } catch (RuntimeException e) {
            // PackageTooLargeException, hook or encoding failure: nothing was written.
            sessions.evict(sessionId);
            throw e;
        }

        byte[] response = sessions.awaitResponse(sessionId, timeout);
        return payloadCodec.decodePayload(response, responseType);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void listen() {
        if (closed.get()) {
            throw new IllegalStateException("Node is closed");
        }
        if (!listening.compareAndSet(false, true)) {
            throw new IllegalStateException("Node is already listening");
        }

        registry.freeze();
        transport.listen(dispatcher::dispatch);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        transport.close();

        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(EXECUTOR_SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                handlerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isListening() {
        return listening.get() && !closed.get();
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    @Override
    public void registerHandler(String topic, String type, HandlerBinding binding) {
        registry.register(topic, type, binding);
    }

    @Override
    public void registerHandler(String topic, String type, Class<?> payloadType, MessageHandler handler, ArgumentShape shape) {
        registry.register(topic, type, payloadType, handler, shape);
    }

    @Override
    public void setBeforeSendHook(PackageHook hook) {
        hooks.setBeforeSend(hook);
    }

    @Override
    public void setBeforeSendHook(String topic, PackageHook hook) {
        hooks.setBeforeSend(topic, hook);
    }

    @Override
    public void setAfterReceiveHook(PackageHook hook) {
        hooks.setAfterReceive(hook);
    }

    @Override
    public void setAfterReceiveHook(String topic, PackageHook hook) {
        hooks.setAfterReceive(topic, hook);
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    @Override
    public Address address() {
        requireListening();
        InetSocketAddress bind = config.bindAddress();
        InetAddress host = bind.getAddress();
        String hostText = (host == null || host.isAnyLocalAddress())
                ? InetAddress.getLoopbackAddress().getHostAddress()
                : host.getHostAddress();
        return new Address(hostText, transport.advertisedPort());
    }

    public NodeConfig config() {
        return config;
    }

    /**
     * Number of requests currently awaiting a response.
     */
    public int pendingRequests() {
        return sessions.pendingCount();
    }

    private void requireListening() {
        if (closed.get()) {
            throw new IllegalStateException("Node is closed");
        }
        if (!listening.get()) {
            throw new IllegalStateException("Node is not listening; call listen() first");
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NodeConfig config = NodeConfig.defaults();
        private NodeObservabilitySink observabilitySink = new Slf4jNodeObservabilitySink();
        private TransportFactory transportFactory = new DefaultTransportFactory();
        private ObjectMapper objectMapper = ObjectMappers.standard();
        private IntSupplier sessionIdSource;

        public Builder withConfig(NodeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(NodeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withTransportFactory(TransportFactory factory) {
            this.transportFactory = factory;
            return this;
        }

        /**
         * Mapper used for both payloads and package documents. Both peers must
         * agree on its configuration.
         */
        public Builder withObjectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public Builder withSessionIdSource(IntSupplier idSource) {
            this.sessionIdSource = idSource;
            return this;
        }

        public MessagingNode build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(transportFactory, "transportFactory");
            Objects.requireNonNull(objectMapper, "objectMapper");
            return new MessagingNode(this);
        }
    }
}
