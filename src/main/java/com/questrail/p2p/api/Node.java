package com.questrail.p2p.api;

import com.questrail.p2p.dispatch.ArgumentShape;
import com.questrail.p2p.dispatch.HandlerBinding;
import com.questrail.p2p.dispatch.MessageHandler;
import com.questrail.p2p.transport.PackageHook;

import java.time.Duration;

/**
 * Node
 * =============================================================================
 * Public surface of one peer in the messaging network.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Register handlers (and optionally hooks).</li>
 *   <li>{@link #listen()}: the handler table is frozen and the transport binds.</li>
 *   <li>Exchange messages with {@link #send} and {@link #sendAndReceive}.</li>
 *   <li>{@link #close()}.</li>
 * </ol>
 *
 * <h2>Request / response</h2>
 * A handler's return value for a request is sent back under the same topic
 * and type as the request, correlated by session. A handler returning
 * {@code null} sends no reply, and the requester times out.
 */
public interface Node extends AutoCloseable
{
    /**
     * Fire-and-forget send. Returns as soon as the package is handed to the
     * transport. Delivery failures are reported to the observability sink,
     * never thrown.
     *
     * @throws com.questrail.p2p.transport.PackageTooLargeException if the encoded package is too large
     * @throws com.questrail.p2p.codec.EncodeException             if the payload cannot be serialized
     * @throws IllegalStateException                               if the node is not listening
     */
    void send(Address to, Message message);

    /**
     * Sends a request and blocks the calling thread until the response
     * arrives, using the configured default timeout.
     *
     * @return the response payload decoded as {@code responseType}; {@code null} for an empty response
     * @throws com.questrail.p2p.session.ResponseTimeoutException if no response arrives in time
     */
    <T> T sendAndReceive(Address to, Message message, Class<T> responseType);

    /**
     * Sends a request and blocks the calling thread until the response
     * arrives or {@code timeout} elapses.
     *
     * <p>Only the calling thread waits. Receive loops and other callers are
     * unaffected.</p>
     *
     * @return the response payload decoded as {@code responseType}; {@code null} for an empty response
     * @throws com.questrail.p2p.session.ResponseTimeoutException   if no response arrives in time
     * @throws com.questrail.p2p.transport.PackageTooLargeException if the encoded request is too large
     * @throws com.questrail.p2p.codec.DecodeException             if the response does not decode as {@code responseType}
     * @throws IllegalStateException                               if the node is not listening
     */
    <T> T sendAndReceive(Address to, Message message, Class<T> responseType, Duration timeout);

    /**
     * Freezes the handler table and starts the transport. Returns once bound.
     *
     * @throws com.questrail.p2p.transport.TransportException if the transport cannot bind
     * @throws IllegalStateException                         if already listening or closed
     */
    void listen();

    /**
     * @throws com.questrail.p2p.dispatch.DuplicateHandlerException if {@code (topic, type)} is taken
     * @throws IllegalStateException                               after {@link #listen()}
     */
    void registerHandler(String topic, String type, HandlerBinding binding);

    /**
     * Shape-level registration, for handlers not built through
     * {@link com.questrail.p2p.dispatch.Handlers}.
     *
     * @param payloadType type the payload is decoded as; ignored when {@code shape} has no PAYLOAD
     */
    void registerHandler(String topic, String type, Class<?> payloadType, MessageHandler handler, ArgumentShape shape);

    /**
     * Hook applied to every outbound package; {@code null} clears it.
     */
    void setBeforeSendHook(PackageHook hook);

    void setBeforeSendHook(String topic, PackageHook hook);

    /**
     * Hook applied to every inbound package after decoding; {@code null} clears it.
     */
    void setAfterReceiveHook(PackageHook hook);

    void setAfterReceiveHook(String topic, PackageHook hook);

    /**
     * Address peers can use to reach this node. A wildcard bind host is
     * reported as the loopback address.
     *
     * @throws IllegalStateException if the node is not listening
     */
    Address address();

    /**
     * Closes the transport and stops the handler executor. Idempotent.
     */
    @Override
    void close();
}
