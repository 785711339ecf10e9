package com.questrail.p2p.dispatch;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.session.Session;

import java.util.Objects;

/**
 * Handlers
 * =============================================================================
 * Typed factories for {@link HandlerBinding}s.
 *
 * <p>Each factory fixes an {@link ArgumentShape} and adapts a typed lambda to
 * the shape-agnostic {@link MessageHandler}. The casts below are safe because
 * the dispatcher fills the argument array from the same shape, and decodes the
 * payload as the declared type.</p>
 *
 * <pre>{@code
 * node.registerHandler("KAD", "PING", Handlers.payloadAndSender(Ping.class,
 *         (ping, sender) -> new Pong(ping.nonce())));
 * }</pre>
 */
public final class Handlers
{
    private Handlers() {
    }

    @FunctionalInterface
    public interface PayloadHandler<P> {
        Object handle(P payload) throws Exception;
    }

    @FunctionalInterface
    public interface SenderHandler {
        Object handle(Address sender) throws Exception;
    }

    @FunctionalInterface
    public interface PayloadSenderHandler<P> {
        Object handle(P payload, Address sender) throws Exception;
    }

    @FunctionalInterface
    public interface SenderPayloadHandler<P> {
        Object handle(Address sender, P payload) throws Exception;
    }

    @FunctionalInterface
    public interface PayloadSessionHandler<P> {
        Object handle(P payload, Session session) throws Exception;
    }

    @FunctionalInterface
    public interface PayloadSenderSessionHandler<P> {
        Object handle(P payload, Address sender, Session session) throws Exception;
    }

    @FunctionalInterface
    public interface NoArgHandler {
        Object handle() throws Exception;
    }

    public static <P> HandlerBinding payload(Class<P> payloadType, PayloadHandler<? super P> handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(payloadType,
                args -> handler.handle(payloadType.cast(args[0])),
                ArgumentShape.payload());
    }

    public static HandlerBinding sender(SenderHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(null,
                args -> handler.handle((Address) args[0]),
                ArgumentShape.sender());
    }

    public static <P> HandlerBinding payloadAndSender(Class<P> payloadType, PayloadSenderHandler<? super P> handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(payloadType,
                args -> handler.handle(payloadType.cast(args[0]), (Address) args[1]),
                ArgumentShape.payloadAndSender());
    }

    public static <P> HandlerBinding senderAndPayload(Class<P> payloadType, SenderPayloadHandler<? super P> handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(payloadType,
                args -> handler.handle((Address) args[0], payloadType.cast(args[1])),
                ArgumentShape.senderAndPayload());
    }

    public static <P> HandlerBinding payloadAndSession(Class<P> payloadType, PayloadSessionHandler<? super P> handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(payloadType,
                args -> handler.handle(payloadType.cast(args[0]), (Session) args[1]),
                ArgumentShape.payloadAndSession());
    }

    public static <P> HandlerBinding payloadSenderSession(Class<P> payloadType,
                                                          PayloadSenderSessionHandler<? super P> handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(payloadType,
                args -> handler.handle(payloadType.cast(args[0]), (Address) args[1], (Session) args[2]),
                ArgumentShape.payloadSenderSession());
    }

    public static HandlerBinding noArgs(NoArgHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(null, args -> handler.handle(), ArgumentShape.none());
    }
}
