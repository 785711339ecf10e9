package com.questrail.p2p.dispatch;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HandlerRegistry
 * =============================================================================
 * {@code (topic, type) → handler} table.
 *
 * <h2>Lifecycle</h2>
 * Handlers are registered while the node is being assembled. {@link #freeze()}
 * is called when the node starts listening; from then on the table is
 * read-only and registration throws {@link IllegalStateException}. Lookups
 * from receive and handler threads therefore never observe a half-built table.
 */
public final class HandlerRegistry
{
    private record Key(String topic, String type) {
    }

    private final Map<Key, HandlerEntry> entries = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    /**
     * @param payloadType type the payload is decoded as; ignored when {@code shape} has no PAYLOAD
     * @throws DuplicateHandlerException if a handler exists for {@code (topic, type)}
     * @throws IllegalStateException     if the registry is frozen
     */
    public synchronized HandlerEntry register(String topic,
                                              String type,
                                              Class<?> payloadType,
                                              MessageHandler handler,
                                              ArgumentShape shape) {
        return register(topic, type, new HandlerBinding(payloadType, handler, shape));
    }

    public synchronized HandlerEntry register(String topic, String type, HandlerBinding binding) {
        requireNonBlank(topic, "topic");
        requireNonBlank(type, "type");
        Objects.requireNonNull(binding, "binding");
        if (frozen) {
            throw new IllegalStateException("Handler registry is frozen; register handlers before listen()");
        }

        HandlerEntry entry = new HandlerEntry(topic, type, binding.handler(), binding.shape(), binding.payloadType());
        if (entries.putIfAbsent(new Key(topic, type), entry) != null) {
            throw new DuplicateHandlerException(topic, type);
        }
        return entry;
    }

    public Optional<HandlerEntry> lookup(String topic, String type) {
        return Optional.ofNullable(entries.get(new Key(topic, type)));
    }

    /**
     * @throws UnknownHandlerException if nothing is registered for {@code (topic, type)}
     */
    public HandlerEntry require(String topic, String type) {
        return lookup(topic, type).orElseThrow(() -> new UnknownHandlerException(topic, type));
    }

    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return entries.size();
    }

    private static void requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
