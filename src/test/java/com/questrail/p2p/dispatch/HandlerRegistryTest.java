package com.questrail.p2p.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class HandlerRegistryTest
{
    private final HandlerRegistry registry = new HandlerRegistry();

    @Test
    void registeredHandlerIsFoundByTopicAndType()
    {
        registry.register("KAD", "PING", Handlers.payload(String.class, p -> p));

        HandlerEntry entry = registry.require("KAD", "PING");
        assertEquals("KAD", entry.topic());
        assertEquals("PING", entry.type());
        assertEquals(String.class, entry.payloadType());
        assertEquals(ArgumentShape.payload(), entry.shape());

        assertTrue(registry.lookup("KAD", "PONG").isEmpty());
        assertTrue(registry.lookup("DHT", "PING").isEmpty());
    }

    @Test
    void duplicatePairIsRejected()
    {
        registry.register("KAD", "PING", Handlers.noArgs(() -> null));

        assertThrows(DuplicateHandlerException.class,
                () -> registry.register("KAD", "PING", Handlers.noArgs(() -> "again")));
        assertEquals(1, registry.size());
    }

    @Test
    void sameTypeUnderDifferentTopicsIsAllowed()
    {
        registry.register("KAD", "PING", Handlers.noArgs(() -> null));
        registry.register("DHT", "PING", Handlers.noArgs(() -> null));

        assertEquals(2, registry.size());
    }

    @Test
    void requireMissingPairThrows()
    {
        UnknownHandlerException e = assertThrows(UnknownHandlerException.class, () -> registry.require("KAD", "NOPE"));
        assertEquals("KAD", e.topic());
        assertEquals("NOPE", e.type());
    }

    @Test
    void frozenRegistryRejectsRegistration()
    {
        registry.register("KAD", "PING", Handlers.noArgs(() -> null));
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class,
                () -> registry.register("KAD", "PONG", Handlers.noArgs(() -> null)));
        assertTrue(registry.lookup("KAD", "PING").isPresent());
    }

    @Test
    void shapeWithoutPayloadIgnoresPayloadType()
    {
        HandlerEntry entry = registry.register("KAD", "WHO", Integer.class, args -> args[0], ArgumentShape.sender());
        assertEquals(Void.class, entry.payloadType());
    }

    @Test
    void shapeWithPayloadRequiresPayloadType()
    {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("KAD", "PING", null, args -> null, ArgumentShape.payload()));
    }

    @Test
    void blankKeysAreRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(" ", "PING", Handlers.noArgs(() -> null)));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("KAD", "", Handlers.noArgs(() -> null)));
    }
}
