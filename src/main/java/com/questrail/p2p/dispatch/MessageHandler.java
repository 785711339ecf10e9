package com.questrail.p2p.dispatch;

/**
 * Shape-agnostic handler callback.
 *
 * <p>{@code args} is laid out exactly as the registered {@link ArgumentShape}
 * declares. The return value becomes the reply payload for REQUEST packages;
 * {@code null} means "no reply". Exceptions are reported and never escape the
 * dispatcher.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    Object handle(Object... args) throws Exception;
}
