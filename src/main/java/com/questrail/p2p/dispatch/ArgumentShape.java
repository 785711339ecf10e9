package com.questrail.p2p.dispatch;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ArgumentShape
 * -----------------------------------------------------------------------------
 * Ordered list of the arguments a handler expects. Each {@link HandlerArgument}
 * appears at most once.
 *
 * <p>The shape is declared once at registration time. The dispatcher builds
 * the argument array from it with a plain switch, so no reflection is involved
 * on the receive path.</p>
 */
public final class ArgumentShape
{
    private static final ArgumentShape NONE = new ArgumentShape(List.of());

    private final List<HandlerArgument> arguments;

    private ArgumentShape(List<HandlerArgument> arguments) {
        this.arguments = arguments;
    }

    /**
     * @throws IllegalArgumentException if an argument is repeated
     */
    public static ArgumentShape of(HandlerArgument... arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Set<HandlerArgument> seen = EnumSet.noneOf(HandlerArgument.class);
        for (HandlerArgument a : arguments) {
            Objects.requireNonNull(a, "argument");
            if (!seen.add(a)) {
                throw new IllegalArgumentException("Argument " + a + " appears more than once");
            }
        }
        return arguments.length == 0 ? NONE : new ArgumentShape(List.of(arguments));
    }

    public static ArgumentShape none() {
        return NONE;
    }

    public static ArgumentShape payload() {
        return of(HandlerArgument.PAYLOAD);
    }

    public static ArgumentShape sender() {
        return of(HandlerArgument.SENDER);
    }

    public static ArgumentShape payloadAndSender() {
        return of(HandlerArgument.PAYLOAD, HandlerArgument.SENDER);
    }

    public static ArgumentShape senderAndPayload() {
        return of(HandlerArgument.SENDER, HandlerArgument.PAYLOAD);
    }

    public static ArgumentShape payloadAndSession() {
        return of(HandlerArgument.PAYLOAD, HandlerArgument.SESSION);
    }

    public static ArgumentShape payloadSenderSession() {
        return of(HandlerArgument.PAYLOAD, HandlerArgument.SENDER, HandlerArgument.SESSION);
    }

    public List<HandlerArgument> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int arity() {
        return arguments.size();
    }

    public boolean requiresPayload() {
        return arguments.contains(HandlerArgument.PAYLOAD);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArgumentShape that)) return false;
        return arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return arguments.hashCode();
    }

    @Override
    public String toString() {
        return "ArgumentShape" + arguments;
    }
}
