package in.ticktrader.service.feed;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable choice of direct tick callback, fixed when the adapter connects.
 *
 * "No callback" is an explicit value ({@link #none()}), not a null handler, so
 * reconnect paths have nothing to clear or overwrite.
 */
public final class CallbackBinding {

    private static final CallbackBinding NONE = new CallbackBinding(null);

    private final TickHandler handler;

    private CallbackBinding(TickHandler handler) {
        this.handler = handler;
    }

    public static CallbackBinding none() {
        return NONE;
    }

    public static CallbackBinding of(TickHandler handler) {
        return new CallbackBinding(Objects.requireNonNull(handler, "handler"));
    }

    public Optional<TickHandler> handler() {
        return Optional.ofNullable(handler);
    }

    public boolean isBound() {
        return handler != null;
    }

    @Override
    public String toString() {
        return isBound() ? "CallbackBinding[bound]" : "CallbackBinding[none]";
    }
}
