package tessera.spi;

/**
 * Receives security events (failed logins, lockouts, refresh-token reuse,
 * session revocations) on the dispatcher thread.
 *
 * <p>Handlers are found with {@link java.util.ServiceLoader}; list the class in
 * {@code META-INF/services/tessera.spi.SecurityEventHandler}. The dispatcher
 * calls every available handler in descending {@link #priority()} order, and a
 * handler that throws does not stop the others.
 *
 * <p>The built-in {@code metrics} handler (priority 10) counts events and the
 * {@code logging} handler (priority 0) writes them to the
 * {@code tessera.security} log category.
 */
public interface SecurityEventHandler {

    /** Short unique name, used in logs. */
    String name();

    /** Handlers with a higher value see an event first. */
    default int priority() {
        return 0;
    }

    /** A handler that returns false at startup is skipped for the lifetime of the dispatcher. */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Process one event. Must not block for long: all handlers share a single
     * dispatcher thread.
     */
    void handle(SecurityEvent event);

    /** Release resources on shutdown. */
    default void close() {}
}
