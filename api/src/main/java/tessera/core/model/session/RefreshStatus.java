package tessera.core.model.session;

/**
 * Lifecycle state of a refresh-token record.
 *
 * <p>Only {@link #ACTIVE} records can transition. {@link #ROTATED} and
 * {@link #REVOKED} are terminal; rotated records are retained so that a replay
 * can be recognised.
 */
public enum RefreshStatus {
    ACTIVE,
    ROTATED,
    REVOKED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
