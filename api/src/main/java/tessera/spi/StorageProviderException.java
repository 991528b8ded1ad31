package tessera.spi;

/**
 * No session storage provider could be selected or initialized.
 *
 * <p>Raised while wiring storage at startup, never on the request path, so it
 * is an {@link IllegalStateException} rather than a storage outage.
 */
public class StorageProviderException extends IllegalStateException {

    public StorageProviderException(String message) {
        super(message);
    }
}
