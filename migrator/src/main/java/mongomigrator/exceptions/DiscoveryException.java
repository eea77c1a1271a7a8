package mongomigrator.exceptions;

/**
 * Thrown when the migrations of a location cannot be discovered.
 *
 * <p>Raised when the location does not exist on the class path, or when the
 * change units found there do not form a valid migration set (malformed ids,
 * duplicate orders or names, gaps in the order sequence).
 *
 * @see mongomigrator.scanner.MigrationDiscovery
 */
public class DiscoveryException extends MigrateException {

    public DiscoveryException(String message) {
        super(message, null, Stage.DISCOVERY, null);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, null, Stage.DISCOVERY, cause);
    }
}
