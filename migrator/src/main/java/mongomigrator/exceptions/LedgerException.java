package mongomigrator.exceptions;

/**
 * Thrown when the ledger collection cannot be read or written.
 *
 * @see mongomigrator.ledger.MigrationLedger
 */
public class LedgerException extends MigrateException {

    public LedgerException(String message, String migrationName, Throwable cause) {
        super(message, migrationName, Stage.LEDGER, cause);
    }
}
