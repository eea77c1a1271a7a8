package mongomigrator.exceptions;

/**
 * Thrown when a change unit cannot be resolved into a {@link mongomigrator.Migration}.
 *
 * @see mongomigrator.load.MigrationLoader
 */
public class LoadException extends MigrateException {

    public LoadException(String message, String migrationName) {
        super(message, migrationName, Stage.LOAD, null);
    }

    public LoadException(String message, String migrationName, Throwable cause) {
        super(message, migrationName, Stage.LOAD, cause);
    }
}
