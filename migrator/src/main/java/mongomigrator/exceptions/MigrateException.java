package mongomigrator.exceptions;

/**
 * Base exception for every failure of a migration run.
 *
 * <p>Besides the message it carries optional diagnostic context:
 * <ul>
 *   <li>the name of the migration involved</li>
 *   <li>the {@link Stage} at which the run failed</li>
 * </ul>
 *
 * <p>Both are appended to {@link #getMessage()} so a single log line is
 * enough to tell which migration broke and where.
 *
 * @see mongomigrator.engine.MigrationManager
 */
public class MigrateException extends Exception {

    /**
     * Phase of a run in which a failure occurred.
     */
    public enum Stage {
        DISCOVERY,
        LOAD,
        PREREQUISITE,
        APPLY,
        REVERT,
        LEDGER,
        LOCK
    }

    private final String migrationName;
    private final Stage stage;

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with full diagnostic context.
     *
     * @param message the error message
     * @param migrationName the migration involved, or null
     * @param stage the stage where the failure occurred, or null
     * @param cause the underlying cause, or null
     */
    public MigrateException(String message, String migrationName, Stage stage, Throwable cause) {
        super(message, cause);
        this.migrationName = migrationName;
        this.stage = stage;
    }

    /**
     * Returns the name of the migration involved.
     *
     * @return the migration name, or null if not set
     */
    public String getMigrationName() {
        return migrationName;
    }

    /**
     * Returns the stage where the failure occurred.
     *
     * @return the stage, or null if not set
     */
    public Stage getStage() {
        return stage;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (migrationName != null) sb.append(" [migration=").append(migrationName).append("]");

        return sb.toString();
    }
}
