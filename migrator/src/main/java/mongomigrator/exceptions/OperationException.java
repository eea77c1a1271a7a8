package mongomigrator.exceptions;

/**
 * Thrown when a migration's own {@code apply} or {@code revert} fails.
 *
 * <p>The original failure is kept unchanged as the cause.
 */
public class OperationException extends MigrateException {

    public OperationException(String migrationName, Stage stage, Throwable cause) {
        super(describe(stage) + " failed: " + cause.getMessage(), migrationName, stage, cause);
    }

    private static String describe(Stage stage) {
        return stage == Stage.REVERT ? "Rollback" : "Migration";
    }
}
