package mongomigrator.exceptions;

/**
 * Thrown when the advisory migration lock is held by another runner or
 * cannot be written.
 *
 * @see mongomigrator.lock.MigrationLock
 */
public class MigrationLockException extends MigrateException {

    public MigrationLockException(String message) {
        super(message, null, Stage.LOCK, null);
    }

    public MigrationLockException(String message, Throwable cause) {
        super(message, null, Stage.LOCK, cause);
    }
}
