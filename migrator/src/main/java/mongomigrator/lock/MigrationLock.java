package mongomigrator.lock;

import mongomigrator.exceptions.MigrationLockException;

/**
 * Advisory lock held for the duration of one migration run.
 *
 * <p>The manager acquires the lock before its first ledger read and releases
 * it when the run ends, successful or not. Only runners using the same lock
 * store are excluded from each other.
 *
 * @see MongoMigrationLock
 * @see NoopMigrationLock
 */
public interface MigrationLock {

    /**
     * Acquires the lock without waiting.
     *
     * @throws MigrationLockException if another runner holds it or it cannot be written
     */
    void acquire() throws MigrationLockException;

    /**
     * Releases the lock if this runner holds it.
     */
    void release();
}
