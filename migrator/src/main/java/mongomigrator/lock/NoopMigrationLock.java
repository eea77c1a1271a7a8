package mongomigrator.lock;

/**
 * Default lock used when locking is disabled: runs are not serialized.
 */
public enum NoopMigrationLock implements MigrationLock {
    INSTANCE;

    @Override
    public void acquire() { /* no-op */ }

    @Override
    public void release() { /* no-op */ }
}
