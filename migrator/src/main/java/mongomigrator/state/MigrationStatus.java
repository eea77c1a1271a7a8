package mongomigrator.state;

import mongomigrator.plan.MigrationDescriptor;

/**
 * Applied state of one discovered migration.
 *
 * @param id migration id
 * @param name ledger name
 * @param order order number
 * @param applied whether the ledger holds a record for this migration
 * @see mongomigrator.engine.MigrationManager#status(mongomigrator.plan.MigrationSet)
 */
public record MigrationStatus(String id, String name, int order, boolean applied) {

    public static MigrationStatus of(MigrationDescriptor d, boolean applied) {
        return new MigrationStatus(d.id(), d.name(), d.order(), applied);
    }
}
