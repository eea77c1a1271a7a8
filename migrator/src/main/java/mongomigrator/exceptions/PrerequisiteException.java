package mongomigrator.exceptions;

/**
 * Thrown when a migration is applied before its immediate predecessor.
 *
 * <p>A migration with order {@code N > 1} requires a ledger record with order
 * {@code N - 1}. Nothing is written to the ledger when this is thrown.
 */
public class PrerequisiteException extends MigrateException {

    private final int missingOrder;

    public PrerequisiteException(String migrationName, int missingOrder) {
        super("Previous migration with order " + missingOrder + " has not been applied",
                migrationName, Stage.PREREQUISITE, null);
        this.missingOrder = missingOrder;
    }

    /** Returns the order of the predecessor that has no ledger record. */
    public int getMissingOrder() {
        return missingOrder;
    }
}
