package mongomigrator.ledger;

import org.bson.Document;

/**
 * One row of the ledger: a migration that has been applied.
 *
 * <p>Records are created when a migration is applied and deleted when it is
 * rolled back; they are never updated.
 *
 * @param name unique migration name
 * @param order order number of the migration
 * @param applied always true for a stored record
 */
public record LedgerRecord(String name, int order, boolean applied) {

    static final String NAME = "name";
    static final String ORDER = "order";
    static final String APPLIED = "applied";

    /**
     * Creates the record written after a successful apply.
     */
    public static LedgerRecord applied(String name, int order) {
        return new LedgerRecord(name, order, true);
    }

    /**
     * Converts this record to its stored form {@code {name, order, applied}}.
     */
    public Document toDocument() {
        return new Document(NAME, name)
                .append(ORDER, order)
                .append(APPLIED, applied);
    }

    /**
     * Reads a record from its stored form.
     */
    public static LedgerRecord fromDocument(Document doc) {
        Number order = doc.get(ORDER, Number.class);
        return new LedgerRecord(
                doc.getString(NAME),
                order != null ? order.intValue() : 0,
                Boolean.TRUE.equals(doc.getBoolean(APPLIED)));
    }
}
