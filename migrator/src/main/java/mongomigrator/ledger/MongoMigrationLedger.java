package mongomigrator.ledger;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import mongomigrator.exceptions.LedgerException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MigrationLedger} stored in a MongoDB collection.
 *
 * <p>Each applied migration is one document {@code {name, order, applied}}.
 * Driver failures are reported as {@link LedgerException}.
 */
public class MongoMigrationLedger implements MigrationLedger {

    public static final String DEFAULT_COLLECTION = "migrations";

    private static final Logger log = LoggerFactory.getLogger(MongoMigrationLedger.class);

    private final MongoCollection<Document> collection;

    public MongoMigrationLedger(MongoDatabase db) {
        this(db, DEFAULT_COLLECTION);
    }

    public MongoMigrationLedger(MongoDatabase db, String collectionName) {
        this(db.getCollection(collectionName));
    }

    public MongoMigrationLedger(MongoCollection<Document> collection) {
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    @Override
    public Optional<LedgerRecord> findByName(String name) throws LedgerException {
        try {
            Document doc = collection.find(Filters.eq(LedgerRecord.NAME, name)).first();
            return Optional.ofNullable(doc).map(LedgerRecord::fromDocument);
        } catch (MongoException e) {
            throw new LedgerException("Failed to read ledger", name, e);
        }
    }

    @Override
    public Optional<LedgerRecord> findByOrder(int order) throws LedgerException {
        try {
            Document doc = collection.find(Filters.eq(LedgerRecord.ORDER, order)).first();
            return Optional.ofNullable(doc).map(LedgerRecord::fromDocument);
        } catch (MongoException e) {
            throw new LedgerException("Failed to read ledger for order " + order, null, e);
        }
    }

    @Override
    public void insert(LedgerRecord record) throws LedgerException {
        try {
            collection.insertOne(record.toDocument());
            log.debug("Ledger record inserted: {}", record);
        } catch (MongoException e) {
            throw new LedgerException("Failed to write ledger record", record.name(), e);
        }
    }

    @Override
    public boolean deleteByName(String name) throws LedgerException {
        try {
            long deleted = collection.deleteOne(Filters.eq(LedgerRecord.NAME, name)).getDeletedCount();
            log.debug("Ledger records deleted for {}: {}", name, deleted);
            return deleted > 0;
        } catch (MongoException e) {
            throw new LedgerException("Failed to delete ledger record", name, e);
        }
    }

    @Override
    public List<LedgerRecord> findAll() throws LedgerException {
        try {
            List<LedgerRecord> records = new ArrayList<>();
            for (Document doc : collection.find().sort(Sorts.ascending(LedgerRecord.ORDER))) {
                records.add(LedgerRecord.fromDocument(doc));
            }
            return records;
        } catch (MongoException e) {
            throw new LedgerException("Failed to list ledger", null, e);
        }
    }
}
