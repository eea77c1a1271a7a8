package mongomigrator.cli;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import mongomigrator.config.MigrationConfig;
import mongomigrator.engine.MigrationManager;
import mongomigrator.ledger.MigrationLedger;
import mongomigrator.ledger.MongoMigrationLedger;
import mongomigrator.load.MigrationLoader;
import mongomigrator.lock.MigrationLock;
import mongomigrator.lock.MongoMigrationLock;
import mongomigrator.lock.NoopMigrationLock;
import mongomigrator.scanner.MigrationDiscovery;
import mongomigrator.scanner.MigrationScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Everything one CLI invocation needs, wired from a {@link MigrationConfig}.
 *
 * <p>Owns the MongoDB client for the lifetime of the run; closing the session
 * closes the client.
 */
public final class MigrationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationSession.class);

    private final MigrationConfig config;
    private final MigrationManager manager;
    private final MigrationLoader loader;
    private final MigrationDiscovery discovery;
    private final AutoCloseable resource;

    /**
     * Wires a session over an existing database.
     *
     * @param config the settings
     * @param db the database migrations run against
     * @param ledger the ledger of applied migrations
     * @param lock the advisory lock, or null for none
     * @param resource closed with the session, or null
     */
    public MigrationSession(MigrationConfig config,
                            MongoDatabase db,
                            MigrationLedger ledger,
                            MigrationLock lock,
                            AutoCloseable resource) {
        this.config = Objects.requireNonNull(config, "config");
        this.manager = new MigrationManager(db, ledger, lock, LoggerFactory.getLogger("migration"));

        MigrationScanner scanner = new MigrationScanner();
        this.loader = new MigrationLoader(scanner);
        this.discovery = new MigrationDiscovery(scanner, loader);
        this.resource = resource;
    }

    /**
     * Connects to MongoDB and wires the ledger and lock collections named in the settings.
     *
     * @param config the settings
     * @return an open session
     */
    public static MigrationSession open(MigrationConfig config) {
        MongoClient client = MongoClients.create(config.mongoUri());
        MongoDatabase db = client.getDatabase(config.databaseName());
        log.debug("Connected to database {}", config.databaseName());

        MigrationLock lock = config.lockEnabled()
                ? new MongoMigrationLock(db, config.lockCollection())
                : NoopMigrationLock.INSTANCE;

        return new MigrationSession(
                config,
                db,
                new MongoMigrationLedger(db, config.ledgerCollection()),
                lock,
                client);
    }

    public MigrationConfig config() { return config; }

    public MigrationManager manager() { return manager; }

    public MigrationLoader loader() { return loader; }

    public MigrationDiscovery discovery() { return discovery; }

    @Override
    public void close() {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close session resource", e);
        }
    }
}
