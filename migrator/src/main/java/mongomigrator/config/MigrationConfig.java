package mongomigrator.config;

/**
 * Settings of a migrator run.
 *
 * <p>Holds the MongoDB connection parameters and the names the runner uses:
 * <ul>
 *   <li>connection string and database name</li>
 *   <li>name of the migrations package inside a module (default {@code migrations})</li>
 *   <li>ledger collection (default {@code migrations})</li>
 *   <li>advisory lock switch and collection (default off, {@code migrations_lock})</li>
 * </ul>
 *
 * <p>Usually loaded with {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    private final String mongoUri;
    private final String databaseName;
    private final String migrationsDirectory;
    private final String ledgerCollection;
    private final boolean lockEnabled;
    private final String lockCollection;

    private MigrationConfig(Builder b) {
        this.mongoUri = b.mongoUri;
        this.databaseName = b.databaseName;
        this.migrationsDirectory = b.migrationsDirectory;
        this.ledgerCollection = b.ledgerCollection;
        this.lockEnabled = b.lockEnabled;
        this.lockCollection = b.lockCollection;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the MongoDB connection string. */
    public String mongoUri() { return mongoUri; }

    /** Returns the database migrations run against. */
    public String databaseName() { return databaseName; }

    /** Returns the name of the migrations package inside a module. */
    public String migrationsDirectory() { return migrationsDirectory; }

    /** Returns the ledger collection name. */
    public String ledgerCollection() { return ledgerCollection; }

    /** Returns true if runs hold the advisory lock. */
    public boolean lockEnabled() { return lockEnabled; }

    /** Returns the lock collection name. */
    public String lockCollection() { return lockCollection; }

    /**
     * Resolves the package holding the migrations of a module.
     *
     * @param module the module package, e.g. {@code backend}, or null
     * @return {@code <module>.<migrationsDirectory>}, or just the directory without a module
     */
    public String locationOf(String module) {
        if (module == null || module.isBlank()) {
            return migrationsDirectory;
        }
        return module + "." + migrationsDirectory;
    }

    @Override
    public String toString() {
        // the URI may carry credentials
        return "MigrationConfig{" +
                "databaseName=" + databaseName +
                ", migrationsDirectory=" + migrationsDirectory +
                ", ledgerCollection=" + ledgerCollection +
                ", lockEnabled=" + lockEnabled +
                ", lockCollection=" + lockCollection +
                '}';
    }

    /**
     * Builder for {@link MigrationConfig}.
     */
    public static final class Builder {
        private String mongoUri;
        private String databaseName;
        private String migrationsDirectory = "migrations";
        private String ledgerCollection = "migrations";
        private boolean lockEnabled = false;
        private String lockCollection = "migrations_lock";

        public Builder mongoUri(String uri) {
            this.mongoUri = uri;
            return this;
        }

        public Builder databaseName(String name) {
            this.databaseName = name;
            return this;
        }

        public Builder migrationsDirectory(String directory) {
            this.migrationsDirectory = directory;
            return this;
        }

        public Builder ledgerCollection(String collection) {
            this.ledgerCollection = collection;
            return this;
        }

        public Builder lockEnabled(boolean enabled) {
            this.lockEnabled = enabled;
            return this;
        }

        public Builder lockCollection(String collection) {
            this.lockCollection = collection;
            return this;
        }

        /**
         * @throws MigrationConfigException if the URI or the database name is missing
         */
        public MigrationConfig build() {
            requireText(mongoUri, "mongodb.uri");
            requireText(databaseName, "mongodb.database");
            requireText(migrationsDirectory, "migration.directory");
            requireText(ledgerCollection, "migration.ledger.collection");
            requireText(lockCollection, "migration.lock.collection");
            return new MigrationConfig(this);
        }

        private static void requireText(String value, String key) {
            if (value == null || value.isBlank()) {
                throw new MigrationConfigException("Missing required setting: " + key);
            }
        }
    }
}
