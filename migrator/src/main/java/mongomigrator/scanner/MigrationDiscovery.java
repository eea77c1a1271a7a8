package mongomigrator.scanner;

import mongomigrator.annotations.ChangeUnit;
import mongomigrator.exceptions.DiscoveryException;
import mongomigrator.exceptions.LoadException;
import mongomigrator.load.MigrationLoader;
import mongomigrator.plan.MigrationDescriptor;
import mongomigrator.plan.MigrationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Discovers the ordered migration set of a location.
 *
 * <p>Scans the location, resolves every change unit through the
 * {@link MigrationLoader} and validates the result as a {@link MigrationSet}.
 * The set is recomputed on every call.
 */
public final class MigrationDiscovery {

    private static final Logger log = LoggerFactory.getLogger(MigrationDiscovery.class);

    private final MigrationScanner scanner;
    private final MigrationLoader loader;

    public MigrationDiscovery(MigrationScanner scanner, MigrationLoader loader) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Discovers the migrations of a location.
     *
     * @param location the package holding the migrations
     * @return the validated set, sorted by order
     * @throws DiscoveryException if the location is missing, an id is malformed or the set is invalid
     * @throws LoadException if a change unit does not implement Migration or cannot be instantiated
     */
    public MigrationSet discover(String location) throws DiscoveryException, LoadException {
        Set<Class<?>> types = scanner.scan(location);
        for (Class<?> type : types) {
            String id = type.getAnnotation(ChangeUnit.class).value();
            if (!MigrationDescriptor.isValidId(id)) {
                throw new DiscoveryException("Malformed migration id '" + id + "' on " + type.getName()
                        + ", expected <order>_<description>");
            }
        }

        List<MigrationDescriptor> descriptors = new ArrayList<>();
        for (Class<?> type : types) {
            descriptors.add(loader.load(type));
        }

        MigrationSet set = MigrationSet.build(descriptors);
        log.info("Discovered {} migrations in {}", set.size(), location);
        return set;
    }
}
