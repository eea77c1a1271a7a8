package mongomigrator.plan;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import mongomigrator.Migration;

/**
 * Descriptor of one resolved migration.
 *
 * <p>A MigrationDescriptor holds:
 * <ul>
 *   <li>the migration id, {@code <order>_<description>}</li>
 *   <li>the order parsed from the id prefix ({@code 0002_x} gives 2)</li>
 *   <li>the name recorded in the ledger, normally the simple name of the
 *       implementing class</li>
 *   <li>the instantiated {@link Migration}</li>
 * </ul>
 *
 * @see MigrationSet
 * @see mongomigrator.load.MigrationLoader
 */
public final class MigrationDescriptor {

    private static final Pattern ID_PATTERN = Pattern.compile("^(\\d+)_(.+)$");

    private final String id;
    private final int order;
    private final String name;
    private final Migration migration;

    /**
     * Creates a descriptor, parsing the order from the id.
     *
     * @param id the migration id
     * @param name the ledger name
     * @param migration the migration instance
     * @throws IllegalArgumentException if the id does not follow {@code <order>_<description>}
     */
    public MigrationDescriptor(String id, String name, Migration migration) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.migration = Objects.requireNonNull(migration, "migration");
        this.order = orderOf(id);
    }

    /**
     * Checks whether an id follows the {@code <order>_<description>} convention.
     *
     * @param id the id to check
     * @return true if an order can be parsed from it
     */
    public static boolean isValidId(String id) {
        try {
            orderOf(id);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Parses the order from a migration id: the integer before the first underscore.
     *
     * @param id the migration id
     * @return the parsed order
     * @throws IllegalArgumentException if the id is malformed
     */
    public static int orderOf(String id) {
        Matcher m = id == null ? null : ID_PATTERN.matcher(id);
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException(
                    "Migration id must look like <order>_<description>: " + id);
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Migration order out of range: " + id, e);
        }
    }

    /** Returns the migration id. */
    public String id() { return id; }

    /** Returns the order parsed from the id. */
    public int order() { return order; }

    /** Returns the name stored in the ledger. */
    public String name() { return name; }

    /** Returns the migration instance. */
    public Migration migration() { return migration; }

    @Override
    public String toString() {
        return "MigrationDescriptor{id=" + id + ", order=" + order + ", name=" + name + '}';
    }
}
