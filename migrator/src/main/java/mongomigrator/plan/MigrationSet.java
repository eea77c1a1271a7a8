package mongomigrator.plan;

import java.util.*;

import mongomigrator.exceptions.DiscoveryException;

/**
 * Immutable, ordered set of migrations found in one location.
 *
 * <p>Sets are built using {@link #build(List)} or {@link #builder()}, which
 * validate that:
 * <ul>
 *   <li>each order number is used once</li>
 *   <li>each ledger name and each id is used once</li>
 *   <li>orders are contiguous, starting at 1</li>
 * </ul>
 *
 * <p>The migrations are kept sorted ascending by order.
 *
 * @see MigrationDescriptor
 * @see mongomigrator.scanner.MigrationDiscovery
 */
public final class MigrationSet {

    private final List<MigrationDescriptor> ordered;
    private final Map<String, MigrationDescriptor> byName;
    private final Map<String, MigrationDescriptor> byId;

    private MigrationSet(List<MigrationDescriptor> ordered,
                         Map<String, MigrationDescriptor> byName,
                         Map<String, MigrationDescriptor> byId) {
        this.ordered = ordered;
        this.byName = byName;
        this.byId = byId;
    }

    // ===== public API =====

    /**
     * Gets the migrations in ascending order.
     *
     * @return an immutable list of descriptors in execution order
     */
    public List<MigrationDescriptor> ordered() {
        return ordered;
    }

    /**
     * Looks up a migration by its ledger name or its id.
     *
     * @param nameOrId the class name or the {@code <order>_<description>} id
     * @return the descriptor, or empty if none matches
     */
    public Optional<MigrationDescriptor> find(String nameOrId) {
        MigrationDescriptor d = byId.get(nameOrId);
        return Optional.ofNullable(d != null ? d : byName.get(nameOrId));
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    /**
     * Returns an empty set.
     */
    public static MigrationSet empty() {
        return new MigrationSet(List.of(), Map.of(), Map.of());
    }

    /**
     * Creates a builder that registers migrations one by one.
     */
    public static Builder builder() {
        return new Builder();
    }

    // ===== factory =====

    /**
     * Builds a migration set from descriptors in any order.
     *
     * @param descriptors the migrations to include
     * @return an immutable migration set sorted by order
     * @throws DiscoveryException if orders, names or ids collide, or orders have gaps
     */
    public static MigrationSet build(List<MigrationDescriptor> descriptors) throws DiscoveryException {
        Objects.requireNonNull(descriptors, "descriptors");

        Map<Integer, MigrationDescriptor> byOrder = new TreeMap<>();
        Map<String, MigrationDescriptor> byName = new HashMap<>();
        Map<String, MigrationDescriptor> byId = new HashMap<>();

        for (MigrationDescriptor d : descriptors) {
            MigrationDescriptor previous = byOrder.putIfAbsent(d.order(), d);
            if (previous != null) {
                throw new DiscoveryException(
                        "Duplicate migration order " + d.order() + ": "
                                + previous.id() + " and " + d.id());
            }
            if (byName.putIfAbsent(d.name(), d) != null) {
                throw new DiscoveryException("Duplicate migration name: " + d.name());
            }
            if (byId.putIfAbsent(d.id(), d) != null) {
                throw new DiscoveryException("Duplicate migration id: " + d.id());
            }
        }

        validateContiguous(byOrder.keySet());

        return new MigrationSet(
                List.copyOf(byOrder.values()),
                Map.copyOf(byName),
                Map.copyOf(byId));
    }

    // ===== validation =====

    private static void validateContiguous(Set<Integer> sortedOrders) throws DiscoveryException {
        int expected = 1;
        for (int order : sortedOrders) {
            if (order != expected) {
                throw new DiscoveryException(
                        "Migration orders must be contiguous from 1: expected "
                                + expected + " but found " + order);
            }
            expected++;
        }
    }

    /**
     * Builder registering migrations in a table keyed by their order prefix.
     *
     * <pre>
     * MigrationSet set = MigrationSet.builder()
     *         .add(createIndexDescriptor)
     *         .add(addFieldDescriptor)
     *         .build();
     * </pre>
     */
    public static final class Builder {
        private final List<MigrationDescriptor> descriptors = new ArrayList<>();

        public Builder add(MigrationDescriptor descriptor) {
            descriptors.add(Objects.requireNonNull(descriptor, "descriptor"));
            return this;
        }

        public MigrationSet build() throws DiscoveryException {
            return MigrationSet.build(descriptors);
        }
    }
}
