package mongomigrator.load;

import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;
import mongomigrator.exceptions.DiscoveryException;
import mongomigrator.exceptions.LoadException;
import mongomigrator.plan.MigrationDescriptor;
import mongomigrator.scanner.MigrationScanner;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves and instantiates change units.
 *
 * <p>This class is responsible for:
 * <ul>
 *   <li>Validating that a class carries {@link ChangeUnit} with a well formed id</li>
 *   <li>Validating that it implements {@link Migration}</li>
 *   <li>Instantiating it through its no-arg constructor</li>
 *   <li>Finding a single unit of a location by id or class name</li>
 * </ul>
 *
 * @see MigrationScanner
 * @see mongomigrator.scanner.MigrationDiscovery
 */
public final class MigrationLoader {

    private final MigrationScanner scanner;

    public MigrationLoader(MigrationScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    /**
     * Resolves the unit of a location whose id or class simple name equals {@code nameOrId}.
     *
     * @param location the package holding the migrations
     * @param nameOrId the migration id ({@code 0002_add_field}) or class simple name
     * @return the resolved descriptor
     * @throws LoadException if the location or the unit is missing, or it cannot be instantiated
     */
    public MigrationDescriptor load(String location, String nameOrId) throws LoadException {
        Objects.requireNonNull(nameOrId, "nameOrId");

        List<Class<?>> matches = new ArrayList<>();
        try {
            for (Class<?> type : scanner.scan(location)) {
                ChangeUnit unit = type.getAnnotation(ChangeUnit.class);
                if (nameOrId.equals(unit.value()) || nameOrId.equals(type.getSimpleName())) {
                    matches.add(type);
                }
            }
        } catch (DiscoveryException e) {
            throw new LoadException("Migration not found in " + location, nameOrId, e);
        }

        if (matches.isEmpty()) {
            throw new LoadException("Migration not found in " + location, nameOrId);
        }
        if (matches.size() > 1) {
            throw new LoadException("Ambiguous migration name, matches " + matches, nameOrId);
        }
        return load(matches.get(0));
    }

    /**
     * Resolves a change unit class into a descriptor.
     *
     * @param type a class annotated with {@link ChangeUnit}
     * @return the descriptor holding a fresh instance
     * @throws LoadException if the class is not a valid change unit
     */
    public MigrationDescriptor load(Class<?> type) throws LoadException {
        String name = type.getSimpleName();

        ChangeUnit unit = type.getAnnotation(ChangeUnit.class);
        if (unit == null) {
            throw new LoadException("Missing @ChangeUnit on " + type.getName(), name);
        }
        if (!MigrationDescriptor.isValidId(unit.value())) {
            throw new LoadException(
                    "@ChangeUnit id must look like <order>_<description>: '" + unit.value() + "'", name);
        }
        if (!Migration.class.isAssignableFrom(type)) {
            throw new LoadException(
                    "@ChangeUnit must implement Migration: " + type.getName(), name);
        }

        return new MigrationDescriptor(unit.value(), name, instantiate(type, name));
    }

    private static Migration instantiate(Class<?> type, String name) throws LoadException {
        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return (Migration) ctor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new LoadException(type.getName() + " must have a no-arg constructor", name, e);
        } catch (InvocationTargetException e) {
            throw new LoadException("Constructor of " + type.getName() + " failed", name, e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new LoadException("Failed to instantiate " + type.getName(), name, e);
        }
    }
}
