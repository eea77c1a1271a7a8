package mongomigrator.scanner;

import mongomigrator.annotations.ChangeUnit;
import mongomigrator.exceptions.DiscoveryException;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scans a migration location for classes annotated with {@link ChangeUnit}.
 *
 * <p>A location is a Java package, for example {@code backend.migrations}.
 * Only classes declared directly in that package are returned; subpackages,
 * abstract classes and interfaces are skipped.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationScanner scanner = new MigrationScanner();
 * Set&lt;Class&lt;?&gt;&gt; units = scanner.scan("backend.migrations");
 * </pre>
 *
 * @see MigrationDiscovery
 */
public final class MigrationScanner {

    private static final Logger log = LoggerFactory.getLogger(MigrationScanner.class);

    private final ClassLoader classLoader;

    /**
     * Creates a scanner using the thread context classloader.
     */
    public MigrationScanner() {
        this(null);
    }

    /**
     * Creates a scanner using a specific classloader.
     *
     * @param classLoader the classloader to scan, or null for the default
     */
    public MigrationScanner(ClassLoader classLoader) {
        this.classLoader = classLoader != null ? classLoader : defaultClassLoader();
    }

    /**
     * Checks whether a location exists on the class path.
     *
     * @param location the package name
     * @return true if at least one class path entry contains the package
     */
    public boolean exists(String location) {
        try {
            return classLoader.getResources(location.replace('.', '/')).hasMoreElements();
        } catch (IOException e) {
            log.warn("Cannot look up location {}", location, e);
            return false;
        }
    }

    /**
     * Returns the annotated classes of a location, sorted by class name.
     *
     * @param location the package name
     * @return the change unit classes declared directly in the package
     * @throws DiscoveryException if the location does not exist
     */
    public Set<Class<?>> scan(String location) throws DiscoveryException {
        if (!exists(location)) {
            throw new DiscoveryException("Migrations location not found: " + location);
        }

        ConfigurationBuilder config = new ConfigurationBuilder()
                .setUrls(ClasspathHelper.forPackage(location, classLoader))
                .filterInputsBy(new FilterBuilder().includePackage(location))
                .addClassLoaders(classLoader)
                .addScanners(Scanners.TypesAnnotated);

        Reflections reflections = new Reflections(config);

        Set<Class<?>> result = new LinkedHashSet<>();
        reflections.getTypesAnnotatedWith(ChangeUnit.class, true).stream()
                .filter(type -> isCandidate(type, location))
                .sorted(Comparator.comparing(Class::getName))
                .forEach(result::add);

        log.debug("Found {} change units in {}", result.size(), location);
        return result;
    }

    private static boolean isCandidate(Class<?> type, String location) {
        if (!location.equals(type.getPackageName())) {
            return false;
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            log.debug("Skipping abstract change unit {}", type.getName());
            return false;
        }
        return true;
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return cl != null ? cl : MigrationScanner.class.getClassLoader();
    }
}
