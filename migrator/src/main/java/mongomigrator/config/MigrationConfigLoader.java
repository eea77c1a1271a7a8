package mongomigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migrator settings from properties or YAML files.
 *
 * <p>Settings are searched in the following order:
 * <ol>
 *   <li>{@code migrator.properties} in the working directory</li>
 *   <li>{@code migrator.yml} in the working directory</li>
 *   <li>{@code migrator.properties} on the classpath</li>
 *   <li>{@code migrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file values (e.g. {@code -Dmongodb.database=staging}).
 *
 * <h2>Settings:</h2>
 * <ul>
 *   <li>{@code mongodb.uri} - connection string, required</li>
 *   <li>{@code mongodb.database} - database name, required</li>
 *   <li>{@code migration.directory} - migrations package inside a module</li>
 *   <li>{@code migration.ledger.collection} - ledger collection</li>
 *   <li>{@code migration.lock.enabled} - true to hold the advisory lock</li>
 *   <li>{@code migration.lock.collection} - lock collection</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    static final String PROPERTIES_FILE = "migrator.properties";
    static final String YAML_FILE = "migrator.yml";

    private MigrationConfigLoader() {}

    /**
     * Loads from the working directory, falling back to the classpath.
     *
     * @throws MigrationConfigException if no settings file is found or it is invalid
     */
    public static MigrationConfig load() {
        return load(Path.of(""));
    }

    /**
     * Loads from a directory, falling back to the classpath.
     *
     * @param dir the directory searched before the classpath
     * @throws MigrationConfigException if no settings file is found or it is invalid
     */
    public static MigrationConfig load(Path dir) {
        for (String name : new String[] {PROPERTIES_FILE, YAML_FILE}) {
            Path file = dir.resolve(name);
            if (Files.isRegularFile(file)) {
                return loadFromFile(file);
            }
        }

        InputStream is = getResource(PROPERTIES_FILE);
        if (is != null) {
            return loadProperties(is, "classpath:" + PROPERTIES_FILE);
        }

        is = getResource(YAML_FILE);
        if (is != null) {
            return loadYaml(is, "classpath:" + YAML_FILE);
        }

        throw new MigrationConfigException(
                "Settings file required: " + PROPERTIES_FILE + " or " + YAML_FILE);
    }

    /**
     * Loads settings from an explicit file.
     *
     * @param path path to a .properties or .yml/.yaml file
     * @throws MigrationConfigException if the file is missing, unreadable or invalid
     */
    public static MigrationConfig loadFromFile(Path path) {
        String name = path.getFileName().toString();
        if (!Files.isRegularFile(path)) {
            throw new MigrationConfigException("Settings file not found at " + path.toAbsolutePath());
        }
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, path.toString());
            }
            return loadProperties(is, path.toString());
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to read " + path, e);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded settings from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Properties props = new Properties();
        try (is) {
            Object root = new Yaml().load(is);
            if (root instanceof Map<?, ?> map) {
                flatten("", map, props);
            } else if (root != null) {
                throw new MigrationConfigException("Expected a mapping in " + source);
            }
        } catch (YAMLException e) {
            throw new MigrationConfigException("Invalid YAML in " + source, e);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
        log.info("Loaded settings from {}", source);
        return parse(props);
    }

    private static void flatten(String prefix, Map<?, ?> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map<?, ?> nested) {
                flatten(key, nested, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getString(props, "mongodb.uri").ifPresent(b::mongoUri);
        getString(props, "mongodb.database").ifPresent(b::databaseName);
        getString(props, "migration.directory").ifPresent(b::migrationsDirectory);
        getString(props, "migration.ledger.collection").ifPresent(b::ledgerCollection);
        getString(props, "migration.lock.collection").ifPresent(b::lockCollection);

        getString(props, "migration.lock.enabled").ifPresent(v -> {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                b.lockEnabled(Boolean.parseBoolean(v));
            } else {
                log.warn("Invalid migration.lock.enabled: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }
}
