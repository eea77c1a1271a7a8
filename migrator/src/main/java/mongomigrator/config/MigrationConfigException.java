package mongomigrator.config;

/**
 * Exception thrown when migrator settings cannot be loaded or are invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No settings file is found</li>
 *   <li>The settings file cannot be parsed</li>
 *   <li>A required property ({@code mongodb.uri}, {@code mongodb.database}) is missing</li>
 * </ul>
 *
 * <p>This is an unchecked exception: a broken setup cannot be recovered from
 * at runtime.
 *
 * @see MigrationConfigLoader
 */
public class MigrationConfigException extends RuntimeException {

    public MigrationConfigException(String message) {
        super(message);
    }

    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
