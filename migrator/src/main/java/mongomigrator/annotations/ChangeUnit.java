package mongomigrator.annotations;

import java.lang.annotation.*;

/**
 * Registers a class as a migration of the package it is declared in.
 *
 * <p>The value is the migration id, written {@code <order>_<description>},
 * for example {@code 0003_add_status_field}. The order is the integer before
 * the first underscore and must be unique and contiguous within the package.
 *
 * <p>The annotated class must implement {@link mongomigrator.Migration} and
 * have a no-arg constructor.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}ChangeUnit("0001_create_text_index")
 * public class CreateTextIndex implements Migration { ... }
 * </pre>
 *
 * @see mongomigrator.scanner.MigrationScanner
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface ChangeUnit {

    /** The migration id, {@code <order>_<description>}. */
    String value();
}
