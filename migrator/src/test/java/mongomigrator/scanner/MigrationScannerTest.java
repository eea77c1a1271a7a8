package mongomigrator.scanner;

import mongomigrator.exceptions.DiscoveryException;
import mongomigrator.fixtures.ordered.migrations.AddEmailIndex;
import mongomigrator.fixtures.ordered.migrations.BackfillStatus;
import mongomigrator.fixtures.ordered.migrations.CreateUsers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationScanner")
class MigrationScannerTest {

    private static final String ORDERED = "mongomigrator.fixtures.ordered.migrations";

    private final MigrationScanner scanner = new MigrationScanner();

    @Nested
    @DisplayName("scan")
    class Scan {

        @Test
        @DisplayName("should return concrete change units of the package sorted by class name")
        void shouldReturnConcreteUnits() throws DiscoveryException {
            Set<Class<?>> units = scanner.scan(ORDERED);

            assertThat(units).containsExactly(AddEmailIndex.class, BackfillStatus.class, CreateUsers.class);
        }

        @Test
        @DisplayName("should ignore change units in subpackages")
        void shouldIgnoreSubpackages() throws DiscoveryException {
            assertThat(scanner.scan(ORDERED))
                    .extracting(Class::getSimpleName)
                    .doesNotContain("NestedMigration", "AbstractFixtureMigration");
        }

        @Test
        @DisplayName("should scan a root level package")
        void shouldScanRootPackage() throws DiscoveryException {
            assertThat(scanner.scan("migrations"))
                    .extracting(Class::getSimpleName)
                    .containsExactly("StandaloneMigration");
        }

        @Test
        @DisplayName("should fail when the location does not exist")
        void shouldFailForMissingLocation() {
            assertThatThrownBy(() -> scanner.scan("mongomigrator.fixtures.absent.migrations"))
                    .isInstanceOf(DiscoveryException.class)
                    .hasMessageContaining("Migrations location not found: mongomigrator.fixtures.absent.migrations");
        }
    }

    @Nested
    @DisplayName("exists")
    class Exists {

        @Test
        @DisplayName("should find packages on the class path")
        void shouldFindPackage() {
            assertThat(scanner.exists(ORDERED)).isTrue();
            assertThat(scanner.exists("mongomigrator.fixtures.absent")).isFalse();
        }
    }
}
