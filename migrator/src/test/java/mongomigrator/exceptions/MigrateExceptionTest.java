package mongomigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrateException")
class MigrateExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should store message")
        void shouldStoreMessage() {
            MigrateException ex = new MigrateException("Migration failed");

            assertThat(ex.getMessage()).isEqualTo("Migration failed");
        }

        @Test
        @DisplayName("should have null diagnostic fields")
        void shouldHaveNullDiagnosticFields() {
            MigrateException ex = new MigrateException("Error");

            assertThat(ex.getMigrationName()).isNull();
            assertThat(ex.getStage()).isNull();
            assertThat(ex.getCause()).isNull();
        }
    }

    @Nested
    @DisplayName("constructor with full context")
    class ConstructorWithFullContext {

        @Test
        @DisplayName("should append stage and migration to the message")
        void shouldAppendContext() {
            RuntimeException cause = new RuntimeException("socket closed");

            MigrateException ex = new MigrateException("Ledger write failed", "AddStatus",
                    MigrateException.Stage.LEDGER, cause);

            assertThat(ex.getMessage())
                    .isEqualTo("Ledger write failed [stage=LEDGER] [migration=AddStatus]");
            assertThat(ex.getCause()).isSameAs(cause);
        }
    }

    @Nested
    @DisplayName("subclasses")
    class Subclasses {

        @Test
        @DisplayName("should report the missing predecessor")
        void prerequisite() {
            PrerequisiteException ex = new PrerequisiteException("AddStatus", 1);

            assertThat(ex.getMissingOrder()).isEqualTo(1);
            assertThat(ex.getStage()).isEqualTo(MigrateException.Stage.PREREQUISITE);
            assertThat(ex.getMessage()).isEqualTo(
                    "Previous migration with order 1 has not been applied [stage=PREREQUISITE] [migration=AddStatus]");
        }

        @Test
        @DisplayName("should keep the original failure of an operation")
        void operation() {
            IllegalStateException cause = new IllegalStateException("index not found");

            OperationException apply = new OperationException("CreateIndex", MigrateException.Stage.APPLY, cause);
            OperationException revert = new OperationException("CreateIndex", MigrateException.Stage.REVERT, cause);

            assertThat(apply).hasMessageStartingWith("Migration failed: index not found").hasCause(cause);
            assertThat(revert).hasMessageStartingWith("Rollback failed: index not found");
        }

        @Test
        @DisplayName("should tag discovery, load and lock failures with their stage")
        void stages() {
            assertThat(new DiscoveryException("x").getStage()).isEqualTo(MigrateException.Stage.DISCOVERY);
            assertThat(new LoadException("x", "A").getStage()).isEqualTo(MigrateException.Stage.LOAD);
            assertThat(new MigrationLockException("x").getStage()).isEqualTo(MigrateException.Stage.LOCK);
        }
    }
}
