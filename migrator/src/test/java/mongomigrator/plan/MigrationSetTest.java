package mongomigrator.plan;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.exceptions.DiscoveryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationSet")
class MigrationSetTest {

    private static MigrationDescriptor unit(String id, String name) {
        return new MigrationDescriptor(id, name, new Migration() {
            @Override
            public void apply(MongoDatabase db) {
            }

            @Override
            public void revert(MongoDatabase db) {
            }
        });
    }

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("should sort migrations by order")
        void shouldSortByOrder() throws DiscoveryException {
            MigrationSet set = MigrationSet.build(List.of(
                    unit("0003_c", "C"), unit("0001_a", "A"), unit("0002_b", "B")));

            assertThat(set.ordered()).extracting(MigrationDescriptor::name).containsExactly("A", "B", "C");
            assertThat(set.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should sort numerically, not lexically")
        void shouldSortNumerically() throws DiscoveryException {
            MigrationSet.Builder builder = MigrationSet.builder();
            for (int i = 10; i >= 1; i--) {
                builder.add(unit(i + "_m", "M" + i));
            }

            assertThat(builder.build().ordered())
                    .extracting(MigrationDescriptor::order)
                    .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        }

        @Test
        @DisplayName("should reject duplicate orders")
        void shouldRejectDuplicateOrders() {
            assertThatThrownBy(() -> MigrationSet.build(List.of(unit("0001_a", "A"), unit("1_b", "B"))))
                    .isInstanceOf(DiscoveryException.class)
                    .hasMessageContaining("Duplicate migration order 1: 0001_a and 1_b");
        }

        @Test
        @DisplayName("should reject duplicate names")
        void shouldRejectDuplicateNames() {
            assertThatThrownBy(() -> MigrationSet.build(List.of(unit("0001_a", "A"), unit("0002_b", "A"))))
                    .isInstanceOf(DiscoveryException.class)
                    .hasMessageContaining("Duplicate migration name: A");
        }

        @Test
        @DisplayName("should reject orders that do not start at 1")
        void shouldRejectMissingFirst() {
            assertThatThrownBy(() -> MigrationSet.build(List.of(unit("0002_b", "B"))))
                    .isInstanceOf(DiscoveryException.class)
                    .hasMessageContaining("expected 1 but found 2");
        }

        @Test
        @DisplayName("should reject gaps")
        void shouldRejectGaps() {
            assertThatThrownBy(() -> MigrationSet.build(List.of(unit("0001_a", "A"), unit("0003_c", "C"))))
                    .isInstanceOf(DiscoveryException.class)
                    .hasMessageContaining("contiguous");
        }

        @Test
        @DisplayName("should accept an empty list")
        void shouldAcceptEmpty() throws DiscoveryException {
            assertThat(MigrationSet.build(List.of()).isEmpty()).isTrue();
            assertThat(MigrationSet.empty().ordered()).isEmpty();
        }
    }

    @Nested
    @DisplayName("find")
    class Find {

        @Test
        @DisplayName("should find by id or by name")
        void shouldFindByIdOrName() throws DiscoveryException {
            MigrationSet set = MigrationSet.builder().add(unit("0001_create_index", "CreateIndex")).build();

            assertThat(set.find("0001_create_index")).map(MigrationDescriptor::name).contains("CreateIndex");
            assertThat(set.find("CreateIndex")).map(MigrationDescriptor::id).contains("0001_create_index");
            assertThat(set.find("DropIndex")).isEmpty();
        }
    }
}
