package net.readtrack.domain.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class EntityKeyTest {

    @Test
    void should_OrderByTypeValueThenId_When_Sorted() {
        List<EntityKey> keys = new ArrayList<>(List.of(
            EntityKey.of(EntityType.READING, 1),
            EntityKey.of(EntityType.BOOK, 20),
            EntityKey.of(EntityType.GENRE, 3),
            EntityKey.of(EntityType.BOOK, 3),
            EntityKey.of(EntityType.AUTHOR, 99)
        ));

        Collections.sort(keys);

        assertThat(keys).containsExactly(
            EntityKey.of(EntityType.AUTHOR, 99),
            EntityKey.of(EntityType.BOOK, 3),
            EntityKey.of(EntityType.BOOK, 20),
            EntityKey.of(EntityType.GENRE, 3),
            EntityKey.of(EntityType.READING, 1)
        );
    }

    @Test
    void should_RenderTypeAndId_When_Printed() {
        assertThat(EntityKey.of(EntityType.BOOK, 12).toString()).isEqualTo("book:12");
    }

    @Test
    void should_ParseStoredValue_When_CaseOrWhitespaceDiffers() {
        assertThat(EntityType.fromDbValue(" Reading ")).contains(EntityType.READING);
        assertThat(EntityType.fromDbValue("shelf")).isEmpty();
        assertThatThrownBy(() -> EntityType.requireDbValue("shelf"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shelf");
    }

    @Test
    void should_TreatOnlyReadingsAsUserScoped() {
        assertThat(EntityType.READING.isCatalogEntity()).isFalse();
        assertThat(EntityType.BOOK.isCatalogEntity()).isTrue();
        assertThat(EntityType.AUTHOR.isCatalogEntity()).isTrue();
        assertThat(EntityType.GENRE.isCatalogEntity()).isTrue();
    }

    @Test
    void should_DefaultToGlobalScope_When_ParameterAbsent() {
        assertThat(TimelineScope.fromParameter(null)).isEqualTo(TimelineScope.GLOBAL);
        assertThat(TimelineScope.fromParameter("mine")).isEqualTo(TimelineScope.MINE);
        assertThatThrownBy(() -> TimelineScope.fromParameter("friends"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
