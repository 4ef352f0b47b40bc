package net.readtrack.application.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelineCursor;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.TimelinePage;
import net.readtrack.domain.timeline.TimelinePayload;
import net.readtrack.domain.timeline.TimelineReadingData;
import net.readtrack.domain.timeline.TimelineScope;
import net.readtrack.exception.InvalidTimelineCursorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimelineQueryServiceTest {

    private static final Instant T1 = Instant.parse("2024-04-01T09:00:00Z");

    @Mock
    private TimelineEventRepository timelineEventRepository;

    private TimelineQueryService service;

    @BeforeEach
    void setUp() {
        service = new TimelineQueryService(timelineEventRepository, new TimelineQueryService.PageSettings(20, 100));
    }

    @Test
    void should_MapEventsToEntries_When_GlobalPageRequested() {
        TimelineEvent event = new TimelineEvent(9, EntityKey.of(EntityType.READING, 5), "finished", T1, 2L,
            new TimelinePayload("Dune", List.of(new TimelineEventDetail("Rating", "4/5")), List.of(),
                new TimelineReadingData(1, "read", 4.0)));
        when(timelineEventRepository.listGlobal(null, 20))
            .thenReturn(new TimelinePage<>(List.of(event), "next-token"));

        TimelinePage<TimelineEntry> page = service.page(TimelineScope.GLOBAL, null, null, null);

        assertThat(page.nextCursor()).isEqualTo("next-token");
        assertThat(page.items()).singleElement().satisfies(entry -> {
            assertThat(entry.id()).isEqualTo(9L);
            assertThat(entry.entityType()).isEqualTo("reading");
            assertThat(entry.entityId()).isEqualTo(5L);
            assertThat(entry.action()).isEqualTo("finished");
            assertThat(entry.title()).isEqualTo("Dune");
            assertThat(entry.readingData().bookId()).isEqualTo(1L);
        });
    }

    @Test
    void should_QueryUserFeedFromCursor_When_MineRequested() {
        TimelineCursor cursor = new TimelineCursor(T1, 40L);
        when(timelineEventRepository.listByUser(2L, cursor, 5)).thenReturn(new TimelinePage<>(List.of(), null));

        TimelinePage<TimelineEntry> page = service.page(TimelineScope.MINE, 2L, cursor.encode(), 5);

        assertThat(page.items()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void should_RejectMineScope_When_UserUnknown() {
        assertThatThrownBy(() -> service.page(TimelineScope.MINE, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(timelineEventRepository);
    }

    @Test
    void should_RejectCursor_When_Malformed() {
        assertThatThrownBy(() -> service.page(TimelineScope.GLOBAL, null, "not-a-cursor", null))
            .isInstanceOf(InvalidTimelineCursorException.class);
        verifyNoInteractions(timelineEventRepository);
    }

    @Test
    void should_ClampPageSize_When_LimitOutOfBounds() {
        when(timelineEventRepository.listGlobal(any(), anyInt())).thenReturn(new TimelinePage<>(List.of(), null));

        service.page(TimelineScope.GLOBAL, null, null, 500);
        service.page(TimelineScope.GLOBAL, null, "", 0);

        verify(timelineEventRepository).listGlobal(null, 100);
        verify(timelineEventRepository).listGlobal(eq(null), eq(1));
    }

    @Test
    void should_BoundDefaultPageSize_When_SettingsInconsistent() {
        TimelineQueryService.PageSettings settings = new TimelineQueryService.PageSettings(500, 50);

        assertThat(settings.defaultPageSize()).isEqualTo(50);
        assertThat(settings.clamp(null)).isEqualTo(50);
        assertThat(settings.clamp(-3)).isEqualTo(1);
        assertThatThrownBy(() -> new TimelineQueryService.PageSettings(20, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_ReturnHistoryInStoredOrder_When_EntityRequested() {
        EntityKey key = EntityKey.of(EntityType.BOOK, 1);
        TimelinePayload payload = new TimelinePayload("Dune", List.of(), List.of(), null);
        when(timelineEventRepository.listByEntity(key)).thenReturn(List.of(
            new TimelineEvent(1, key, "created", T1, 2L, payload),
            new TimelineEvent(4, key, "updated", T1.plusSeconds(60), 2L, payload)
        ));

        List<TimelineEntry> history = service.history(key);

        assertThat(history).extracting(TimelineEntry::action).containsExactly("created", "updated");
    }
}
