package net.readtrack.application.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.NewTimelineEvent;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.TimelinePayload;
import net.readtrack.domain.timeline.snapshot.BookSnapshot;
import net.readtrack.domain.timeline.snapshot.ReadingSnapshot;
import net.readtrack.domain.timeline.snapshot.ReadingStatus;
import net.readtrack.exception.TimelineSnapshotValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class TimelineRecorderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.123456789Z");

    @Mock
    private TimelineEventRepository timelineEventRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private TimelineRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new TimelineRecorder(timelineEventRepository, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void should_AppendRenderedPayload_When_BookCreated() {
        when(timelineEventRepository.append(any(NewTimelineEvent.class))).thenReturn(11L);
        BookSnapshot dune = new BookSnapshot(1, "Dune", List.of("Frank Herbert"), "Sci-Fi", null, null);

        TimelineEvent event = recorder.record(EntityType.BOOK, 1, "created", 2L, dune);

        ArgumentCaptor<NewTimelineEvent> captor = ArgumentCaptor.forClass(NewTimelineEvent.class);
        verify(timelineEventRepository).append(captor.capture());
        NewTimelineEvent appended = captor.getValue();
        assertThat(appended.key()).isEqualTo(EntityKey.of(EntityType.BOOK, 1));
        assertThat(appended.action()).isEqualTo("created");
        assertThat(appended.occurredAt()).isEqualTo(Instant.parse("2024-05-01T12:00:00.123456Z"));
        assertThat(appended.userId()).isEqualTo(2L);
        assertThat(appended.payload().details()).containsExactly(
            new TimelineEventDetail("Author", "Frank Herbert"),
            new TimelineEventDetail("Genres", "Sci-Fi")
        );
        assertThat(event.id()).isEqualTo(11L);
        assertThat(event.payload()).isEqualTo(appended.payload());
    }

    @Test
    void should_PublishReadingOwner_When_ReadingRecordedByAnotherUser() {
        when(timelineEventRepository.append(any(NewTimelineEvent.class))).thenReturn(12L);
        ReadingSnapshot reading = new ReadingSnapshot(5, 9L, 1, "Dune", List.of(), ReadingStatus.READ, null, 4.0);

        recorder.record(EntityType.READING, 5, "finished", 2L, reading);

        ArgumentCaptor<TimelineMutationEvent> captor = ArgumentCaptor.forClass(TimelineMutationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getEventId()).isEqualTo(12L);
        assertThat(captor.getValue().getStatsUserId()).isEqualTo(9L);
        assertThat(captor.getValue().isUpdate()).isFalse();
    }

    @Test
    void should_NotAppend_When_SnapshotMissingRequiredField() {
        BookSnapshot untitled = new BookSnapshot(1, "", List.of(), null, null, null);

        assertThatThrownBy(() -> recorder.record(EntityType.BOOK, 1, "created", 2L, untitled))
            .isInstanceOf(TimelineSnapshotValidationException.class);

        verify(timelineEventRepository, never()).append(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void should_RejectSnapshot_When_ItDescribesAnotherEntity() {
        BookSnapshot other = new BookSnapshot(2, "Emma", List.of(), null, null, null);

        assertThatThrownBy(() -> recorder.record(EntityType.BOOK, 1, "updated", null, other))
            .isInstanceOf(TimelineSnapshotValidationException.class)
            .hasMessageContaining("book:2");
    }

    @Test
    void should_ReuseLastPayload_When_EntityDeletedWithoutState() {
        EntityKey key = EntityKey.of(EntityType.BOOK, 1);
        TimelinePayload last = new TimelinePayload("Dune", List.of(), List.of(), null);
        when(timelineEventRepository.findLatestByEntity(key))
            .thenReturn(Optional.of(new TimelineEvent(3, key, "updated", NOW, 2L, last)));
        when(timelineEventRepository.append(any(NewTimelineEvent.class))).thenReturn(4L);

        TimelineEvent event = recorder.record(EntityType.BOOK, 1, "deleted", 2L, null);

        assertThat(event.payload()).isEqualTo(last);
        assertThat(event.action()).isEqualTo("deleted");
    }

    @Test
    void should_PublishReadingOwner_When_AnotherUserDeletesReadingWithoutState() {
        EntityKey key = EntityKey.of(EntityType.READING, 5);
        TimelinePayload last = new TimelinePayload("Dune", List.of(), List.of(), null);
        when(timelineEventRepository.findLatestByEntity(key))
            .thenReturn(Optional.of(new TimelineEvent(3, key, "finished", NOW, 9L, last)));
        when(timelineEventRepository.append(any(NewTimelineEvent.class))).thenReturn(4L);

        TimelineEvent event = recorder.record(EntityType.READING, 5, "deleted", 2L, null);

        ArgumentCaptor<TimelineMutationEvent> captor = ArgumentCaptor.forClass(TimelineMutationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getStatsUserId()).isEqualTo(9L);
        assertThat(event.userId()).isEqualTo(2L);
        verify(timelineEventRepository, times(1)).findLatestByEntity(key);
    }

    @Test
    void should_PublishActingUser_When_LastReadingEventHasNoUser() {
        EntityKey key = EntityKey.of(EntityType.READING, 6);
        TimelinePayload last = new TimelinePayload("Emma", List.of(), List.of(), null);
        when(timelineEventRepository.findLatestByEntity(key))
            .thenReturn(Optional.of(new TimelineEvent(7, key, "started", NOW, null, last)));
        when(timelineEventRepository.append(any(NewTimelineEvent.class))).thenReturn(8L);

        recorder.record(EntityType.READING, 6, "deleted", 2L, null);

        ArgumentCaptor<TimelineMutationEvent> captor = ArgumentCaptor.forClass(TimelineMutationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getStatsUserId()).isEqualTo(2L);
    }

    @Test
    void should_RejectMissingState_When_ActionIsNotDeletion() {
        assertThatThrownBy(() -> recorder.record(EntityType.BOOK, 1, "updated", 2L, null))
            .isInstanceOf(TimelineSnapshotValidationException.class)
            .hasMessageContaining("entity state is required");
    }

    @Test
    void should_RejectDeletion_When_NoStateWasEverRecorded() {
        when(timelineEventRepository.findLatestByEntity(EntityKey.of(EntityType.GENRE, 8))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> recorder.record(EntityType.GENRE, 8, "deleted", null, null))
            .isInstanceOf(TimelineSnapshotValidationException.class)
            .hasMessageContaining("genre:8");
    }

    @Test
    void should_RejectBlankAction() {
        BookSnapshot dune = new BookSnapshot(1, "Dune", List.of(), null, null, null);

        assertThatThrownBy(() -> recorder.record(EntityType.BOOK, 1, " ", 2L, dune))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
