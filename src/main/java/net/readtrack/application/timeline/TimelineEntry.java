package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.TimelineReadingData;

/**
 * Display-ready feed row.
 */
public record TimelineEntry(
    long id,
    String entityType,
    long entityId,
    String action,
    Instant occurredAt,
    String title,
    List<TimelineEventDetail> details,
    List<String> genres,
    @Nullable TimelineReadingData readingData
) {
    public static TimelineEntry from(TimelineEvent event) {
        return new TimelineEntry(
            event.id(),
            event.key().entityType().dbValue(),
            event.key().entityId(),
            event.action(),
            event.occurredAt(),
            event.payload().title(),
            event.payload().details(),
            event.payload().genres(),
            event.payload().readingData()
        );
    }
}
