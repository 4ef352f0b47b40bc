package net.readtrack.domain.timeline;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Denormalized, display-ready part of a timeline event. This is the only part of an
 * event the rebuild job may rewrite.
 */
public record TimelinePayload(
    String title,
    List<TimelineEventDetail> details,
    List<String> genres,
    @Nullable TimelineReadingData readingData
) {
    public TimelinePayload {
        details = details == null ? List.of() : List.copyOf(details);
        genres = genres == null ? List.of() : List.copyOf(genres);
    }
}
