package net.readtrack.domain.timeline.snapshot;

import jakarta.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.TimelinePayload;
import net.readtrack.domain.timeline.TimelineReadingData;
import net.readtrack.exception.TimelineSnapshotValidationException;

/**
 * One reading session joined with the parent book fields the feed shows.
 */
public record ReadingSnapshot(
    long entityId,
    @Nullable Long userId,
    long bookId,
    String bookTitle,
    List<String> authorNames,
    ReadingStatus status,
    @Nullable ReadingFormat format,
    @Nullable Double rating
) implements TimelineSnapshot {

    public ReadingSnapshot {
        authorNames = authorNames == null ? List.of() : List.copyOf(authorNames);
    }

    @Override
    public EntityType entityType() {
        return EntityType.READING;
    }

    @Override
    public TimelinePayload toPayload() {
        SnapshotFields.requirePositiveId(EntityType.READING, "id", entityId);
        SnapshotFields.requirePositiveId(EntityType.READING, "bookId", bookId);
        String title = SnapshotFields.requireText(EntityType.READING, "bookTitle", bookTitle);
        if (status == null) {
            throw new TimelineSnapshotValidationException(EntityType.READING, "status", "status is required");
        }

        List<TimelineEventDetail> details = new ArrayList<>(3);
        details.add(TimelineEventDetail.authors(SnapshotFields.cleanNames(authorNames)));
        if (format != null) {
            details.add(new TimelineEventDetail("Format", format.displayLabel()));
        }
        if (rating != null) {
            details.add(new TimelineEventDetail("Rating", formatRating(rating)));
        }
        TimelineReadingData readingData = new TimelineReadingData(bookId, status.dbValue(), rating);
        return new TimelinePayload(title, details, List.of(), readingData);
    }

    /** Formats a half-star rating as {@code 4/5} or {@code 4.5/5}. */
    static String formatRating(double rating) {
        BigDecimal value = BigDecimal.valueOf(rating).stripTrailingZeros();
        return value.toPlainString() + "/5";
    }
}
