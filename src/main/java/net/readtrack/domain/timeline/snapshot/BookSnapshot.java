package net.readtrack.domain.timeline.snapshot;

import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.TimelinePayload;

/**
 * Book state as rendered on the feed: title, credited authors, up to two genres and length.
 */
public record BookSnapshot(
    long entityId,
    String title,
    List<String> authorNames,
    @Nullable String primaryGenre,
    @Nullable String secondaryGenre,
    @Nullable Integer pageCount
) implements TimelineSnapshot {

    public BookSnapshot {
        authorNames = authorNames == null ? List.of() : List.copyOf(authorNames);
    }

    @Override
    public EntityType entityType() {
        return EntityType.BOOK;
    }

    /** Genre names in display order, primary first. */
    public List<String> genres() {
        List<String> genres = new ArrayList<>(2);
        String primary = SnapshotFields.trimToNull(primaryGenre);
        String secondary = SnapshotFields.trimToNull(secondaryGenre);
        if (primary != null) {
            genres.add(primary);
        }
        if (secondary != null && !secondary.equals(primary)) {
            genres.add(secondary);
        }
        return List.copyOf(genres);
    }

    @Override
    public TimelinePayload toPayload() {
        SnapshotFields.requirePositiveId(EntityType.BOOK, "id", entityId);
        String displayTitle = SnapshotFields.requireText(EntityType.BOOK, "title", title);

        List<String> genres = genres();
        List<TimelineEventDetail> details = new ArrayList<>(3);
        details.add(TimelineEventDetail.authors(SnapshotFields.cleanNames(authorNames)));
        if (!genres.isEmpty()) {
            details.add(new TimelineEventDetail("Genres", String.join(", ", genres)));
        }
        if (pageCount != null && pageCount > 0) {
            details.add(new TimelineEventDetail("Pages", Integer.toString(pageCount)));
        }
        return new TimelinePayload(displayTitle, details, genres, null);
    }
}
