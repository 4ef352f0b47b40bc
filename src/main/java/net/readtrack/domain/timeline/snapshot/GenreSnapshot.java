package net.readtrack.domain.timeline.snapshot;

import java.util.List;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelinePayload;

public record GenreSnapshot(long entityId, String name) implements TimelineSnapshot {

    @Override
    public EntityType entityType() {
        return EntityType.GENRE;
    }

    @Override
    public TimelinePayload toPayload() {
        SnapshotFields.requirePositiveId(EntityType.GENRE, "id", entityId);
        String title = SnapshotFields.requireText(EntityType.GENRE, "name", name);
        return new TimelinePayload(title, List.of(), List.of(), null);
    }
}
