package net.readtrack.domain.timeline.snapshot;

import java.util.List;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelinePayload;

public record AuthorSnapshot(long entityId, String name) implements TimelineSnapshot {

    @Override
    public EntityType entityType() {
        return EntityType.AUTHOR;
    }

    @Override
    public TimelinePayload toPayload() {
        SnapshotFields.requirePositiveId(EntityType.AUTHOR, "id", entityId);
        String title = SnapshotFields.requireText(EntityType.AUTHOR, "name", name);
        return new TimelinePayload(title, List.of(), List.of(), null);
    }
}
