package net.readtrack.domain.timeline;

import java.util.List;
import java.util.Optional;
import net.readtrack.domain.timeline.snapshot.TimelineSnapshot;

/**
 * Read-side port for loading the current state of tracked entities.
 */
public interface EntitySnapshotReader {

    /**
     * Loads the current state of one entity.
     *
     * @param key entity to load
     * @return current snapshot, or empty when the entity no longer exists
     */
    Optional<TimelineSnapshot> read(EntityKey key);

    /**
     * Entities whose rendered payload embeds fields of {@code key}: a book's readings, an
     * author's books and their readings, a genre's books. Readings have no dependents.
     *
     * @param key changed entity
     * @return dependent keys in {@link EntityKey} order, never containing {@code key} itself
     */
    List<EntityKey> dependentsOf(EntityKey key);
}
