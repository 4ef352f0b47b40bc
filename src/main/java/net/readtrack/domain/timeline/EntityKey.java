package net.readtrack.domain.timeline;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one tracked entity; ordered the same way the store enumerates keys.
 */
public record EntityKey(EntityType entityType, long entityId) implements Comparable<EntityKey> {

    private static final Comparator<EntityKey> ORDER = Comparator
        .comparing((EntityKey key) -> key.entityType().dbValue())
        .thenComparingLong(EntityKey::entityId);

    public EntityKey {
        Objects.requireNonNull(entityType, "entityType");
    }

    public static EntityKey of(EntityType entityType, long entityId) {
        return new EntityKey(entityType, entityId);
    }

    @Override
    public int compareTo(EntityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return entityType.dbValue() + ":" + entityId;
    }
}
