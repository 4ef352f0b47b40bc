package net.readtrack.domain.timeline;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of tracked entities that produce timeline events.
 *
 * <p>The declaration order is the key order used by batch rebuilds, which must match the
 * {@code ORDER BY entity_type} collation of the stored text values.</p>
 */
public enum EntityType {
    AUTHOR("author"),
    BOOK("book"),
    GENRE("genre"),
    READING("reading");

    private final String dbValue;

    EntityType(String dbValue) {
        this.dbValue = dbValue;
    }

    /** Stored column value, for example {@code book}. */
    public String dbValue() {
        return dbValue;
    }

    /** Whether this entity is shared across users (names appear in every holder's stats). */
    public boolean isCatalogEntity() {
        return this != READING;
    }

    public static Optional<EntityType> fromDbValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.dbValue.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static EntityType requireDbValue(String value) {
        return fromDbValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + value));
    }
}
