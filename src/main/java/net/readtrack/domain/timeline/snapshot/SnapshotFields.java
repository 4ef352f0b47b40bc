package net.readtrack.domain.timeline.snapshot;

import java.util.ArrayList;
import java.util.List;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.exception.TimelineSnapshotValidationException;

final class SnapshotFields {

    private SnapshotFields() {
    }

    static String requireText(EntityType entityType, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new TimelineSnapshotValidationException(entityType, field, field + " is required");
        }
        return value.trim();
    }

    static void requirePositiveId(EntityType entityType, String field, long value) {
        if (value <= 0) {
            throw new TimelineSnapshotValidationException(entityType, field, field + " must be positive but was " + value);
        }
    }

    static List<String> cleanNames(List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>(names.size());
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                cleaned.add(name.trim());
            }
        }
        return List.copyOf(cleaned);
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
