package net.readtrack.domain.timeline.snapshot;

import java.util.Locale;
import java.util.Optional;

public enum ReadingStatus {
    READING("reading"),
    READ("read"),
    ABANDONED("abandoned");

    private final String dbValue;

    ReadingStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static Optional<ReadingStatus> fromDbValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReadingStatus status : values()) {
            if (status.dbValue.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
