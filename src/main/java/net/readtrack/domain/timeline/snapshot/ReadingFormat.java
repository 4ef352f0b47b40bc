package net.readtrack.domain.timeline.snapshot;

import java.util.Locale;
import java.util.Optional;

public enum ReadingFormat {
    PHYSICAL("physical", "Physical"),
    EREADER("ereader", "eReader"),
    AUDIOBOOK("audiobook", "Audiobook");

    private final String dbValue;
    private final String displayLabel;

    ReadingFormat(String dbValue, String displayLabel) {
        this.dbValue = dbValue;
        this.displayLabel = displayLabel;
    }

    public String dbValue() {
        return dbValue;
    }

    public String displayLabel() {
        return displayLabel;
    }

    public static Optional<ReadingFormat> fromDbValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReadingFormat format : values()) {
            if (format.dbValue.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
