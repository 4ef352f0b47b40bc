package net.readtrack.domain.timeline;

import java.util.Locale;

/** Which events a feed request covers. */
public enum TimelineScope {
    MINE,
    GLOBAL;

    public static TimelineScope fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return GLOBAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("scope must be 'mine' or 'global' but was '" + value + "'", ex);
        }
    }
}
