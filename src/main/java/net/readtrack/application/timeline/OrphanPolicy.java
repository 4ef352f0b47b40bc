package net.readtrack.application.timeline;

import java.util.Locale;

/**
 * What the rebuild job does with events whose source entity no longer exists.
 */
public enum OrphanPolicy {
    /** Keep the last known payload; the events stay in the feed unchanged. */
    FREEZE,
    /** Delete every event of the missing entity. */
    PRUNE;

    public static OrphanPolicy fromProperty(String value) {
        if (value == null || value.isBlank()) {
            return FREEZE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                "app.timeline.rebuild.orphan-policy must be FREEZE or PRUNE but was '" + value + "'", ex);
        }
    }
}
