package net.readtrack.application.timeline;

/**
 * Action labels with special meaning to the timeline. Any other label is recorded as given.
 */
public final class TimelineActions {

    public static final String CREATED = "created";
    public static final String UPDATED = "updated";
    public static final String DELETED = "deleted";
    public static final String ADDED = "added";

    private TimelineActions() {
    }
}
