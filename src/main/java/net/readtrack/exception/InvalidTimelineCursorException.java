package net.readtrack.exception;

/**
 * A feed cursor could not be decoded. Callers should restart from the first page.
 */
public class InvalidTimelineCursorException extends IllegalArgumentException {

    private final String cursor;

    public InvalidTimelineCursorException(String cursor, String reason) {
        super("Invalid timeline cursor: " + reason);
        this.cursor = cursor;
    }

    public String getCursor() {
        return cursor;
    }
}
