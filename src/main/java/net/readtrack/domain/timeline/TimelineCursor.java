package net.readtrack.domain.timeline;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Objects;
import net.readtrack.exception.InvalidTimelineCursorException;

/**
 * Keyset position in the feed ordering {@code (occurred_at desc, id desc)}.
 *
 * <p>A page requested with a cursor starts strictly after the cursor's row, so rows
 * inserted concurrently never shift or duplicate page boundaries.</p>
 */
public record TimelineCursor(Instant occurredAt, long id) {

    private static final char SEPARATOR = '|';

    public TimelineCursor {
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    /**
     * Encodes the cursor as opaque URL-safe text.
     *
     * @return base64url token
     */
    public String encode() {
        String raw = occurredAt.toString() + SEPARATOR + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parses a token produced by {@link #encode()}.
     *
     * @param token opaque cursor text from a previous page
     * @return decoded cursor
     * @throws InvalidTimelineCursorException when the token is malformed
     */
    public static TimelineCursor decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTimelineCursorException(token, "cursor is blank");
        }
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new InvalidTimelineCursorException(token, "cursor is not base64url");
        }
        int separatorIndex = raw.lastIndexOf(SEPARATOR);
        if (separatorIndex <= 0 || separatorIndex == raw.length() - 1) {
            throw new InvalidTimelineCursorException(token, "cursor has no id component");
        }
        try {
            Instant occurredAt = Instant.parse(raw.substring(0, separatorIndex));
            long id = Long.parseLong(raw.substring(separatorIndex + 1));
            return new TimelineCursor(occurredAt, id);
        } catch (DateTimeParseException | NumberFormatException ex) {
            throw new InvalidTimelineCursorException(token, "cursor components are malformed");
        }
    }
}
