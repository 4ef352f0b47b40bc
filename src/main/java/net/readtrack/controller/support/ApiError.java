package net.readtrack.controller.support;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.annotation.Nullable;
import net.readtrack.exception.TimelineSnapshotValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;

/**
 * Error body returned by the timeline, stats and admin endpoints.
 * Null fields are omitted; {@code entityType} and {@code field} are only set for rejected snapshots.
 *
 * @param error short label of the failure class, stable across releases
 * @param message human-readable detail, when there is one worth showing
 * @param entityType entity kind whose snapshot was rejected
 * @param field snapshot field that failed validation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    String error,
    @Nullable String message,
    @Nullable String entityType,
    @Nullable String field
) {

    static ApiError of(String error, @Nullable String message) {
        return new ApiError(error, StringUtils.hasText(message) ? message : null, null, null);
    }

    static ApiError rejectedSnapshot(TimelineSnapshotValidationException ex) {
        return new ApiError("Invalid entity state", ex.getMessage(), ex.getEntityType().dbValue(), ex.getField());
    }

    ResponseEntity<ApiError> withStatus(HttpStatus status) {
        return ResponseEntity.status(status).body(this);
    }
}
