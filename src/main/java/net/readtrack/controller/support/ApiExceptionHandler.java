package net.readtrack.controller.support;

import lombok.extern.slf4j.Slf4j;
import net.readtrack.exception.InvalidTimelineCursorException;
import net.readtrack.exception.RebuildAlreadyRunningException;
import net.readtrack.exception.TimelineSnapshotValidationException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps timeline and stats failures to {@link ApiError} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidTimelineCursorException.class)
    public ResponseEntity<ApiError> handleInvalidCursor(InvalidTimelineCursorException ex) {
        log.debug("Rejected feed cursor '{}': {}", ex.getCursor(), ex.getMessage());
        return ApiError.of("Invalid cursor", ex.getMessage()).withStatus(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(TimelineSnapshotValidationException.class)
    public ResponseEntity<ApiError> handleInvalidSnapshot(TimelineSnapshotValidationException ex) {
        log.warn("Rejected mutation: {}", ex.getMessage());
        return ApiError.rejectedSnapshot(ex).withStatus(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return ApiError.of("Bad request", ex.getMessage()).withStatus(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RebuildAlreadyRunningException.class)
    public ResponseEntity<ApiError> handleRebuildRunning(RebuildAlreadyRunningException ex) {
        return ApiError.of("Rebuild already running", ex.getMessage()).withStatus(HttpStatus.CONFLICT);
    }

    // storage details stay in the log
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleStorageFailure(DataAccessException ex) {
        log.error("Storage failure while serving request", ex);
        return ApiError.of("Storage unavailable", null).withStatus(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
