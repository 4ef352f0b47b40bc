package net.readtrack.exception;

/**
 * Raised when a timeline rebuild is requested while another one is still executing.
 */
public class RebuildAlreadyRunningException extends IllegalStateException {

    public RebuildAlreadyRunningException() {
        super("A timeline rebuild is already running");
    }
}
