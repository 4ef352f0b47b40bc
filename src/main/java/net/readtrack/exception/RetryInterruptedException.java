package net.readtrack.exception;

/**
 * Raised when the calling thread is interrupted while backing off between storage attempts.
 * The thread's interrupt flag is set again before this is thrown.
 */
public class RetryInterruptedException extends IllegalStateException {

    private final String operationLabel;

    public RetryInterruptedException(String operationLabel, InterruptedException cause) {
        super("Interrupted while waiting to retry " + operationLabel, cause);
        this.operationLabel = operationLabel;
    }

    public String getOperationLabel() {
        return operationLabel;
    }
}
