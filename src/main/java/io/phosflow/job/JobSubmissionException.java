package io.phosflow.job;

public final class JobSubmissionException extends RuntimeException {
    public JobSubmissionException(String message) {
        super(message);
    }

    public JobSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
