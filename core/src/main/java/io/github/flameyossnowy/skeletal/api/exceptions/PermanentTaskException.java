package io.github.flameyossnowy.skeletal.api.exceptions;

/**
 * Raised by a background task that can never succeed. The task queue drops the task
 * instead of retrying it.
 */
public class PermanentTaskException extends SkeletalException {
    public PermanentTaskException(String message) {
        super(message);
    }

    public PermanentTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
