package io.github.flameyossnowy.skeletal.api.exceptions;

public class SkeletalException extends RuntimeException {
    public SkeletalException(String message) {
        super(message);
    }

    public SkeletalException(String message, Throwable cause) {
        super(message, cause);
    }
}
