package io.github.flameyossnowy.skeletal.api.exceptions;

public class UniqueValueConflictException extends SkeletalException {
    private final String kind;
    private final String boneName;

    public UniqueValueConflictException(String kind, String boneName, String message) {
        super(message);
        this.kind = kind;
        this.boneName = boneName;
    }

    public String getKind() {
        return kind;
    }

    public String getBoneName() {
        return boneName;
    }
}
