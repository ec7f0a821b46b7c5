package io.github.flameyossnowy.skeletal.api.bones;

public enum ReadFromClientErrorSeverity {
    /** The field was not submitted at all. */
    NOT_SET,
    /** The value is valid but makes another field invalid. */
    INVALIDATES_OTHER,
    /** The field was submitted without a value. */
    EMPTY,
    /** The submitted value was rejected. */
    INVALID
}
