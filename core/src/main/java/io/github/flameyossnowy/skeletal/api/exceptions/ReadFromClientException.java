package io.github.flameyossnowy.skeletal.api.exceptions;

import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientError;

import java.util.List;

public class ReadFromClientException extends SkeletalException {
    private final List<ReadFromClientError> errors;

    public ReadFromClientException(List<ReadFromClientError> errors) {
        super("Invalid client data: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<ReadFromClientError> getErrors() {
        return errors;
    }
}
