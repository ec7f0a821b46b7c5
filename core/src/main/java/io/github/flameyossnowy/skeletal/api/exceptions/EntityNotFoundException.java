package io.github.flameyossnowy.skeletal.api.exceptions;

import io.github.flameyossnowy.skeletal.api.store.Key;

public class EntityNotFoundException extends SkeletalException {
    private final Key key;

    public EntityNotFoundException(Key key) {
        super("Entity " + key + " does not exist (anymore?)");
        this.key = key;
    }

    public Key getKey() {
        return key;
    }
}
