package io.github.flameyossnowy.skeletal.api.exceptions;

/**
 * Misuse of the skeleton registry: duplicate kinds, unresolvable relation targets or
 * registration after the registry has been sealed.
 */
public class SchemaException extends SkeletalException {
    public SchemaException(String message) {
        super(message);
    }
}
