package org.javai.projective;

/**
 * Thrown when a content fails the additivity needed to extend it to a measure.
 * For the product families built by this library it signals a defect, never bad input.
 */
public class ExtensionException extends ProjectiveLimitException {

    public ExtensionException(String message) {
        super(message);
    }
}
