package org.javai.projective;

/**
 * Thrown when a set or point is used over a window it is not defined on, or when a
 * reindexing would shrink rather than grow a window.
 */
public class DomainException extends ProjectiveLimitException {

    public DomainException(String message) {
        super(message);
    }
}
