package org.javai.projective;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a kind of invariant violation.
 *
 * @param namespace the component that checks the invariant (e.g., "projectivity", "witness")
 * @param name the specific law that failed (e.g., "pushforward_mismatch", "not_antitone")
 */
public record ViolationId(String namespace, String name) {

    public ViolationId {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static ViolationId of(String namespace, String name) {
        return new ViolationId(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
