package com.questrail.webm.registry;

import java.util.Objects;

/**
 * Registry entry: an element identifier with its schema kind and a
 * human-readable name used for diagnostics only.
 */
public record ElementInfo(long id, ElementKind kind, String name)
{
    public ElementInfo {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if (kind == ElementKind.UNKNOWN) {
            throw new IllegalArgumentException("registered elements must have a concrete kind: " + name);
        }
    }
}
