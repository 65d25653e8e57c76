package com.questrail.webm.registry;

/**
 * How the payload of an element is interpreted.
 *
 * <p>The kind is a property of the element identifier, fixed by the schema
 * and looked up in {@link ElementRegistry}. It is never inferred from the
 * bytes themselves.</p>
 */
public enum ElementKind
{
    /** Payload is a sequence of child elements. */
    CONTAINER,
    UNSIGNED_INT,
    SIGNED_INT,
    FLOAT,
    /** Printable ASCII; decoded as UTF-8, of which it is a subset. */
    RESTRICTED_STRING,
    UTF8_STRING,
    /** Signed nanoseconds since 2001-01-01T00:00:00 UTC. */
    DATE,
    BINARY,
    /** Identifier absent from the registry. Handled as opaque binary. */
    UNKNOWN;

    public boolean isContainer() {
        return this == CONTAINER;
    }
}
