package com.questrail.webm.decode;

/**
 * Classification of every failure the EBML reader can report.
 *
 * <p>An identifier missing from the element registry is <strong>not</strong>
 * an error; such elements are kept as opaque binary.</p>
 */
public enum EbmlErrorKind
{
    /** Fewer bytes were available than a length field demanded. */
    TRUNCATED_INPUT,

    /** The leading four bytes are not the EBML header identifier. */
    BAD_SIGNATURE,

    /** A string payload is not valid UTF-8. */
    INVALID_ENCODING,

    /** A view required a child element that is not present. */
    MISSING_MANDATORY_FIELD,

    /** Child elements do not exactly fill their parent's declared size. */
    SPAN_MISMATCH,

    /**
     * A declared size uses the reserved "unknown size" encoding, or is too
     * large to be held in memory.
     */
    UNSUPPORTED_SIZE,

    /** Container nesting exceeded the configured maximum depth. */
    NESTING_TOO_DEEP
}
