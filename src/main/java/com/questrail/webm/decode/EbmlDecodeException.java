package com.questrail.webm.decode;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Indicates that an EBML byte stream, or a field of an already decoded
 * document, could not be decoded.
 *
 * <p>Every instance carries an {@link EbmlErrorKind} and the
 * {@link DecodeStage} that failed. Where known, the absolute byte offset and
 * the identifier of the element involved are attached so that host
 * applications can report a precise reason for rejecting a file.</p>
 *
 * <p>There is no partial recovery: one malformed element invalidates the
 * whole parse, or, for a field accessor, that single lookup.</p>
 */
public final class EbmlDecodeException extends RuntimeException
{
    private static final long UNKNOWN = -1L;

    private final EbmlErrorKind kind;
    private final DecodeStage stage;
    private final long offset;
    private final long elementId;
    private final String detail;

    public EbmlDecodeException(EbmlErrorKind kind,
                               DecodeStage stage,
                               long offset,
                               long elementId,
                               String message) {
        this(kind, stage, offset, elementId, message, null);
    }

    public EbmlDecodeException(EbmlErrorKind kind,
                               DecodeStage stage,
                               long offset,
                               long elementId,
                               String message,
                               Throwable cause) {
        super(describe(stage, offset, elementId, message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.offset = offset;
        this.elementId = elementId;
        this.detail = message;
    }

    // ------------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------------

    public static EbmlDecodeException truncated(DecodeStage stage,
                                                long offset,
                                                long requested,
                                                long available) {
        return new EbmlDecodeException(EbmlErrorKind.TRUNCATED_INPUT, stage, offset, UNKNOWN,
                "needed " + requested + " byte(s) but only " + available + " available");
    }

    public static EbmlDecodeException truncatedPayload(long offset, long elementId, long requested, long available) {
        return new EbmlDecodeException(EbmlErrorKind.TRUNCATED_INPUT, DecodeStage.ELEMENT_READ, offset, elementId,
                "payload needs " + requested + " byte(s) but only " + available + " available");
    }

    public static EbmlDecodeException badSignature(String found) {
        return new EbmlDecodeException(EbmlErrorKind.BAD_SIGNATURE, DecodeStage.SIGNATURE_CHECK, 0L, UNKNOWN,
                "stream does not start with the EBML header signature (found " + found + ")");
    }

    public static EbmlDecodeException invalidEncoding(Throwable cause) {
        return new EbmlDecodeException(EbmlErrorKind.INVALID_ENCODING, DecodeStage.UTF8_DECODE, UNKNOWN, UNKNOWN,
                "payload is not valid UTF-8", cause);
    }

    public static EbmlDecodeException missingField(long parentId, long parentOffset, long fieldId) {
        return new EbmlDecodeException(EbmlErrorKind.MISSING_MANDATORY_FIELD, DecodeStage.FIELD_LOOKUP,
                parentOffset, parentId,
                "mandatory child 0x" + Long.toHexString(fieldId).toUpperCase() + " not present");
    }

    public static EbmlDecodeException spanMismatch(long offset, long elementId, long childEnd, long parentEnd) {
        return new EbmlDecodeException(EbmlErrorKind.SPAN_MISMATCH, DecodeStage.ELEMENT_READ, offset, elementId,
                "element ends at " + childEnd + " beyond its parent's end at " + parentEnd);
    }

    public static EbmlDecodeException unsupportedSize(long offset, long elementId, String reason) {
        return new EbmlDecodeException(EbmlErrorKind.UNSUPPORTED_SIZE, DecodeStage.ELEMENT_READ, offset, elementId,
                reason);
    }

    public static EbmlDecodeException nestingTooDeep(long offset, long elementId, int maxDepth) {
        return new EbmlDecodeException(EbmlErrorKind.NESTING_TOO_DEEP, DecodeStage.ELEMENT_READ, offset, elementId,
                "container nesting exceeds " + maxDepth + " levels");
    }

    /**
     * Returns a copy of this exception with the element location filled in.
     *
     * <p>Used where a low-level conversion fails without knowing which
     * element it was decoding.</p>
     */
    public EbmlDecodeException at(long offset, long elementId) {
        EbmlDecodeException located = new EbmlDecodeException(kind, stage, offset, elementId, detail, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    // ------------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------------

    public EbmlErrorKind kind() {
        return kind;
    }

    public DecodeStage stage() {
        return stage;
    }

    /**
     * Absolute stream offset of the failure, or of the element involved.
     */
    public OptionalLong offset() {
        return offset < 0 ? OptionalLong.empty() : OptionalLong.of(offset);
    }

    public OptionalLong elementId() {
        return elementId < 0 ? OptionalLong.empty() : OptionalLong.of(elementId);
    }

    private static String describe(DecodeStage stage, long offset, long elementId, String message) {
        StringBuilder sb = new StringBuilder(stage.name());
        if (offset >= 0) {
            sb.append(" @").append(offset);
        }
        if (elementId >= 0) {
            sb.append(" id=0x").append(Long.toHexString(elementId).toUpperCase());
        }
        return sb.append(": ").append(message).toString();
    }
}
