package com.questrail.webm;

import com.questrail.webm.decode.EbmlDecodeException;

import java.util.Objects;

/**
 * ParseOutcome
 * -----------------------------------------------------------------------------
 * Explicit result of {@link WebmParser#tryParse}. Exactly one of
 * {@link Parsed} or {@link Rejected}.
 */
public sealed interface ParseOutcome
        permits ParseOutcome.Parsed, ParseOutcome.Rejected
{
    boolean isParsed();

    /** The source decoded into a complete document. */
    record Parsed(WebmDocument document) implements ParseOutcome {
        public Parsed {
            Objects.requireNonNull(document, "document");
        }

        @Override
        public boolean isParsed() {
            return true;
        }
    }

    /** The source was rejected; no partial document exists. */
    record Rejected(EbmlDecodeException error) implements ParseOutcome {
        public Rejected {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isParsed() {
            return false;
        }
    }
}
