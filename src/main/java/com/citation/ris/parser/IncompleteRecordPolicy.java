package com.citation.ris.parser;

/**
 * What to do with a record that is still open when the input ends.
 */
public enum IncompleteRecordPolicy {
    /**
     * Drop the record (logged at WARN).
     */
    DISCARD,

    /**
     * Fail the parse with a {@link com.citation.ris.exception.ParseException}.
     */
    FAIL,

    /**
     * Hand the record out as if it had been closed. Used by dialects without
     * an end tag.
     */
    EMIT
}
