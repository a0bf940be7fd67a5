package com.citation.ris.parser;

import com.citation.ris.model.RisRecord;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of feeding one line to a {@link ParseSession}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class LineStep {

    private static final LineStep SKIP = new LineStep(Kind.SKIP, null, null);

    Kind kind;
    RisRecord record;
    String message;

    enum Kind {
        EMIT,
        SKIP,
        ERROR
    }

    static LineStep emit(RisRecord record) {
        return new LineStep(Kind.EMIT, record, null);
    }

    static LineStep skip() {
        return SKIP;
    }

    static LineStep error(String message) {
        return new LineStep(Kind.ERROR, null, message);
    }
}
