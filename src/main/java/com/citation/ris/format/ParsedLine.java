package com.citation.ris.format;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One classified input line.
 */
@Data
@AllArgsConstructor
public class ParsedLine {
    private Kind kind;
    private String tag;
    private String content;
    private int lineNumber;
    private String raw;

    public enum Kind {
        BLANK,
        TAG,
        CONTINUATION
    }

    public boolean isTag() {
        return kind == Kind.TAG;
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }
}
