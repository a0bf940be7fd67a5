package com.citation.ris.exception;

/**
 * Malformed citation input. Aborts the current parse call; records produced
 * before the failing line stay valid.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String line;

    public ParseException(String reason, int lineNumber, String line) {
        super(reason + " in line " + lineNumber + ":\n " + line);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * @return 1-based number of the offending line
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
