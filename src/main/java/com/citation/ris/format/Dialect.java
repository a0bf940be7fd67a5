package com.citation.ris.format;

/**
 * Supported citation text dialects.
 */
public enum Dialect {
    RIS(RisLineFormat.INSTANCE),
    WOK(WokLineFormat.INSTANCE),
    PUBMED(PubMedLineFormat.INSTANCE);

    private final LineFormat lineFormat;

    Dialect(LineFormat lineFormat) {
        this.lineFormat = lineFormat;
    }

    public LineFormat lineFormat() {
        return lineFormat;
    }
}
