package com.citation.ris.writer;

import lombok.Value;

/**
 * Non-fatal problem met while writing: the named field was dropped (fully or
 * partly) from the output of one record.
 */
@Value
public class ExportWarning {
    /**
     * 1-based position of the record in the written sequence.
     */
    int recordIndex;
    String field;
    String message;
}
