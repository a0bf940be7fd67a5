package com.citation.ris.mapping;

import lombok.Builder;
import lombok.Data;

/**
 * A single line of a tag mapping file.
 */
@Data
@Builder
public class TagMappingEntry {
    private String tag;
    private String fieldName;
    private boolean list;
    private String delimiter;
    private int lineNumber;

    public boolean isDelimited() {
        return delimiter != null;
    }
}
