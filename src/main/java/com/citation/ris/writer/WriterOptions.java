package com.citation.ris.writer;

import java.util.Map;
import java.util.Set;

import com.citation.ris.format.LineFormat;
import com.citation.ris.mapping.TagMapping;

import lombok.Builder;
import lombok.Value;

/**
 * Writer settings. Every {@code null} table falls back to the dialect default;
 * a non-null table replaces it entirely.
 */
@Value
@Builder(toBuilder = true)
public class WriterOptions {

    private static final WriterOptions DEFAULTS = WriterOptions.builder().build();

    Map<String, String> mapping;

    Set<String> listTags;

    /**
     * Tag code -> separator used to join a list value onto a single line.
     */
    Map<String, String> delimiterTags;

    Set<String> ignoreTags;

    /**
     * Leave out the unknown-tag container of each record.
     */
    boolean skipUnknownTags;

    /**
     * When set, only list tags are written one line per value; a list held by
     * any other tag is cut to its first value with a warning. When cleared,
     * every list value is written one line per value.
     */
    @Builder.Default
    boolean enforceListTags = true;

    @Builder.Default
    String newline = "\n";

    /**
     * Start-tag value for records that carry none; {@code null} selects the
     * dialect default.
     */
    String defaultReferenceType;

    /**
     * Write the dialect's per-record header (the {@code "1."} line for RIS).
     */
    @Builder.Default
    boolean numberRecords = true;

    /**
     * Receives dropped-field warnings; {@code null} logs them at WARN.
     */
    ExportWarningListener warningListener;

    public static WriterOptions defaults() {
        return DEFAULTS;
    }

    TagMapping resolveMapping(LineFormat format) {
        TagMapping defaults = format.defaultMapping();
        return TagMapping.builder()
                .tags(mapping != null ? mapping : defaults.getTags())
                .listTags(listTags != null ? listTags : defaults.getListTags())
                .delimiters(delimiterTags != null ? delimiterTags : defaults.getDelimiters())
                .build()
                .validate();
    }

    Set<String> resolveIgnoreTags(LineFormat format) {
        return ignoreTags != null ? ignoreTags : format.defaultIgnoredTags();
    }

    String resolveDefaultReferenceType(LineFormat format) {
        return defaultReferenceType != null ? defaultReferenceType : format.defaultReferenceType().orElse(null);
    }
}
