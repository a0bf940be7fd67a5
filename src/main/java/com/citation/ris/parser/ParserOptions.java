package com.citation.ris.parser;

import java.util.Map;
import java.util.Set;

import com.citation.ris.format.LineFormat;
import com.citation.ris.mapping.TagMapping;

import lombok.Builder;
import lombok.Value;

/**
 * Parser settings. Every {@code null} table falls back to the dialect default;
 * a non-null table replaces the default entirely.
 */
@Value
@Builder(toBuilder = true)
public class ParserOptions {

    private static final ParserOptions DEFAULTS = ParserOptions.builder().build();

    /**
     * Tag code -> field name.
     */
    Map<String, String> mapping;

    /**
     * Tags always read as lists.
     */
    Set<String> listTags;

    /**
     * Tag code -> literal separator for splitting one line into several values.
     */
    Map<String, String> delimiterTags;

    /**
     * Tags skipped silently.
     */
    Set<String> ignoreTags;

    /**
     * Tags whose entries are split again on {@code ;} once the record is complete.
     */
    Set<String> semicolonTags;

    /**
     * Drop tags missing from the mapping instead of keeping them in the
     * unknown-tag container.
     */
    boolean skipUnknownTags;

    /**
     * When set, a repeated non-list tag keeps its first value. When cleared,
     * the field is promoted to a list holding every occurrence.
     */
    @Builder.Default
    boolean enforceListTags = true;

    /**
     * Skip every line without a tag instead of treating it as a continuation.
     */
    boolean skipMissingTags;

    /**
     * Handling of a record left open at end of input; {@code null} selects
     * {@link IncompleteRecordPolicy#DISCARD} for dialects with an end tag and
     * {@link IncompleteRecordPolicy#EMIT} for the others.
     */
    IncompleteRecordPolicy incompleteRecordPolicy;

    public static ParserOptions defaults() {
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

    Set<String> resolveSemicolonTags(LineFormat format) {
        return semicolonTags != null ? semicolonTags : format.defaultSemicolonTags();
    }

    IncompleteRecordPolicy resolveIncompleteRecordPolicy(LineFormat format) {
        if (incompleteRecordPolicy != null) {
            return incompleteRecordPolicy;
        }
        return format.endTag().isPresent() ? IncompleteRecordPolicy.DISCARD : IncompleteRecordPolicy.EMIT;
    }
}
