package com.citation.ris.format;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.citation.ris.mapping.TagMapping;

/**
 * Dialect-specific shape of tag lines, used by both the parser and the writer.
 *
 * Implementations are stateless.
 */
public interface LineFormat {

    /**
     * Whether the line starts with a tag in this dialect's layout.
     */
    boolean isTagLine(String line);

    /**
     * Tag code of a line for which {@link #isTagLine(String)} holds.
     */
    String tagOf(String line);

    /**
     * Content (non-tag part) of a tag line, trimmed.
     */
    String contentOf(String line);

    /**
     * Whether a line outside any record is header noise that can be skipped.
     */
    default boolean isHeader(String line) {
        return false;
    }

    String startTag();

    /**
     * End-of-record tag; empty for dialects where a record ends at the next
     * start tag.
     */
    Optional<String> endTag();

    default Set<String> defaultIgnoredTags() {
        return Set.of();
    }

    /**
     * Whether an indented continuation line of a list tag belongs to the last
     * element (wrapped text) rather than starting a new one.
     */
    default boolean continuationExtendsListValue() {
        return false;
    }

    TagMapping defaultMapping();

    /**
     * Tags whose entries are split once more on {@code ;} when a record is
     * complete.
     */
    default Set<String> defaultSemicolonTags() {
        return Set.of();
    }

    /**
     * Value written on the start tag line when a record carries none.
     */
    default Optional<String> defaultReferenceType() {
        return Optional.empty();
    }

    String formatLine(String tag, String value);

    /**
     * Line emitted before the start tag of the {@code index}-th record (1-based).
     */
    default Optional<String> recordHeader(int index) {
        return Optional.empty();
    }

    default List<String> fileHeader() {
        return List.of();
    }

    default List<String> fileTrailer() {
        return List.of();
    }

    /**
     * Classifies a raw line.
     */
    default ParsedLine classify(String line, int lineNumber) {
        if (line.isBlank()) {
            return new ParsedLine(ParsedLine.Kind.BLANK, null, "", lineNumber, line);
        }
        if (isTagLine(line)) {
            return new ParsedLine(ParsedLine.Kind.TAG, tagOf(line), contentOf(line), lineNumber, line);
        }
        return new ParsedLine(ParsedLine.Kind.CONTINUATION, null, line.strip(), lineNumber, line);
    }
}
