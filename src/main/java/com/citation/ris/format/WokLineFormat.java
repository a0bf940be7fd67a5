package com.citation.ris.format;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.citation.ris.mapping.DefaultTagMappings;
import com.citation.ris.mapping.TagMapping;

/**
 * Web of Science export: {@code "PT J"}, continuation lines indented by three
 * spaces, file wrapped in {@code FN}/{@code VR} ... {@code EF}.
 */
public class WokLineFormat implements LineFormat {

    public static final WokLineFormat INSTANCE = new WokLineFormat();

    private static final Pattern TAG_PATTERN = Pattern.compile("^[A-Z][A-Z0-9] |^(ER|EF)\\s*$");

    @Override
    public boolean isTagLine(String line) {
        return TAG_PATTERN.matcher(line).find();
    }

    @Override
    public String tagOf(String line) {
        return line.substring(0, 2);
    }

    @Override
    public String contentOf(String line) {
        return line.substring(2).strip();
    }

    /**
     * Everything outside a record is file header noise in this dialect.
     */
    @Override
    public boolean isHeader(String line) {
        return true;
    }

    @Override
    public String startTag() {
        return "PT";
    }

    @Override
    public Optional<String> endTag() {
        return Optional.of("ER");
    }

    @Override
    public Set<String> defaultIgnoredTags() {
        return Set.of("FN", "VR", "EF");
    }

    @Override
    public TagMapping defaultMapping() {
        return DefaultTagMappings.WOK;
    }

    @Override
    public Optional<String> defaultReferenceType() {
        return Optional.of("J");
    }

    @Override
    public String formatLine(String tag, String value) {
        return value.isEmpty() ? tag : tag + " " + value;
    }

    @Override
    public List<String> fileHeader() {
        return List.of("FN Clarivate Analytics Web of Science", "VR 1.0");
    }

    @Override
    public List<String> fileTrailer() {
        return List.of("EF");
    }
}
