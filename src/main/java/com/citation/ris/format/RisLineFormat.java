package com.citation.ris.format;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.citation.ris.mapping.DefaultTagMappings;
import com.citation.ris.mapping.TagMapping;

/**
 * Refman RIS: {@code "TY  - JOUR"}, records closed by {@code "ER  - "}, and
 * optionally numbered by a {@code "1."} line.
 */
public class RisLineFormat implements LineFormat {

    public static final RisLineFormat INSTANCE = new RisLineFormat();

    private static final Pattern TAG_PATTERN = Pattern.compile("^[A-Z][A-Z0-9]  - |^ER  -\\s*$");
    private static final Pattern COUNTER_PATTERN = Pattern.compile("^[0-9]+\\.");
    private static final int CONTENT_OFFSET = 6;

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
        return line.length() > CONTENT_OFFSET ? line.substring(CONTENT_OFFSET).strip() : "";
    }

    @Override
    public boolean isHeader(String line) {
        return COUNTER_PATTERN.matcher(line).find();
    }

    @Override
    public String startTag() {
        return "TY";
    }

    @Override
    public Optional<String> endTag() {
        return Optional.of("ER");
    }

    @Override
    public TagMapping defaultMapping() {
        return DefaultTagMappings.RIS;
    }

    @Override
    public Set<String> defaultSemicolonTags() {
        return DefaultTagMappings.RIS_SEMICOLON_TAGS;
    }

    @Override
    public Optional<String> defaultReferenceType() {
        return Optional.of("JOUR");
    }

    @Override
    public String formatLine(String tag, String value) {
        return tag + "  - " + value;
    }

    @Override
    public Optional<String> recordHeader(int index) {
        return Optional.of(index + ".");
    }
}
