package com.citation.ris.format;

import java.util.Optional;
import java.util.regex.Pattern;

import com.citation.ris.mapping.DefaultTagMappings;
import com.citation.ris.mapping.TagMapping;

/**
 * PubMed/MEDLINE export: four-character tag field, {@code "- "} at column 5,
 * no end tag. Wrapped lines are indented by six spaces.
 */
public class PubMedLineFormat implements LineFormat {

    public static final PubMedLineFormat INSTANCE = new PubMedLineFormat();

    private static final Pattern TAG_PATTERN = Pattern.compile("^[A-Z][A-Z0-9 ]{3}- ");
    private static final int TAG_WIDTH = 4;
    private static final int CONTENT_OFFSET = 6;

    @Override
    public boolean isTagLine(String line) {
        return TAG_PATTERN.matcher(line).find();
    }

    @Override
    public String tagOf(String line) {
        return line.substring(0, TAG_WIDTH).strip();
    }

    @Override
    public String contentOf(String line) {
        return line.length() > CONTENT_OFFSET ? line.substring(CONTENT_OFFSET).strip() : "";
    }

    @Override
    public String startTag() {
        return "PMID";
    }

    @Override
    public Optional<String> endTag() {
        return Optional.empty();
    }

    @Override
    public boolean continuationExtendsListValue() {
        return true;
    }

    @Override
    public TagMapping defaultMapping() {
        return DefaultTagMappings.PUBMED;
    }

    @Override
    public String formatLine(String tag, String value) {
        return String.format("%-" + TAG_WIDTH + "s- %s", tag, value);
    }
}
