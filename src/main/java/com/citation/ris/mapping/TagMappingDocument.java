package com.citation.ris.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.citation.ris.exception.ConfigurationException;

import lombok.Data;

/**
 * Parsed tag mapping file with the problems found while reading it.
 */
@Data
public class TagMappingDocument {
    private final List<TagMappingEntry> entries = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void addEntry(TagMappingEntry entry) {
        entries.add(entry);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Builds the mapping described by the file.
     *
     * @throws ConfigurationException if the file had errors, repeats a tag or
     *         maps two tags to the same field
     */
    public TagMapping toTagMapping() {
        if (hasErrors()) {
            throw new ConfigurationException("Invalid tag mapping file:" + System.lineSeparator()
                    + String.join(System.lineSeparator(), errors));
        }

        Map<String, String> tags = new LinkedHashMap<>();
        Set<String> listTags = new LinkedHashSet<>();
        Map<String, String> delimiters = new LinkedHashMap<>();

        for (TagMappingEntry entry : entries) {
            if (tags.putIfAbsent(entry.getTag(), entry.getFieldName()) != null) {
                throw new ConfigurationException("Line " + entry.getLineNumber() + ": tag "
                        + entry.getTag() + " is mapped more than once");
            }
            if (entry.isList()) {
                listTags.add(entry.getTag());
            }
            if (entry.isDelimited()) {
                delimiters.put(entry.getTag(), entry.getDelimiter());
            }
        }

        TagMapping mapping = TagMapping.builder()
                .tags(tags)
                .listTags(listTags)
                .delimiters(delimiters)
                .build()
                .validate();
        mapping.inverse();
        return mapping;
    }
}
