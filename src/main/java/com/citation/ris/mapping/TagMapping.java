package com.citation.ris.mapping;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.citation.ris.exception.ConfigurationException;
import com.citation.ris.util.MappingUtil;

import lombok.Builder;
import lombok.Value;

/**
 * Tag code to field name table together with the tags that are always read
 * as lists and the tags whose single-line content is split on a literal
 * delimiter.
 *
 * Pure configuration; instances are immutable and shared freely.
 */
@Value
@Builder(toBuilder = true)
public class TagMapping {

    /**
     * Tag code -> field name. Iteration order is kept.
     */
    Map<String, String> tags;

    /**
     * Tags whose fields are always sequences.
     */
    @Builder.Default
    Set<String> listTags = Set.of();

    /**
     * Tag code -> literal separator used to split one line into several values.
     */
    @Builder.Default
    Map<String, String> delimiters = Map.of();

    public boolean isMapped(String tag) {
        return tags.containsKey(tag);
    }

    public String fieldFor(String tag) {
        return tags.get(tag);
    }

    public boolean isListTag(String tag) {
        return listTags.contains(tag);
    }

    public Optional<String> delimiterFor(String tag) {
        return Optional.ofNullable(delimiters.get(tag));
    }

    /**
     * Name of the record entry that holds unmapped tags. A mapping may rename
     * it through the {@code UK} tag.
     */
    public String getUnknownFieldName() {
        return tags.getOrDefault(DefaultTagMappings.UNKNOWN_TAG, DefaultTagMappings.UNKNOWN_FIELD);
    }

    /**
     * Field name -> tag code.
     *
     * @throws ConfigurationException if two tags share a field name
     */
    public Map<String, String> inverse() {
        return MappingUtil.invert(tags);
    }

    /**
     * Checks that every part of the configuration is present and usable.
     *
     * @throws ConfigurationException on the first problem found
     */
    public TagMapping validate() {
        if (tags == null || tags.isEmpty()) {
            throw new ConfigurationException("Tag mapping is required and must not be empty");
        }
        if (listTags == null) {
            throw new ConfigurationException("List tag set is required");
        }
        if (delimiters == null) {
            throw new ConfigurationException("Delimiter mapping must not be null");
        }
        tags.forEach((tag, field) -> {
            if (tag == null || tag.isBlank()) {
                throw new ConfigurationException("Tag mapping contains a blank tag code");
            }
            if (field == null || field.isBlank()) {
                throw new ConfigurationException("Tag " + tag + " is mapped to a blank field name");
            }
        });
        delimiters.forEach((tag, separator) -> {
            if (separator == null || separator.isEmpty()) {
                throw new ConfigurationException("Delimiter for tag " + tag + " must not be empty");
            }
        });
        return this;
    }
}
