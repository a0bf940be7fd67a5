package com.citation.ris.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One citation: an ordered mapping from field name to value, plus the
 * container of tags that had no field name in the active mapping.
 *
 * Field order is the order in which the fields were added, which for parsed
 * records is the order of the tags in the source text.
 */
@Value
public class RisRecord {

    /**
     * Mapped fields, in insertion order.
     */
    Map<String, FieldValue> fields;

    /**
     * Raw tag code -> values for tags absent from the mapping, in insertion order.
     */
    Map<String, List<String>> unknownTags;

    @Builder(toBuilder = true)
    private RisRecord(@Singular Map<String, FieldValue> fields, @Singular Map<String, List<String>> unknownTags) {
        this.fields = fields;
        Map<String, List<String>> copies = new LinkedHashMap<>();
        unknownTags.forEach((tag, values) -> copies.put(tag, List.copyOf(values)));
        this.unknownTags = Collections.unmodifiableMap(copies);
    }

    public Optional<FieldValue> get(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Scalar content of a field, or empty when the field is absent or holds a list.
     */
    public Optional<String> getText(String fieldName) {
        FieldValue value = fields.get(fieldName);
        if (value == null || value.isList()) {
            return Optional.empty();
        }
        return Optional.of(value.getText());
    }

    public List<String> getValues(String fieldName) {
        FieldValue value = fields.get(fieldName);
        return value == null ? List.of() : value.getValues();
    }

    public boolean has(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public boolean hasUnknownTags() {
        return !unknownTags.isEmpty();
    }

    /**
     * Flattens the record into plain Java values. The unknown-tag container,
     * when present, is stored last under {@code unknownFieldName}.
     */
    public Map<String, Object> toMap(String unknownFieldName) {
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((name, value) -> map.put(name, value.unwrap()));
        if (!unknownTags.isEmpty()) {
            map.put(unknownFieldName, new LinkedHashMap<>(unknownTags));
        }
        return map;
    }

    public static class RisRecordBuilder {

        public RisRecordBuilder text(String fieldName, String value) {
            return field(fieldName, FieldValue.of(value));
        }

        public RisRecordBuilder list(String fieldName, String... values) {
            return field(fieldName, FieldValue.ofList(values));
        }

        public RisRecordBuilder list(String fieldName, List<String> values) {
            return field(fieldName, FieldValue.ofList(values));
        }
    }
}
