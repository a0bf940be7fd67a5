package com.citation.ris.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Value of a single record field: either one string or an ordered list of
 * strings. Instances are immutable.
 */
@EqualsAndHashCode(doNotUseGetters = true)
public final class FieldValue {

    private final String text;
    private final List<String> values;

    private FieldValue(String text, List<String> values) {
        this.text = text;
        this.values = values;
    }

    public static FieldValue of(@NonNull String text) {
        return new FieldValue(text, null);
    }

    public static FieldValue ofList(@NonNull List<String> values) {
        return new FieldValue(null, List.copyOf(values));
    }

    public static FieldValue ofList(String... values) {
        return ofList(List.of(values));
    }

    public boolean isList() {
        return values != null;
    }

    /**
     * Scalar content.
     *
     * @throws IllegalStateException if this value is a list
     */
    public String getText() {
        if (values != null) {
            throw new IllegalStateException("Field holds a list of " + values.size() + " values, not a single value");
        }
        return text;
    }

    /**
     * List view of the value. A scalar is returned as a one-element list.
     */
    public List<String> getValues() {
        return values != null ? values : List.of(text);
    }

    /**
     * Plain Java view: a {@code String} for scalars, an unmodifiable
     * {@code List<String>} for lists.
     */
    public Object unwrap() {
        return values != null ? values : text;
    }

    @Override
    public String toString() {
        return values != null ? values.toString() : '"' + text + '"';
    }
}
