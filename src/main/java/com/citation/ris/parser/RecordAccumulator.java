package com.citation.ris.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import com.citation.ris.model.FieldValue;
import com.citation.ris.model.RisRecord;

/**
 * Mutable field storage for the record currently being read. Never leaves
 * the parse session; {@link #build()} produces the immutable record.
 */
class RecordAccumulator {

    private final Map<String, Slot> fields = new LinkedHashMap<>();
    private Map<String, List<String>> unknownTags;

    boolean has(String name) {
        return fields.containsKey(name);
    }

    void setText(String name, String value) {
        fields.put(name, Slot.text(value));
    }

    void setList(String name, List<String> values) {
        fields.put(name, Slot.list(values));
    }

    /**
     * Appends to a list field, creating it when absent and promoting a scalar
     * to a list when necessary.
     */
    void append(String name, List<String> values) {
        Slot slot = fields.get(name);
        if (slot == null) {
            fields.put(name, Slot.list(values));
            return;
        }
        slot.promote();
        slot.values.addAll(values);
    }

    /**
     * Joins wrapped text to the last value of a field with a single space.
     */
    void extendLast(String name, String text) {
        Slot slot = fields.get(name);
        if (slot == null) {
            fields.put(name, Slot.text(text));
            return;
        }
        if (slot.values == null) {
            slot.text = join(slot.text, text);
        } else if (slot.values.isEmpty()) {
            slot.values.add(text);
        } else {
            int last = slot.values.size() - 1;
            slot.values.set(last, join(slot.values.get(last), text));
        }
    }

    void addUnknown(String tag, String value) {
        if (unknownTags == null) {
            unknownTags = new LinkedHashMap<>();
        }
        unknownTags.computeIfAbsent(tag, t -> new ArrayList<>()).add(value);
    }

    void extendLastUnknown(String tag, String text) {
        List<String> values = unknownTags == null ? null : unknownTags.get(tag);
        if (values == null || values.isEmpty()) {
            addUnknown(tag, text);
            return;
        }
        int last = values.size() - 1;
        values.set(last, join(values.get(last), text));
    }

    /**
     * Replaces the values of a field by {@code splitter(values)}; a scalar is
     * only replaced when the splitter yields more than one value.
     */
    void resplit(String name, UnaryOperator<List<String>> splitter) {
        Slot slot = fields.get(name);
        if (slot == null) {
            return;
        }
        if (slot.values != null) {
            slot.values = new ArrayList<>(splitter.apply(slot.values));
            return;
        }
        List<String> parts = splitter.apply(List.of(slot.text));
        if (parts.size() > 1) {
            fields.put(name, Slot.list(parts));
        }
    }

    RisRecord build() {
        RisRecord.RisRecordBuilder builder = RisRecord.builder();
        fields.forEach((name, slot) -> builder.field(name, slot.toFieldValue()));
        if (unknownTags != null) {
            unknownTags.forEach((tag, values) -> builder.unknownTag(tag, List.copyOf(values)));
        }
        return builder.build();
    }

    private static String join(String head, String tail) {
        return head.isEmpty() ? tail : head + " " + tail;
    }

    private static final class Slot {
        private String text;
        private List<String> values;

        static Slot text(String text) {
            Slot slot = new Slot();
            slot.text = text;
            return slot;
        }

        static Slot list(List<String> values) {
            Slot slot = new Slot();
            slot.values = new ArrayList<>(values);
            return slot;
        }

        void promote() {
            if (values == null) {
                values = new ArrayList<>();
                values.add(text);
                text = null;
            }
        }

        FieldValue toFieldValue() {
            return values != null ? FieldValue.ofList(values) : FieldValue.of(text);
        }
    }
}
