package com.citation.ris.writer;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citation.ris.format.Dialect;
import com.citation.ris.format.LineFormat;
import com.citation.ris.mapping.TagMapping;
import com.citation.ris.model.FieldValue;
import com.citation.ris.model.RisRecord;

/**
 * Writes {@link RisRecord}s back into citation text.
 *
 * For records produced by {@link com.citation.ris.parser.RisParser} with the
 * same tables, the output reproduces the parsed text.
 */
public class RisWriter {
    private static final Logger log = LoggerFactory.getLogger(RisWriter.class);

    private final LineFormat format;
    private final WriterOptions options;
    private final TagMapping mapping;
    private final Map<String, String> fieldToTag;
    private final Set<String> ignoreTags;
    private final String defaultReferenceType;
    private final ExportWarningListener warningListener;

    public RisWriter() {
        this(Dialect.RIS);
    }

    public RisWriter(Dialect dialect) {
        this(dialect, WriterOptions.defaults());
    }

    public RisWriter(Dialect dialect, WriterOptions options) {
        this(dialect.lineFormat(), options);
    }

    /**
     * @throws com.citation.ris.exception.ConfigurationException if the
     *         mapping is unusable or cannot be inverted
     */
    public RisWriter(LineFormat format, WriterOptions options) {
        this.format = format;
        this.options = options;
        this.mapping = options.resolveMapping(format);
        this.fieldToTag = mapping.inverse();
        this.ignoreTags = options.resolveIgnoreTags(format);
        this.defaultReferenceType = options.resolveDefaultReferenceType(format);
        this.warningListener = options.getWarningListener() != null
                ? options.getWarningListener()
                : warning -> log.warn("label `{}` not exported: {}", warning.getField(), warning.getMessage());
    }

    public String dumps(List<RisRecord> records) {
        List<String> lines = lines(records);
        if (lines.isEmpty()) {
            return "";
        }
        return String.join(options.getNewline(), lines) + options.getNewline();
    }

    /**
     * Writes every record to {@code out}. The writer is flushed but not closed.
     */
    public void dump(List<RisRecord> records, Writer out) throws IOException {
        for (String line : lines(records)) {
            out.write(line);
            out.write(options.getNewline());
        }
        out.flush();
    }

    /**
     * Output lines without line terminators.
     */
    public List<String> lines(List<RisRecord> records) {
        List<String> lines = new ArrayList<>(format.fileHeader());
        for (int i = 0; i < records.size(); i++) {
            formatRecord(records.get(i), i + 1, lines);
            if (i < records.size() - 1) {
                lines.add("");
            }
        }
        lines.addAll(format.fileTrailer());
        return lines;
    }

    private void formatRecord(RisRecord record, int index, List<String> lines) {
        if (options.isNumberRecords()) {
            format.recordHeader(index).ifPresent(lines::add);
        }

        String startTag = format.startTag();
        lines.add(format.formatLine(startTag, referenceType(record, index)));

        Optional<String> endTag = format.endTag();
        for (Map.Entry<String, FieldValue> entry : record.getFields().entrySet()) {
            String field = entry.getKey();
            FieldValue value = entry.getValue();

            String tag = fieldToTag.get(field);
            if (tag == null) {
                warn(index, field, "no tag is mapped to this field");
                continue;
            }
            if (tag.equals(startTag) || ignoreTags.contains(tag) || endTag.filter(tag::equals).isPresent()) {
                continue;
            }
            formatField(tag, field, value, index, lines);
        }

        if (!options.isSkipUnknownTags()) {
            record.getUnknownTags().forEach((tag, values) -> {
                for (String value : values) {
                    lines.add(format.formatLine(tag, value));
                }
            });
        }

        endTag.ifPresent(tag -> lines.add(format.formatLine(tag, "")));
    }

    private void formatField(String tag, String field, FieldValue value, int index, List<String> lines) {
        Optional<String> delimiter = mapping.delimiterFor(tag);
        if (delimiter.isPresent() && value.isList()) {
            lines.add(format.formatLine(tag, String.join(delimiter.get(), value.getValues())));
            return;
        }

        if (mapping.isListTag(tag) || (value.isList() && !options.isEnforceListTags())) {
            for (String item : value.getValues()) {
                lines.add(format.formatLine(tag, item));
            }
            return;
        }

        if (value.isList()) {
            List<String> values = value.getValues();
            if (values.isEmpty()) {
                return;
            }
            if (values.size() > 1) {
                warn(index, field, "tag " + tag + " is not a list tag; only the first of "
                        + values.size() + " values written");
            }
            lines.add(format.formatLine(tag, values.get(0)));
            return;
        }

        lines.add(format.formatLine(tag, value.getText()));
    }

    private String referenceType(RisRecord record, int index) {
        String startField = mapping.fieldFor(format.startTag());
        if (startField != null) {
            List<String> values = record.getValues(startField);
            if (!values.isEmpty()) {
                return values.get(0);
            }
        }
        if (defaultReferenceType == null) {
            throw new IllegalArgumentException("Record " + index + " has no value for start tag "
                    + format.startTag() + " and no default reference type is configured");
        }
        return defaultReferenceType;
    }

    private void warn(int index, String field, String message) {
        warningListener.onWarning(new ExportWarning(index, field, message));
    }

    public TagMapping getMapping() {
        return mapping;
    }
}
