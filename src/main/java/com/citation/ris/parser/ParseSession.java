package com.citation.ris.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citation.ris.exception.ParseException;
import com.citation.ris.format.LineFormat;
import com.citation.ris.format.ParsedLine;
import com.citation.ris.mapping.TagMapping;
import com.citation.ris.model.RisRecord;

/**
 * State of one parse call: reads lines on demand and hands out one record at
 * a time. Not thread-safe; every call to {@link RisParser} creates its own.
 */
class ParseSession implements Iterator<RisRecord> {
    private static final Logger log = LoggerFactory.getLogger(ParseSession.class);

    private static final char BOM = '\uFEFF';

    private enum Target {
        NONE,
        FIELD,
        UNKNOWN,
        DROPPED
    }

    private final BufferedReader reader;
    private final LineFormat format;
    private final TagMapping mapping;
    private final ParserOptions options;
    private final Set<String> ignoreTags;
    private final Set<String> semicolonTags;
    private final IncompleteRecordPolicy incompleteRecordPolicy;
    private final Optional<String> endTag;
    private final String unknownFieldName;

    private int lineNumber = 0;
    private boolean exhausted = false;
    private RisRecord pending;

    private boolean inRecord = false;
    private int recordStartLine;
    private String recordStartRaw;
    private RecordAccumulator current;
    private Target target = Target.NONE;
    private String lastTag;

    ParseSession(BufferedReader reader, LineFormat format, TagMapping mapping, ParserOptions options) {
        this.reader = reader;
        this.format = format;
        this.mapping = mapping;
        this.options = options;
        this.ignoreTags = options.resolveIgnoreTags(format);
        this.semicolonTags = options.resolveSemicolonTags(format);
        this.incompleteRecordPolicy = options.resolveIncompleteRecordPolicy(format);
        this.endTag = format.endTag();
        this.unknownFieldName = mapping.getUnknownFieldName();
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public RisRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RisRecord record = pending;
        pending = null;
        return record;
    }

    private RisRecord advance() {
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1) {
                line = stripBom(line);
            }

            LineStep step = step(format.classify(line, lineNumber));
            if (step.getKind() == LineStep.Kind.EMIT) {
                return step.getRecord();
            }
            if (step.getKind() == LineStep.Kind.ERROR) {
                exhausted = true;
                throw new ParseException(step.getMessage(), lineNumber, line);
            }
        }
        exhausted = true;
        return endOfInput();
    }

    private LineStep step(ParsedLine line) {
        if (line.isBlank()) {
            return LineStep.skip();
        }
        return line.isTag() ? onTag(line) : onContinuation(line);
    }

    private LineStep onTag(ParsedLine line) {
        String tag = line.getTag();

        if (ignoreTags.contains(tag)) {
            lastTag = tag;
            target = Target.DROPPED;
            return LineStep.skip();
        }

        if (endTag.isPresent() && endTag.get().equals(tag)) {
            if (!inRecord) {
                log.debug("Skipping end tag outside of a record in line {}", line.getLineNumber());
                return LineStep.skip();
            }
            return LineStep.emit(closeRecord());
        }

        if (format.startTag().equals(tag)) {
            if (!inRecord) {
                openRecord(line);
                return LineStep.skip();
            }
            if (endTag.isPresent()) {
                return LineStep.error("Missing end of record tag");
            }
            RisRecord finished = closeRecord();
            openRecord(line);
            return LineStep.emit(finished);
        }

        if (!inRecord) {
            if (format.isHeader(line.getRaw())) {
                return LineStep.skip();
            }
            return LineStep.error("Invalid start tag");
        }

        addTag(tag, line.getContent());
        return LineStep.skip();
    }

    private LineStep onContinuation(ParsedLine line) {
        if (options.isSkipMissingTags()) {
            return LineStep.skip();
        }
        if (!inRecord) {
            if (format.isHeader(line.getRaw())) {
                return LineStep.skip();
            }
            return LineStep.error("Expected start tag");
        }

        String text = line.getContent();
        switch (target) {
            case NONE -> {
                return LineStep.error("Expected tag");
            }
            case FIELD -> addFieldContinuation(lastTag, text);
            case UNKNOWN -> current.extendLastUnknown(lastTag, text);
            case DROPPED -> log.debug("Dropping continuation of skipped tag {} in line {}", lastTag, line.getLineNumber());
        }
        return LineStep.skip();
    }

    private void openRecord(ParsedLine line) {
        inRecord = true;
        recordStartLine = line.getLineNumber();
        recordStartRaw = line.getRaw();
        current = new RecordAccumulator();
        target = Target.NONE;
        lastTag = null;
        addTag(line.getTag(), line.getContent());
    }

    private RisRecord closeRecord() {
        for (String tag : semicolonTags) {
            String name = mapping.fieldFor(tag);
            if (name != null) {
                current.resplit(name, ParseSession::splitOnSemicolons);
            }
        }
        RisRecord record = current.build();
        inRecord = false;
        current = null;
        target = Target.NONE;
        lastTag = null;
        return record;
    }

    private void addTag(String tag, String content) {
        lastTag = tag;
        String name = mapping.fieldFor(tag);

        if (name == null || name.equals(unknownFieldName)) {
            if (options.isSkipUnknownTags()) {
                target = Target.DROPPED;
                return;
            }
            target = Target.UNKNOWN;
            current.addUnknown(tag, content);
            return;
        }

        target = Target.FIELD;
        List<String> parts = split(tag, content);

        if (mapping.isListTag(tag)) {
            current.append(name, parts != null ? parts : List.of(content));
            return;
        }

        if (!current.has(name)) {
            if (parts != null) {
                current.setList(name, parts);
            } else {
                current.setText(name, content);
            }
            return;
        }

        if (options.isEnforceListTags()) {
            log.debug("Tag {} repeated in record starting at line {}; keeping first value", tag, recordStartLine);
            return;
        }
        current.append(name, parts != null ? parts : List.of(content));
    }

    private void addFieldContinuation(String tag, String text) {
        String name = mapping.fieldFor(tag);
        if (mapping.isListTag(tag) && !format.continuationExtendsListValue()) {
            List<String> parts = split(tag, text);
            current.append(name, parts != null ? parts : List.of(text));
            return;
        }
        current.extendLast(name, text);
    }

    private List<String> split(String tag, String content) {
        return mapping.delimiterFor(tag)
                .map(delimiter -> splitOn(content, delimiter))
                .orElse(null);
    }

    private RisRecord endOfInput() {
        if (!inRecord) {
            return null;
        }
        return switch (incompleteRecordPolicy) {
            case EMIT -> closeRecord();
            case FAIL -> throw new ParseException("Missing end of record tag before end of input",
                    recordStartLine, recordStartRaw);
            case DISCARD -> {
                log.warn("Discarding record starting at line {}: input ended before its end tag", recordStartLine);
                inRecord = false;
                current = null;
                yield null;
            }
        };
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            exhausted = true;
            throw new UncheckedIOException("Failed to read citation input at line " + (lineNumber + 1), e);
        }
    }

    private static String stripBom(String line) {
        int start = 0;
        while (start < line.length() && line.charAt(start) == BOM) {
            start++;
        }
        return line.substring(start);
    }

    private static List<String> splitOnSemicolons(List<String> values) {
        List<String> parts = new ArrayList<>();
        for (String value : values) {
            parts.addAll(splitOn(value, ";"));
        }
        return parts;
    }

    /**
     * Splits on a literal separator, trimming each part and dropping empty ones.
     */
    static List<String> splitOn(String content, String delimiter) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        while (true) {
            int at = content.indexOf(delimiter, from);
            String part = (at < 0 ? content.substring(from) : content.substring(from, at)).strip();
            if (!part.isEmpty()) {
                parts.add(part);
            }
            if (at < 0) {
                return parts;
            }
            from = at + delimiter.length();
        }
    }
}
