package com.citation.ris.parser;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citation.ris.format.Dialect;
import com.citation.ris.format.LineFormat;
import com.citation.ris.mapping.TagMapping;
import com.citation.ris.model.RisRecord;

/**
 * Reads citation text into {@link RisRecord}s.
 *
 * Configuration is resolved once at construction and never changes. Each
 * call works on its own session, so an instance can be reused for several
 * inputs one after another; a single iterator must not be shared between
 * threads.
 */
public class RisParser {
    private static final Logger log = LoggerFactory.getLogger(RisParser.class);

    private final LineFormat format;
    private final ParserOptions options;
    private final TagMapping mapping;

    public RisParser() {
        this(Dialect.RIS);
    }

    public RisParser(Dialect dialect) {
        this(dialect, ParserOptions.defaults());
    }

    public RisParser(Dialect dialect, ParserOptions options) {
        this(dialect.lineFormat(), options);
    }

    /**
     * @throws com.citation.ris.exception.ConfigurationException if the
     *         resolved mapping is unusable
     */
    public RisParser(LineFormat format, ParserOptions options) {
        this.format = format;
        this.options = options;
        this.mapping = options.resolveMapping(format);
    }

    public List<RisRecord> parse(String text) {
        return parse(new StringReader(text));
    }

    /**
     * Reads every record. The reader is consumed but not closed.
     */
    public List<RisRecord> parse(Reader reader) {
        List<RisRecord> records = new ArrayList<>();
        iterate(reader).forEachRemaining(records::add);
        log.debug("Parsed {} records", records.size());
        return records;
    }

    /**
     * Lazily reads records one at a time. A
     * {@link com.citation.ris.exception.ParseException} is thrown from
     * {@code hasNext()}/{@code next()} when the offending line is reached.
     */
    public Iterator<RisRecord> iterate(Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        return new ParseSession(buffered, format, mapping, options);
    }

    public Stream<RisRecord> stream(Reader reader) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterate(reader), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public LineFormat getFormat() {
        return format;
    }

    public TagMapping getMapping() {
        return mapping;
    }
}
