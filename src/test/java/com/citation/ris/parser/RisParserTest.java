package com.citation.ris.parser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.citation.ris.TestResources;
import com.citation.ris.exception.ConfigurationException;
import com.citation.ris.exception.ParseException;
import com.citation.ris.format.Dialect;
import com.citation.ris.model.RisRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RisParser on RIS input.
 */
class RisParserTest {

    private static final String UNKNOWN = "unknown_tag";

    private final RisParser parser = new RisParser();

    @Test
    void testParseBasicRecord() {
        String text = """
                TY  - JOUR
                AU  - Shannon,Claude E.
                PY  - 1948/07//
                TI  - A Mathematical Theory of Communication
                SP  - 379
                EP  - 423
                ER  -
                """;

        List<RisRecord> records = parser.parse(text);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).toMap(UNKNOWN)).containsExactly(
                entry("type_of_reference", "JOUR"),
                entry("authors", List.of("Shannon,Claude E.")),
                entry("year", "1948/07//"),
                entry("title", "A Mathematical Theory of Communication"),
                entry("start_page", "379"),
                entry("end_page", "423"));
    }

    @Test
    void testParseFileWithRecordHeader() {
        List<RisRecord> records = parser.parse(TestResources.read("data/example_basic.ris"));

        assertThat(records).hasSize(1);
        RisRecord record = records.get(0);
        assertThat(record.getText("alternate_title3")).contains("Bell System Technical Journal");
        assertThat(record.getText("volume")).contains("27");
        assertThat(record.hasUnknownTags()).isFalse();
    }

    @Test
    void testParseMultipleRecords() {
        List<RisRecord> records = parser.parse(TestResources.read("data/example_full.ris"));

        assertThat(records).hasSize(2);
        RisRecord first = records.get(0);
        assertThat(first.getValues("first_authors")).containsExactly("Marx, Karl", "Lindgren, Astrid");
        assertThat(first.getValues("secondary_authors")).containsExactly("Glattauer, Daniel");
        assertThat(first.getValues("keywords")).containsExactly("Pippi", "Nordwind", "Piraten");
        assertThat(first.getText("publication_year")).contains("2014//");
        assertThat(first.getText("notes_abstract").orElseThrow())
                .startsWith("BACKGROUND: Lorem ipsum")
                .contains("mus.  RESULTS:");
        assertThat(first.getValues("urls")).containsExactly("http://example_url.com");

        RisRecord second = records.get(1);
        assertThat(second.getText("primary_title")).contains("The title of the reference");
        assertThat(second.getText("place_published")).contains("Germany");
    }

    @Test
    void testParseMultilineValues() {
        RisRecord record = parser.parse(TestResources.read("data/multiline.ris")).get(0);

        assertThat(record.getText("notes_abstract"))
                .contains("first line, then second line and at the end the last line");
        assertThat(record.getValues("notes"))
                .containsExactly("first line", "* second line", "* last line");
        assertThat(record.getText("start_page")).contains("379");
    }

    @Test
    void testParseStartingNewlines() {
        List<RisRecord> records = parser.parse(TestResources.read("data/example_starting_newlines.ris"));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getValues("authors")).containsExactly("Shannon,Claude E.");
    }

    @Test
    void testStripByteOrderMark() {
        String text = "\uFEFFTY  - JOUR\nTI  - Marked\nER  -\n";

        List<RisRecord> records = parser.parse(text);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getText("type_of_reference")).contains("JOUR");
    }

    @Test
    void testSingleUnknownTag() {
        RisRecord record = parser.parse(TestResources.read("data/example_single_unknown_tag.ris")).get(0);

        assertThat(record.getUnknownTags()).containsExactly(entry("JP", List.of("CRISPR", "Direct Current")));
        Map<String, Object> map = record.toMap(UNKNOWN);
        assertThat(map.keySet()).last().isEqualTo(UNKNOWN);
    }

    @Test
    void testMultipleUnknownTags() {
        RisRecord record = parser.parse(TestResources.read("data/example_multi_unknown_tags.ris")).get(0);

        assertThat(record.getUnknownTags()).containsExactly(
                entry("JP", List.of("CRISPR")),
                entry("DC", List.of("Direct Current")));
        assertThat(record.has("start_page")).isFalse();
        assertThat(record.getText("end_page")).contains("423");
    }

    @Test
    void testContinuationOfUnknownTagJoinsLastValue() {
        String text = """
                TY  - JOUR
                JP  - CRIS
                PR
                ER  -
                """;

        RisRecord record = parser.parse(text).get(0);

        assertThat(record.getUnknownTags()).containsExactly(entry("JP", List.of("CRIS PR")));
    }

    @Test
    void testSkipUnknownTags() {
        ParserOptions options = ParserOptions.builder().skipUnknownTags(true).build();

        RisRecord record = new RisParser(Dialect.RIS, options)
                .parse(TestResources.read("data/example_multi_unknown_tags.ris")).get(0);

        assertThat(record.hasUnknownTags()).isFalse();
        assertThat(record.toMap(UNKNOWN)).doesNotContainKey(UNKNOWN);
    }

    @Test
    void testUnterminatedRecordReportsLineNumber() {
        String text = """
                TY  - JOUR
                TI  - First
                TY  - BOOK
                ER  -
                """;

        assertThatThrownBy(() -> parser.parse(text))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Missing end of record tag in line 3")
                .hasMessageContaining("TY  - BOOK")
                .extracting(e -> ((ParseException) e).getLineNumber())
                .isEqualTo(3);
    }

    @Test
    void testTagBeforeStartTagIsRejected() {
        assertThatThrownBy(() -> parser.parse("TI  - Orphan title\nER  -\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageStartingWith("Invalid start tag in line 1");
    }

    @Test
    void testTextBeforeStartTagIsRejected() {
        String text = "some preamble\nTY  - JOUR\nER  -\n";

        assertThatThrownBy(() -> parser.parse(text))
                .isInstanceOf(ParseException.class)
                .hasMessageStartingWith("Expected start tag in line 1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.", "42.", "7. Exported"})
    void testRecordHeaderLinesAreSkipped(String header) {
        String text = header + "\nTY  - JOUR\nTI  - Numbered\nER  -\n";

        List<RisRecord> records = parser.parse(text);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getText("title")).contains("Numbered");
    }

    @Test
    void testEndTagOutsideRecordIsSkipped() {
        String text = "ER  -\nTY  - JOUR\nTI  - After stray end\nER  -\n";

        assertThat(parser.parse(text)).hasSize(1);
    }

    @Test
    void testSkipMissingTags() {
        String text = """
                TY  - JOUR
                TI  - Title
                wrapped text
                ER  -
                garbage between records
                """;
        ParserOptions options = ParserOptions.builder().skipMissingTags(true).build();

        List<RisRecord> records = new RisParser(Dialect.RIS, options).parse(text);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getText("title")).contains("Title");
    }

    @Test
    void testRepeatedScalarTagKeepsFirstValue() {
        String text = "TY  - JOUR\nTI  - First\nTI  - Second\nER  -\n";

        RisRecord record = parser.parse(text).get(0);

        assertThat(record.getText("title")).contains("First");
    }

    @Test
    void testRepeatedScalarTagIsPromotedWhenRelaxed() {
        String text = "TY  - JOUR\nTI  - First\nTI  - Second\nER  -\n";
        ParserOptions options = ParserOptions.builder().enforceListTags(false).build();

        RisRecord record = new RisParser(Dialect.RIS, options).parse(text).get(0);

        assertThat(record.getValues("title")).containsExactly("First", "Second");
        assertThat(record.get("title")).hasValueSatisfying(value -> assertThat(value.isList()).isTrue());
    }

    @Test
    void testListTagAlwaysYieldsList() {
        RisRecord record = parser.parse("TY  - JOUR\nAU  - Only, One\nER  -\n").get(0);

        assertThat(record.get("authors")).hasValueSatisfying(value -> {
            assertThat(value.isList()).isTrue();
            assertThat(value.getValues()).containsExactly("Only, One");
        });
    }

    @Test
    void testDelimitedTagIsSplit() {
        String text = "TY  - JOUR\nKW  - alpha; beta;; gamma\nSN  - 1234, 5678\nER  -\n";
        ParserOptions options = ParserOptions.builder()
                .delimiterTags(Map.of("KW", ";", "SN", ","))
                .build();

        RisRecord record = new RisParser(Dialect.RIS, options).parse(text).get(0);

        assertThat(record.getValues("keywords")).containsExactly("alpha", "beta", "gamma");
        assertThat(record.getValues("issn")).containsExactly("1234", "5678");
    }

    @Test
    void testUrlsAreSplitOnSemicolons() {
        RisRecord record = parser.parse(TestResources.read("data/example_urls.ris")).get(0);

        assertThat(record.getValues("urls"))
                .containsExactly("http://a.com", "http://b.com", "http://c.com", "http://d.com");
    }

    @Test
    void testSemicolonSplitCanBeDisabled() {
        ParserOptions options = ParserOptions.builder().semicolonTags(Set.of()).build();

        RisRecord record = new RisParser(Dialect.RIS, options)
                .parse(TestResources.read("data/example_urls.ris")).get(0);

        assertThat(record.getValues("urls")).containsExactly("http://a.com;http://b.com", "http://c.com ; http://d.com");
    }

    @Test
    void testCustomListTags() {
        ParserOptions options = ParserOptions.builder().listTags(Set.of("AU", "SN")).build();

        RisRecord record = new RisParser(Dialect.RIS, options)
                .parse(TestResources.read("data/example_custom_list_tags.ris")).get(0);

        assertThat(record.getValues("authors")).containsExactly("Marx, Karl", "Marxus, Karlus");
        assertThat(record.getValues("issn")).containsExactly("12345", "ABCDEFG", "666666");
    }

    @Test
    void testCustomMappingReplacesDefault() {
        String text = "TY  - JOUR\nTI  - Renamed\nAU  - Nobody\nER  -\n";
        ParserOptions options = ParserOptions.builder()
                .mapping(Map.of("TY", "kind", "TI", "headline", "ER", "end"))
                .build();

        RisRecord record = new RisParser(Dialect.RIS, options).parse(text).get(0);

        assertThat(record.getFields()).containsOnlyKeys("kind", "headline");
        assertThat(record.getUnknownTags()).containsExactly(entry("AU", List.of("Nobody")));
    }

    @Test
    void testIgnoredTagDropsContinuation() {
        String text = """
                TY  - JOUR
                N1  - private note
                still private
                TI  - Kept
                ER  -
                """;
        ParserOptions options = ParserOptions.builder().ignoreTags(Set.of("N1")).build();

        RisRecord record = new RisParser(Dialect.RIS, options).parse(text).get(0);

        assertThat(record.has("notes")).isFalse();
        assertThat(record.hasUnknownTags()).isFalse();
        assertThat(record.getText("title")).contains("Kept");
    }

    @Test
    void testIncompleteRecordIsDiscardedByDefault() {
        String text = "TY  - JOUR\nTI  - Complete\nER  -\nTY  - JOUR\nTI  - Cut off\n";

        List<RisRecord> records = parser.parse(text);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getText("title")).contains("Complete");
    }

    @Test
    void testIncompleteRecordFails() {
        String text = "TY  - JOUR\nTI  - Complete\nER  -\nTY  - JOUR\nTI  - Cut off\n";
        ParserOptions options = ParserOptions.builder()
                .incompleteRecordPolicy(IncompleteRecordPolicy.FAIL)
                .build();
        RisParser strictParser = new RisParser(Dialect.RIS, options);

        assertThatThrownBy(() -> strictParser.parse(text))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("before end of input")
                .extracting(e -> ((ParseException) e).getLineNumber())
                .isEqualTo(4);
    }

    @Test
    void testIncompleteRecordIsEmitted() {
        String text = "TY  - JOUR\nTI  - Cut off\n";
        ParserOptions options = ParserOptions.builder()
                .incompleteRecordPolicy(IncompleteRecordPolicy.EMIT)
                .build();

        List<RisRecord> records = new RisParser(Dialect.RIS, options).parse(text);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getText("title")).contains("Cut off");
    }

    @Test
    void testIterateYieldsRecordsBeforeError() {
        String text = "TY  - JOUR\nTI  - Good\nER  -\nTY  - JOUR\nTY  - JOUR\n";

        Iterator<RisRecord> iterator = parser.iterate(new StringReader(text));

        assertThat(iterator.hasNext()).isTrue();
        assertThat(iterator.next().getText("title")).contains("Good");
        assertThatThrownBy(iterator::hasNext)
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getLineNumber())
                .isEqualTo(5);
    }

    @Test
    void testStreamRecords() {
        long count = parser.stream(new StringReader(TestResources.read("data/example_full.ris"))).count();

        assertThat(count).isEqualTo(2);
    }

    @Test
    void testEmptyInput() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("\n\n   \n")).isEmpty();
    }

    @Test
    void testNonInvertibleMappingIsAcceptedByParser() {
        ParserOptions options = ParserOptions.builder()
                .mapping(Map.of("TY", "type_of_reference", "TI", "title", "T1", "title"))
                .build();

        RisRecord record = new RisParser(Dialect.RIS, options)
                .parse("TY  - JOUR\nT1  - Primary\nTI  - Secondary\nER  -\n").get(0);

        assertThat(record.getText("title")).contains("Primary");
    }

    @Test
    void testBlankFieldNameInMappingIsRejected() {
        ParserOptions options = ParserOptions.builder().mapping(Map.of("TY", " ")).build();

        assertThatThrownBy(() -> new RisParser(Dialect.RIS, options))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testDroppedContinuationIsLoggedUnderIgnoredTag() {
        Logger logger = (Logger) LoggerFactory.getLogger(ParseSession.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        Level previousLevel = logger.getLevel();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        String text = "TY  - JOUR\nTI  - Kept\nN1  - private note\nstill private\nER  -\n";
        ParserOptions options = ParserOptions.builder().ignoreTags(Set.of("N1")).build();

        try {
            new RisParser(Dialect.RIS, options).parse(text);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previousLevel);
            appender.stop();
        }

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .filteredOn(message -> message.startsWith("Dropping continuation"))
                .containsExactly("Dropping continuation of skipped tag N1 in line 4");
    }

    @Test
    void testReadFailureReportsLineBeingRead() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("device gone");
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> parser.parse(failing))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessage("Failed to read citation input at line 1")
                .hasRootCauseMessage("device gone");
    }
}
