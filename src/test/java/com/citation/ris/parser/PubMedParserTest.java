package com.citation.ris.parser;

import com.citation.ris.TestResources;
import com.citation.ris.exception.ParseException;
import com.citation.ris.format.Dialect;
import com.citation.ris.model.RisRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RisParser on PubMed (MEDLINE) exports.
 */
class PubMedParserTest {

    private final RisParser parser = new RisParser(Dialect.PUBMED);

    @Test
    void testParseRecordsWithoutEndTag() {
        List<RisRecord> records = parser.parse(TestResources.read("data/example_pubmed.nbib"));

        assertThat(records).hasSize(2);
        assertThat(records).extracting(record -> record.getText("pubmed_id").orElseThrow())
                .containsExactly("31181385", "12345678");
    }

    @Test
    void testWrappedLinesAreJoined() {
        RisRecord record = parser.parse(TestResources.read("data/example_pubmed.nbib")).get(0);

        assertThat(record.getText("title")).contains(
                "Fantastic yeasts and where to find them: the hidden diversity of dimorphic fungal pathogens.");
        assertThat(record.getText("abstract"))
                .contains("Dimorphic fungal pathogens are a significant cause of human disease worldwide.");
    }

    @Test
    void testWrappedLineExtendsLastListEntry() {
        RisRecord record = parser.parse(TestResources.read("data/example_pubmed.nbib")).get(0);

        assertThat(record.getValues("affiliation")).containsExactly(
                "Department of Microbiology and Immunology, University of Somewhere, Somewhere, USA.");
    }

    @Test
    void testListTags() {
        RisRecord record = parser.parse(TestResources.read("data/example_pubmed.nbib")).get(0);

        assertThat(record.getValues("issn")).containsExactly("1942-0862 (Electronic)", "1942-0862 (Linking)");
        assertThat(record.getValues("full_author"))
                .containsExactly("Van Dyke, Marley C Caballero", "Teixeira, Marcus M");
        assertThat(record.getValues("author")).containsExactly("Van Dyke MCC", "Teixeira MM");
        assertThat(record.getValues("language")).containsExactly("eng");
        assertThat(record.getValues("publication_type")).containsExactly("Journal Article", "Review");
        assertThat(record.getText("owner")).contains("NLM");
        assertThat(record.getText("date_completed")).contains("20200113");
    }

    @Test
    void testLastRecordIsEmittedAtEndOfInput() {
        RisRecord last = parser.parse(TestResources.read("data/example_pubmed.nbib")).get(1);

        assertThat(last.getText("title")).contains("Second article.");
        assertThat(last.getValues("author")).containsExactly("Doe J");
    }

    @Test
    void testFailPolicyRejectsTrailingRecord() {
        ParserOptions options = ParserOptions.builder()
                .incompleteRecordPolicy(IncompleteRecordPolicy.FAIL)
                .build();
        RisParser strictParser = new RisParser(Dialect.PUBMED, options);

        assertThatThrownBy(() -> strictParser.parse(TestResources.read("data/example_pubmed.nbib")))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("PMID- 12345678");
    }
}
