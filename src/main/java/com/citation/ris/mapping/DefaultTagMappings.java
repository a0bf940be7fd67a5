package com.citation.ris.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Built-in tag tables for the supported dialects.
 */
@UtilityClass
public class DefaultTagMappings {

    /**
     * Field name reserved for the container of unmapped tags.
     */
    public static final String UNKNOWN_FIELD = "unknown_tag";

    /**
     * Tag under which a mapping may rename the unknown-tag container.
     */
    public static final String UNKNOWN_TAG = "UK";

    public static final Map<String, String> RIS_TAGS = ordered(
            "TY", "type_of_reference",
            "A1", "first_authors",
            "A2", "secondary_authors",
            "A3", "tertiary_authors",
            "A4", "subsidiary_authors",
            "AB", "abstract",
            "AD", "author_address",
            "AN", "accession_number",
            "AU", "authors",
            "C1", "custom1",
            "C2", "custom2",
            "C3", "custom3",
            "C4", "custom4",
            "C5", "custom5",
            "C6", "custom6",
            "C7", "custom7",
            "C8", "custom8",
            "CA", "caption",
            "CN", "call_number",
            "CY", "place_published",
            "DA", "date",
            "DB", "name_of_database",
            "DO", "doi",
            "DP", "database_provider",
            "ED", "editor",
            "EP", "end_page",
            "ET", "edition",
            "ID", "id",
            "IS", "number",
            "J2", "alternate_title1",
            "JA", "alternate_title2",
            "JF", "alternate_title3",
            "JO", "journal_name",
            "KW", "keywords",
            "L1", "file_attachments1",
            "L2", "file_attachments2",
            "L4", "figure",
            "LA", "language",
            "LB", "label",
            "M1", "note",
            "M3", "type_of_work",
            "N1", "notes",
            "N2", "notes_abstract",
            "NV", "number_of_volumes",
            "OP", "original_publication",
            "PB", "publisher",
            "PY", "year",
            "RI", "reviewed_item",
            "RN", "research_notes",
            "RP", "reprint_edition",
            "SE", "section",
            "SN", "issn",
            "SP", "start_page",
            "ST", "short_title",
            "T1", "primary_title",
            "T2", "secondary_title",
            "T3", "tertiary_title",
            "TA", "translated_author",
            "TI", "title",
            "TT", "translated_title",
            "UR", "urls",
            "VL", "volume",
            "Y1", "publication_year",
            "Y2", "access_date",
            "ER", "end_of_reference",
            UNKNOWN_TAG, UNKNOWN_FIELD);

    public static final Set<String> RIS_LIST_TAGS = Set.of("A1", "A2", "A3", "A4", "AU", "KW", "N1", "UR");

    public static final Map<String, String> WOK_TAGS = ordered(
            "FN", "file_name",
            "VR", "version_number",
            "PT", "publication_type",
            "AU", "authors",
            "AF", "author_full_names",
            "BA", "book_authors",
            "BF", "book_authors_full_name",
            "CA", "group_authors",
            "GP", "book_group_authors",
            "BE", "editors",
            "TI", "document_title",
            "SO", "publication_name",
            "SE", "book_series_title",
            "BS", "book_series_subtitle",
            "LA", "language",
            "DT", "document_type",
            "CT", "conference_title",
            "CY", "conference_date",
            "CL", "conference_location",
            "SP", "conference_sponsors",
            "HO", "conference_host",
            "DE", "author_keywords",
            "ID", "keywords_plus",
            "AB", "abstract",
            "C1", "author_address",
            "RP", "reprint_address",
            "EM", "email_address",
            "RI", "researcher_id_number",
            "OI", "orcid_identifier",
            "FU", "funding_agency_and_grant_number",
            "FX", "funding_text",
            "CR", "cited_references",
            "NR", "cited_reference_count",
            "TC", "wos_times_cited_count",
            "Z9", "total_times_cited_count",
            "U1", "usage_count_last_180_days",
            "U2", "usage_count_since_2013",
            "PU", "publisher",
            "PI", "publisher_city",
            "PA", "publisher_address",
            "SN", "issn",
            "EI", "eissn",
            "BN", "isbn",
            "J9", "source_abbreviation_29_character",
            "JI", "iso_source_abbreviation",
            "PD", "publication_date",
            "PY", "year_published",
            "VL", "volume",
            "IS", "issue",
            "PN", "part_number",
            "SU", "supplement",
            "SI", "special_issue",
            "MA", "meeting_abstract",
            "BP", "beginning_page",
            "EP", "ending_page",
            "AR", "article_number",
            "DI", "doi",
            "D2", "book_doi",
            "EA", "early_access_date",
            "PG", "page_count",
            "WC", "wos_categories",
            "SC", "research_areas",
            "GA", "document_delivery_number",
            "UT", "accession_number",
            "PM", "pubmed_id",
            "OA", "open_access_indicator",
            "HC", "highly_cited_status",
            "HP", "hot_paper_status",
            "DA", "date_report_generated",
            "ER", "end_of_record",
            "EF", "end_of_file",
            UNKNOWN_TAG, UNKNOWN_FIELD);

    public static final Set<String> WOK_LIST_TAGS = Set.of(
            "AU", "AF", "BA", "BF", "CA", "GP", "BE", "C1", "CR", "EM", "RI", "OI", "FU");

    public static final Map<String, String> PUBMED_TAGS = ordered(
            "PMID", "pubmed_id",
            "OWN", "owner",
            "STAT", "status",
            "DCOM", "date_completed",
            "LR", "date_last_revised",
            "IS", "issn",
            "VI", "volume",
            "IP", "issue",
            "DP", "publication_date",
            "TI", "title",
            "BTI", "book_title",
            "PG", "pagination",
            "LID", "location_identifier",
            "AB", "abstract",
            "CI", "copyright_information",
            "FAU", "full_author",
            "AU", "author",
            "AUID", "author_identifier",
            "AD", "affiliation",
            "FED", "full_editor",
            "ED", "editor",
            "LA", "language",
            "GR", "grant_number",
            "PT", "publication_type",
            "DEP", "date_of_electronic_publication",
            "PL", "place_of_publication",
            "TA", "journal_title_abbreviation",
            "JT", "journal_title",
            "JID", "nlm_unique_id",
            "RN", "registry_number",
            "SB", "subset",
            "MH", "mesh_terms",
            "OTO", "other_term_owner",
            "OT", "other_term",
            "COIS", "conflict_of_interest_statement",
            "EDAT", "entrez_date",
            "MHDA", "mesh_date",
            "CRDT", "create_date",
            "PHST", "publication_history_status",
            "AID", "article_identifier",
            "PST", "publication_status",
            "SO", "source",
            "PMC", "pubmed_central_identifier",
            "MID", "manuscript_identifier",
            "CIN", "comment_in",
            "CON", "comment_on",
            "EIN", "erratum_in",
            "SI", "secondary_source_id",
            UNKNOWN_TAG, UNKNOWN_FIELD);

    public static final Set<String> PUBMED_LIST_TAGS = Set.of(
            "FAU", "AU", "AUID", "AD", "FED", "ED", "LA", "GR", "PT", "RN", "SB", "MH", "OT", "PHST", "AID",
            "CIN", "CON", "EIN", "SI", "LID", "IS");

    /**
     * Tags whose values may hold several {@code ;}-separated entries on one
     * physical line ("multiple addresses can be entered on one line using a
     * semi-colon as a separator").
     */
    public static final Set<String> RIS_SEMICOLON_TAGS = Set.of("UR");

    public static final TagMapping RIS = TagMapping.builder()
            .tags(RIS_TAGS)
            .listTags(RIS_LIST_TAGS)
            .build();

    public static final TagMapping WOK = TagMapping.builder()
            .tags(WOK_TAGS)
            .listTags(WOK_LIST_TAGS)
            .build();

    public static final TagMapping PUBMED = TagMapping.builder()
            .tags(PUBMED_TAGS)
            .listTags(PUBMED_LIST_TAGS)
            .build();

    private static Map<String, String> ordered(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
