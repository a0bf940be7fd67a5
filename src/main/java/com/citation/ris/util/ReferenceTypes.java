package com.citation.ris.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.citation.ris.model.FieldValue;
import com.citation.ris.model.RisRecord;

import lombok.experimental.UtilityClass;

/**
 * Conversion between RIS reference type codes ({@code JOUR}, {@code BOOK}, ...)
 * and their readable names.
 */
@UtilityClass
public class ReferenceTypes {

    public static final String TYPE_FIELD = "type_of_reference";

    public static final Map<String, String> DEFAULT = names(
            "ABST", "Abstract",
            "ADVS", "Audiovisual material",
            "AGGR", "Aggregated Database",
            "ANCIENT", "Ancient Text",
            "ART", "Art Work",
            "BILL", "Bill",
            "BLOG", "Blog",
            "BOOK", "Whole book",
            "CASE", "Case",
            "CHAP", "Book chapter",
            "CHART", "Chart",
            "CLSWK", "Classical Work",
            "COMP", "Computer program",
            "CONF", "Conference proceeding",
            "CPAPER", "Conference paper",
            "CTLG", "Catalog",
            "DATA", "Data file",
            "DBASE", "Online Database",
            "DICT", "Dictionary",
            "EBOOK", "Electronic Book",
            "ECHAP", "Electronic Book Section",
            "EDBOOK", "Edited Book",
            "EJOUR", "Electronic Article",
            "ELEC", "Web Page",
            "ENCYC", "Encyclopedia",
            "EQUA", "Equation",
            "FIGURE", "Figure",
            "GEN", "Generic",
            "GOVDOC", "Government Document",
            "GRANT", "Grant",
            "HEAR", "Hearing",
            "ICOMM", "Internet Communication",
            "INPR", "In Press",
            "JFULL", "Journal (full)",
            "JOUR", "Journal",
            "LEGAL", "Legal Rule or Regulation",
            "MANSCPT", "Manuscript",
            "MAP", "Map",
            "MGZN", "Magazine article",
            "MPCT", "Motion picture",
            "MULTI", "Online Multimedia",
            "MUSIC", "Music score",
            "NEWS", "Newspaper",
            "PAMP", "Pamphlet",
            "PAT", "Patent",
            "PCOMM", "Personal communication",
            "RPRT", "Report",
            "SER", "Serial publication",
            "SLIDE", "Slide",
            "SOUND", "Sound recording",
            "STAND", "Standard",
            "STAT", "Statute",
            "THES", "Thesis/Dissertation",
            "UNBILL", "Unenacted Bill",
            "UNPB", "Unpublished work",
            "VIDEO", "Video recording");

    /**
     * Converts type codes to readable names using {@link #DEFAULT}.
     */
    public static List<RisRecord> toNames(List<RisRecord> records, boolean strict) {
        return convert(records, DEFAULT, false, strict);
    }

    /**
     * Converts readable names back to type codes using {@link #DEFAULT}.
     */
    public static List<RisRecord> toCodes(List<RisRecord> records, boolean strict) {
        return convert(records, DEFAULT, true, strict);
    }

    /**
     * Returns copies of the records with {@value #TYPE_FIELD} converted through
     * {@code typeMap} (or its inverse when {@code reverse} is set).
     *
     * A type missing from the table is kept as is, unless {@code strict} is set
     * and the type is not already a converted value, in which case an
     * {@link IllegalArgumentException} is thrown. Records without a type are
     * copied unchanged.
     */
    public static List<RisRecord> convert(List<RisRecord> records, Map<String, String> typeMap,
                                          boolean reverse, boolean strict) {
        Map<String, String> table = reverse ? MappingUtil.invert(typeMap) : typeMap;

        List<RisRecord> converted = new ArrayList<>(records.size());
        for (RisRecord record : records) {
            String oldType = record.getText(TYPE_FIELD).orElse(null);
            if (oldType == null) {
                converted.add(record);
                continue;
            }
            String newType = table.get(oldType);
            if (newType == null) {
                if (strict && !table.containsValue(oldType)) {
                    throw new IllegalArgumentException("Type \"" + oldType + "\" not found.");
                }
                converted.add(record);
                continue;
            }
            converted.add(replaceType(record, newType));
        }
        return converted;
    }

    private static RisRecord replaceType(RisRecord record, String newType) {
        Map<String, FieldValue> fields = new LinkedHashMap<>(record.getFields());
        fields.put(TYPE_FIELD, FieldValue.of(newType));
        return record.toBuilder()
                .clearFields()
                .fields(fields)
                .build();
    }

    private static Map<String, String> names(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
