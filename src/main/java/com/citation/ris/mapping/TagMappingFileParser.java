package com.citation.ris.mapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for tag mapping files.
 *
 * Format:
 * - Field:     TI = title
 * - List tag:  AU = authors:list
 * - Delimited: KW = keywords:split(;)
 * - Both:      UR = urls:list:split(;)
 * - Comments:  # comment
 */
public class TagMappingFileParser {
    private static final Logger log = LoggerFactory.getLogger(TagMappingFileParser.class);

    // Pattern for parsing mapping lines
    private static final Pattern MAPPING_PATTERN = Pattern.compile(
            "^([A-Z][A-Z0-9]{1,3})\\s*=\\s*(.+)$"
    );

    // Pattern for field name with optional modifiers
    private static final Pattern TARGET_PATTERN = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)((?::list|:split\\(.+?\\))*)$"
    );

    private static final Pattern MODIFIER_PATTERN = Pattern.compile(
            ":(list)|:split\\((.+?)\\)"
    );

    public TagMappingDocument parse(Path mappingFile) throws IOException {
        List<String> lines = Files.readAllLines(mappingFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public TagMappingDocument parse(List<String> lines) {
        TagMappingDocument doc = new TagMappingDocument();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            // Skip empty lines and comments
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                TagMappingEntry entry = parseLine(trimmed, lineNum);
                doc.addEntry(entry);
                log.debug("Parsed mapping: {} -> {} (list={}, delimiter={})",
                        entry.getTag(), entry.getFieldName(), entry.isList(), entry.getDelimiter());
            } catch (IllegalArgumentException e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse mapping line {}: {}", lineNum, e.getMessage());
            }
        }

        return doc;
    }

    private TagMappingEntry parseLine(String line, int lineNum) {
        Matcher matcher = MAPPING_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid mapping format: " + line);
        }

        String tag = matcher.group(1);
        String targetStr = matcher.group(2).trim();

        Matcher targetMatcher = TARGET_PATTERN.matcher(targetStr);
        if (!targetMatcher.matches()) {
            throw new IllegalArgumentException("Invalid field format: " + targetStr);
        }

        boolean list = false;
        String delimiter = null;
        Matcher modifiers = MODIFIER_PATTERN.matcher(targetMatcher.group(2));
        while (modifiers.find()) {
            if (modifiers.group(1) != null) {
                list = true;
            } else {
                delimiter = modifiers.group(2);
            }
        }

        return TagMappingEntry.builder()
                .tag(tag)
                .fieldName(targetMatcher.group(1))
                .list(list)
                .delimiter(delimiter)
                .lineNumber(lineNum)
                .build();
    }
}
