package com.citation.ris.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citation.ris.cli.model.ConvertOptions;
import com.citation.ris.cli.model.ValidatedConvertOptions;
import com.citation.ris.writer.ExportWarning;

/**
 * Responsible only for printing CLI output for the "convert" command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("RIS Citation Converter");
        log.info("=================================================");
        log.info("Input: {}", o.getInput().toAbsolutePath());
        log.info("Output: {}", o.getOutput() != null ? o.getOutput().toAbsolutePath() : "standard output");
        log.info("Dialect: {} -> {}", o.getFrom(), v.getTargetDialect());
        log.info("Encoding: {}", v.getEncoding());
        log.info("Mapping File: {}", o.getMappingFile() != null ? o.getMappingFile().toAbsolutePath() : "None (dialect default)");
        log.info("List Tags: {}", v.getListTags() != null ? String.join(",", v.getListTags()) : "dialect default");
        log.info("Skip Unknown Tags: {}", o.isSkipUnknownTags());
        log.info("Enforce List Tags: {}", !o.isRelaxedListTags());
        log.info("=================================================");
    }

    public void printSuccess(int recordCount, List<ExportWarning> warnings) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Records Converted: {}", recordCount);
        log.info("Export Warnings: {}", warnings.size());
        for (ExportWarning warning : warnings) {
            log.info("  record {}: field `{}` {}", warning.getRecordIndex(), warning.getField(), warning.getMessage());
        }
        log.info("=================================================");
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  {}", error);
        }
    }
}
