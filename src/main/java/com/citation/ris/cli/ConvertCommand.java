package com.citation.ris.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citation.ris.cli.exception.OptionsValidationException;
import com.citation.ris.cli.model.ConvertOptions;
import com.citation.ris.cli.model.ValidatedConvertOptions;
import com.citation.ris.cli.output.ConvertResultsPrinter;
import com.citation.ris.cli.validation.ConvertOptionsValidator;
import com.citation.ris.exception.ConfigurationException;
import com.citation.ris.exception.ParseException;
import com.citation.ris.io.RisFiles;
import com.citation.ris.mapping.TagMapping;
import com.citation.ris.mapping.TagMappingFileParser;
import com.citation.ris.model.RisRecord;
import com.citation.ris.parser.IncompleteRecordPolicy;
import com.citation.ris.parser.ParserOptions;
import com.citation.ris.parser.RisParser;
import com.citation.ris.util.ReferenceTypes;
import com.citation.ris.writer.ExportWarning;
import com.citation.ris.writer.RisWriter;
import com.citation.ris.writer.WriterOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that reads a citation file and writes it back out.
 */
@Command(
        name = "ris-convert",
        mixinStandardHelpOptions = true,
        version = "ris-citation-converter 1.0.0",
        description = "Reads RIS, Web of Science or PubMed citation files and writes them back, optionally in another dialect."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    @Spec
    private CommandSpec spec;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedConvertOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            TagMapping customMapping = loadMapping();

            RisParser parser = new RisParser(options.getFrom(), parserOptions(validated, customMapping));
            List<RisRecord> records = RisFiles.read(options.getInput(), validated.getEncoding(), parser);
            log.info("Read {} records from {}", records.size(), options.getInput());

            if (options.isTypeNames()) {
                records = ReferenceTypes.toNames(records, false);
            }

            List<ExportWarning> warnings = new ArrayList<>();
            RisWriter writer = new RisWriter(validated.getTargetDialect(),
                    writerOptions(validated, customMapping, warnings));

            if (options.getOutput() != null) {
                RisFiles.write(options.getOutput(), validated.getEncoding(), records, writer);
            } else {
                PrintWriter out = spec.commandLine().getOut();
                writer.dump(records, out);
            }

            printer.printSuccess(records.size(), warnings);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 2;
        } catch (ParseException e) {
            log.error("Malformed input in {} at line {}: {}", options.getInput(), e.getLineNumber(), e.getMessage());
            return 1;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.error("Conversion failed with I/O error: {}", e.getMessage());
            log.debug("I/O failure details", e);
            return 1;
        }
    }

    private TagMapping loadMapping() throws IOException {
        if (options.getMappingFile() == null) {
            return null;
        }
        TagMapping mapping = new TagMappingFileParser().parse(options.getMappingFile()).toTagMapping();
        log.info("Loaded {} tags from {}", mapping.getTags().size(), options.getMappingFile());
        return mapping;
    }

    private ParserOptions parserOptions(ValidatedConvertOptions validated, TagMapping customMapping) {
        ParserOptions.ParserOptionsBuilder builder = ParserOptions.builder()
                .skipUnknownTags(options.isSkipUnknownTags())
                .enforceListTags(!options.isRelaxedListTags())
                .skipMissingTags(options.isSkipMissingTags());
        if (customMapping != null) {
            builder.mapping(customMapping.getTags())
                    .listTags(customMapping.getListTags())
                    .delimiterTags(customMapping.getDelimiters());
        }
        if (validated.getListTags() != null) {
            builder.listTags(validated.getListTags());
        }
        if (options.isStrictEof()) {
            builder.incompleteRecordPolicy(IncompleteRecordPolicy.FAIL);
        }
        return builder.build();
    }

    private WriterOptions writerOptions(ValidatedConvertOptions validated, TagMapping customMapping,
                                        List<ExportWarning> warnings) {
        WriterOptions.WriterOptionsBuilder builder = WriterOptions.builder()
                .skipUnknownTags(options.isSkipUnknownTags())
                .enforceListTags(!options.isRelaxedListTags())
                .warningListener(warning -> {
                    warnings.add(warning);
                    log.warn("Record {}: field `{}` not exported ({})",
                            warning.getRecordIndex(), warning.getField(), warning.getMessage());
                });
        if (customMapping != null && validated.getTargetDialect() == options.getFrom()) {
            builder.mapping(customMapping.getTags())
                    .listTags(customMapping.getListTags())
                    .delimiterTags(customMapping.getDelimiters());
        }
        if (validated.getListTags() != null && validated.getTargetDialect() == options.getFrom()) {
            builder.listTags(validated.getListTags());
        }
        return builder.build();
    }
}
