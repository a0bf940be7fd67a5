package com.citation.ris;

import com.citation.ris.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the RIS citation converter.
 * Reads a RIS, Web of Science or PubMed file and writes it back out, optionally
 * in another dialect.
 */
public class RisConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
