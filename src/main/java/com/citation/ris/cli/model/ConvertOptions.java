package com.citation.ris.cli.model;

import java.nio.file.Path;

import com.citation.ris.format.Dialect;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Citation file to read")
	private Path input;

	@Option(names = { "--output", "-o" }, description = "File to write (defaults to standard output)")
	private Path output;

	@Option(names = { "--from" }, defaultValue = "RIS", description = "Input dialect: RIS, WOK or PUBMED")
	private Dialect from;

	@Option(names = { "--to" }, description = "Output dialect (defaults to the input dialect)")
	private Dialect to;

	@Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Character encoding of input and output files")
	private String encoding;

	@Option(names = { "--mapping-file", "-m" }, description = "Tag mapping file replacing the dialect's default mapping")
	private Path mappingFile;

	@Option(names = { "--list-tags" }, description = "Comma-separated tags always read as lists (replaces the default set)")
	private String listTags;

	@Option(names = { "--skip-unknown-tags" }, description = "Drop tags missing from the mapping instead of keeping them")
	private boolean skipUnknownTags;

	@Option(names = { "--relaxed-list-tags" }, description = "Turn repeated tags into lists instead of keeping the first value")
	private boolean relaxedListTags;

	@Option(names = { "--skip-missing-tags" }, description = "Skip lines without a tag instead of treating them as continuations")
	private boolean skipMissingTags;

	@Option(names = { "--strict-eof" }, description = "Fail when the input ends inside a record")
	private boolean strictEof;

	@Option(names = { "--type-names" }, description = "Replace reference type codes (JOUR, BOOK, ...) with readable names")
	private boolean typeNames;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

}
