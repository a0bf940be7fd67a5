package com.citation.ris.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.citation.ris.cli.exception.OptionsValidationException;
import com.citation.ris.cli.model.ConvertOptions;
import com.citation.ris.cli.model.ValidatedConvertOptions;
import com.citation.ris.format.Dialect;

public class ConvertOptionsValidator {

	private static final Pattern TAG_CODE = Pattern.compile("[A-Z][A-Z0-9]{1,3}");

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Input file is required (--input / -i).");
		} else if (!existsFile(o.getInput())) {
			errors.add("Input file does not exist or is not a regular file: " + o.getInput());
		}

		if (o.getOutput() != null && Files.exists(o.getOutput()) && !o.isForce()) {
			errors.add("Output file already exists: " + o.getOutput() + ". Use --force to overwrite.");
		}

		if (o.getMappingFile() != null && !existsFile(o.getMappingFile())) {
			errors.add("Mapping file does not exist: " + o.getMappingFile());
		}

		Charset encoding = parseEncoding(o.getEncoding(), errors);
		Set<String> listTags = parseListTags(o.getListTags(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Dialect target = o.getTo() != null ? o.getTo() : o.getFrom();
		return new ValidatedConvertOptions(encoding, target, listTags);
	}

	private static Charset parseEncoding(String name, List<String> errors) {
		if (name == null || name.isBlank()) {
			errors.add("Encoding must not be blank.");
			return null;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalArgumentException e) {
			errors.add("Unsupported encoding: " + name);
			return null;
		}
	}

	private static Set<String> parseListTags(String raw, List<String> errors) {
		if (raw == null) {
			return null;
		}

		Set<String> result = new LinkedHashSet<>();
		Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(result::add);

		for (String tag : result) {
			if (!TAG_CODE.matcher(tag).matches()) {
				errors.add("Invalid tag code in --list-tags: " + tag);
			}
		}

		return result;
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.isRegularFile(p);
	}
}
