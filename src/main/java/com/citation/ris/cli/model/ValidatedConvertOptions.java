package com.citation.ris.cli.model;

import java.nio.charset.Charset;
import java.util.Set;

import com.citation.ris.format.Dialect;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Charset encoding;
    Dialect targetDialect;
    /**
     * {@code null} when the dialect default applies.
     */
    Set<String> listTags;
}
