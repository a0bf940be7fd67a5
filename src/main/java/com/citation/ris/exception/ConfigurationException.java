package com.citation.ris.exception;

/**
 * Raised when a tag mapping, list-tag set or delimiter rule cannot be used,
 * e.g. a mapping whose field names are not unique and therefore cannot be
 * inverted for writing.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
