package com.citation.ris.writer;

/**
 * Receives {@link ExportWarning}s as they occur. Writing always continues.
 */
@FunctionalInterface
public interface ExportWarningListener {

    void onWarning(ExportWarning warning);
}
