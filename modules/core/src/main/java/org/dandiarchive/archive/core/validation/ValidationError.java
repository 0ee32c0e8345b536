package org.dandiarchive.archive.core.validation;

/**
 * One schema violation. {@code field} is a dotted path into the document, or
 * {@code ""} for document-level errors.
 */
public record ValidationError(String field, String message) {}
