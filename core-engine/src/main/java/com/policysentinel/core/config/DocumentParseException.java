package com.policysentinel.core.config;

/**
 * Raised by {@link DocumentReader} when a registry, pack or fixture document
 * cannot be read or is not well-formed structured data.
 *
 * @since 1.0.0
 */
public class DocumentParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public DocumentParseException(String message) {
        super(message);
    }
}
