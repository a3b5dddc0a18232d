package com.myorg.justelparser.exception;

/**
 * Base of the recoverable parser failures. Each subtype is caught at the scope it is
 * fatal for (footnote, article or document) and turned into a {@code ParseIssue}.
 */
public abstract class DocumentParseException extends Exception {

    protected DocumentParseException(String message) {
        super(message);
    }

    protected DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
