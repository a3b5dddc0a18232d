package com.myorg.justelparser.exception;

/**
 * Bad caller input: a malformed source document or a replacement tree that breaks the
 * hierarchy rules.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
