package com.al.hl7generator.exception;

/**
 * Raised when a schema resource exists but cannot be read or parsed.
 */
public class SchemaLoadException extends RuntimeException {

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
