package com.napipe.schema;

/**
 * Exception thrown when a schema is malformed or cannot be parsed.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
