package com.jsonschema.generator.schema;

/**
 * Raised when a schema document cannot be read into a schema graph.
 */
public class SchemaReadException extends Exception {

    private static final long serialVersionUID = 1L;

    public SchemaReadException(String message) {
        super(message);
    }

    public SchemaReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
