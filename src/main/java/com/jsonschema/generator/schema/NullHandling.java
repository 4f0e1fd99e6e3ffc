package com.jsonschema.generator.schema;

/**
 * How nullability of a schema is determined.
 */
public enum NullHandling {
    /** Nullable when the type flags contain {@code null}. */
    JSON,
    /** Nullable when {@code x-nullable} says so, otherwise when the property is not required. */
    SWAGGER
}
