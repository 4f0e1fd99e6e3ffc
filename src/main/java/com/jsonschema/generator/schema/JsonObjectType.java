package com.jsonschema.generator.schema;

import java.util.Locale;

/**
 * Structural type flags a schema node may declare. A node carries a set of these;
 * an empty set means no type was declared.
 */
public enum JsonObjectType {
    ARRAY,
    BOOLEAN,
    INTEGER,
    NULL,
    NUMBER,
    OBJECT,
    STRING,
    FILE;

    /**
     * Parses a JSON Schema type keyword ("string", "integer", ...).
     *
     * @return the flag, or null for an unknown keyword
     */
    public static JsonObjectType fromKeyword(String keyword) {
        if (keyword == null) {
            return null;
        }
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "array" -> ARRAY;
            case "boolean" -> BOOLEAN;
            case "integer" -> INTEGER;
            case "null" -> NULL;
            case "number" -> NUMBER;
            case "object" -> OBJECT;
            case "string" -> STRING;
            case "file" -> FILE;
            default -> null;
        };
    }
}
