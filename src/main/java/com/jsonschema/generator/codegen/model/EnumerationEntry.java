package com.jsonschema.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One member of a generated enum.
 */
@Value
@Builder
public class EnumerationEntry {

    /** C# member name. */
    @NonNull
    String name;

    /** Literal value from the schema, escaped for a C# string literal. */
    @NonNull
    String value;

    /** Numeric value assigned to the member. */
    @NonNull
    String internalValue;
}
