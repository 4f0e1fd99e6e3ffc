package com.jsonschema.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Describes a single property of a generated class.
 *
 * Pure structure only (no resolution logic).
 */
@Value
@Builder(toBuilder = true)
public class PropertyModel {

    /**
     * Property name as it appears in JSON.
     */
    @NonNull
    String name;

    /**
     * C# property name (PascalCase).
     */
    @NonNull
    String propertyName;

    /**
     * Resolved type expression, e.g. "string", "int?", "ObservableCollection&lt;Pet&gt;".
     */
    @NonNull
    String type;

    String description;

    boolean required;

    boolean nullable;

    /**
     * Newtonsoft {@code Required} member: Always, AllowNull, DisallowNull or Default.
     */
    @NonNull
    String jsonPropertyRequired;

    boolean renderRequiredAttribute;

    /**
     * JSON name escaped for a C# string literal.
     */
    @NonNull
    String escapedName;

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
