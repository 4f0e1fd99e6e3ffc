package com.jsonschema.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Rendering model of the C# Enum template.
 */
@Value
@Builder(toBuilder = true)
public class EnumTemplateModel {

    @NonNull
    String name;

    String description;

    /** True for string-backed enumerations, false for integer-backed ones. */
    boolean stringEnum;

    @NonNull
    @Builder.Default
    List<EnumerationEntry> entries = List.of();

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
