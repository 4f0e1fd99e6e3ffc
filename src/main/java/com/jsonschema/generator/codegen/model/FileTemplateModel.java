package com.jsonschema.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Rendering model of the C# File template.
 */
@Value
@Builder
public class FileTemplateModel {

    @NonNull
    String namespace;

    /** Already rendered and indented type declarations. */
    @NonNull
    String classes;

    @NonNull
    String toolName;
}
