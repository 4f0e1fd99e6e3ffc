package com.jsonschema.generator.codegen.generator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Source text produced for one named type.
 */
@Value
@Builder
public class TypeGeneratorResult {

    @NonNull
    String typeName;

    /** Name of the base type, null when the type does not inherit. */
    String baseTypeName;

    @NonNull
    TypeKind kind;

    @NonNull
    String code;
}
