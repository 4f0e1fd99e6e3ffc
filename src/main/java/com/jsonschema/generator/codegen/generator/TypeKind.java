package com.jsonschema.generator.codegen.generator;

public enum TypeKind {
    CLASS,
    ENUM
}
