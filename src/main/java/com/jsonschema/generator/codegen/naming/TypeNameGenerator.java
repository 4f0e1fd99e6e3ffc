package com.jsonschema.generator.codegen.naming;

import java.util.Set;

import com.jsonschema.generator.schema.JsonSchema;

/**
 * Produces type names for schemas that become named types.
 */
public interface TypeNameGenerator {

    /**
     * Generates a type name that is not contained in {@code reservedTypeNames}.
     *
     * @param schema            the dereferenced schema to name
     * @param typeNameHint      naming hint from the usage site, may be null
     * @param reservedTypeNames names already handed out in this run
     */
    String generate(JsonSchema schema, String typeNameHint, Set<String> reservedTypeNames);
}
