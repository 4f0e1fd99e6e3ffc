package com.jsonschema.generator.codegen.naming;

import java.util.Set;

import com.jsonschema.generator.codegen.util.NamingUtil;
import com.jsonschema.generator.schema.JsonSchema;

/**
 * Names a type after the schema's declared name, else the hint, else {@value #ANONYMOUS}.
 * Collisions are resolved with a numeric suffix starting at 2.
 */
public class DefaultTypeNameGenerator implements TypeNameGenerator {

    public static final String ANONYMOUS = "Anonymous";

    @Override
    public String generate(JsonSchema schema, String typeNameHint, Set<String> reservedTypeNames) {
        String candidate = NamingUtil.toTypeIdentifier(schema.getTypeNameRaw(), null);
        if (candidate == null) {
            candidate = NamingUtil.toTypeIdentifier(typeNameHint, ANONYMOUS);
        }
        return NamingUtil.disambiguate(candidate, reservedTypeNames);
    }
}
