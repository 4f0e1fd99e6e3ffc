package com.jsonschema.generator.codegen.generator;

/**
 * Produces the declaration of one named type.
 *
 * Generators are created when their name is reserved and must not resolve member types before
 * {@link #generateType(String)} is called; that is what lets a type refer to itself.
 */
public abstract class TypeGeneratorBase {

    /**
     * Resolves the members of the type and renders its declaration.
     *
     * @param typeName the name reserved for the type
     */
    public abstract TypeGeneratorResult generateType(String typeName);
}
