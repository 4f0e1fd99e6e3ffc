package com.jsonschema.generator.codegen.resolver;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.codegen.generator.TypeGeneratorBase;
import com.jsonschema.generator.codegen.generator.TypeGeneratorResult;
import com.jsonschema.generator.codegen.naming.TypeNameGenerator;
import com.jsonschema.generator.schema.JsonObjectType;
import com.jsonschema.generator.schema.JsonSchema;
import com.jsonschema.generator.schema.NullHandling;

/**
 * Maps schemas to type expressions and owns the named types generated along the way.
 *
 * A resolver instance is the context of exactly one generation run: every recursive
 * resolution, including those made by its generators, goes through the same instance.
 *
 * @param <G> the generator type of the target language
 */
public abstract class TypeResolverBase<G extends TypeGeneratorBase> {

    private static final Logger log = LoggerFactory.getLogger(TypeResolverBase.class);

    private final TypeRegistry<G> registry;

    protected TypeResolverBase(TypeNameGenerator typeNameGenerator) {
        this.registry = new TypeRegistry<>(typeNameGenerator);
    }

    /**
     * Resolves the schema to a type expression, registering named types as needed.
     *
     * @param schema       the schema, dereferenced before any rule is applied
     * @param isNullable   whether the usage site allows null
     * @param typeNameHint name to use if a new named type is created, may be null
     */
    public abstract String resolve(JsonSchema schema, boolean isNullable, String typeNameHint);

    protected abstract G createTypeGenerator(JsonSchema schema);

    public TypeRegistry<G> getRegistry() {
        return registry;
    }

    public String getOrCreateTypeName(JsonSchema schema, String typeNameHint) {
        return registry.getOrCreateName(schema, typeNameHint);
    }

    public void addOrReplaceTypeGenerator(String typeName, G generator) {
        registry.addOrReplace(typeName, generator);
    }

    /**
     * Reserves the schema's name and binds a generator to it unless one is bound already.
     *
     * @return the type name
     */
    protected String addGenerator(JsonSchema schema, String typeNameHint) {
        JsonSchema actual = schema.getActualSchema();
        String typeName = getOrCreateTypeName(actual, typeNameHint);
        if (!registry.contains(typeName)) {
            addOrReplaceTypeGenerator(typeName, createTypeGenerator(actual));
        }
        return typeName;
    }

    /**
     * Resolves the value type of a dictionary schema, or returns the fallback when the
     * schema declares no value schema.
     */
    protected String resolveDictionaryValueType(JsonSchema schema, String fallbackType, NullHandling nullHandling) {
        JsonSchema valueSchema = schema.getAdditionalPropertiesSchema();
        if (valueSchema != null) {
            return resolve(valueSchema, valueSchema.isNullable(nullHandling), null);
        }
        return fallbackType;
    }

    /**
     * Renders every registered type, including types registered while rendering others.
     *
     * Loops until each name's currently bound generator has been rendered: a generator that is
     * replaced after rendering is rendered again. Results are returned in registration order.
     */
    public List<TypeGeneratorResult> generateTypes() {
        Map<String, G> renderedBy = new HashMap<>();
        Map<String, TypeGeneratorResult> results = new HashMap<>();

        int pass = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            pass++;
            for (Map.Entry<String, G> entry : registry.entries()) {
                String typeName = entry.getKey();
                G generator = registry.get(typeName).orElse(entry.getValue());
                if (renderedBy.get(typeName) == generator) {
                    continue;
                }
                results.put(typeName, generator.generateType(typeName));
                renderedBy.put(typeName, generator);
                changed = true;
            }
            log.debug("Generation pass {} done, {} types registered", pass, registry.size());
        }

        List<TypeGeneratorResult> ordered = new ArrayList<>(registry.size());
        for (Map.Entry<String, G> entry : registry.entries()) {
            ordered.add(results.get(entry.getKey()));
        }
        return ordered;
    }

    /**
     * True when the schema declares a type flag other than {@code null}.
     */
    protected static boolean hasStructuralType(JsonSchema schema) {
        return schema.getType().stream().anyMatch(t -> t != JsonObjectType.NULL);
    }

    /**
     * Backing type of an enumeration: integer when every literal is integral, else string.
     */
    public static JsonObjectType inferEnumerationType(JsonSchema schema) {
        if (schema.getType().contains(JsonObjectType.INTEGER)) {
            return JsonObjectType.INTEGER;
        }
        if (hasStructuralType(schema)) {
            return JsonObjectType.STRING;
        }
        return schema.getEnumeration().stream().allMatch(TypeResolverBase::isIntegerLiteral)
                ? JsonObjectType.INTEGER
                : JsonObjectType.STRING;
    }

    private static boolean isIntegerLiteral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }
}
