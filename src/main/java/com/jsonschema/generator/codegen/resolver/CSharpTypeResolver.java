package com.jsonschema.generator.codegen.resolver;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.codegen.generator.CSharpGenerator;
import com.jsonschema.generator.codegen.generator.TypeGeneratorResult;
import com.jsonschema.generator.codegen.naming.DefaultTypeNameGenerator;
import com.jsonschema.generator.codegen.naming.TypeNameGenerator;
import com.jsonschema.generator.codegen.settings.CSharpGeneratorSettings;
import com.jsonschema.generator.codegen.template.DefaultTemplateFactory;
import com.jsonschema.generator.codegen.template.TemplateFactory;
import com.jsonschema.generator.schema.JsonFormatStrings;
import com.jsonschema.generator.schema.JsonObjectType;
import com.jsonschema.generator.schema.JsonSchema;

/**
 * Converts schemas to C# type expressions and manages the generated C# types.
 *
 * Never fails on a schema shape: anything it cannot classify becomes a named type or falls back
 * to {@value #ANY_TYPE}.
 */
public class CSharpTypeResolver extends TypeResolverBase<CSharpGenerator> {

    private static final Logger log = LoggerFactory.getLogger(CSharpTypeResolver.class);

    public static final String ANY_TYPE = "object";
    public static final String STRING_TYPE = "string";
    public static final String BYTE_ARRAY_TYPE = "byte[]";
    public static final String GUID_TYPE = "System.Guid";
    public static final String TUPLE_TYPE = "System.Tuple";

    /** Marker whose presence in generated code requires the converter support type. */
    public static final String INHERITANCE_CONVERTER = "JsonInheritanceConverter";

    private static final String NULLABLE_MARKER = "?";

    private final CSharpGeneratorSettings settings;
    private final TemplateFactory templateFactory;

    public CSharpTypeResolver(CSharpGeneratorSettings settings) {
        this(settings, DefaultTemplateFactory.createDefault());
    }

    public CSharpTypeResolver(CSharpGeneratorSettings settings, TemplateFactory templateFactory) {
        this(settings, templateFactory, new DefaultTypeNameGenerator());
    }

    public CSharpTypeResolver(CSharpGeneratorSettings settings, TemplateFactory templateFactory,
                              TypeNameGenerator typeNameGenerator) {
        super(typeNameGenerator);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.templateFactory = Objects.requireNonNull(templateFactory, "templateFactory");
    }

    public TemplateFactory getTemplateFactory() {
        return templateFactory;
    }

    @Override
    public String resolve(JsonSchema schema, boolean isNullable, String typeNameHint) {
        schema = schema.getActualSchema();

        if (schema.isAnyType()) {
            return ANY_TYPE;
        }

        Set<JsonObjectType> type = schema.getType();
        if (!hasStructuralType(schema) && schema.isEnumeration()) {
            type = EnumSet.of(inferEnumerationType(schema));
        }

        if (type.contains(JsonObjectType.ARRAY)) {
            return resolveArray(schema);
        }

        if (type.contains(JsonObjectType.NUMBER)) {
            return resolveNumber(schema, isNullable);
        }

        if (type.contains(JsonObjectType.INTEGER)) {
            return resolveInteger(schema, isNullable, typeNameHint);
        }

        if (type.contains(JsonObjectType.BOOLEAN)) {
            return nullable("bool", isNullable);
        }

        if (type.contains(JsonObjectType.STRING)) {
            return resolveString(schema, isNullable, typeNameHint);
        }

        if (type.contains(JsonObjectType.FILE)) {
            return BYTE_ARRAY_TYPE;
        }

        if (schema.isDictionary()) {
            String valueType = resolveDictionaryValueType(schema, ANY_TYPE, settings.getNullHandling());
            return settings.getDictionaryType() + "<" + STRING_TYPE + ", " + valueType + ">";
        }

        return addGenerator(schema, typeNameHint);
    }

    /**
     * Renders all registered types, in registration order, followed by the inheritance
     * converter when any of them uses it.
     */
    public String generateClasses() {
        String classes = generateTypes().stream()
                .map(TypeGeneratorResult::getCode)
                .collect(Collectors.joining("\n\n"));

        if (classes.contains(INHERITANCE_CONVERTER)) {
            log.debug("Appending {} support type", INHERITANCE_CONVERTER);
            classes += "\n\n" + templateFactory.render(DefaultTemplateFactory.CSHARP,
                    DefaultTemplateFactory.INHERITANCE_CONVERTER_TEMPLATE, settings);
        }
        return classes;
    }

    /**
     * Integer enumerations always rebind their name to a fresh generator: the revisit carries
     * the declared enumeration literals, so the new generator is at least as informed as the
     * bound one.
     */
    @Override
    protected String addGenerator(JsonSchema schema, String typeNameHint) {
        JsonSchema actual = schema.getActualSchema();
        if (actual.isEnumeration() && isDeclaredInteger(actual)) {
            String typeName = getOrCreateTypeName(actual, typeNameHint);
            addOrReplaceTypeGenerator(typeName, createTypeGenerator(actual));
        }
        return super.addGenerator(actual, typeNameHint);
    }

    @Override
    protected CSharpGenerator createTypeGenerator(JsonSchema schema) {
        return new CSharpGenerator(schema, settings, this);
    }

    private static boolean isDeclaredInteger(JsonSchema schema) {
        Set<JsonObjectType> declared = EnumSet.noneOf(JsonObjectType.class);
        declared.addAll(schema.getType());
        declared.remove(JsonObjectType.NULL);
        return declared.equals(EnumSet.of(JsonObjectType.INTEGER));
    }

    private String resolveString(JsonSchema schema, boolean isNullable, String typeNameHint) {
        String format = schema.getFormat();

        if (JsonFormatStrings.DATE.equals(format)) {
            return nullableConfigured(settings.getDateType(), isNullable);
        }
        if (JsonFormatStrings.DATE_TIME.equals(format)) {
            return nullableConfigured(settings.getDateTimeType(), isNullable);
        }
        if (JsonFormatStrings.TIME.equals(format)) {
            return nullableConfigured(settings.getTimeType(), isNullable);
        }
        if (JsonFormatStrings.TIME_SPAN.equals(format)) {
            return nullableConfigured(settings.getTimeSpanType(), isNullable);
        }

        if (JsonFormatStrings.GUID.equals(format) || JsonFormatStrings.UUID.equals(format)) {
            return nullable(GUID_TYPE, isNullable);
        }
        if (JsonFormatStrings.BASE64.equals(format) || JsonFormatStrings.BYTE.equals(format)) {
            return BYTE_ARRAY_TYPE;
        }

        if (schema.isEnumeration()) {
            return addGenerator(schema, typeNameHint) + (isNullable ? NULLABLE_MARKER : "");
        }

        return STRING_TYPE;
    }

    private String resolveInteger(JsonSchema schema, boolean isNullable, String typeNameHint) {
        if (schema.isEnumeration()) {
            return addGenerator(schema, typeNameHint);
        }

        String format = schema.getFormat();
        if (JsonFormatStrings.BYTE.equals(format)) {
            return nullable("byte", isNullable);
        }
        if (JsonFormatStrings.LONG.equals(format) || JsonFormatStrings.LONG_LEGACY.equals(format)) {
            return nullable("long", isNullable);
        }
        return nullable("int", isNullable);
    }

    private static String resolveNumber(JsonSchema schema, boolean isNullable) {
        if (JsonFormatStrings.DECIMAL.equals(schema.getFormat())) {
            return nullable("decimal", isNullable);
        }
        return nullable("double", isNullable);
    }

    private String resolveArray(JsonSchema schema) {
        if (schema.getItem() != null) {
            return settings.getArrayType() + "<" + resolve(schema.getItem(), false, null) + ">";
        }

        if (!schema.getItems().isEmpty()) {
            return TUPLE_TYPE + "<" + schema.getItems().stream()
                    .map(item -> resolve(item, false, null))
                    .collect(Collectors.joining(", ")) + ">";
        }

        return settings.getArrayType() + "<" + ANY_TYPE + ">";
    }

    private static String nullable(String type, boolean isNullable) {
        return isNullable ? type + NULLABLE_MARKER : type;
    }

    /**
     * A configured type configured as plain "string" is already nullable and gets no marker.
     */
    private static String nullableConfigured(String configuredType, boolean isNullable) {
        if (configuredType == null) {
            return STRING_TYPE;
        }
        return isNullable && !STRING_TYPE.equalsIgnoreCase(configuredType)
                ? configuredType + NULLABLE_MARKER
                : configuredType;
    }
}
