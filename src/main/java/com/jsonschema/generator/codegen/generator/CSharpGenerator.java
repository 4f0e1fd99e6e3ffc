package com.jsonschema.generator.codegen.generator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.codegen.model.ClassTemplateModel;
import com.jsonschema.generator.codegen.model.EnumTemplateModel;
import com.jsonschema.generator.codegen.model.EnumerationEntry;
import com.jsonschema.generator.codegen.model.FileTemplateModel;
import com.jsonschema.generator.codegen.model.PropertyModel;
import com.jsonschema.generator.codegen.resolver.CSharpTypeResolver;
import com.jsonschema.generator.codegen.resolver.TypeResolverBase;
import com.jsonschema.generator.codegen.settings.CSharpGeneratorSettings;
import com.jsonschema.generator.codegen.template.DefaultTemplateFactory;
import com.jsonschema.generator.codegen.template.TemplateFactory;
import com.jsonschema.generator.codegen.util.CodeFormatUtil;
import com.jsonschema.generator.codegen.util.NamingUtil;
import com.jsonschema.generator.schema.JsonObjectType;
import com.jsonschema.generator.schema.JsonSchema;

/**
 * Generates the C# declaration (class or enum) of one schema.
 *
 * Member types are resolved through the resolver of the enclosing run, only when
 * {@link #generateType(String)} is called.
 */
public class CSharpGenerator extends TypeGeneratorBase {

    private static final Logger log = LoggerFactory.getLogger(CSharpGenerator.class);

    static final String TOOL_NAME = "jsonschema-codegen-tool";

    private final JsonSchema schema;
    private final CSharpGeneratorSettings settings;
    private final CSharpTypeResolver resolver;

    public CSharpGenerator(JsonSchema schema, CSharpGeneratorSettings settings, CSharpTypeResolver resolver) {
        this.schema = Objects.requireNonNull(schema, "schema").getActualSchema();
        this.settings = Objects.requireNonNull(settings, "settings");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public JsonSchema getSchema() {
        return schema;
    }

    public boolean isEnumeration() {
        return schema.isEnumeration();
    }

    /**
     * Generates a complete C# file: resolves this generator's schema as the root type, renders
     * every type it reaches and wraps them in the namespace.
     *
     * @param rootTypeNameHint name for the root type if its schema declares none
     */
    public String generateFile(String rootTypeNameHint) {
        String rootType = resolver.resolve(schema, false, rootTypeNameHint);
        log.debug("Root schema resolved to {}", rootType);

        String classes = resolver.generateClasses();
        FileTemplateModel model = FileTemplateModel.builder()
                .namespace(settings.getNamespace())
                .classes(CodeFormatUtil.indent(classes, 1))
                .toolName(TOOL_NAME)
                .build();
        return templates().render(DefaultTemplateFactory.CSHARP, DefaultTemplateFactory.FILE_TEMPLATE, model);
    }

    @Override
    public TypeGeneratorResult generateType(String typeName) {
        if (schema.isEnumeration()) {
            return generateEnum(typeName);
        }
        return generateClass(typeName);
    }

    private TypeGeneratorResult generateClass(String typeName) {
        JsonSchema inherited = schema.getInheritedSchema();
        String baseClassName = inherited != null ? resolver.resolve(inherited, false, null) : null;

        // Members may not repeat or share the name of their enclosing class
        Set<String> usedNames = new HashSet<>();
        usedNames.add(typeName);
        List<PropertyModel> properties = new ArrayList<>();
        for (Map.Entry<String, JsonSchema> property : schema.getActualProperties().entrySet()) {
            properties.add(createProperty(property.getKey(), property.getValue(), usedNames));
        }

        ClassTemplateModel model = ClassTemplateModel.builder()
                .className(typeName)
                .description(schema.getDescription())
                .baseClassName(baseClassName)
                .discriminator(schema.getDiscriminator())
                .escapedDiscriminator(schema.getDiscriminator() != null
                        ? CodeFormatUtil.escapeLiteral(schema.getDiscriminator())
                        : null)
                .properties(properties)
                .build();

        log.debug("Generating class {} with {} properties", typeName, properties.size());
        String code = templates().render(DefaultTemplateFactory.CSHARP, DefaultTemplateFactory.CLASS_TEMPLATE, model);

        return TypeGeneratorResult.builder()
                .typeName(typeName)
                .baseTypeName(baseClassName)
                .kind(TypeKind.CLASS)
                .code(code)
                .build();
    }

    private PropertyModel createProperty(String name, JsonSchema property, Set<String> usedNames) {
        boolean required = schema.isRequired(name);
        boolean nullable = schema.isPropertyNullable(name, settings.getNullHandling());
        String propertyName = NamingUtil.disambiguate(NamingUtil.toTypeIdentifier(name, "Property"), usedNames);
        usedNames.add(propertyName);

        return PropertyModel.builder()
                .name(name)
                .escapedName(CodeFormatUtil.escapeLiteral(name))
                .propertyName(propertyName)
                .type(resolver.resolve(property, nullable, propertyName))
                .description(property.getDescription() != null
                        ? property.getDescription()
                        : property.getActualSchema().getDescription())
                .required(required)
                .nullable(nullable)
                .jsonPropertyRequired(jsonPropertyRequired(required, nullable))
                .renderRequiredAttribute(settings.isGenerateDataAnnotations() && required && !nullable)
                .build();
    }

    private String jsonPropertyRequired(boolean required, boolean nullable) {
        if (settings.isRequiredPropertiesMustBeDefined() && required) {
            return nullable ? "AllowNull" : "Always";
        }
        return nullable ? "Default" : "DisallowNull";
    }

    private TypeGeneratorResult generateEnum(String typeName) {
        boolean stringEnum = TypeResolverBase.inferEnumerationType(schema) == JsonObjectType.STRING;

        List<Object> literals = schema.getEnumeration();
        List<String> names = schema.getEnumerationNames();
        Set<String> usedNames = new HashSet<>();
        List<EnumerationEntry> entries = new ArrayList<>();

        for (int i = 0; i < literals.size(); i++) {
            Object literal = literals.get(i);
            String declaredName = i < names.size() ? names.get(i) : null;

            String memberName = NamingUtil.disambiguate(memberName(literal, declaredName, stringEnum), usedNames);
            usedNames.add(memberName);

            entries.add(EnumerationEntry.builder()
                    .name(memberName)
                    .value(CodeFormatUtil.escapeLiteral(String.valueOf(literal)))
                    .internalValue(stringEnum ? String.valueOf(i) : String.valueOf(literal))
                    .build());
        }

        EnumTemplateModel model = EnumTemplateModel.builder()
                .name(typeName)
                .description(schema.getDescription())
                .stringEnum(stringEnum)
                .entries(entries)
                .build();

        log.debug("Generating {} enum {} with {} members", stringEnum ? "string" : "integer", typeName, entries.size());
        String code = templates().render(DefaultTemplateFactory.CSHARP, DefaultTemplateFactory.ENUM_TEMPLATE, model);

        return TypeGeneratorResult.builder()
                .typeName(typeName)
                .kind(TypeKind.ENUM)
                .code(code)
                .build();
    }

    private static String memberName(Object literal, String declaredName, boolean stringEnum) {
        if (declaredName != null && !declaredName.isBlank()) {
            return NamingUtil.toTypeIdentifier(declaredName, "Value");
        }
        if (!stringEnum) {
            return "_" + String.valueOf(literal).replace("-", "Minus");
        }
        return NamingUtil.toTypeIdentifier(String.valueOf(literal), "Empty");
    }

    private TemplateFactory templates() {
        return resolver.getTemplateFactory();
    }
}
