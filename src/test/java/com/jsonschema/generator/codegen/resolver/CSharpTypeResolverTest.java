package com.jsonschema.generator.codegen.resolver;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.jsonschema.generator.codegen.generator.CSharpGenerator;
import com.jsonschema.generator.codegen.generator.TypeGeneratorResult;
import com.jsonschema.generator.codegen.generator.TypeKind;
import com.jsonschema.generator.codegen.settings.CSharpGeneratorSettings;
import com.jsonschema.generator.schema.JsonObjectType;
import com.jsonschema.generator.schema.JsonSchema;
import com.jsonschema.generator.schema.NullHandling;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CSharpTypeResolver type mapping and named type management.
 */
class CSharpTypeResolverTest {

    private CSharpGeneratorSettings settings;
    private CSharpTypeResolver resolver;

    @BeforeEach
    void setUp() {
        settings = CSharpGeneratorSettings.defaults();
        resolver = new CSharpTypeResolver(settings);
    }

    @Test
    void testAnyTypeResolvesToObject() {
        assertThat(resolver.resolve(new JsonSchema(), false, null)).isEqualTo("object");
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.NULL), true, null)).isEqualTo("object");
    }

    @Test
    void testScalarTypes() {
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.INTEGER), false, null)).isEqualTo("int");
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.NUMBER), false, null)).isEqualTo("double");
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.BOOLEAN), false, null)).isEqualTo("bool");
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.STRING), false, null)).isEqualTo("string");
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.FILE), true, null)).isEqualTo("byte[]");
    }

    @Test
    void testFormats() {
        assertThat(resolver.resolve(withFormat(JsonObjectType.INTEGER, "int64"), false, null)).isEqualTo("long");
        assertThat(resolver.resolve(withFormat(JsonObjectType.INTEGER, "byte"), true, null)).isEqualTo("byte?");
        assertThat(resolver.resolve(withFormat(JsonObjectType.NUMBER, "decimal"), false, null)).isEqualTo("decimal");
        assertThat(resolver.resolve(withFormat(JsonObjectType.STRING, "date-time"), false, null)).isEqualTo("System.DateTime");
        assertThat(resolver.resolve(withFormat(JsonObjectType.STRING, "duration"), true, null)).isEqualTo("System.TimeSpan?");
        assertThat(resolver.resolve(withFormat(JsonObjectType.STRING, "uuid"), true, null)).isEqualTo("System.Guid?");
        assertThat(resolver.resolve(withFormat(JsonObjectType.STRING, "byte"), true, null)).isEqualTo("byte[]");
    }

    @Test
    void testConfiguredStringScalarGetsNoNullableMarker() {
        resolver = new CSharpTypeResolver(settings.toBuilder().dateType("string").build());

        assertThat(resolver.resolve(withFormat(JsonObjectType.STRING, "date"), true, null)).isEqualTo("string");
    }

    @Test
    void testNullabilityIsIdempotent() {
        JsonSchema schema = JsonSchema.of(JsonObjectType.INTEGER);

        String first = resolver.resolve(schema, true, null);
        String second = resolver.resolve(schema, true, null);

        assertThat(first).isEqualTo("int?").isEqualTo(second);
        assertThat(resolver.resolve(schema, false, null)).doesNotContain("?");
        assertThat(resolver.resolve(withFormat(JsonObjectType.STRING, "date"), false, null)).doesNotContain("?");
    }

    @Test
    void testArrayWithSingleItem() {
        JsonSchema array = JsonSchema.of(JsonObjectType.ARRAY);
        array.setItem(JsonSchema.of(JsonObjectType.STRING));

        assertThat(resolver.resolve(array, false, null))
                .isEqualTo("System.Collections.ObjectModel.ObservableCollection<string>");
    }

    @Test
    void testArrayItemIsResolvedNonNullable() {
        JsonSchema array = JsonSchema.of(JsonObjectType.ARRAY);
        array.setItem(JsonSchema.of(JsonObjectType.INTEGER, JsonObjectType.NULL));

        assertThat(resolver.resolve(array, true, null))
                .isEqualTo("System.Collections.ObjectModel.ObservableCollection<int>");
    }

    @Test
    void testArrayWithTupleItems() {
        JsonSchema tuple = JsonSchema.of(JsonObjectType.ARRAY);
        tuple.getItems().add(JsonSchema.of(JsonObjectType.INTEGER));
        tuple.getItems().add(JsonSchema.of(JsonObjectType.STRING));

        assertThat(resolver.resolve(tuple, false, null)).isEqualTo("System.Tuple<int, string>");
    }

    @Test
    void testArrayWithoutItems() {
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.ARRAY), false, null))
                .isEqualTo("System.Collections.ObjectModel.ObservableCollection<object>");
    }

    @Test
    void testCustomArrayType() {
        resolver = new CSharpTypeResolver(settings.toBuilder().arrayType("System.Collections.Generic.List").build());
        JsonSchema array = JsonSchema.of(JsonObjectType.ARRAY);
        array.setItem(JsonSchema.of(JsonObjectType.NUMBER));

        assertThat(resolver.resolve(array, false, null)).isEqualTo("System.Collections.Generic.List<double>");
    }

    @Test
    void testDictionaryWithValueSchema() {
        JsonSchema dictionary = JsonSchema.of(JsonObjectType.OBJECT);
        dictionary.setAdditionalPropertiesSchema(JsonSchema.of(JsonObjectType.BOOLEAN));

        assertThat(resolver.resolve(dictionary, false, null))
                .isEqualTo("System.Collections.Generic.Dictionary<string, bool>");
        assertThat(resolver.getRegistry().size()).isZero();
    }

    @Test
    void testDictionaryWithoutValueSchema() {
        assertThat(resolver.resolve(JsonSchema.of(JsonObjectType.OBJECT), false, null))
                .isEqualTo("System.Collections.Generic.Dictionary<string, object>");
    }

    @Test
    void testDictionaryValueNullability() {
        JsonSchema dictionary = JsonSchema.of(JsonObjectType.OBJECT);
        dictionary.setAdditionalPropertiesSchema(JsonSchema.of(JsonObjectType.INTEGER, JsonObjectType.NULL));

        assertThat(resolver.resolve(dictionary, false, null))
                .isEqualTo("System.Collections.Generic.Dictionary<string, int?>");

        resolver = new CSharpTypeResolver(settings.toBuilder().nullHandling(NullHandling.SWAGGER).build());
        assertThat(resolver.resolve(dictionary, false, null))
                .isEqualTo("System.Collections.Generic.Dictionary<string, int>");
    }

    @Test
    void testObjectBecomesNamedType() {
        JsonSchema pet = objectWith("name", JsonSchema.of(JsonObjectType.STRING));
        pet.setTypeNameRaw("Pet");

        assertThat(resolver.resolve(pet, true, "Ignored")).isEqualTo("Pet");
        assertThat(resolver.resolve(JsonSchema.referenceTo(pet), false, "Other")).isEqualTo("Pet");
        assertThat(resolver.getRegistry().size()).isEqualTo(1);
    }

    @Test
    void testSiblingObjectsWithSameHintGetDistinctNames() {
        JsonSchema first = objectWith("a", JsonSchema.of(JsonObjectType.STRING));
        JsonSchema second = objectWith("b", JsonSchema.of(JsonObjectType.STRING));

        assertThat(resolver.resolve(first, false, "Item")).isEqualTo("Item");
        assertThat(resolver.resolve(second, false, "Item")).isEqualTo("Item2");
    }

    @Test
    void testSelfReferencingSchemaHasStableName() {
        JsonSchema node = JsonSchema.of(JsonObjectType.OBJECT);
        node.setTypeNameRaw("Node");
        node.addProperty("value", JsonSchema.of(JsonObjectType.STRING));
        node.addProperty("next", JsonSchema.referenceTo(node));

        assertThat(resolver.resolve(node, false, null)).isEqualTo("Node");
        assertThat(resolver.resolve(node.getProperties().get("next"), true, "Next")).isEqualTo("Node");

        List<TypeGeneratorResult> results = resolver.generateTypes();

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getCode()).contains("public Node Next { get; set; }");
    }

    @Test
    void testIndirectCycleTerminates() {
        JsonSchema parent = objectWith("name", JsonSchema.of(JsonObjectType.STRING));
        parent.setTypeNameRaw("Parent");
        JsonSchema child = objectWith("parent", JsonSchema.referenceTo(parent));
        child.setTypeNameRaw("Child");
        JsonSchema children = JsonSchema.of(JsonObjectType.ARRAY);
        children.setItem(JsonSchema.referenceTo(child));
        parent.addProperty("children", children);

        resolver.resolve(parent, false, null);
        List<TypeGeneratorResult> results = resolver.generateTypes();

        assertThat(results).extracting(TypeGeneratorResult::getTypeName).containsExactly("Parent", "Child");
        assertThat(results.get(0).getCode()).contains("ObservableCollection<Child> Children");
        assertThat(results.get(1).getCode()).contains("public Parent Parent { get; set; }");
    }

    @Test
    void testUntypedIntegerLiteralsInferIntegerEnum() {
        JsonSchema schema = enumOf(1, 2, 3);

        assertThat(TypeResolverBase.inferEnumerationType(schema)).isEqualTo(JsonObjectType.INTEGER);
        assertThat(resolver.resolve(schema, true, "Level")).isEqualTo("Level");
        assertThat(render("Level").getCode()).contains("_1 = 1,").doesNotContain("EnumMember");
    }

    @Test
    void testUntypedStringLiteralsInferStringEnum() {
        JsonSchema schema = enumOf("a", "b");

        assertThat(TypeResolverBase.inferEnumerationType(schema)).isEqualTo(JsonObjectType.STRING);
        assertThat(resolver.resolve(schema, true, "Letter")).isEqualTo("Letter?");
        assertThat(render("Letter").getCode()).contains("EnumMember(Value = \"a\")").contains("A = 0,");
    }

    @Test
    void testMixedLiteralsInferStringEnum() {
        assertThat(TypeResolverBase.inferEnumerationType(enumOf("a", 1))).isEqualTo(JsonObjectType.STRING);
    }

    @Test
    void testIntegerEnumNeverGetsNullableMarker() {
        JsonSchema schema = enumOf(1, 2);
        schema.getType().add(JsonObjectType.INTEGER);

        assertThat(resolver.resolve(schema, true, "Level")).isEqualTo("Level");
        assertThat(resolver.resolve(schema, false, "Level")).isEqualTo("Level");
    }

    @Test
    void testIntegerEnumUpgradesProvisionalGenerator() {
        JsonSchema levels = enumOf(10, 20);
        levels.getType().add(JsonObjectType.INTEGER);

        resolver.resolve(objectWith("x", JsonSchema.of(JsonObjectType.STRING)), false, "First");
        String name = resolver.getOrCreateTypeName(levels, "Level");
        CSharpGenerator provisional = new CSharpGenerator(
                objectWith("y", JsonSchema.of(JsonObjectType.STRING)), settings, resolver);
        resolver.addOrReplaceTypeGenerator(name, provisional);
        resolver.resolve(objectWith("z", JsonSchema.of(JsonObjectType.STRING)), false, "Last");

        assertThat(resolver.resolve(levels, false, "Ignored")).isEqualTo(name);

        CSharpGenerator bound = resolver.getRegistry().get(name).orElseThrow();
        assertThat(bound).isNotSameAs(provisional);
        assertThat(bound.isEnumeration()).isTrue();
        assertThat(resolver.getRegistry().entries())
                .extracting(Map.Entry::getKey)
                .containsExactly("First", "Level", "Last");
        assertThat(render(name).getCode()).contains("_10 = 10,").contains("_20 = 20,");
    }

    @Test
    void testStringEnumKeepsBoundGenerator() {
        JsonSchema colors = enumOf("red", "green");
        colors.getType().add(JsonObjectType.STRING);

        String name = resolver.getOrCreateTypeName(colors, "Color");
        CSharpGenerator provisional = new CSharpGenerator(colors, settings, resolver);
        resolver.addOrReplaceTypeGenerator(name, provisional);

        resolver.resolve(colors, false, null);

        assertThat(resolver.getRegistry().get(name)).containsSame(provisional);
    }

    @Test
    void testGenerateTypesRendersTypesRegisteredDuringRendering() {
        JsonSchema address = objectWith("street", JsonSchema.of(JsonObjectType.STRING));
        JsonSchema person = objectWith("address", address);

        resolver.resolve(person, false, "Person");
        assertThat(resolver.getRegistry().size()).isEqualTo(1);

        List<TypeGeneratorResult> results = resolver.generateTypes();

        assertThat(results).extracting(TypeGeneratorResult::getTypeName).containsExactly("Person", "Address");
        assertThat(results).extracting(TypeGeneratorResult::getKind).containsExactly(TypeKind.CLASS, TypeKind.CLASS);
    }

    @Test
    void testGenerateClassesAppendsConverterForDiscriminator() {
        JsonSchema shape = objectWith("kind", JsonSchema.of(JsonObjectType.STRING));
        shape.setDiscriminator("kind");
        resolver.resolve(shape, false, "Shape");

        String code = resolver.generateClasses();

        assertThat(code).contains("typeof(JsonInheritanceConverter), \"kind\"");
        assertThat(code).contains("public class JsonInheritanceConverter : Newtonsoft.Json.JsonConverter");
    }

    @Test
    void testGenerateClassesWithoutConverterMarker() {
        resolver.resolve(objectWith("id", JsonSchema.of(JsonObjectType.INTEGER)), false, "Plain");

        assertThat(resolver.generateClasses())
                .startsWith("public partial class Plain")
                .doesNotContain("JsonInheritanceConverter");
    }

    private TypeGeneratorResult render(String typeName) {
        return resolver.generateTypes().stream()
                .filter(r -> r.getTypeName().equals(typeName))
                .findFirst()
                .orElseThrow();
    }

    private static JsonSchema withFormat(JsonObjectType type, String format) {
        JsonSchema schema = JsonSchema.of(type);
        schema.setFormat(format);
        return schema;
    }

    private static JsonSchema objectWith(String property, JsonSchema propertySchema) {
        return JsonSchema.of(JsonObjectType.OBJECT).addProperty(property, propertySchema);
    }

    private static JsonSchema enumOf(Object... literals) {
        JsonSchema schema = new JsonSchema();
        schema.getEnumeration().addAll(List.of(literals));
        return schema;
    }
}
