package com.jsonschema.generator.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.jsonschema.generator.codegen.GeneratorConfig;
import com.jsonschema.generator.codegen.GeneratorResult;
import com.jsonschema.generator.codegen.SchemaCodeGenerator;
import com.jsonschema.generator.codegen.settings.CSharpGeneratorSettings;
import com.jsonschema.generator.codegen.template.DefaultTemplateFactory;

import freemarker.template.Configuration;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process.
 */
class GeneratorIntegrationTest {

    private static final String PET_STORE = """
        {
          "title": "PetStore",
          "type": "object",
          "required": ["pets"],
          "properties": {
            "pets": { "type": "array", "items": { "$ref": "#/definitions/Pet" } },
            "owners": { "type": "object", "additionalProperties": { "$ref": "#/definitions/Owner" } },
            "opened": { "type": "string", "format": "date-time" }
          },
          "definitions": {
            "Pet": {
              "type": "object",
              "discriminator": "petType",
              "required": ["name", "petType"],
              "properties": {
                "name": { "type": "string" },
                "petType": { "type": "string" },
                "status": { "type": "string", "enum": ["available", "sold"] },
                "size": { "type": "integer", "enum": [1, 2, 3] },
                "friend": { "$ref": "#/definitions/Pet" }
              }
            },
            "Cat": {
              "allOf": [
                { "$ref": "#/definitions/Pet" },
                { "type": "object", "properties": { "lives": { "type": "integer" } } }
              ]
            },
            "Owner": {
              "type": "object",
              "properties": {
                "name": { "type": "string" },
                "favourite": { "$ref": "#/definitions/Cat" }
              }
            }
          }
        }
        """;

    @TempDir
    Path tempDir;

    private Path schemaFile;

    @BeforeEach
    void setUp() throws IOException {
        schemaFile = tempDir.resolve("pet-store.schema.json");
        Files.writeString(schemaFile, PET_STORE);
    }

    @Test
    void testGenerateFromSchemaFile() throws IOException {
        Path output = tempDir.resolve("out/PetStore.cs");
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaFile(schemaFile)
                .outputFile(output)
                .settings(CSharpGeneratorSettings.builder().namespace("PetStore.Models").build())
                .build();

        GeneratorResult result = new SchemaCodeGenerator(config).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputPath()).isEqualTo(output);
        assertThat(result.getTypesGenerated()).isEqualTo(6);
        assertThat(result.getEnumsGenerated()).isEqualTo(2);
        assertThat(result.getClassesGenerated()).isEqualTo(4);
        assertThat(result.isInheritanceConverterGenerated()).isTrue();

        String code = Files.readString(output);
        assertThat(code).contains("namespace PetStore.Models");
        assertThat(code).contains("public partial class PetStore");
        assertThat(code).contains("public System.Collections.ObjectModel.ObservableCollection<Pet> Pets { get; set; }");
        assertThat(code).contains("public System.Collections.Generic.Dictionary<string, Owner> Owners { get; set; }");
        assertThat(code).contains("public System.DateTime Opened { get; set; }");
        assertThat(code).contains("public Pet Friend { get; set; }");
        assertThat(code).contains("public Status Status { get; set; }");
        assertThat(code).contains("public Size Size { get; set; }");
        assertThat(code).contains("public partial class Cat : Pet");
        assertThat(code).contains("public class JsonInheritanceConverter");

        assertThat(code.indexOf("class PetStore")).isLessThan(code.indexOf("class Pet\n"));
        assertThat(code.indexOf("class Pet\n")).isLessThan(code.indexOf("class Owner"));
        assertThat(code.indexOf("class Owner")).isLessThan(code.indexOf("class JsonInheritanceConverter"));
    }

    @Test
    void testRootTypeNameFromFileNameWhenUntitled() throws IOException {
        Path untitled = tempDir.resolve("order.json");
        Files.writeString(untitled, """
            { "type": "object", "properties": { "total": { "type": "number", "format": "decimal" } } }
            """);
        Path output = tempDir.resolve("Order.cs");

        GeneratorResult result = new SchemaCodeGenerator(GeneratorConfig.builder()
                .schemaFile(untitled)
                .outputFile(output)
                .build()).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isInheritanceConverterGenerated()).isFalse();
        String code = Files.readString(output);
        assertThat(code).contains("public partial class Order").contains("public decimal Total { get; set; }");
        assertThat(code).contains("namespace MyNamespace").doesNotContain("JsonInheritanceConverter");
    }

    @Test
    void testReferenceToInlinePropertyGeneratesOneClass() throws IOException {
        Path addresses = tempDir.resolve("addresses.json");
        Files.writeString(addresses, """
            {
              "type": "object",
              "properties": {
                "home": { "type": "object", "properties": { "street": { "type": "string" } } },
                "work": { "$ref": "#/properties/home" }
              }
            }
            """);
        Path output = tempDir.resolve("Addresses.cs");

        GeneratorResult result = new SchemaCodeGenerator(GeneratorConfig.builder()
                .schemaFile(addresses)
                .outputFile(output)
                .build()).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTypesGenerated()).isEqualTo(2);
        String code = Files.readString(output);
        assertThat(code).contains("public partial class Home").doesNotContain("Home2");
        assertThat(code).contains("public Home Home { get; set; }").contains("public Home Work { get; set; }");
    }

    @Test
    void testRootTypeNameHint() {
        assertThat(GeneratorConfig.builder().schemaFile(schemaFile).build().getRootTypeNameHint())
                .isEqualTo("PetStore");
        assertThat(GeneratorConfig.builder().schemaFile(schemaFile).rootTypeName("Shop").build().getRootTypeNameHint())
                .isEqualTo("Shop");
        assertThat(GeneratorConfig.builder().build().getRootTypeNameHint()).isNull();
    }

    @Test
    void testTemplateMissFailsWithoutOutput() {
        Path output = tempDir.resolve("PetStore.cs");
        DefaultTemplateFactory withoutEnums = new DefaultTemplateFactory()
                .registerFreemarker(cfg(), DefaultTemplateFactory.CSHARP, DefaultTemplateFactory.FILE_TEMPLATE)
                .registerFreemarker(cfg(), DefaultTemplateFactory.CSHARP, DefaultTemplateFactory.CLASS_TEMPLATE);

        GeneratorResult result = new SchemaCodeGenerator(GeneratorConfig.builder()
                .schemaFile(schemaFile)
                .outputFile(output)
                .build(), withoutEnums).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("Could not load template 'Enum' for package 'CSharp'.");
        assertThat(output).doesNotExist();
    }

    @Test
    void testUnreadableSchemaFails() {
        GeneratorResult result = new SchemaCodeGenerator(GeneratorConfig.builder()
                .schemaFile(tempDir.resolve("missing.json"))
                .outputFile(tempDir.resolve("Missing.cs"))
                .build()).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("missing.json");
    }

    @Test
    void testExistingOutputRequiresForce() throws IOException {
        Path output = tempDir.resolve("PetStore.cs");
        Files.writeString(output, "existing");
        GeneratorConfig.GeneratorConfigBuilder config = GeneratorConfig.builder()
                .schemaFile(schemaFile)
                .outputFile(output);

        GeneratorResult refused = new SchemaCodeGenerator(config.build()).generate();
        assertThat(refused.isSuccess()).isFalse();
        assertThat(Files.readString(output)).isEqualTo("existing");

        GeneratorResult forced = new SchemaCodeGenerator(config.force(true).build()).generate();
        assertThat(forced.isSuccess()).isTrue();
        assertThat(Files.readString(output)).contains("public partial class PetStore");
    }

    @Test
    void testRunsAreIndependent() throws IOException {
        Path first = tempDir.resolve("first.cs");
        Path second = tempDir.resolve("second.cs");

        new SchemaCodeGenerator(GeneratorConfig.builder().schemaFile(schemaFile).outputFile(first).build()).generate();
        new SchemaCodeGenerator(GeneratorConfig.builder().schemaFile(schemaFile).outputFile(second).build()).generate();

        assertThat(Files.readString(first)).isEqualTo(Files.readString(second));
    }

    private static Configuration cfg() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(GeneratorIntegrationTest.class, "/templates");
        return cfg;
    }
}
