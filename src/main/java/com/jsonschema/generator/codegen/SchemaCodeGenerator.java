package com.jsonschema.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.codegen.generator.CSharpGenerator;
import com.jsonschema.generator.codegen.resolver.CSharpTypeResolver;
import com.jsonschema.generator.codegen.template.CodeRenderException;
import com.jsonschema.generator.codegen.template.DefaultTemplateFactory;
import com.jsonschema.generator.codegen.template.TemplateFactory;
import com.jsonschema.generator.codegen.template.TemplateResolutionException;
import com.jsonschema.generator.codegen.util.FileWriteUtil;
import com.jsonschema.generator.schema.JsonSchema;
import com.jsonschema.generator.schema.JsonSchemaReader;
import com.jsonschema.generator.schema.SchemaReadException;

/**
 * Main generator that turns a JSON Schema file into a C# source file.
 *
 * Every run uses a fresh resolver, so no naming state is shared between runs. A run either
 * writes the complete output or reports a failure and writes nothing.
 */
public class SchemaCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(SchemaCodeGenerator.class);

    private final GeneratorConfig config;
    private final TemplateFactory templateFactory;
    private final JsonSchemaReader schemaReader;

    public SchemaCodeGenerator(GeneratorConfig config) {
        this(config, DefaultTemplateFactory.createDefault());
    }

    public SchemaCodeGenerator(GeneratorConfig config, TemplateFactory templateFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.templateFactory = Objects.requireNonNull(templateFactory, "templateFactory");
        this.schemaReader = new JsonSchemaReader();
    }

    /**
     * Generate the C# file.
     */
    public GeneratorResult generate() {
        long startTime = System.currentTimeMillis();
        try {
            log.info("Starting code generation...");

            // Step 1: Read schema
            log.info("Step 1: Reading schema {}...", config.getSchemaFile());
            JsonSchema schema = schemaReader.read(config.getSchemaFile());

            // Step 2: Resolve and render types
            log.info("Step 2: Generating types...");
            CSharpTypeResolver resolver = new CSharpTypeResolver(config.getSettings(), templateFactory);
            String code = new CSharpGenerator(schema, config.getSettings(), resolver)
                    .generateFile(config.getRootTypeNameHint());

            // Step 3: Write output
            Path outputPath = resolveOutputPath();
            log.info("Step 3: Writing {}...", outputPath);
            if (Files.exists(outputPath) && !config.isForce()) {
                return GeneratorResult.failure("Output file already exists: " + outputPath + ". Use --force to overwrite.");
            }
            FileWriteUtil.writeAtomically(outputPath, code);

            long enums = resolver.getRegistry().entries().stream()
                    .filter(e -> e.getValue().isEnumeration())
                    .count();
            int types = resolver.getRegistry().size();

            log.info("Generated {} types ({} enums)", types, enums);
            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .typesGenerated(types)
                    .enumsGenerated((int) enums)
                    .classesGenerated(types - (int) enums)
                    .inheritanceConverterGenerated(code.contains("class " + CSharpTypeResolver.INHERITANCE_CONVERTER))
                    .generationTimeMillis(System.currentTimeMillis() - startTime)
                    .build();

        } catch (TemplateResolutionException e) {
            log.error("Template resolution failed, generation cannot proceed", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (CodeRenderException e) {
            log.error("Template rendering failed", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (SchemaReadException e) {
            log.error("Schema could not be read: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Failed to write output", e);
            return GeneratorResult.failure("Failed to write output: " + e.getMessage());
        }
    }

    private Path resolveOutputPath() {
        if (config.getOutputFile() != null) {
            return config.getOutputFile();
        }
        String hint = config.getRootTypeNameHint();
        return Path.of(hint != null ? hint + ".cs" : "Generated.cs");
    }
}
