package com.jsonschema.generator.codegen;

import java.nio.file.Path;

import com.jsonschema.generator.codegen.settings.CSharpGeneratorSettings;
import com.jsonschema.generator.codegen.util.NamingUtil;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one generation run.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path schemaFile;
    private Path outputFile;
    private String rootTypeName;
    private boolean force;

    @Builder.Default
    private CSharpGeneratorSettings settings = CSharpGeneratorSettings.defaults();

    /**
     * Root type name hint: the configured name, else derived from the schema file name.
     */
    public String getRootTypeNameHint() {
        if (rootTypeName != null && !rootTypeName.isBlank()) {
            return rootTypeName;
        }
        return schemaFile != null ? NamingUtil.typeNameFromFile(schemaFile, "Root") : null;
    }
}
