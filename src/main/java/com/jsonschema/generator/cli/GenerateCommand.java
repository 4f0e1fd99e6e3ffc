package com.jsonschema.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.cli.exception.OptionsValidationException;
import com.jsonschema.generator.cli.model.GenerateOptions;
import com.jsonschema.generator.cli.model.ValidatedGenerateOptions;
import com.jsonschema.generator.cli.output.GenerateResultsPrinter;
import com.jsonschema.generator.cli.validation.GenerateOptionsValidator;
import com.jsonschema.generator.codegen.GeneratorConfig;
import com.jsonschema.generator.codegen.GeneratorResult;
import com.jsonschema.generator.codegen.SchemaCodeGenerator;
import com.jsonschema.generator.codegen.settings.CSharpGeneratorSettings;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating C# types from a JSON Schema.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "jsonschema-codegen-tool 1.0.0",
        description = "Generates C# classes and enums from a JSON Schema document."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorResult result = new SchemaCodeGenerator(toConfig(validated)).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(result);
        return 0;
    }

    private GeneratorConfig toConfig(ValidatedGenerateOptions validated) {
        CSharpGeneratorSettings settings = CSharpGeneratorSettings.builder()
                .namespace(options.getNamespace())
                .arrayType(options.getArrayType())
                .dictionaryType(options.getDictionaryType())
                .dateType(options.getDateType())
                .dateTimeType(options.getDateTimeType())
                .timeType(options.getTimeType())
                .timeSpanType(options.getTimeSpanType())
                .nullHandling(options.getNullHandling())
                .generateDataAnnotations(options.isGenerateDataAnnotations())
                .build();

        return GeneratorConfig.builder()
                .schemaFile(validated.getSchemaFile())
                .outputFile(validated.getOutputFile())
                .rootTypeName(validated.getRootTypeName())
                .force(options.isForce())
                .settings(settings)
                .build();
    }
}
