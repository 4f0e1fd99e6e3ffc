package com.jsonschema.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.cli.model.GenerateOptions;
import com.jsonschema.generator.cli.model.ValidatedGenerateOptions;
import com.jsonschema.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("JSON Schema Code Generator");
        log.info("=================================================");
        log.info("Schema File: {}", v.getSchemaFile());
        log.info("Root Type: {}", v.getRootTypeName());
        log.info("Namespace: {}", o.getNamespace());
        log.info("Array Type: {}", o.getArrayType());
        log.info("Dictionary Type: {}", o.getDictionaryType());
        log.info("Date / DateTime Types: {} / {}", o.getDateType(), o.getDateTimeType());
        log.info("Time / TimeSpan Types: {} / {}", o.getTimeType(), o.getTimeSpanType());
        log.info("Null Handling: {}", o.getNullHandling());
        log.info("Data Annotations: {}", o.isGenerateDataAnnotations());
        log.info("Output File: {}", v.getOutputFile());
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        log.info("Types Generated: {}", result.getTypesGenerated());
        log.info("  Classes: {}", result.getClassesGenerated());
        log.info("  Enums: {}", result.getEnumsGenerated());
        if (result.isInheritanceConverterGenerated()) {
            log.info("  Inheritance converter: included");
        }
        log.info("Generation Time: {} ms", result.getGenerationTimeMillis());
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
