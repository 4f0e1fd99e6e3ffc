package com.jsonschema.generator;

import com.jsonschema.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the JSON Schema code generator.
 * This CLI tool turns a JSON Schema document into C# classes and enums.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
