package com.jsonschema.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.jsonschema.generator.cli.exception.OptionsValidationException;
import com.jsonschema.generator.cli.model.GenerateOptions;
import com.jsonschema.generator.cli.model.ValidatedGenerateOptions;
import com.jsonschema.generator.codegen.util.NamingUtil;

public class GenerateOptionsValidator {

	private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path schemaFile = o.getSchemaFile();
		if (schemaFile == null) {
			errors.add("Schema file is required (--schema / -s).");
		} else if (!Files.isRegularFile(schemaFile)) {
			errors.add("Schema file does not exist or is not a file: " + schemaFile);
		}

		if (isBlank(o.getNamespace()) || !NAMESPACE.matcher(o.getNamespace()).matches()) {
			errors.add("Namespace is not a valid C# namespace: " + o.getNamespace());
		}

		if (o.getRootTypeName() != null && !IDENTIFIER.matcher(o.getRootTypeName()).matches()) {
			errors.add("Root type name is not a valid C# identifier: " + o.getRootTypeName());
		}

		requireNonBlank(o.getArrayType(), "--array-type", errors);
		requireNonBlank(o.getDictionaryType(), "--dictionary-type", errors);
		requireNonBlank(o.getDateType(), "--date-type", errors);
		requireNonBlank(o.getDateTimeType(), "--date-time-type", errors);
		requireNonBlank(o.getTimeType(), "--time-type", errors);
		requireNonBlank(o.getTimeSpanType(), "--time-span-type", errors);

		String rootTypeName = o.getRootTypeName() != null
				? o.getRootTypeName()
				: NamingUtil.typeNameFromFile(schemaFile, "Root");

		Path outputFile = (o.getOutputFile() != null
				? o.getOutputFile()
				: Path.of(rootTypeName + ".cs")).toAbsolutePath().normalize();

		if (Files.isDirectory(outputFile)) {
			errors.add("Output path is a directory: " + outputFile);
		} else if (Files.exists(outputFile) && !o.isForce()) {
			errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(schemaFile.toAbsolutePath().normalize(), outputFile, rootTypeName);
	}

	private static void requireNonBlank(String value, String option, List<String> errors) {
		if (isBlank(value)) {
			errors.add("Option " + option + " must not be blank.");
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
