package com.jsonschema.generator.cli.model;

import java.nio.file.Path;

import com.jsonschema.generator.schema.NullHandling;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--schema", "-s" }, required = true, description = "Path to the JSON Schema file")
	private Path schemaFile;

	@Option(names = { "--output", "-o" }, description = "Output C# file (defaults to <root type>.cs)")
	private Path outputFile;

	@Option(names = { "--namespace", "-n" }, defaultValue = "MyNamespace", description = "Namespace of the generated code")
	private String namespace;

	@Option(names = { "--root-type", "-r" }, description = "Name of the root type when the schema declares no title (defaults to the file name)")
	private String rootTypeName;

	@Option(names = {
			"--array-type" }, defaultValue = "System.Collections.ObjectModel.ObservableCollection", description = "Generic array container type")
	private String arrayType;

	@Option(names = {
			"--dictionary-type" }, defaultValue = "System.Collections.Generic.Dictionary", description = "Generic dictionary container type")
	private String dictionaryType;

	@Option(names = { "--date-type" }, defaultValue = "System.DateTime", description = "Type for format 'date'")
	private String dateType;

	@Option(names = {
			"--date-time-type" }, defaultValue = "System.DateTime", description = "Type for format 'date-time'")
	private String dateTimeType;

	@Option(names = { "--time-type" }, defaultValue = "System.TimeSpan", description = "Type for format 'time'")
	private String timeType;

	@Option(names = {
			"--time-span-type" }, defaultValue = "System.TimeSpan", description = "Type for format 'duration'")
	private String timeSpanType;

	@Option(names = {
			"--null-handling" }, defaultValue = "JSON", description = "Nullability source: JSON (null type) or SWAGGER (x-nullable)")
	private NullHandling nullHandling;

	@Option(names = {
			"--no-data-annotations" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Do not emit [Required] data annotations")
	private boolean generateDataAnnotations;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

}
