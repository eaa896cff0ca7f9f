package com.grammar.depend.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the dependency command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class DependOptions {

	@Parameters(paramLabel = "GRAMMAR", arity = "1..*", description = "Grammar files to compute dependencies for")
	private List<Path> grammarFiles = new ArrayList<>();

	@Option(names = { "-o", "--output-dir" }, description = "Directory generated files are written to")
	private String outputDirectory;

	@Option(names = { "-lib", "--lib" }, defaultValue = ".",
			description = "Directory holding token vocabularies and imported grammars (default: current directory)")
	private String libDirectory;

	@Option(names = { "--listener" }, negatable = true, defaultValue = "true", fallbackValue = "true",
			description = "Count listener sources as outputs (default: true)")
	private boolean listener;

	@Option(names = { "--visitor" }, negatable = true, defaultValue = "false", fallbackValue = "true",
			description = "Count visitor sources as outputs (default: false)")
	private boolean visitor;

	@Option(names = {
			"--exact-output-dir" }, description = "Write every output directly into the output directory, ignoring the grammar's relative directory")
	private boolean exactOutputDir;

	@Option(names = { "-D" }, paramLabel = "option=value", description = "Set or override a grammar-level option")
	private Map<String, String> grammarOptions = new LinkedHashMap<>();

	@Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Encoding of grammar files (default: UTF-8)")
	private String encoding;
}
