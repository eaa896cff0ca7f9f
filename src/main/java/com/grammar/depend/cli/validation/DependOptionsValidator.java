package com.grammar.depend.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.grammar.depend.cli.exception.OptionsValidationException;
import com.grammar.depend.cli.model.DependOptions;
import com.grammar.depend.cli.model.ValidatedDependOptions;
import com.grammar.depend.tool.ToolConfig;
import com.grammar.depend.util.PathUtil;

public class DependOptionsValidator {

	public ValidatedDependOptions validate(DependOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getGrammarFiles() == null || o.getGrammarFiles().isEmpty()) {
			errors.add("At least one grammar file is required.");
		} else {
			for (Path grammarFile : o.getGrammarFiles()) {
				if (!Files.isRegularFile(grammarFile)) {
					errors.add("Grammar file does not exist or is not a file: " + grammarFile);
				}
			}
		}

		String libDirectory = isBlank(o.getLibDirectory()) ? PathUtil.CURRENT_DIRECTORY : o.getLibDirectory();
		if (!PathUtil.isCurrentDirectory(libDirectory) && !Files.isDirectory(Path.of(libDirectory))) {
			errors.add("Library directory does not exist or is not a directory: " + libDirectory);
		}

		if (o.getOutputDirectory() != null && o.getOutputDirectory().isBlank()) {
			errors.add("Output directory must not be blank (-o).");
		}

		for (Map.Entry<String, String> option : o.getGrammarOptions().entrySet()) {
			if (isBlank(option.getKey())) {
				errors.add("Grammar option name must not be blank: -D" + option.getKey() + "=" + option.getValue());
			}
		}

		Charset encoding = parseEncoding(o.getEncoding(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ToolConfig toolConfig = ToolConfig.builder()
				.outputDirectory(o.getOutputDirectory())
				.libDirectory(libDirectory)
				.generateListener(o.isListener())
				.generateVisitor(o.isVisitor())
				.exactOutputDir(o.isExactOutputDir())
				.grammarOptions(o.getGrammarOptions())
				.encoding(encoding)
				.build();

		return new ValidatedDependOptions(toolConfig, List.copyOf(o.getGrammarFiles()));
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static Charset parseEncoding(String raw, List<String> errors) {
		if (isBlank(raw)) {
			errors.add("Encoding must not be blank (--encoding).");
			return null;
		}
		try {
			return Charset.forName(raw);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			errors.add("Unsupported encoding: " + raw);
			return null;
		}
	}
}
