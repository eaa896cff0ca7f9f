package com.grammar.depend.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grammar.depend.cli.exception.OptionsValidationException;
import com.grammar.depend.cli.model.DependOptions;
import com.grammar.depend.cli.model.ValidatedDependOptions;
import com.grammar.depend.cli.output.DependResultsPrinter;
import com.grammar.depend.cli.validation.DependOptionsValidator;
import com.grammar.depend.codegen.target.TargetRegistry;
import com.grammar.depend.codegen.template.TemplateRenderException;
import com.grammar.depend.depend.BuildDependencyGenerator;
import com.grammar.depend.grammar.exception.GrammarLoadException;
import com.grammar.depend.grammar.model.Grammar;
import com.grammar.depend.grammar.service.GrammarLoadingService;
import com.grammar.depend.tool.ToolConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command printing make-compatible dependencies for grammar files: what each
 * grammar reads and what the code generator would write for it.
 */
@Command(
        name = "grammar-depend",
        mixinStandardHelpOptions = true,
        version = "grammar-depend 1.0.0",
        description = "Lists the files a grammar depends on and the files generated from it, in make syntax."
)
public class DependCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DependCommand.class);

    @Mixin
    private DependOptions options = new DependOptions();

    @Spec
    private CommandSpec spec;

    private final DependOptionsValidator validator = new DependOptionsValidator();
    private final DependResultsPrinter printer = new DependResultsPrinter();

    @Override
    public Integer call() {
        ValidatedDependOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(validated);

        ToolConfig tool = validated.getToolConfig();
        TargetRegistry targetRegistry = new TargetRegistry();
        GrammarLoadingService loader = new GrammarLoadingService(tool);
        PrintWriter out = spec.commandLine().getOut();

        int failures = 0;
        try {
            for (Path grammarFile : validated.getGrammarFiles()) {
                try {
                    Grammar grammar = loader.load(grammarFile);
                    BuildDependencyGenerator generator = new BuildDependencyGenerator(tool, grammar, targetRegistry);
                    printer.printReport(out, generator.renderReport());
                } catch (GrammarLoadException e) {
                    log.error("Skipping {}: {}", grammarFile, e.getMessage());
                    failures++;
                }
            }
        } catch (TemplateRenderException e) {
            log.error("Cannot render dependency report", e);
            return 1;
        }

        printer.printSummary(validated.getGrammarFiles().size(), failures);
        return failures == 0 ? 0 : 1;
    }
}
