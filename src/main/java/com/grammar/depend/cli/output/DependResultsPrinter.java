package com.grammar.depend.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grammar.depend.cli.model.ValidatedDependOptions;
import com.grammar.depend.tool.ToolConfig;

/**
 * Responsible only for printing CLI output for the dependency command.
 * Reports go to the command's output stream; everything else is logged.
 */
public class DependResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(DependResultsPrinter.class);

    public void printBanner(ValidatedDependOptions v) {
        ToolConfig tool = v.getToolConfig();
        log.info("Computing dependencies for {} grammar(s)", v.getGrammarFiles().size());
        log.info("  Output Directory: {}", tool.haveOutputDir() ? tool.getOutputDirectory() : "next to each grammar");
        log.info("  Library Directory: {}", tool.getLibDirectory());
        log.info("  Listener: {}, Visitor: {}", tool.isGenerateListener(), tool.isGenerateVisitor());
        if (!tool.getGrammarOptions().isEmpty()) {
            log.info("  Grammar Options: {}", tool.getGrammarOptions());
        }
    }

    public void printReport(PrintWriter out, String report) {
        out.println(report);
        out.flush();
    }

    public void printSummary(int grammarCount, int failures) {
        if (failures == 0) {
            log.info("Dependencies computed for {} grammar(s)", grammarCount);
        } else {
            log.error("{} of {} grammar(s) could not be processed", failures, grammarCount);
        }
    }
}
