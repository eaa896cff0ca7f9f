package com.grammar.depend;

import com.grammar.depend.cli.DependCommand;
import picocli.CommandLine;

/**
 * Main entry point for grammar-depend.
 * Prints, for each grammar file given, the files it depends on and the files the
 * grammar compiler generates from it, in a form make and similar build tools read.
 */
public class DependApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DependCommand()).execute(args);
        System.exit(exitCode);
    }
}
