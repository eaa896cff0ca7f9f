package com.grammar.depend.integration;

import com.grammar.depend.cli.DependCommand;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the command end to end: grammar files on disk in, make rules out.
 */
class DependCommandIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    void testParserGrammarWithVocabLibAndOutputDir() throws IOException {
        Path lib = Files.createDirectory(tempDir.resolve("lib"));
        Path grammar = Files.writeString(tempDir.resolve("ExprParser.g4"), """
                parser grammar ExprParser;
                options { tokenVocab = ExprLexer; }
                expr : INT ;
                """);

        StringWriter out = new StringWriter();
        int exit = run(out, "-o", "gen", "-lib", lib.toString(), "--no-listener", grammar.toString());

        String g = grammar.toString();
        assertThat(exit).isZero();
        assertThat(out.toString()).isEqualToNormalizingNewlines(
                g + ": " + lib + "/ExprLexer.tokens\n"
                        + "gen/ExprParser.java : " + g + "\n"
                        + "gen/ExprParser.tokens : " + g + "\n");
    }

    @Test
    void testCombinedGrammarWithImportAndVisitor() throws IOException {
        Files.writeString(tempDir.resolve("Common.g4"), "lexer grammar Common;\nID : [a-z]+ ;\n");
        Path grammar = Files.writeString(tempDir.resolve("T.g4"), "grammar T;\nimport Common;\ns : ID ;\n");

        StringWriter out = new StringWriter();
        int exit = run(out, "-o", "gen", "--visitor", grammar.toString());

        String g = grammar.toString();
        assertThat(exit).isZero();
        assertThat(out.toString()).isEqualToNormalizingNewlines(
                g + ": Common.g4\n"
                        + "gen/TParser.java : " + g + "\n"
                        + "gen/T.tokens : " + g + "\n"
                        + "gen/TLexer.java : " + g + "\n"
                        + "gen/TLexer.tokens : " + g + "\n"
                        + "gen/TListener.java : " + g + "\n"
                        + "gen/TBaseListener.java : " + g + "\n"
                        + "gen/TVisitor.java : " + g + "\n"
                        + "gen/TBaseVisitor.java : " + g + "\n"
                        + "gen/Common.g4 : " + g + "\n");
    }

    @Test
    void testUnknownLanguageReportsNoOutputs() throws IOException {
        Path grammar = Files.writeString(tempDir.resolve("T.g4"), "parser grammar T;\n");

        StringWriter out = new StringWriter();
        int exit = run(out, "-Dlanguage=Nope", grammar.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).isEqualToNormalizingNewlines("\n");
    }

    @Test
    void testMissingGrammarFileFailsValidation() {
        StringWriter out = new StringWriter();
        int exit = run(out, tempDir.resolve("Missing.g4").toString());

        assertThat(exit).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testBrokenGrammarIsSkippedAndOthersStillReported() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("Broken.g4"), "grammar ;\n");
        Path good = Files.writeString(tempDir.resolve("L.g4"), "lexer grammar L;\n");

        StringWriter out = new StringWriter();
        int exit = run(out, "-o", "gen", "--no-listener", broken.toString(), good.toString());

        String g = good.toString();
        assertThat(exit).isEqualTo(1);
        assertThat(out.toString()).isEqualToNormalizingNewlines(
                "gen/L.java : " + g + "\n"
                        + "gen/L.tokens : " + g + "\n");
    }

    private static int run(StringWriter out, String... args) {
        return new CommandLine(new DependCommand())
                .setOut(new PrintWriter(out))
                .execute(args);
    }
}
