package com.grammar.depend.grammar.service;

import com.grammar.depend.grammar.exception.GrammarLoadException;
import com.grammar.depend.grammar.model.Grammar;
import com.grammar.depend.grammar.model.GrammarType;
import com.grammar.depend.tool.ToolConfig;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for GrammarLoadingService against grammar files on disk.
 */
class GrammarLoadingServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadKeepsPathAsGivenAndReadsHeader() throws IOException {
        Path file = write(tempDir, "ExprParser.g4", """
                parser grammar ExprParser;
                options { tokenVocab = ExprLexer; }
                expr : INT ;
                """);

        Grammar g = new GrammarLoadingService(ToolConfig.builder().build()).load(file);

        assertThat(g.getName()).isEqualTo("ExprParser");
        assertThat(g.getType()).isEqualTo(GrammarType.PARSER);
        assertThat(g.getFileName()).isEqualTo(file.toString());
        assertThat(g.getOptionString(Grammar.TOKEN_VOCAB_OPTION)).isEqualTo("ExprLexer");
        assertThat(g.getImportedGrammars()).isEmpty();
    }

    @Test
    void testImportNextToGrammarKeepsBareFileName() throws IOException {
        write(tempDir, "Common.g4", "lexer grammar Common;\nID : [a-z]+ ;\n");
        Path file = write(tempDir, "T.g4", "grammar T;\nimport Common;\nstart : ID ;\n");

        Grammar g = new GrammarLoadingService(ToolConfig.builder().build()).load(file);

        assertThat(g.getImportedGrammars()).singleElement().satisfies(imported -> {
            assertThat(imported.getName()).isEqualTo("Common");
            assertThat(imported.getFileName()).isEqualTo("Common.g4");
            assertThat(imported.getType()).isEqualTo(GrammarType.LEXER);
        });
    }

    @Test
    void testImportFoundInLibDirectory() throws IOException {
        Path lib = Files.createDirectory(tempDir.resolve("lib"));
        Path src = Files.createDirectory(tempDir.resolve("src"));
        write(lib, "Keywords.g4", "lexer grammar Keywords;\nSELECT : 'select' ;\n");
        Path file = write(src, "Sql.g4", "grammar Sql;\nimport Keywords;\nq : SELECT ;\n");

        ToolConfig tool = ToolConfig.builder().libDirectory(lib.toString()).build();
        Grammar g = new GrammarLoadingService(tool).load(file);

        assertThat(g.getImportedGrammars()).extracting(Grammar::getFileName).containsExactly("Keywords.g4");
    }

    @Test
    void testImportFallsBackToOldExtension() throws IOException {
        write(tempDir, "Legacy.g", "lexer grammar Legacy;\n");
        Path file = write(tempDir, "T.g4", "grammar T;\nimport Legacy;\n");

        Grammar g = new GrammarLoadingService(ToolConfig.builder().build()).load(file);

        assertThat(g.getImportedGrammars()).extracting(Grammar::getFileName).containsExactly("Legacy.g");
    }

    @Test
    void testNestedImportsAreLoadedTransitively() throws IOException {
        write(tempDir, "C.g4", "lexer grammar C;\n");
        write(tempDir, "B.g4", "parser grammar B;\nimport C;\n");
        Path file = write(tempDir, "A.g4", "grammar A;\nimport B, C;\n");

        Grammar g = new GrammarLoadingService(ToolConfig.builder().build()).load(file);

        assertThat(g.getAllImportedGrammars()).extracting(Grammar::getName).containsExactly("B", "C");
    }

    @Test
    void testCommandLineOptionsOverrideGrammarOptions() throws IOException {
        Path file = write(tempDir, "T.g4", "grammar T;\noptions { language = Java; }\n");

        ToolConfig tool = ToolConfig.builder().grammarOption("language", "Cpp").build();
        Grammar g = new GrammarLoadingService(tool).load(file);

        assertThat(g.getOptionString(Grammar.LANGUAGE_OPTION)).isEqualTo("Cpp");
    }

    @Test
    void testMissingImportIsReported() throws IOException {
        Path file = write(tempDir, "T.g4", "grammar T;\nimport Nowhere;\n");

        GrammarLoadingService service = new GrammarLoadingService(ToolConfig.builder().build());

        assertThatThrownBy(() -> service.load(file))
                .isInstanceOf(GrammarLoadException.class)
                .hasMessageContaining("Cannot find grammar Nowhere");
    }

    @Test
    void testImportCycleIsReported() throws IOException {
        write(tempDir, "B.g4", "parser grammar B;\nimport A;\n");
        Path file = write(tempDir, "A.g4", "parser grammar A;\nimport B;\n");

        GrammarLoadingService service = new GrammarLoadingService(ToolConfig.builder().build());

        assertThatThrownBy(() -> service.load(file))
                .isInstanceOf(GrammarLoadException.class)
                .hasMessage("Import cycle: A -> B -> A");
    }

    @Test
    void testUnreadableGrammarIsReported() {
        Path missing = tempDir.resolve("Missing.g4");

        GrammarLoadingService service = new GrammarLoadingService(ToolConfig.builder().build());

        assertThatThrownBy(() -> service.load(missing))
                .isInstanceOf(GrammarLoadException.class)
                .hasMessageContaining("Cannot read grammar");
    }

    private static Path write(Path dir, String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void testSelfImportUnderDifferentDeclaredNameIsReportedAsCycle() throws IOException {
        write(tempDir, "B.g4", "parser grammar X;\nimport B;\n");
        Path file = write(tempDir, "T.g4", "grammar T;\nimport B;\n");

        GrammarLoadingService service = new GrammarLoadingService(ToolConfig.builder().build());

        assertThatThrownBy(() -> service.load(file))
                .isInstanceOf(GrammarLoadException.class)
                .hasMessage("Import cycle: T -> X -> X");
    }

    @Test
    void testImportOfRootGrammarIsReportedAsCycle() throws IOException {
        write(tempDir, "Shared.g4", "parser grammar Shared;\nimport T;\n");
        Path file = write(tempDir, "T.g4", "parser grammar T;\nimport Shared;\n");

        GrammarLoadingService service = new GrammarLoadingService(ToolConfig.builder().build());

        assertThatThrownBy(() -> service.load(file))
                .isInstanceOf(GrammarLoadException.class)
                .hasMessage("Import cycle: T -> Shared -> T");
    }
}
