package com.grammar.depend.tool;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ToolConfig output directory resolution.
 */
class ToolConfigTest {

    @Test
    void testDefaults() {
        ToolConfig tool = ToolConfig.builder().build();

        assertThat(tool.getLibDirectory()).isEqualTo(".");
        assertThat(tool.isGenerateListener()).isTrue();
        assertThat(tool.isGenerateVisitor()).isFalse();
        assertThat(tool.isExactOutputDir()).isFalse();
        assertThat(tool.haveOutputDir()).isFalse();
        assertThat(tool.getGrammarOptions()).isEmpty();
        assertThat(tool.getEncoding()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void testWithoutOutputDirUsesGrammarDirectory() {
        ToolConfig tool = ToolConfig.builder().build();

        assertThat(tool.resolveOutputDirectory("T.g4")).isEqualTo(".");
        assertThat(tool.resolveOutputDirectory("src/T.g4")).isEqualTo("src");
    }

    @Test
    void testOutputDirNestsRelativeGrammarDirectory() {
        ToolConfig tool = ToolConfig.builder().outputDirectory("out").build();

        assertThat(tool.resolveOutputDirectory("T.g4")).isEqualTo("out/.");
        assertThat(tool.resolveOutputDirectory("src/T.g4")).isEqualTo("out/src");
    }

    @Test
    void testOutputDirReplacesAbsoluteGrammarDirectory() {
        ToolConfig tool = ToolConfig.builder().outputDirectory("out").build();

        assertThat(tool.resolveOutputDirectory("/work/T.g4")).isEqualTo("out");
        assertThat(tool.resolveOutputDirectory("~/grammars/T.g4")).isEqualTo("out");
    }

    @Test
    void testExactOutputDir() {
        ToolConfig exact = ToolConfig.builder().outputDirectory("out").exactOutputDir(true).build();
        ToolConfig exactWithoutOut = ToolConfig.builder().exactOutputDir(true).build();

        assertThat(exact.resolveOutputDirectory("src/T.g4")).isEqualTo("out");
        assertThat(exactWithoutOut.resolveOutputDirectory("src/T.g4")).isEqualTo("src");
    }

    @Test
    void testEmptyOutputDirectoryCountsAsUnset() {
        ToolConfig tool = ToolConfig.builder().outputDirectory("").build();

        assertThat(tool.haveOutputDir()).isFalse();
        assertThat(tool.resolveOutputDirectory("T.g4")).isEqualTo(".");
    }
}
