package com.grammar.depend.tool;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import com.grammar.depend.util.PathUtil;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Tool-level settings that shape where generated files land and where dependencies
 * are looked up.
 *
 * Directories are kept as strings because the dependency report reproduces them
 * verbatim; {@value PathUtil#CURRENT_DIRECTORY} means "current directory".
 */
@Value
@Builder(toBuilder = true)
public class ToolConfig {

    /**
     * Value of {@code -o}; {@code null} when generated files go next to the grammar.
     */
    String outputDirectory;

    /**
     * Value of {@code -lib}; where token vocabularies and imported grammars are found.
     */
    @NonNull
    @Builder.Default
    String libDirectory = PathUtil.CURRENT_DIRECTORY;

    @Builder.Default
    boolean generateListener = true;

    @Builder.Default
    boolean generateVisitor = false;

    /**
     * Put every generated file directly in the output directory, ignoring the
     * grammar's own relative directory.
     */
    @Builder.Default
    boolean exactOutputDir = false;

    /**
     * {@code -D} overrides applied on top of the options a grammar declares.
     */
    @Singular
    Map<String, String> grammarOptions;

    @NonNull
    @Builder.Default
    Charset encoding = StandardCharsets.UTF_8;

    public boolean haveOutputDir() {
        return outputDirectory != null && !outputDirectory.isEmpty();
    }

    /**
     * Directory a file derived from {@code fileNameWithPath} is written to.
     *
     * Without {@code -o} that is the file's own directory. With {@code -o} a relative
     * file directory is nested under the output directory, so a bare file name maps to
     * {@code <out>/.}; an absolute one collapses to the output directory.
     */
    public String resolveOutputDirectory(String fileNameWithPath) {
        String fileDirectory = PathUtil.directoryOf(fileNameWithPath);

        if (exactOutputDir) {
            return haveOutputDir() ? outputDirectory : fileDirectory;
        }
        if (!haveOutputDir()) {
            return fileDirectory;
        }
        if (Path.of(fileDirectory).isAbsolute() || fileDirectory.startsWith("~")) {
            return outputDirectory;
        }
        return Path.of(outputDirectory).resolve(fileDirectory).toString();
    }
}
