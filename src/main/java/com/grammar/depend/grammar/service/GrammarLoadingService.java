package com.grammar.depend.grammar.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grammar.depend.grammar.exception.GrammarLoadException;
import com.grammar.depend.grammar.model.Grammar;
import com.grammar.depend.grammar.parser.GrammarHeader;
import com.grammar.depend.grammar.parser.GrammarHeaderParser;
import com.grammar.depend.tool.ToolConfig;
import com.grammar.depend.util.PathUtil;

import lombok.RequiredArgsConstructor;

/**
 * Loads a grammar file and, transitively, the grammars it imports.
 *
 * An imported grammar {@code B} is looked up as {@code B.g4}, then {@code B.g}, first
 * next to the importing grammar and then in the library directory. Imported grammars
 * keep only their bare file name, which is how dependency reports qualify them against
 * the library directory.
 */
@RequiredArgsConstructor
public class GrammarLoadingService {
    private static final Logger log = LoggerFactory.getLogger(GrammarLoadingService.class);

    private static final List<String> GRAMMAR_EXTENSIONS = List.of(".g4", ".g");

    private final ToolConfig tool;

    /**
     * Loads {@code grammarFile}, keeping its path as given for the grammar's file name,
     * and applies the tool's {@code -D} option overrides to it.
     */
    public Grammar load(Path grammarFile) {
        Map<Path, Grammar> loaded = new HashMap<>();
        Map<Path, String> currentlyResolving = new LinkedHashMap<>();

        Grammar root = loadGrammar(grammarFile, grammarFile.toString(), loaded, currentlyResolving);
        if (tool.getGrammarOptions().isEmpty()) {
            return root;
        }
        return root.toBuilder().options(tool.getGrammarOptions()).build();
    }

    /**
     * Both maps are keyed by the grammar's absolute normalized path, so a grammar whose
     * declared name differs from its file name is still recognized when imported again.
     */
    private Grammar loadGrammar(Path path, String fileName, Map<Path, Grammar> loaded,
                                Map<Path, String> currentlyResolving) {
        GrammarHeader header = GrammarHeaderParser.parse(read(path, fileName), fileName);
        log.debug("Read grammar {} ({}) from {}", header.getName(), header.getType(), fileName);

        String stem = stem(path);
        if (!header.getName().equals(stem)) {
            log.warn("Grammar name {} and file name {} differ", header.getName(), fileName);
        }

        Path key = key(path);
        currentlyResolving.put(key, header.getName());
        try {
            Grammar.GrammarBuilder grammar = Grammar.builder()
                    .name(header.getName())
                    .fileName(fileName)
                    .type(header.getType())
                    .options(header.getOptions());

            for (String importName : header.getImportNames()) {
                grammar.importedGrammar(resolveImport(importName, path, fileName, loaded, currentlyResolving));
            }
            return grammar.build();
        } finally {
            currentlyResolving.remove(key);
        }
    }

    private Grammar resolveImport(String importName, Path importingFile, String importingFileName,
                                  Map<Path, Grammar> loaded, Map<Path, String> currentlyResolving) {
        Path importedFile = findImportedGrammar(importName, importingFile);
        if (importedFile == null) {
            throw new GrammarLoadException(String.format(
                    "Cannot find grammar %s imported by %s. Provide it next to the importing grammar or in -lib %s",
                    importName, importingFileName, tool.getLibDirectory()));
        }

        Path key = key(importedFile);
        if (currentlyResolving.containsKey(key)) {
            throw new GrammarLoadException("Import cycle: " + String.join(" -> ", currentlyResolving.values())
                    + " -> " + currentlyResolving.get(key));
        }

        Grammar cached = loaded.get(key);
        if (cached != null) {
            return cached;
        }

        log.info("Resolved import {} -> {}", importName, importedFile);
        Grammar imported = loadGrammar(importedFile, importedFile.getFileName().toString(), loaded,
                currentlyResolving);
        loaded.put(key, imported);
        return imported;
    }

    private Path findImportedGrammar(String name, Path importingFile) {
        Path importingDir = importingFile.toAbsolutePath().getParent();
        Path found = searchDirectory(importingDir, name);
        if (found != null) {
            return found;
        }
        String libDirectory = tool.getLibDirectory();
        if (PathUtil.isCurrentDirectory(libDirectory)) {
            return searchDirectory(Path.of("").toAbsolutePath(), name);
        }
        return searchDirectory(Path.of(libDirectory), name);
    }

    private Path searchDirectory(Path dir, String name) {
        if (dir == null || !Files.isDirectory(dir)) {
            return null;
        }
        for (String ext : GRAMMAR_EXTENSIONS) {
            Path candidate = dir.resolve(name + ext);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private String read(Path path, String fileName) {
        try {
            return Files.readString(path, tool.getEncoding());
        } catch (IOException e) {
            throw new GrammarLoadException("Cannot read grammar " + fileName + " (" + e.getMessage() + ")", e);
        }
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String stem(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return (dot > 0) ? file.substring(0, dot) : file;
    }
}
