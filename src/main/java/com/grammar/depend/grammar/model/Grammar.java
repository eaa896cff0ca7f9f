package com.grammar.depend.grammar.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Header-level view of a grammar: its name, kind, declared options and the
 * grammars it imports.
 *
 * Pure structure only. Import graphs are acyclic; the loader rejects cycles.
 */
@Value
@Builder(toBuilder = true)
public class Grammar {

    public static final String TOKEN_VOCAB_OPTION = "tokenVocab";
    public static final String LANGUAGE_OPTION = "language";

    @NonNull
    String name;

    @NonNull
    String fileName;

    @NonNull
    GrammarType type;

    @Singular
    Map<String, String> options;

    /**
     * Direct imports, in declaration order.
     */
    @Singular
    List<Grammar> importedGrammars;

    public String getOptionString(String key) {
        return options.get(key);
    }

    public boolean isCombined() {
        return type == GrammarType.COMBINED;
    }

    public boolean isLexer() {
        return type == GrammarType.LEXER;
    }

    public boolean isParser() {
        return type == GrammarType.PARSER;
    }

    /**
     * Combined grammar T yields recognizer TParser; lexer and parser grammars keep
     * their declared name.
     */
    public String getRecognizerName() {
        if (isCombined()) {
            return name + type.getFileNameSuffix();
        }
        return name;
    }

    /**
     * All grammars reachable through imports, each direct import followed by its own
     * imports. A grammar reached twice keeps its first position.
     */
    public List<Grammar> getAllImportedGrammars() {
        Map<String, Grammar> delegates = new LinkedHashMap<>();
        for (Grammar imported : importedGrammars) {
            delegates.putIfAbsent(imported.getFileName(), imported);
            for (Grammar transitive : imported.getAllImportedGrammars()) {
                delegates.putIfAbsent(transitive.getFileName(), transitive);
            }
        }
        return new ArrayList<>(delegates.values());
    }
}
