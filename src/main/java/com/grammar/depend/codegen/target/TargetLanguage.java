package com.grammar.depend.codegen.target;

import java.util.Arrays;
import java.util.Optional;

/**
 * Targets this tool knows the naming rules of.
 */
public enum TargetLanguage {
    JAVA("Java", false),
    CSHARP("CSharp", false),
    PYTHON3("Python3", false),
    JAVASCRIPT("JavaScript", false),
    TYPESCRIPT("TypeScript", false),
    CPP("Cpp", true);

    private final String languageName;
    private final boolean needsHeader;

    TargetLanguage(String languageName, boolean needsHeader) {
        this.languageName = languageName;
        this.needsHeader = needsHeader;
    }

    public String getLanguageName() {
        return languageName;
    }

    public boolean needsHeader() {
        return needsHeader;
    }

    /**
     * Language names are matched exactly, as they appear in the {@code language} option.
     */
    public static Optional<TargetLanguage> fromLanguageName(String languageName) {
        return Arrays.stream(values())
                .filter(t -> t.languageName.equals(languageName))
                .findFirst();
    }
}
