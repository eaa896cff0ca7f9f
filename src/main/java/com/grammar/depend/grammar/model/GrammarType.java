package com.grammar.depend.grammar.model;

/**
 * Kinds of grammar a source file can declare, with the suffix the code generator
 * appends to the grammar name when naming the recognizer of that kind.
 */
public enum GrammarType {
    /**
     * {@code lexer grammar T;}
     */
    LEXER("Lexer"),

    /**
     * {@code parser grammar T;}
     */
    PARSER("Parser"),

    /**
     * {@code grammar T;} declaring both lexer and parser rules.
     */
    COMBINED("Parser");

    private final String fileNameSuffix;

    GrammarType(String fileNameSuffix) {
        this.fileNameSuffix = fileNameSuffix;
    }

    public String getFileNameSuffix() {
        return fileNameSuffix;
    }
}
