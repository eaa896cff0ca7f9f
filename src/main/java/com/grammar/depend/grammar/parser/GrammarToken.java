package com.grammar.depend.grammar.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the grammar header tokenizer.
 */
@Data
@AllArgsConstructor
public class GrammarToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        IDENTIFIER,
        STRING_LITERAL,
        NUMERIC_LITERAL,
        /**
         * Balanced {@code { ... }} block; value is the text between the braces.
         */
        BLOCK,
        SEMI,
        COLON,
        COLONCOLON,
        COMMA,
        ASSIGN,
        DOT,
        AT,
        OTHER,
        EOF
    }

    public boolean isIdentifier(String text) {
        return type == TokenType.IDENTIFIER && value.equals(text);
    }
}
